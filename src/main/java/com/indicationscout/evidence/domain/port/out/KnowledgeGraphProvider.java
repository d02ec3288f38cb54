package com.indicationscout.evidence.domain.port.out;

import com.indicationscout.evidence.domain.model.disease.DiseaseSynonyms;
import com.indicationscout.evidence.domain.model.drug.DrugProfile;
import com.indicationscout.evidence.domain.model.drug.DrugWithTargets;
import com.indicationscout.evidence.domain.model.drug.Indication;
import com.indicationscout.evidence.domain.model.target.Association;
import com.indicationscout.evidence.domain.model.target.DrugSummary;
import com.indicationscout.evidence.domain.model.target.TargetProfile;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interface representing a biomedical knowledge graph.
 * Implementations resolve free-text names to canonical identifiers and return
 * typed snapshots of drug, target and disease nodes.
 */
public interface KnowledgeGraphProvider {

    double DEFAULT_MIN_ASSOCIATION_SCORE = 0.1;

    /**
     * Resolves a drug name and returns its full profile.
     * The first search hit is taken as the match; ambiguous names may resolve
     * to an unintended drug.
     *
     * @param name free-text drug name, case-insensitive
     * @return the profile of the resolved drug
     */
    DrugProfile getDrug(String name);

    /**
     * Returns the full profile of a target, with every disease association.
     *
     * @param targetId canonical target identifier (Ensembl gene id)
     */
    TargetProfile getTarget(String targetId);

    /**
     * Fetches a drug and every target it references, the targets concurrently.
     * A failure fetching any one target fails the whole call.
     */
    DrugWithTargets getDrugWithTargets(String name);

    List<Indication> getDrugIndications(String name);

    /**
     * Associations of a target scoring at least {@code minScore}.
     */
    List<Association> getTargetAssociations(String targetId, double minScore);

    default List<Association> getTargetAssociations(String targetId) {
        return getTargetAssociations(targetId, DEFAULT_MIN_ASSOCIATION_SCORE);
    }

    /**
     * For each target of a drug, every known drug acting on that target,
     * keyed by target symbol.
     */
    Map<String, List<DrugSummary>> getDrugTargetCompetitors(String name);

    /**
     * Late-stage (phase 3+) drugs sharing a target with the given drug,
     * grouped by disease. Diseases where the drug itself appears are dropped;
     * the ten diseases with most competitors are returned.
     */
    Map<String, Set<String>> getDrugCompetitors(String name);

    /**
     * Every drug known for a disease, one entry per drug at its highest phase.
     */
    List<DrugSummary> getDiseaseDrugs(String diseaseId);

    DiseaseSynonyms getDiseaseSynonyms(String diseaseName);
}
