package com.indicationscout.evidence.domain.model.drug;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of a drug node in the knowledge graph at fetch time.
 * Targets are references only; full target data is fetched separately.
 *
 * <p>{@code drugType}, {@code approved}, {@code maxClinicalPhase},
 * {@code yearFirstApproved} and {@code adverseEventsCriticalValue} are null
 * when the graph does not report them.
 */
public record DrugProfile(
        String chemblId,
        String name,
        List<String> synonyms,
        List<String> tradeNames,
        String drugType,
        Boolean approved,
        Double maxClinicalPhase,
        Integer yearFirstApproved,
        List<DrugWarning> warnings,
        List<Indication> indications,
        List<DrugTarget> targets,
        List<AdverseEvent> adverseEvents,
        Double adverseEventsCriticalValue
) {
    public DrugProfile {
        synonyms = List.copyOf(synonyms);
        tradeNames = List.copyOf(tradeNames);
        warnings = List.copyOf(warnings);
        indications = List.copyOf(indications);
        targets = List.copyOf(targets);
        adverseEvents = List.copyOf(adverseEvents);
    }

    /**
     * Disease ids with an approved (phase 4) indication.
     */
    public Set<String> approvedDiseaseIds() {
        return indications.stream()
                .filter(i -> i.maxPhase() >= 4)
                .map(Indication::diseaseId)
                .collect(Collectors.toSet());
    }

    public Set<String> investigatedDiseaseIds() {
        return indications.stream()
                .map(Indication::diseaseId)
                .collect(Collectors.toSet());
    }

    public Set<String> targetIds() {
        return targets.stream()
                .map(DrugTarget::targetId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
