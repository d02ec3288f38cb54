package com.indicationscout.evidence.infrastructure.adapter.opentargets;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indicationscout.evidence.domain.model.disease.DiseaseSynonyms;
import com.indicationscout.evidence.domain.model.drug.AdverseEvent;
import com.indicationscout.evidence.domain.model.drug.DrugProfile;
import com.indicationscout.evidence.domain.model.drug.DrugTarget;
import com.indicationscout.evidence.domain.model.drug.DrugWarning;
import com.indicationscout.evidence.domain.model.drug.Indication;
import com.indicationscout.evidence.domain.model.target.Association;
import com.indicationscout.evidence.domain.model.target.BiologicalModel;
import com.indicationscout.evidence.domain.model.target.CellTypeExpression;
import com.indicationscout.evidence.domain.model.target.DrugSummary;
import com.indicationscout.evidence.domain.model.target.GeneticConstraint;
import com.indicationscout.evidence.domain.model.target.Interaction;
import com.indicationscout.evidence.domain.model.target.MousePhenotype;
import com.indicationscout.evidence.domain.model.target.Pathway;
import com.indicationscout.evidence.domain.model.target.ProteinExpression;
import com.indicationscout.evidence.domain.model.target.RnaExpression;
import com.indicationscout.evidence.domain.model.target.SafetyEffect;
import com.indicationscout.evidence.domain.model.target.SafetyLiability;
import com.indicationscout.evidence.domain.model.target.TargetProfile;
import com.indicationscout.evidence.domain.model.target.TissueExpression;
import com.indicationscout.evidence.infrastructure.adapter.ResponseFields;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.elements;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalBoolean;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalDouble;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalInt;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalText;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.rows;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.textList;

/**
 * Maps Open Targets GraphQL nodes to domain records, one parser per section.
 */
@Component
public class OpenTargetsMapper {

    static final String SOURCE = "open_targets";

    static final Map<String, String> INTERACTION_TYPES = Map.of(
            "intact", "physical",
            "signor", "signalling",
            "reactome", "enzymatic",
            "string", "functional"
    );

    private static final Map<String, String> SYNONYM_RELATIONS = Map.of(
            "hasExactSynonym", "exact",
            "hasRelatedSynonym", "related",
            "hasNarrowSynonym", "narrow",
            "hasBroadSynonym", "broad"
    );

    private static final TypeReference<Map<String, Object>> REFERENCE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OpenTargetsMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DrugProfile toDrugProfile(JsonNode raw, String chemblId) {
        ResponseFields fields = ResponseFields.of(SOURCE, "drug", "drug " + chemblId);

        List<DrugTarget> targets = new ArrayList<>();
        for (JsonNode row : rows(raw, "mechanismsOfAction")) {
            String mechanism = fields.requiredText(row, "mechanismOfAction");
            String actionType = optionalText(row, "actionType");
            for (JsonNode target : elements(row, "targets")) {
                targets.add(new DrugTarget(
                        fields.requiredText(target, "id"),
                        fields.requiredText(target, "approvedSymbol"),
                        mechanism,
                        actionType));
            }
        }

        List<DrugWarning> warnings = elements(raw, "drugWarnings").stream()
                .map(w -> new DrugWarning(
                        optionalText(w, "warningType"),
                        optionalText(w, "description"),
                        optionalText(w, "toxicityClass"),
                        optionalText(w, "country"),
                        optionalInt(w, "year"),
                        optionalText(w, "efoId")))
                .toList();

        List<Indication> indications = rows(raw, "indications").stream()
                .map(row -> toIndication(row, fields))
                .toList();

        JsonNode adverse = raw.path("adverseEvents");
        List<AdverseEvent> adverseEvents = rows(raw, "adverseEvents").stream()
                .map(row -> new AdverseEvent(
                        fields.requiredText(row, "name"),
                        optionalText(row, "meddraCode"),
                        fields.requiredLong(row, "count"),
                        fields.requiredDouble(row, "logLR")))
                .toList();

        return new DrugProfile(
                fields.requiredText(raw, "id"),
                fields.requiredText(raw, "name"),
                textList(raw, "synonyms"),
                textList(raw, "tradeNames"),
                optionalText(raw, "drugType"),
                optionalBoolean(raw, "isApproved"),
                optionalDouble(raw, "maximumClinicalTrialPhase"),
                optionalInt(raw, "yearOfFirstApproval"),
                warnings,
                indications,
                targets,
                adverseEvents,
                adverse.isObject() ? optionalDouble(adverse, "criticalValue") : null
        );
    }

    public TargetProfile toTargetProfile(JsonNode raw, String targetId) {
        ResponseFields fields = ResponseFields.of(SOURCE, "target", "target " + targetId);

        return new TargetProfile(
                fields.requiredText(raw, "id"),
                fields.requiredText(raw, "approvedSymbol"),
                optionalText(raw, "approvedName"),
                toAssociations(raw, targetId),
                elements(raw, "pathways").stream().map(this::toPathway).toList(),
                rows(raw, "interactions").stream().map(row -> toInteraction(row, fields)).toList(),
                rows(raw, "knownDrugs").stream().map(row -> toDrugSummary(row, fields)).toList(),
                elements(raw, "expressions").stream().map(e -> toExpression(e, fields)).toList(),
                elements(raw, "mousePhenotypes").stream().map(this::toMousePhenotype).toList(),
                elements(raw, "safetyLiabilities").stream().map(this::toSafetyLiability).toList(),
                elements(raw, "geneticConstraint").stream().map(c -> toConstraint(c, fields)).toList()
        );
    }

    /**
     * Parses the {@code associatedDiseases} rows of a target node.
     */
    public List<Association> toAssociations(JsonNode target, String targetId) {
        ResponseFields fields = ResponseFields.of(SOURCE, "target_associations", "target " + targetId);
        return rows(target, "associatedDiseases").stream()
                .map(row -> toAssociation(row, fields))
                .toList();
    }

    /**
     * Known drugs for a disease, one entry per drug id. When a drug appears
     * for several indications the row with the highest phase is kept.
     */
    public List<DrugSummary> toDiseaseDrugs(JsonNode disease, String diseaseId) {
        ResponseFields fields = ResponseFields.of(SOURCE, "disease_drugs", "disease " + diseaseId);
        Map<String, DrugSummary> byDrug = new LinkedHashMap<>();
        for (JsonNode row : rows(disease, "knownDrugs")) {
            DrugSummary summary = toDrugSummary(row, fields);
            DrugSummary current = byDrug.get(summary.drugId());
            if (current == null || phaseOf(summary) > phaseOf(current)) {
                byDrug.put(summary.drugId(), summary);
            }
        }
        return List.copyOf(byDrug.values());
    }

    public DiseaseSynonyms toDiseaseSynonyms(JsonNode disease, String diseaseId) {
        ResponseFields fields = ResponseFields.of(SOURCE, "disease_synonyms", "disease " + diseaseId);

        Map<String, List<String>> grouped = new LinkedHashMap<>();
        SYNONYM_RELATIONS.values().forEach(group -> grouped.put(group, new ArrayList<>()));
        for (JsonNode entry : elements(disease, "synonyms")) {
            String group = SYNONYM_RELATIONS.getOrDefault(entry.path("relation").asText(), null);
            if (group != null) {
                grouped.get(group).addAll(textList(entry, "terms"));
            }
        }

        List<String> parentNames = elements(disease, "parents").stream()
                .map(parent -> fields.requiredText(parent, "name"))
                .toList();

        return new DiseaseSynonyms(
                fields.requiredText(disease, "id"),
                fields.requiredText(disease, "name"),
                parentNames,
                grouped.get("exact"),
                grouped.get("related"),
                grouped.get("narrow"),
                grouped.get("broad")
        );
    }

    private Indication toIndication(JsonNode row, ResponseFields fields) {
        JsonNode disease = fields.requiredObject(row, "disease");
        List<Map<String, Object>> references = elements(row, "references").stream()
                .map(reference -> objectMapper.convertValue(reference, REFERENCE_TYPE))
                .toList();
        return new Indication(
                fields.requiredText(disease, "id"),
                fields.requiredText(disease, "name"),
                fields.requiredDouble(row, "maxPhaseForIndication"),
                references);
    }

    private Association toAssociation(JsonNode row, ResponseFields fields) {
        JsonNode disease = fields.requiredObject(row, "disease");

        Map<String, Double> datatypeScores = new LinkedHashMap<>();
        for (JsonNode score : elements(row, "datatypeScores")) {
            datatypeScores.put(fields.requiredText(score, "id"), fields.requiredDouble(score, "score"));
        }
        List<String> therapeuticAreas = elements(disease, "therapeuticAreas").stream()
                .map(area -> fields.requiredText(area, "name"))
                .toList();

        return new Association(
                fields.requiredText(disease, "id"),
                fields.requiredText(disease, "name"),
                fields.requiredDouble(row, "score"),
                datatypeScores,
                therapeuticAreas);
    }

    private Pathway toPathway(JsonNode raw) {
        return new Pathway(
                optionalText(raw, "pathwayId"),
                optionalText(raw, "pathway"),
                optionalText(raw, "topLevelTerm"));
    }

    private Interaction toInteraction(JsonNode raw, ResponseFields fields) {
        JsonNode partner = raw.path("targetB");
        String partnerId = partner.isObject() ? optionalText(partner, "id") : null;
        if (partnerId == null) {
            partnerId = fields.requiredText(raw, "intB");
        }
        String sourceDatabase = optionalText(raw, "sourceDatabase");
        String interactionType = sourceDatabase == null
                ? null
                : INTERACTION_TYPES.get(sourceDatabase.toLowerCase(Locale.ROOT));

        return new Interaction(
                partnerId,
                partner.isObject() ? optionalText(partner, "approvedSymbol") : null,
                optionalDouble(raw, "score"),
                sourceDatabase,
                optionalText(raw, "intBBiologicalRole"),
                optionalInt(raw, "count"),
                interactionType);
    }

    private DrugSummary toDrugSummary(JsonNode raw, ResponseFields fields) {
        return new DrugSummary(
                fields.requiredText(raw, "drugId"),
                optionalText(raw, "prefName"),
                optionalText(raw, "diseaseId"),
                optionalText(raw, "label"),
                optionalDouble(raw, "phase"),
                optionalText(raw, "status"),
                optionalText(raw, "mechanismOfAction"),
                textList(raw, "ctIds"));
    }

    private TissueExpression toExpression(JsonNode raw, ResponseFields fields) {
        JsonNode tissue = raw.path("tissue");
        List<String> systems = textList(tissue, "anatomicalSystems");

        RnaExpression rna = null;
        JsonNode rnaNode = raw.path("rna");
        if (rnaNode.isObject()) {
            rna = new RnaExpression(
                    optionalDouble(rnaNode, "value"),
                    optionalInt(rnaNode, "level"),
                    optionalText(rnaNode, "unit"));
        }

        ProteinExpression protein = null;
        JsonNode proteinNode = raw.path("protein");
        if (proteinNode.isObject()) {
            List<CellTypeExpression> cellTypes = elements(proteinNode, "cellType").stream()
                    .map(cell -> new CellTypeExpression(
                            fields.requiredText(cell, "name"),
                            (int) fields.requiredLong(cell, "level"),
                            optionalBoolean(cell, "reliability")))
                    .toList();
            protein = new ProteinExpression(
                    optionalInt(proteinNode, "level"),
                    optionalBoolean(proteinNode, "reliability"),
                    cellTypes);
        }

        return new TissueExpression(
                tissue.isObject() ? optionalText(tissue, "id") : null,
                tissue.isObject() ? optionalText(tissue, "label") : null,
                systems.isEmpty() ? null : systems.get(0),
                rna,
                protein);
    }

    private MousePhenotype toMousePhenotype(JsonNode raw) {
        List<String> categories = elements(raw, "modelPhenotypeClasses").stream()
                .map(c -> optionalText(c, "label"))
                .filter(Objects::nonNull)
                .toList();
        List<BiologicalModel> models = elements(raw, "biologicalModels").stream()
                .map(m -> new BiologicalModel(
                        optionalText(m, "id"),
                        optionalText(m, "allelicComposition"),
                        optionalText(m, "geneticBackground"),
                        textList(m, "literature")))
                .toList();
        return new MousePhenotype(
                optionalText(raw, "modelPhenotypeId"),
                optionalText(raw, "modelPhenotypeLabel"),
                categories,
                models);
    }

    private SafetyLiability toSafetyLiability(JsonNode raw) {
        List<SafetyEffect> effects = elements(raw, "effects").stream()
                .map(e -> new SafetyEffect(optionalText(e, "direction"), optionalText(e, "dosing")))
                .toList();
        return new SafetyLiability(
                optionalText(raw, "event"),
                optionalText(raw, "eventId"),
                effects,
                optionalText(raw, "datasource"),
                optionalText(raw, "literature"),
                optionalText(raw, "url"));
    }

    private GeneticConstraint toConstraint(JsonNode raw, ResponseFields fields) {
        return new GeneticConstraint(
                fields.requiredText(raw, "constraintType"),
                optionalDouble(raw, "oe"),
                optionalDouble(raw, "oeLower"),
                optionalDouble(raw, "oeUpper"),
                optionalDouble(raw, "score"),
                optionalInt(raw, "upperBin"));
    }

    private static double phaseOf(DrugSummary summary) {
        return summary.phase() != null ? summary.phase() : -1;
    }
}
