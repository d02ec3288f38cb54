package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import com.fasterxml.jackson.databind.JsonNode;
import com.indicationscout.evidence.domain.model.trial.Intervention;
import com.indicationscout.evidence.domain.model.trial.PrimaryOutcome;
import com.indicationscout.evidence.domain.model.trial.Trial;
import com.indicationscout.evidence.domain.model.trial.TrialPhases;
import com.indicationscout.evidence.infrastructure.adapter.ResponseFields;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.elements;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalBoolean;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalInt;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.optionalText;
import static com.indicationscout.evidence.infrastructure.adapter.ResponseFields.textList;

/**
 * Maps registry v2 study documents to {@link Trial} records.
 */
@Component
public class ClinicalTrialsMapper {

    static final String SOURCE = "clinical_trials";

    /**
     * Parses every study on a search page. A page without a {@code studies}
     * member is an empty page.
     */
    public List<Trial> toTrials(JsonNode page) {
        return elements(page, "studies").stream()
                .map(this::toTrial)
                .toList();
    }

    public Trial toTrial(JsonNode study) {
        JsonNode protocol = study.path("protocolSection");
        JsonNode identification = protocol.path("identificationModule");
        String nctId = optionalText(identification, "nctId");
        if (nctId == null) {
            throw ResponseFields.of(SOURCE, "search", "study without identifier")
                    .malformed("Missing 'protocolSection.identificationModule.nctId'");
        }

        ResponseFields fields = ResponseFields.of(SOURCE, "search", "study " + nctId);
        JsonNode status = protocol.path("statusModule");
        JsonNode design = protocol.path("designModule");
        JsonNode sponsors = protocol.path("sponsorCollaboratorsModule");

        List<Intervention> interventions = elements(protocol.path("armsInterventionsModule"), "interventions")
                .stream()
                .map(i -> new Intervention(
                        interventionType(optionalText(i, "type")),
                        fields.requiredText(i, "name"),
                        optionalText(i, "description")))
                .toList();

        List<PrimaryOutcome> primaryOutcomes = elements(protocol.path("outcomesModule"), "primaryOutcomes")
                .stream()
                .map(o -> new PrimaryOutcome(optionalText(o, "measure"), optionalText(o, "timeFrame")))
                .toList();

        List<String> collaborators = elements(sponsors, "collaborators").stream()
                .map(c -> optionalText(c, "name"))
                .filter(Objects::nonNull)
                .toList();

        List<String> pmids = elements(protocol.path("referencesModule"), "references").stream()
                .map(r -> optionalText(r, "pmid"))
                .filter(pmid -> pmid != null && !pmid.isBlank())
                .toList();

        return new Trial(
                nctId,
                optionalText(identification, "briefTitle"),
                optionalText(protocol.path("descriptionModule"), "briefSummary"),
                TrialPhases.normalize(textList(design, "phases")),
                optionalText(status, "overallStatus"),
                optionalText(status, "whyStopped"),
                textList(protocol.path("conditionsModule"), "conditions"),
                interventions,
                optionalText(sponsors.path("leadSponsor"), "name"),
                collaborators,
                optionalInt(design.path("enrollmentInfo"), "count"),
                optionalText(status.path("startDateStruct"), "date"),
                optionalText(status.path("primaryCompletionDateStruct"), "date"),
                optionalText(design, "studyType"),
                primaryOutcomes,
                optionalBoolean(study, "hasResults"),
                pmids
        );
    }

    /**
     * "DIETARY_SUPPLEMENT" becomes "Dietary Supplement".
     */
    static String interventionType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String[] words = raw.replace('_', ' ').toLowerCase(Locale.ROOT).split(" ");
        StringBuilder title = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}
