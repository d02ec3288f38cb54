package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;
import com.indicationscout.evidence.domain.model.trial.Intervention;
import com.indicationscout.evidence.domain.model.trial.Trial;
import com.indicationscout.evidence.domain.model.trial.TrialPhases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClinicalTrialsMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ClinicalTrialsMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ClinicalTrialsMapper();
    }

    @Test
    void shouldMapFullStudy() throws IOException {
        // When
        Trial trial = mapper.toTrials(loadPage()).get(0);

        // Then
        assertThat(trial.nctId()).isEqualTo("NCT04012345");
        assertThat(trial.title()).isEqualTo("Bupropion for Binge Eating Disorder");
        assertThat(trial.phase()).isEqualTo("Phase 2/Phase 3");
        assertThat(trial.overallStatus()).isEqualTo("TERMINATED");
        assertThat(trial.whyStopped()).contains("accrual");
        assertThat(trial.conditions()).containsExactly("Binge-Eating Disorder", "Obesity");
        assertThat(trial.sponsor()).isEqualTo("University of Example");
        assertThat(trial.collaborators()).containsExactly("National Institute of Mental Health");
        assertThat(trial.enrollment()).isEqualTo(48);
        assertThat(trial.startDate()).isEqualTo("2019-06");
        assertThat(trial.completionDate()).isEqualTo("2021-02-15");
        assertThat(trial.studyType()).isEqualTo("INTERVENTIONAL");
        assertThat(trial.primaryOutcomes()).singleElement()
                .satisfies(o -> assertThat(o.timeFrame()).isEqualTo("12 weeks"));
        assertThat(trial.resultsPosted()).isTrue();
        assertThat(trial.references()).containsExactly("31234567");
    }

    @Test
    void shouldTitleCaseInterventionTypesAndPickFirstDrug() throws IOException {
        // When
        Trial trial = mapper.toTrials(loadPage()).get(0);

        // Then
        assertThat(trial.interventions()).extracting(Intervention::type)
                .containsExactly("Behavioral", "Drug", "Dietary Supplement");
        assertThat(trial.primaryDrug()).map(Intervention::name).contains("Bupropion");
    }

    @Test
    void shouldLeaveMissingModulesEmpty() throws IOException {
        // When
        Trial trial = mapper.toTrials(loadPage()).get(1);

        // Then
        assertThat(trial.phase()).isEqualTo(TrialPhases.NOT_APPLICABLE);
        assertThat(trial.interventions()).isEmpty();
        assertThat(trial.primaryDrug()).isEmpty();
        assertThat(trial.sponsor()).isNull();
        assertThat(trial.enrollment()).isNull();
        assertThat(trial.startDate()).isNull();
        assertThat(trial.resultsPosted()).isNull();
        assertThat(trial.firstCondition()).isEmpty();
    }

    @Test
    void shouldTreatPageWithoutStudiesAsEmpty() throws IOException {
        // Given
        JsonNode page = objectMapper.readTree("{\"totalCount\": 0}");

        // When
        List<Trial> trials = mapper.toTrials(page);

        // Then
        assertThat(trials).isEmpty();
    }

    @Test
    void shouldRejectStudyWithoutIdentifier() throws IOException {
        // Given
        JsonNode study = objectMapper.readTree("{\"protocolSection\": {\"identificationModule\": {}}}");

        // When / Then
        assertThatThrownBy(() -> mapper.toTrial(study))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("nctId");
    }

    @Test
    void shouldRejectInterventionWithoutName() throws IOException {
        // Given
        JsonNode study = objectMapper.readTree("""
                {"protocolSection": {
                    "identificationModule": {"nctId": "NCT1"},
                    "armsInterventionsModule": {"interventions": [{"type": "DRUG"}]}
                }}
                """);

        // When / Then
        assertThatThrownBy(() -> mapper.toTrial(study))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("study NCT1");
    }

    @Test
    void shouldFormatInterventionTypes() {
        assertThat(ClinicalTrialsMapper.interventionType("DIETARY_SUPPLEMENT")).isEqualTo("Dietary Supplement");
        assertThat(ClinicalTrialsMapper.interventionType("BIOLOGICAL")).isEqualTo(Intervention.BIOLOGICAL);
        assertThat(ClinicalTrialsMapper.interventionType(" ")).isNull();
        assertThat(ClinicalTrialsMapper.interventionType(null)).isNull();
    }

    private JsonNode loadPage() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/clinicaltrials/studies_page.json")) {
            return objectMapper.readTree(in);
        }
    }
}
