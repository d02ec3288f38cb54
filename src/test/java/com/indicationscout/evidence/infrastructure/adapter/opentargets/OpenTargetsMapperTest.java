package com.indicationscout.evidence.infrastructure.adapter.opentargets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;
import com.indicationscout.evidence.domain.model.disease.DiseaseSynonyms;
import com.indicationscout.evidence.domain.model.drug.DrugProfile;
import com.indicationscout.evidence.domain.model.target.Association;
import com.indicationscout.evidence.domain.model.target.DrugSummary;
import com.indicationscout.evidence.domain.model.target.Interaction;
import com.indicationscout.evidence.domain.model.target.TargetProfile;
import com.indicationscout.evidence.domain.model.target.TissueExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.indicationscout.evidence.infrastructure.adapter.opentargets.OpenTargetsFixtures.MAPPER;
import static com.indicationscout.evidence.infrastructure.adapter.opentargets.OpenTargetsFixtures.knownDrug;
import static com.indicationscout.evidence.infrastructure.adapter.opentargets.OpenTargetsFixtures.load;
import static com.indicationscout.evidence.infrastructure.adapter.opentargets.OpenTargetsFixtures.withKnownDrugs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class OpenTargetsMapperTest {

    private OpenTargetsMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new OpenTargetsMapper(MAPPER);
    }

    @Test
    void shouldMapDrugProfile() {
        // When
        DrugProfile drug = mapper.toDrugProfile(load("drug.json"), "CHEMBL894");

        // Then
        assertThat(drug.chemblId()).isEqualTo("CHEMBL894");
        assertThat(drug.name()).isEqualTo("BUPROPION");
        assertThat(drug.tradeNames()).containsExactly("Wellbutrin", "Zyban");
        assertThat(drug.approved()).isTrue();
        assertThat(drug.maxClinicalPhase()).isEqualTo(4.0);
        assertThat(drug.yearFirstApproved()).isEqualTo(1985);
        assertThat(drug.targetIds()).containsExactly("ENSG00000142319", "ENSG00000103546");
        assertThat(drug.targets().get(0).mechanismOfAction()).isEqualTo("Dopamine transporter inhibitor");
        assertThat(drug.targets().get(0).actionType()).isEqualTo("INHIBITOR");
        assertThat(drug.approvedDiseaseIds()).containsExactly("EFO_0003761");
        assertThat(drug.investigatedDiseaseIds()).containsExactlyInAnyOrder("EFO_0003761", "EFO_0001073");
        assertThat(drug.indications().get(0).references()).hasSize(1);
        assertThat(drug.indications().get(0).references().get(0)).containsEntry("source", "FDA");
    }

    @Test
    void shouldKeepAbsentOptionalFieldsAsNull() {
        // When
        DrugProfile drug = mapper.toDrugProfile(load("drug.json"), "CHEMBL894");

        // Then
        assertThat(drug.warnings()).hasSize(1);
        assertThat(drug.warnings().get(0).description()).isNull();
        assertThat(drug.warnings().get(0).year()).isEqualTo(2009);
        assertThat(drug.adverseEvents()).hasSize(2);
        assertThat(drug.adverseEvents().get(0).logLikelihoodRatio()).isEqualTo(812.4);
        assertThat(drug.adverseEvents().get(1).meddraCode()).isNull();
        assertThat(drug.adverseEventsCriticalValue()).isEqualTo(24.8);
    }

    @Test
    void shouldMapMinimalDrugWithEmptyCollections() {
        // Given
        ObjectNode raw = MAPPER.createObjectNode().put("id", "CHEMBL1").put("name", "TESTDRUG");

        // When
        DrugProfile drug = mapper.toDrugProfile(raw, "CHEMBL1");

        // Then
        assertThat(drug.targets()).isEmpty();
        assertThat(drug.indications()).isEmpty();
        assertThat(drug.drugType()).isNull();
        assertThat(drug.approved()).isNull();
        assertThat(drug.adverseEventsCriticalValue()).isNull();
    }

    @Test
    void shouldFailWhenRequiredDrugFieldIsMissing() {
        // Given
        ObjectNode raw = MAPPER.createObjectNode().put("id", "CHEMBL1");

        // When / Then
        assertThatThrownBy(() -> mapper.toDrugProfile(raw, "CHEMBL1"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("'name'")
                .hasMessageContaining("drug CHEMBL1");
    }

    @Test
    void shouldFailWhenMechanismTargetLacksSymbol() {
        // Given
        ObjectNode raw = (ObjectNode) load("drug.json");
        ((ObjectNode) raw.path("mechanismsOfAction").path("rows").get(0).path("targets").get(0))
                .remove("approvedSymbol");

        // When / Then
        assertThatThrownBy(() -> mapper.toDrugProfile(raw, "CHEMBL894"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("approvedSymbol");
    }

    @Test
    void shouldMapTargetProfile() {
        // When
        TargetProfile target = mapper.toTargetProfile(load("target.json"), "ENSG00000146648");

        // Then
        assertThat(target.symbol()).isEqualTo("EGFR");
        assertThat(target.name()).isEqualTo("epidermal growth factor receptor");
        assertThat(target.pathways()).singleElement()
                .satisfies(p -> assertThat(p.topLevelPathway()).isEqualTo("Signal Transduction"));
        assertThat(target.drugSummaries()).extracting(DrugSummary::drugName).containsExactly("GEFITINIB");
        assertThat(target.drugSummaries().get(0).clinicalTrialIds()).containsExactly("NCT01203917");
        assertThat(target.mousePhenotypes().get(0).phenotypeCategories()).containsExactly("mortality/aging");
        assertThat(target.safetyLiabilities().get(0).effects()).hasSize(1);
        assertThat(target.geneticConstraints().get(0).upperBin()).isZero();
    }

    @Test
    void shouldMapAssociationsWithDatatypeBreakdown() {
        // When
        List<Association> associations = mapper.toAssociations(load("target.json"), "ENSG00000146648");

        // Then
        assertThat(associations).hasSize(2);
        Association first = associations.get(0);
        assertThat(first.diseaseName()).isEqualTo("non-small cell lung carcinoma");
        assertThat(first.overallScore()).isEqualTo(0.84);
        assertThat(first.datatypeScores()).containsOnly(entry("known_drug", 0.99), entry("somatic_mutation", 0.93));
        assertThat(first.therapeuticAreas()).containsExactly("cancer or benign tumor");
        assertThat(associations.get(1).therapeuticAreas()).isEmpty();
    }

    @Test
    void shouldDeriveInteractionTypeFromSourceDatabase() {
        // When
        List<Interaction> interactions = mapper.toTargetProfile(load("target.json"), "ENSG00000146648")
                .interactions();

        // Then
        assertThat(interactions).hasSize(3);
        assertThat(interactions.get(0).interactingTargetId()).isEqualTo("ENSG00000177885");
        assertThat(interactions.get(0).interactingTargetSymbol()).isEqualTo("GRB2");
        assertThat(interactions.get(0).interactionType()).isEqualTo("physical");
        assertThat(interactions.get(1).interactingTargetId()).isEqualTo("P04626");
        assertThat(interactions.get(1).interactionScore()).isNull();
        assertThat(interactions.get(1).interactionType()).isEqualTo("signalling");
        assertThat(interactions.get(2).interactionType()).isNull();
    }

    @Test
    void shouldTakeFirstAnatomicalSystemAndRnaLevel() {
        // When
        List<TissueExpression> expressions = mapper.toTargetProfile(load("target.json"), "ENSG00000146648")
                .expressions();

        // Then
        TissueExpression lung = expressions.get(0);
        assertThat(lung.anatomicalSystem()).isEqualTo("respiratory system");
        assertThat(lung.rna().quantile()).isEqualTo(3);
        assertThat(lung.protein().cellTypes()).singleElement()
                .satisfies(cell -> assertThat(cell.level()).isEqualTo(2));

        TissueExpression brain = expressions.get(1);
        assertThat(brain.anatomicalSystem()).isNull();
        assertThat(brain.protein()).isNull();
    }

    @Test
    void shouldKeepHighestPhasePerDiseaseDrug() {
        // Given
        JsonNode disease = withKnownDrugs(MAPPER.createObjectNode(),
                knownDrug("CHEMBL1", "DRUG A", "asthma", 2.0),
                knownDrug("CHEMBL2", "DRUG B", "asthma", null),
                knownDrug("CHEMBL1", "DRUG A", "asthma", 4.0),
                knownDrug("CHEMBL2", "DRUG B", "asthma", 1.0),
                knownDrug("CHEMBL1", "DRUG A", "asthma", 3.0));

        // When
        List<DrugSummary> drugs = mapper.toDiseaseDrugs(disease, "EFO_0000270");

        // Then
        assertThat(drugs).extracting(DrugSummary::drugId).containsExactly("CHEMBL1", "CHEMBL2");
        assertThat(drugs).extracting(DrugSummary::phase).containsExactly(4.0, 1.0);
    }

    @Test
    void shouldGroupSynonymsByRelation() {
        // When
        DiseaseSynonyms synonyms = mapper.toDiseaseSynonyms(load("disease_synonyms.json"), "EFO_0000270");

        // Then
        assertThat(synonyms.diseaseName()).isEqualTo("asthma");
        assertThat(synonyms.exact()).containsExactly("bronchial asthma", "asthmatic");
        assertThat(synonyms.related()).containsExactly("reactive airway disease");
        assertThat(synonyms.narrow()).containsExactly("allergic asthma");
        assertThat(synonyms.broad()).containsExactly("airway disease");
        assertThat(synonyms.allSynonyms()).containsExactly(
                "bronchial asthma", "asthmatic", "reactive airway disease", "bronchial disease", "lung disease");
    }
}
