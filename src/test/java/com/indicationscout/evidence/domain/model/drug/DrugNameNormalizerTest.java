package com.indicationscout.evidence.domain.model.drug;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DrugNameNormalizerTest {

    @Test
    void shouldStripTrailingSaltForm() {
        assertThat(DrugNameNormalizer.normalize("Bupropion Hydrochloride")).isEqualTo("bupropion");
        assertThat(DrugNameNormalizer.normalize("METFORMIN HYDROCHLORIDE")).isEqualTo("metformin");
        assertThat(DrugNameNormalizer.normalize("Sumatriptan Succinate")).isEqualTo("sumatriptan");
        assertThat(DrugNameNormalizer.normalize("imatinib mesylate")).isEqualTo("imatinib");
    }

    @Test
    void shouldLowerCaseNamesWithoutSalt() {
        assertThat(DrugNameNormalizer.normalize("Semaglutide")).isEqualTo("semaglutide");
        assertThat(DrugNameNormalizer.normalize("sodium chloride solution")).isEqualTo("sodium chloride solution");
    }

    @Test
    void shouldStripOnlyOneSuffix() {
        assertThat(DrugNameNormalizer.normalize("Morphine Sulfate Anhydrous")).isEqualTo("morphine sulfate");
    }
}
