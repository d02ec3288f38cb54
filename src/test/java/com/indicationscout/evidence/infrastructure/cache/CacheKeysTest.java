package com.indicationscout.evidence.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeysTest {

    @Test
    void shouldAddressSameEntryRegardlessOfInsertionOrder() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("query.cond", "asthma");
        first.put("pageSize", "100");
        first.put("filters", new LinkedHashMap<>(Map.of("b", 2, "a", 1)));

        Map<String, Object> second = new LinkedHashMap<>();
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("a", 1);
        nested.put("b", 2);
        second.put("filters", nested);
        second.put("pageSize", "100");
        second.put("query.cond", "asthma");

        // When / Then
        assertThat(CacheKeys.keyFor("clinical_trials_search", first))
                .isEqualTo(CacheKeys.keyFor("clinical_trials_search", second));
    }

    @Test
    void shouldSeparateNamespaces() {
        Map<String, String> params = Map.of("id", "ENSG00000146648");

        assertThat(CacheKeys.keyFor("target", params)).isNotEqualTo(CacheKeys.keyFor("drug", params));
    }

    @Test
    void shouldDistinguishDifferentValues() {
        assertThat(CacheKeys.keyFor("drug", Map.of("chembl_id", "CHEMBL894")))
                .isNotEqualTo(CacheKeys.keyFor("drug", Map.of("chembl_id", "CHEMBL1431")));
    }

    @Test
    void shouldProduceHexSha256() {
        String key = CacheKeys.keyFor("drug", Map.of("chembl_id", "CHEMBL894"));

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void shouldIncludeNamespaceInCanonicalForm() {
        String canonical = CacheKeys.canonicalForm("target", Map.of("target_id", "T1", "list", List.of(2, 1)));

        assertThat(canonical).isEqualTo("{\"list\":[2,1],\"ns\":\"target\",\"target_id\":\"T1\"}");
    }

    @Test
    void shouldRejectParameterNamedLikeNamespaceField() {
        // Given
        Map<String, String> params = Map.of("ns", "drug");

        // When / Then
        assertThatThrownBy(() -> CacheKeys.keyFor("target", params))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'ns' is reserved");
        assertThat(CacheKeys.keyFor("target", Map.of())).isNotBlank();
    }
}
