package com.indicationscout.evidence.domain.model.drug;

import java.util.List;
import java.util.Map;

public record Indication(
        String diseaseId,
        String diseaseName,
        double maxPhase,
        List<Map<String, Object>> references
) {
    public Indication {
        references = List.copyOf(references);
    }
}
