package com.indicationscout.evidence.domain.model.target;

import java.util.List;
import java.util.Map;

/**
 * Target-disease association with the per-datatype evidence breakdown,
 * e.g. {@code {"genetic_association": 0.7, "literature": 0.9}}.
 */
public record Association(
        String diseaseId,
        String diseaseName,
        double overallScore,
        Map<String, Double> datatypeScores,
        List<String> therapeuticAreas
) {
    public Association {
        datatypeScores = Map.copyOf(datatypeScores);
        therapeuticAreas = List.copyOf(therapeuticAreas);
    }
}
