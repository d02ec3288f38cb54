package com.indicationscout.evidence.domain.model.target;

import java.util.List;

public record BiologicalModel(
        String modelId,
        String allelicComposition,
        String geneticBackground,
        List<String> literature
) {
    public BiologicalModel {
        literature = List.copyOf(literature);
    }
}
