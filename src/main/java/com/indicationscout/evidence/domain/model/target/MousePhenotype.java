package com.indicationscout.evidence.domain.model.target;

import java.util.List;

public record MousePhenotype(
        String phenotypeId,
        String phenotypeLabel,
        List<String> phenotypeCategories,
        List<BiologicalModel> biologicalModels
) {
    public MousePhenotype {
        phenotypeCategories = List.copyOf(phenotypeCategories);
        biologicalModels = List.copyOf(biologicalModels);
    }
}
