package com.indicationscout.evidence.domain.model.drug;

/**
 * Black box warning or withdrawal. Every field but the type is optional.
 */
public record DrugWarning(
        String warningType,
        String description,
        String toxicityClass,
        String country,
        Integer year,
        String efoId
) {}
