package com.indicationscout.evidence.domain.model.drug;

/**
 * Significant adverse event reported for a drug (FAERS).
 */
public record AdverseEvent(
        String name,
        String meddraCode,
        long count,
        double logLikelihoodRatio
) {}
