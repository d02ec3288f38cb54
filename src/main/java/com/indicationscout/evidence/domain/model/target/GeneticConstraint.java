package com.indicationscout.evidence.domain.model.target;

/**
 * gnomAD loss-of-function intolerance. {@code upperBin} runs from 0 (most
 * constrained) to 5.
 */
public record GeneticConstraint(
        String constraintType,
        Double oe,
        Double oeLower,
        Double oeUpper,
        Double score,
        Integer upperBin
) {}
