package com.indicationscout.evidence.domain.model.drug;

/**
 * Reference from a drug to one of its targets via a mechanism of action.
 *
 * @param actionType nullable, e.g. "AGONIST"
 */
public record DrugTarget(
        String targetId,
        String targetSymbol,
        String mechanismOfAction,
        String actionType
) {}
