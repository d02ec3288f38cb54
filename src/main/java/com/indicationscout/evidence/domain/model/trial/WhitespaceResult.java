package com.indicationscout.evidence.domain.model.trial;

import java.util.List;

/**
 * Whether a drug-condition pair is unexplored in the registry.
 * {@code conditionDrugs} is only populated for whitespace.
 */
public record WhitespaceResult(
        boolean whitespace,
        int exactMatchCount,
        int drugOnlyTrials,
        int conditionOnlyTrials,
        List<ConditionDrug> conditionDrugs
) {
    public WhitespaceResult {
        conditionDrugs = List.copyOf(conditionDrugs);
    }
}
