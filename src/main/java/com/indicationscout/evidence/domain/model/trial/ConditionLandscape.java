package com.indicationscout.evidence.domain.model.trial;

import java.util.List;
import java.util.Map;

/**
 * Competitive landscape of a condition: ranked competitors, a phase
 * histogram and the trials started recently.
 */
public record ConditionLandscape(
        int totalTrialCount,
        List<CompetitorEntry> competitors,
        Map<String, Integer> phaseDistribution,
        List<RecentStart> recentStarts
) {
    public ConditionLandscape {
        competitors = List.copyOf(competitors);
        phaseDistribution = Map.copyOf(phaseDistribution);
        recentStarts = List.copyOf(recentStarts);
    }
}
