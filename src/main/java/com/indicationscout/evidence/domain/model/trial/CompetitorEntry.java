package com.indicationscout.evidence.domain.model.trial;

import java.util.Set;

/**
 * A sponsor and drug pair competing in a condition.
 *
 * @param mostRecentStart null when none of the group's trials reports a start date
 */
public record CompetitorEntry(
        String sponsor,
        String drugName,
        String drugType,
        String maxPhase,
        int trialCount,
        Set<String> statuses,
        long totalEnrollment,
        String mostRecentStart
) {
    public CompetitorEntry {
        statuses = Set.copyOf(statuses);
    }
}
