package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import com.indicationscout.evidence.domain.model.trial.CompetitorEntry;
import com.indicationscout.evidence.domain.model.trial.ConditionLandscape;
import com.indicationscout.evidence.domain.model.trial.Intervention;
import com.indicationscout.evidence.domain.model.trial.RecentStart;
import com.indicationscout.evidence.domain.model.trial.Trial;
import com.indicationscout.evidence.domain.model.trial.TrialPhases;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups a condition's trials into a competitive landscape.
 *
 * <p>Only trials with a drug or biologic intervention take part. Each is
 * keyed by lead sponsor and the name of its first drug-like intervention.
 * Groups rank by max phase, then summed enrollment, both descending.
 * The total trial count covers every trial passed in, drug-like or not.
 */
@Component
public class LandscapeAggregator {

    /** Start dates compare as strings; anything from this year on is recent. */
    static final String RECENT_START_CUTOFF = "2024";

    public ConditionLandscape aggregate(List<Trial> trials, int topN) {
        Map<GroupKey, Group> groups = new LinkedHashMap<>();
        Map<String, Integer> phaseDistribution = new LinkedHashMap<>();
        List<RecentStart> recentStarts = new ArrayList<>();

        for (Trial trial : trials) {
            Optional<Intervention> primary = trial.primaryDrug();
            if (primary.isEmpty()) {
                continue;
            }
            Intervention drug = primary.get();

            phaseDistribution.merge(trial.phase(), 1, Integer::sum);

            if (trial.startDate() != null && trial.startDate().compareTo(RECENT_START_CUTOFF) >= 0) {
                recentStarts.add(new RecentStart(trial.nctId(), trial.sponsor(), drug.name(),
                        trial.phase(), trial.startDate()));
            }

            groups.computeIfAbsent(new GroupKey(trial.sponsor(), drug.name()), key -> new Group(drug.type()))
                    .add(trial);
        }

        List<CompetitorEntry> competitors = groups.entrySet().stream()
                .map(e -> e.getValue().toEntry(e.getKey()))
                .sorted(Comparator.comparingInt((CompetitorEntry c) -> TrialPhases.rank(c.maxPhase()))
                        .thenComparingLong(CompetitorEntry::totalEnrollment)
                        .reversed())
                .limit(Math.max(0, topN))
                .toList();

        return new ConditionLandscape(trials.size(), competitors, phaseDistribution, recentStarts);
    }

    private record GroupKey(String sponsor, String drugName) {}

    private static final class Group {

        private final String drugType;
        private final Set<String> statuses = new LinkedHashSet<>();
        private String maxPhase;
        private int trialCount;
        private long totalEnrollment;
        private String mostRecentStart;

        private Group(String drugType) {
            this.drugType = drugType;
        }

        private void add(Trial trial) {
            trialCount++;
            if (trial.overallStatus() != null) {
                statuses.add(trial.overallStatus());
            }
            if (trial.enrollment() != null) {
                totalEnrollment += trial.enrollment();
            }
            if (maxPhase == null || TrialPhases.rank(trial.phase()) > TrialPhases.rank(maxPhase)) {
                maxPhase = trial.phase();
            }
            String start = trial.startDate();
            if (start != null && (mostRecentStart == null || start.compareTo(mostRecentStart) > 0)) {
                mostRecentStart = start;
            }
        }

        private CompetitorEntry toEntry(GroupKey key) {
            return new CompetitorEntry(key.sponsor(), key.drugName(), drugType, maxPhase, trialCount,
                    statuses, totalEnrollment, mostRecentStart);
        }
    }
}
