package com.indicationscout.evidence.domain.model.trial;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry phase codes, their display labels and their maturity ranking.
 */
public final class TrialPhases {

    public static final String NOT_APPLICABLE = "Not Applicable";

    /** Phase 2 and later. */
    public static final String PHASE_2_OR_LATER = "(PHASE2 OR PHASE3 OR PHASE4)";

    /** Every phase-tagged study. */
    public static final String ANY_PHASE = "(EARLY_PHASE1 OR PHASE1 OR PHASE2 OR PHASE3 OR PHASE4)";

    private static final Map<String, String> LABELS = Map.of(
            "EARLY_PHASE1", "Early Phase 1",
            "PHASE1", "Phase 1",
            "PHASE2", "Phase 2",
            "PHASE3", "Phase 3",
            "PHASE4", "Phase 4",
            "NA", NOT_APPLICABLE
    );

    private static final Map<String, Integer> RANKS = Map.of(
            NOT_APPLICABLE, 0,
            "Early Phase 1", 1,
            "Phase 1", 2,
            "Phase 1/Phase 2", 3,
            "Phase 2", 4,
            "Phase 2/Phase 3", 5,
            "Phase 3", 6,
            "Phase 3/Phase 4", 7,
            "Phase 4", 8
    );

    private TrialPhases() {
    }

    /**
     * ["PHASE2", "PHASE3"] becomes "Phase 2/Phase 3"; an empty list is "Not Applicable".
     */
    public static String normalize(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return NOT_APPLICABLE;
        }
        return codes.stream()
                .map(code -> LABELS.getOrDefault(code, code))
                .collect(Collectors.joining("/"));
    }

    /**
     * Higher means later stage. Unknown labels rank with "Not Applicable".
     */
    public static int rank(String label) {
        if (label == null) {
            return 0;
        }
        return RANKS.getOrDefault(label, 0);
    }
}
