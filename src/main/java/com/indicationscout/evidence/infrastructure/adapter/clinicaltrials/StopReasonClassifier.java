package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import com.indicationscout.evidence.domain.model.trial.StopCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword classification of a trial's free-text stop reason. Categories are
 * checked in declaration order and the first keyword found wins, so a reason
 * citing both safety and funding is a safety stop.
 */
public final class StopReasonClassifier {

    private static final Map<StopCategory, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(StopCategory.EFFICACY, List.of("efficacy", "futility", "lack of efficacy", "no benefit"));
        KEYWORDS.put(StopCategory.SAFETY, List.of("safety", "adverse", "toxicity", "side effect"));
        KEYWORDS.put(StopCategory.ENROLLMENT, List.of("enrollment", "accrual", "recruitment"));
        KEYWORDS.put(StopCategory.BUSINESS, List.of("business", "strategic", "funding", "commercial"));
    }

    private StopReasonClassifier() {
    }

    public static StopCategory classify(String whyStopped) {
        if (whyStopped == null || whyStopped.isBlank()) {
            return StopCategory.UNKNOWN;
        }
        String reason = whyStopped.toLowerCase(Locale.ROOT);
        for (Map.Entry<StopCategory, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (reason.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return StopCategory.OTHER;
    }
}
