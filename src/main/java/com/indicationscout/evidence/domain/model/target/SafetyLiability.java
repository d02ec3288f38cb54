package com.indicationscout.evidence.domain.model.target;

import java.util.List;

/**
 * Known target safety effect. All scalar fields are nullable.
 */
public record SafetyLiability(
        String event,
        String eventId,
        List<SafetyEffect> effects,
        String datasource,
        String literature,
        String url
) {
    public SafetyLiability {
        effects = List.copyOf(effects);
    }
}
