package com.indicationscout.evidence.domain.model.trial;

/**
 * Coarse reason a trial stopped, derived from its free-text stop reason.
 */
public enum StopCategory {
    EFFICACY,
    SAFETY,
    ENROLLMENT,
    BUSINESS,
    /** Text present but matched no keyword. */
    OTHER,
    /** No stop reason given. */
    UNKNOWN
}
