package com.indicationscout.evidence.domain.model.trial;

public record PrimaryOutcome(String measure, String timeFrame) {}
