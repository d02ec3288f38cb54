package com.indicationscout.evidence.domain.model.target;

/**
 * @param value    null when the source reports no measurement
 * @param quantile relative level across tissues, null when absent
 */
public record RnaExpression(Double value, Integer quantile, String unit) {}
