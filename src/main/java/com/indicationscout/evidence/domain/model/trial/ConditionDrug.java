package com.indicationscout.evidence.domain.model.trial;

/**
 * Another drug tested for the same condition, reported when a drug-condition
 * pair has no trials of its own.
 *
 * @param condition first condition of the trial, null if it lists none
 */
public record ConditionDrug(String nctId, String drugName, String condition, String phase, String status) {}
