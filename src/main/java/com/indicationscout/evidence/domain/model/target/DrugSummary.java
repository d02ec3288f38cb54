package com.indicationscout.evidence.domain.model.target;

import java.util.List;

/**
 * A drug known to act on a target (or to be developed for a disease),
 * with its indication and phase. {@code phase} and {@code status} are nullable.
 */
public record DrugSummary(
        String drugId,
        String drugName,
        String diseaseId,
        String diseaseName,
        Double phase,
        String status,
        String mechanismOfAction,
        List<String> clinicalTrialIds
) {
    public DrugSummary {
        clinicalTrialIds = List.copyOf(clinicalTrialIds);
    }
}
