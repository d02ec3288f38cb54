package com.indicationscout.evidence.domain.model.trial;

import java.util.List;
import java.util.Optional;

/**
 * One clinical-trial registry record.
 *
 * <p>{@code phase} is the normalized label ("Phase 2", "Phase 1/Phase 2",
 * "Not Applicable"). Dates are kept as the registry reports them
 * ("2021-03-15" or "2021-03"), so they sort lexicographically.
 * {@code briefSummary}, {@code whyStopped}, {@code enrollment},
 * {@code startDate}, {@code completionDate} and {@code resultsPosted} are
 * nullable.
 */
public record Trial(
        String nctId,
        String title,
        String briefSummary,
        String phase,
        String overallStatus,
        String whyStopped,
        List<String> conditions,
        List<Intervention> interventions,
        String sponsor,
        List<String> collaborators,
        Integer enrollment,
        String startDate,
        String completionDate,
        String studyType,
        List<PrimaryOutcome> primaryOutcomes,
        Boolean resultsPosted,
        List<String> references
) {
    public Trial {
        conditions = List.copyOf(conditions);
        interventions = List.copyOf(interventions);
        collaborators = List.copyOf(collaborators);
        primaryOutcomes = List.copyOf(primaryOutcomes);
        references = List.copyOf(references);
    }

    /**
     * First intervention that is a drug or biologic.
     */
    public Optional<Intervention> primaryDrug() {
        return interventions.stream()
                .filter(Intervention::isDrugLike)
                .findFirst();
    }

    public Optional<String> firstCondition() {
        return conditions.isEmpty() ? Optional.empty() : Optional.of(conditions.get(0));
    }
}
