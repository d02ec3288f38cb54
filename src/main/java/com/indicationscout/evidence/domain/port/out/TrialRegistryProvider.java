package com.indicationscout.evidence.domain.port.out;

import com.indicationscout.evidence.domain.model.trial.ConditionLandscape;
import com.indicationscout.evidence.domain.model.trial.TerminatedTrial;
import com.indicationscout.evidence.domain.model.trial.Trial;
import com.indicationscout.evidence.domain.model.trial.WhitespaceResult;

import java.time.LocalDate;
import java.util.List;

/**
 * Interface representing a clinical-trial registry and the signals derived
 * from it. A query matching nothing is an empty result, never an error.
 * Every {@code dateBefore} is nullable and restricts results to studies first
 * posted on or before that date.
 */
public interface TrialRegistryProvider {

    /**
     * Searches trials by intervention and/or condition.
     *
     * @param drug        intervention term, nullable
     * @param condition   condition term, nullable
     * @param phaseFilter registry phase expression such as "(PHASE2 OR PHASE3)", nullable
     * @param maxResults  upper bound on returned records
     */
    List<Trial> searchTrials(String drug, String condition, LocalDate dateBefore,
                             String phaseFilter, int maxResults);

    /**
     * Decides whether the pair has no trials. When it has none, also reports
     * up to 50 other drugs in Phase 2 or later for the condition.
     */
    WhitespaceResult detectWhitespace(String drug, String condition, LocalDate dateBefore);

    /**
     * Drug and biologic competitors for a condition ranked by maturity and scale.
     */
    ConditionLandscape getLandscape(String condition, LocalDate dateBefore, int topN);

    /**
     * Terminated, withdrawn and suspended trials matching a free-text query,
     * each classified by stop reason.
     */
    List<TerminatedTrial> getTerminated(String query, LocalDate dateBefore, int maxResults);
}
