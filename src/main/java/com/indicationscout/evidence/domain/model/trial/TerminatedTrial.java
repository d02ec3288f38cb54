package com.indicationscout.evidence.domain.model.trial;

/**
 * A terminated, withdrawn or suspended trial with its stop classification.
 *
 * @param drugName name of the first drug/biologic intervention, null if none
 */
public record TerminatedTrial(Trial trial, String drugName, StopCategory stopCategory) {

    public String nctId() {
        return trial.nctId();
    }

    public String whyStopped() {
        return trial.whyStopped();
    }
}
