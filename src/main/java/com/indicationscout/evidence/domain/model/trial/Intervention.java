package com.indicationscout.evidence.domain.model.trial;

/**
 * A drug, biological, device or other intervention in a trial.
 *
 * @param type title-cased registry type: "Drug", "Biological", "Device", ...
 */
public record Intervention(String type, String name, String description) {

    public static final String DRUG = "Drug";
    public static final String BIOLOGICAL = "Biological";

    public boolean isDrugLike() {
        return DRUG.equals(type) || BIOLOGICAL.equals(type);
    }
}
