package com.indicationscout.evidence.domain.model.drug;

import com.indicationscout.evidence.domain.model.target.TargetProfile;

import java.util.Map;

/**
 * A drug profile together with the full profile of every target it references,
 * keyed by target id.
 */
public record DrugWithTargets(DrugProfile drug, Map<String, TargetProfile> targets) {

    public DrugWithTargets {
        targets = Map.copyOf(targets);
    }
}
