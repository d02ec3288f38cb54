package com.indicationscout.evidence.domain.model.target;

public record SafetyEffect(String direction, String dosing) {}
