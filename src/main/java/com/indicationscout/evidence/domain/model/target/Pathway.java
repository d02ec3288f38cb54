package com.indicationscout.evidence.domain.model.target;

public record Pathway(String pathwayId, String pathwayName, String topLevelPathway) {}
