package com.indicationscout.evidence.domain.model.target;

public record CellTypeExpression(String name, int level, Boolean reliability) {}
