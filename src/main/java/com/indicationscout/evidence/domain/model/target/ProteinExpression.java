package com.indicationscout.evidence.domain.model.target;

import java.util.List;

public record ProteinExpression(Integer level, Boolean reliability, List<CellTypeExpression> cellTypes) {

    public ProteinExpression {
        cellTypes = List.copyOf(cellTypes);
    }
}
