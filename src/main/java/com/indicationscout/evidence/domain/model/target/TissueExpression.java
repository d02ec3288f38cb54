package com.indicationscout.evidence.domain.model.target;

public record TissueExpression(
        String tissueId,
        String tissueName,
        String anatomicalSystem,
        RnaExpression rna,
        ProteinExpression protein
) {}
