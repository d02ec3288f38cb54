package com.indicationscout.evidence.domain.model.target;

import java.util.List;

/**
 * Snapshot of a target node in the knowledge graph. Shared by every drug that
 * references the target.
 */
public record TargetProfile(
        String targetId,
        String symbol,
        String name,
        List<Association> associations,
        List<Pathway> pathways,
        List<Interaction> interactions,
        List<DrugSummary> drugSummaries,
        List<TissueExpression> expressions,
        List<MousePhenotype> mousePhenotypes,
        List<SafetyLiability> safetyLiabilities,
        List<GeneticConstraint> geneticConstraints
) {
    public TargetProfile {
        associations = List.copyOf(associations);
        pathways = List.copyOf(pathways);
        interactions = List.copyOf(interactions);
        drugSummaries = List.copyOf(drugSummaries);
        expressions = List.copyOf(expressions);
        mousePhenotypes = List.copyOf(mousePhenotypes);
        safetyLiabilities = List.copyOf(safetyLiabilities);
        geneticConstraints = List.copyOf(geneticConstraints);
    }

    public TargetProfile withAssociations(List<Association> allAssociations) {
        return new TargetProfile(targetId, symbol, name, allAssociations, pathways, interactions,
                drugSummaries, expressions, mousePhenotypes, safetyLiabilities, geneticConstraints);
    }
}
