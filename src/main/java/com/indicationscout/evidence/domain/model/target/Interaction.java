package com.indicationscout.evidence.domain.model.target;

/**
 * Protein-protein interaction partner.
 *
 * @param interactionScore null for sources that do not score (reactome, signor)
 * @param interactionType  physical, functional, signalling or enzymatic; null for unknown sources
 */
public record Interaction(
        String interactingTargetId,
        String interactingTargetSymbol,
        Double interactionScore,
        String sourceDatabase,
        String biologicalRole,
        Integer evidenceCount,
        String interactionType
) {}
