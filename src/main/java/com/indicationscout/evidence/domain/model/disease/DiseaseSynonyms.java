package com.indicationscout.evidence.domain.model.disease;

import java.util.ArrayList;
import java.util.List;

/**
 * Synonyms for a disease grouped by ontology relation.
 */
public record DiseaseSynonyms(
        String diseaseId,
        String diseaseName,
        List<String> parentNames,
        List<String> exact,
        List<String> related,
        List<String> narrow,
        List<String> broad
) {
    public DiseaseSynonyms {
        parentNames = List.copyOf(parentNames);
        exact = List.copyOf(exact);
        related = List.copyOf(related);
        narrow = List.copyOf(narrow);
        broad = List.copyOf(broad);
    }

    /**
     * Exact and related synonyms followed by parent names.
     */
    public List<String> allSynonyms() {
        List<String> all = new ArrayList<>(exact);
        all.addAll(related);
        all.addAll(parentNames);
        return all;
    }
}
