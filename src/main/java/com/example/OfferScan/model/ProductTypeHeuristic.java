package com.example.OfferScan.model;

import java.util.List;
import java.util.Map;

/**
 * Keyword guess of the insurance product type.
 *
 * @param predictedType  {@code null} when no keyword of any product type matched
 * @param matchesByType  every product type with at least one match, in keyword-table order
 */
public record ProductTypeHeuristic(
        String predictedType,
        double confidence,
        List<String> matchedKeywords,
        Map<String, List<String>> matchesByType,
        Source source
) {
    public enum Source { SEGMENTATION, BUILDER }

    public ProductTypeHeuristic {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        matchesByType = matchesByType == null ? Map.of() : matchesByType;
    }
}
