package com.example.OfferScan.model;

import java.util.List;

/**
 * Side information kept next to the offer for troubleshooting and for the comparison view's
 * source tooltips.
 */
public record ExtractionDiagnostics(
        ExtractionConfidence textConfidence,
        ProductTypePredictions productType,
        List<AggregatedSource> sources,
        int segmentsProcessed,
        boolean aiDegraded
) {
    public ExtractionDiagnostics {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public record ProductTypePredictions(
            String ai,
            ProductTypeHeuristic segmentation,
            ProductTypeHeuristic builder,
            String resolved
    ) {
    }

    public record AggregatedSource(String origin, SectionSource source) {
    }
}
