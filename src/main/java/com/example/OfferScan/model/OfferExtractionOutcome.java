package com.example.OfferScan.model;

import com.fasterxml.jackson.databind.JsonNode;

public record OfferExtractionOutcome(
        UnifiedOffer offer,
        SegmentationResult segmentation,
        JsonNode aiExtraction,
        ExtractionDiagnostics diagnostics
) {
}
