package com.example.OfferScan.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw JSON returned by the AI pass together with how it was obtained.
 */
public record AiExtraction(
        JsonNode data,
        int segmentsProcessed,
        boolean degraded
) {
}
