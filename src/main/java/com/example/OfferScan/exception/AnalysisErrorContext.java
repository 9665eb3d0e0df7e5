package com.example.OfferScan.exception;

/**
 * Everything needed to log a failed analysis call without re-deriving it.
 * All fields are optional; {@code status} is 0 when no response was received.
 */
public record AnalysisErrorContext(
        String endpoint,
        int status,
        String requestId,
        String responseBody,
        String hint
) {
    public static AnalysisErrorContext empty() {
        return new AnalysisErrorContext(null, 0, null, null, null);
    }

    public static AnalysisErrorContext ofEndpoint(String endpoint, String requestId) {
        return new AnalysisErrorContext(endpoint, 0, requestId, null, null);
    }
}
