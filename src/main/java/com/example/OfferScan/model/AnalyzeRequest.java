package com.example.OfferScan.model;

/**
 * @param signedUrl      time-limited URL the remote service downloads the document from
 * @param documentId     caller-side identifier, forwarded to the service when present
 * @param organizationId per-call override of the configured organization
 */
public record AnalyzeRequest(
        String signedUrl,
        String documentId,
        String organizationId
) {
    public static AnalyzeRequest of(String signedUrl) {
        return new AnalyzeRequest(signedUrl, null, null);
    }
}
