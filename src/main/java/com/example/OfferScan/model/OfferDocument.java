package com.example.OfferScan.model;

import lombok.Builder;

/**
 * A stored offer document handed to the pipeline by the document source.
 * {@code signedUrl} drives remote analysis, {@code bytes} the local text parser and the AI pass.
 */
@Builder
public record OfferDocument(
        String documentId,
        String fileName,
        String mimeType,
        String signedUrl,
        byte[] bytes,
        String organizationId,
        String calculationId
) {
    public boolean hasSignedUrl() {
        return signedUrl != null && !signedUrl.isBlank();
    }

    public boolean hasBytes() {
        return bytes != null && bytes.length > 0;
    }

    public OfferMetadata metadata() {
        return new OfferMetadata(documentId, fileName, calculationId);
    }
}
