package com.example.OfferScan.model;

public record OfferMetadata(
        String documentId,
        String fileName,
        String calculationId
) {
}
