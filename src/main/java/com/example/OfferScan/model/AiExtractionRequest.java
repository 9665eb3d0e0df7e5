package com.example.OfferScan.model;

import java.util.List;

public record AiExtractionRequest(
        String documentId,
        String fileName,
        List<TextPage> pages
) {
    public AiExtractionRequest {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
