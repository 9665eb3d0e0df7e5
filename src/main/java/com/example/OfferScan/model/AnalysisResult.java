package com.example.OfferScan.model;

import java.util.List;

/**
 * Decoded and normalized content of a result archive.
 *
 * @param structureSummary {@code null} when the service did not report one
 */
public record AnalysisResult(
        String taskId,
        String text,
        List<AnalysisPage> pages,
        StructureSummary structureSummary
) {
    public AnalysisResult {
        text = text == null ? "" : text;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public AnalysisResult withTaskId(String id) {
        return new AnalysisResult(id, text, pages, structureSummary);
    }

    public boolean hasUsableText() {
        if (!text.isBlank()) return true;
        return pages.stream().anyMatch(p -> !p.text().isBlank() || !p.blocks().isEmpty());
    }
}
