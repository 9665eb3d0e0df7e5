package com.example.OfferScan.model;

import lombok.Builder;

import java.util.List;

/**
 * One layout block reported by the remote service. {@code type}, {@code category} and {@code label}
 * are free-text hints; nothing guarantees their vocabulary.
 */
@Builder(toBuilder = true)
public record AnalysisBlock(
        String id,
        String type,
        String category,
        String label,
        String text,
        int pageNumber,
        Double confidence,
        Integer headingLevel,
        BoundingBox boundingBox,
        List<AnalysisBlock> children
) {
    public AnalysisBlock {
        text = text == null ? "" : text;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Category and label joined, used as an extra classification hint. */
    public String hints() {
        StringBuilder sb = new StringBuilder();
        for (String h : new String[]{category, label}) {
            if (h == null || h.isBlank()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(h.trim());
        }
        return sb.toString();
    }
}
