package com.example.OfferScan.model;

import java.util.List;

/**
 * A classified paragraph or block.
 *
 * @param pageRange {@code null} when no page information could be resolved
 */
public record ParsedSection(
        SectionType type,
        String content,
        List<String> keywords,
        double confidence,
        PageRange pageRange,
        String snippet
) {
    public ParsedSection {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isIdentified() {
        return type != SectionType.UNKNOWN;
    }
}
