package com.example.OfferScan.model;

/**
 * Provenance of a section. {@code category} is the section type for segmentation output and the
 * offer field the builder used the section for otherwise.
 */
public record SectionSource(
        SectionType sectionType,
        String category,
        PageRange pageRange,
        String snippet,
        double confidence
) {
    public static SectionSource of(ParsedSection section) {
        return new SectionSource(section.type(), section.type().key(), section.pageRange(),
                section.snippet(), section.confidence());
    }

    public static SectionSource of(ParsedSection section, String category) {
        return new SectionSource(section.type(), category, section.pageRange(),
                section.snippet(), section.confidence());
    }
}
