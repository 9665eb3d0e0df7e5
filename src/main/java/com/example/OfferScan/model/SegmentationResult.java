package com.example.OfferScan.model;

import java.util.List;

public record SegmentationResult(
        List<ParsedSection> sections,
        List<SectionSource> sources,
        ProductTypeHeuristic productTypeHeuristic
) {
    public SegmentationResult {
        sections = sections == null ? List.of() : List.copyOf(sections);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static SegmentationResult empty() {
        return new SegmentationResult(List.of(), List.of(), null);
    }

    /** Share of sections with a known type; 0 when there are no sections. */
    public double identifiedRatio() {
        return identifiedRatio(sections);
    }

    public static double identifiedRatio(List<ParsedSection> sections) {
        if (sections == null || sections.isEmpty()) return 0.0;
        long identified = sections.stream().filter(ParsedSection::isIdentified).count();
        return (double) identified / sections.size();
    }

    public ExtractionConfidence textConfidence() {
        if (sections.isEmpty()) return ExtractionConfidence.LOW;
        double ratio = identifiedRatio();
        if (ratio > 0.7) return ExtractionConfidence.HIGH;
        if (ratio > 0.4) return ExtractionConfidence.MEDIUM;
        return ExtractionConfidence.LOW;
    }
}
