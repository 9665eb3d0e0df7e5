package com.example.OfferScan.model;

import java.util.List;

public record StructureSummary(
        Double confidence,
        List<Page> pages
) {
    public StructureSummary {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public record Page(int pageNumber, int blockCount, List<String> headings, List<String> keywords) {
        public Page {
            headings = headings == null ? List.of() : List.copyOf(headings);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }
}
