package com.example.OfferScan.model;

import java.util.List;

public record AnalysisPage(
        int pageNumber,
        String text,
        Double width,
        Double height,
        List<AnalysisBlock> blocks
) {
    public AnalysisPage {
        text = text == null ? "" : text;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static AnalysisPage ofText(int pageNumber, String text) {
        return new AnalysisPage(pageNumber, text, null, null, List.of());
    }
}
