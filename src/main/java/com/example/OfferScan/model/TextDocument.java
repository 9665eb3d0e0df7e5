package com.example.OfferScan.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text input of paragraph-mode segmentation.
 *
 * @param lines       optional pre-split lines; derived from {@code fullText} when {@code null}
 * @param linePageMap optional page number per line; rebuilt from the pages when {@code null}
 * @param fullText    optional full text; page texts joined by blank lines when {@code null}
 */
public record TextDocument(
        List<TextPage> pages,
        List<String> lines,
        List<Integer> linePageMap,
        String fullText
) {
    public TextDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static TextDocument of(List<TextPage> pages) {
        return new TextDocument(pages, null, null, null);
    }

    public static TextDocument ofPageTexts(List<String> pageTexts) {
        List<TextPage> pages = new ArrayList<>();
        for (int i = 0; i < pageTexts.size(); i++) {
            pages.add(new TextPage(i + 1, pageTexts.get(i)));
        }
        return of(pages);
    }
}
