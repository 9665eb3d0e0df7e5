package com.example.OfferScan.model;

/** Inclusive, 1-indexed. */
public record PageRange(int start, int end) {

    public static PageRange single(int page) {
        return new PageRange(page, page);
    }
}
