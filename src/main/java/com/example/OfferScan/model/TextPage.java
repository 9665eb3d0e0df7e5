package com.example.OfferScan.model;

public record TextPage(int pageNumber, String text) {
    public TextPage {
        text = text == null ? "" : text;
    }
}
