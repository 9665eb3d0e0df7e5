package com.example.OfferScan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExtractionConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
