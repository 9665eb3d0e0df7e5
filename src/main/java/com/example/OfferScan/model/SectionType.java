package com.example.OfferScan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SectionType {
    INSURED,
    BASE_CONTRACT,
    ADDITIONAL_CONTRACT,
    ASSISTANCE,
    PREMIUM,
    DISCOUNT,
    DURATION,
    UNKNOWN;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
