package com.example.OfferScan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Ordered product type to keyword table used by the product type heuristic. */
public record ProductTypeKeywords(Map<String, List<String>> table) {

    public ProductTypeKeywords {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (table != null) {
            table.forEach((type, words) -> {
                if (type == null || type.isBlank() || words == null || words.isEmpty()) return;
                copy.put(type, words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList());
            });
        }
        table = Collections.unmodifiableMap(copy);
    }

    public static ProductTypeKeywords defaults() {
        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("life_insurance", List.of("na życie", "ubezpieczenie na życie", "życiowe", "terminowe", "kapitał"));
        t.put("health_insurance", List.of("zdrowot", "leczenie", "medycz", "hospitalizacja", "opieka zdrowotna"));
        t.put("accident_insurance", List.of("wypadk", "nw", "następstw nieszczęśliwych", "uszczerbek", "kontuzja"));
        t.put("travel_insurance", List.of("podróż", "turystycz", "travel", "koszty leczenia za granicą", "assistance podróżne"));
        t.put("property_insurance", List.of("mieszkanie", "dom", "majątk", "nieruchomość", "pożar"));
        t.put("auto_insurance", List.of("oc", "ac", "samochód", "pojazd", "komunikacyjn"));
        return new ProductTypeKeywords(t);
    }
}
