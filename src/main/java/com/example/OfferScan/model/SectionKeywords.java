package com.example.OfferScan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered section type to keyword table. Iteration order decides ties during classification.
 * Keywords are matched as lower-case substrings.
 */
public record SectionKeywords(Map<SectionType, List<String>> table) {

    public SectionKeywords {
        Map<SectionType, List<String>> copy = new LinkedHashMap<>();
        if (table != null) {
            table.forEach((type, words) -> {
                if (type == null || type == SectionType.UNKNOWN || words == null || words.isEmpty()) return;
                copy.put(type, words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList());
            });
        }
        table = Collections.unmodifiableMap(copy);
    }

    public static SectionKeywords defaults() {
        Map<SectionType, List<String>> t = new LinkedHashMap<>();
        t.put(SectionType.INSURED, List.of("ubezpieczony", "wiek", "imię", "nazwisko", "data urodzenia", "pesel"));
        t.put(SectionType.BASE_CONTRACT, List.of("umowa podstawowa", "życie", "on", "cu", "główna", "podstawowa ochrona"));
        t.put(SectionType.ADDITIONAL_CONTRACT, List.of("umowa dodatkowa", "rozszerzenie", "ab14", "yo14", "nw", "ns", "szpital", "nowotwór"));
        t.put(SectionType.ASSISTANCE, List.of("assistance", "pomoc", "asysta", "wsparcie", "medicover", "interwencja"));
        t.put(SectionType.PREMIUM, List.of("składka", "opłata", "koszt", "cena", "zł", "pln", "miesięczna", "roczna"));
        t.put(SectionType.DISCOUNT, List.of("zniżka", "rabat", "upust", "promocja", "więcej za mniej", "zlecenie"));
        t.put(SectionType.DURATION, List.of("okres", "czas trwania", "od", "do", "data rozpoczęcia", "data zakończenia", "miesięcy", "lat"));
        return new SectionKeywords(t);
    }
}
