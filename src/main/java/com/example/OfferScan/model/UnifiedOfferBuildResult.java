package com.example.OfferScan.model;

import java.util.List;

public record UnifiedOfferBuildResult(
        UnifiedOffer offer,
        List<SectionSource> sources,
        ProductTypeHeuristic productTypeHeuristic
) {
    public UnifiedOfferBuildResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
