package com.example.OfferScan.service;

import com.example.OfferScan.model.AiExtraction;
import com.example.OfferScan.model.AiExtractionRequest;
import reactor.core.publisher.Mono;

/**
 * Secondary extraction pass over the offer text. Implementations fail with
 * {@code AI_EXTRACTION_FAILED} and never return a partial result.
 */
public interface OfferAiExtractor {

    Mono<AiExtraction> extract(AiExtractionRequest request);
}
