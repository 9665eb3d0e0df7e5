package com.example.OfferScan.service;

import com.example.OfferScan.config.AiExtractionProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.AiExtraction;
import com.example.OfferScan.model.AiExtractionRequest;
import com.example.OfferScan.model.ProductTypeKeywords;
import com.example.OfferScan.model.SectionKeywords;
import com.example.OfferScan.model.TextPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatClientOfferExtractorTest {

    private static final List<TextPage> TWO_PAGES = List.of(
            new TextPage(1, "Ubezpieczony: Jan Kowalski, wiek 45"),
            new TextPage(2, "Składka łączna: 89,90 zł miesięcznie"));

    private ChatClient chatClient;
    private AiExtractionProperties props;
    private ChatClientOfferExtractor extractor;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        props = new AiExtractionProperties();
        props.setTimeout(Duration.ofSeconds(5));
        SectionClassifier classifier = new SectionClassifier(SectionKeywords.defaults(), ProductTypeKeywords.defaults());
        extractor = new ChatClientOfferExtractor(chatClient, classifier, props, new ObjectMapper());
    }

    private void stubContent(String first, String... rest) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(first, rest);
    }

    @Test
    void mergesSegmentsAndStripsFencesAndProse() {
        props.setPagesPerSegment(1);
        stubContent(
                "```json\n{\"insured\":[{\"name\":\"Jan\"}],\"total_premium_after_discounts\":\"\"}\n```",
                "Oto dane: {\"total_premium_after_discounts\":\"89,90\",\"insured\":[{\"name\":\"Jan\"}]} Dziękuję.");

        StepVerifier.create(extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)))
                .assertNext(result -> {
                    assertEquals(2, result.segmentsProcessed());
                    assertFalse(result.degraded());
                    assertEquals(1, result.data().path("insured").size());
                    assertEquals("89,90", result.data().path("total_premium_after_discounts").asText());
                })
                .verifyComplete();
    }

    @Test
    void retriesWithTheFirstPageWhenInputIsTooLarge() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("Request too large for model"))
                .thenReturn("{\"product_type\":\"life_insurance\"}");

        StepVerifier.create(extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)))
                .assertNext(result -> {
                    assertTrue(result.degraded());
                    assertEquals(1, result.segmentsProcessed());
                    assertEquals("life_insurance", result.data().path("product_type").asText());
                })
                .verifyComplete();
    }

    @Test
    void unparseableResponseDegrades() {
        stubContent("Nie mogę pomóc z tym dokumentem.", "{\"insurer\":\"PZU\"}");

        AiExtraction result = extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)).block();

        assertTrue(result.degraded());
        assertEquals("PZU", result.data().path("insurer").asText());
    }

    @Test
    void slowModelCountsAsTooLarge() {
        props.setTimeout(Duration.ofMillis(100));
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenAnswer(inv -> {
                    Thread.sleep(1_000);
                    return "{}";
                })
                .thenReturn("{\"insurer\":\"Warta\"}");

        AiExtraction result = extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)).block();

        assertTrue(result.degraded());
        assertEquals("Warta", result.data().path("insurer").asText());
    }

    @Test
    void otherFailuresAreNotRetried() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("401 Unauthorized"));

        StepVerifier.create(extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)))
                .expectErrorSatisfies(ex -> {
                    AnalysisException ae = (AnalysisException) ex;
                    assertEquals(AnalysisErrorCode.AI_EXTRACTION_FAILED, ae.getCode());
                    assertEquals("AI extraction failed (full attempt): 401 Unauthorized", ae.getMessage());
                })
                .verify();
    }

    @Test
    void failedDegradedAttemptIsReported() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("context length exceeded"));

        StepVerifier.create(extractor.extract(new AiExtractionRequest("doc-1", "a.pdf", TWO_PAGES)))
                .expectErrorSatisfies(ex -> {
                    assertEquals(AnalysisErrorCode.AI_EXTRACTION_FAILED, ((AnalysisException) ex).getCode());
                    assertTrue(ex.getMessage().contains("degraded attempt"));
                })
                .verify();
    }

    @Test
    void blankPagesSkipTheModel() {
        StepVerifier.create(extractor.extract(new AiExtractionRequest("doc-1", "a.pdf",
                        List.of(new TextPage(1, "  "), new TextPage(2, "")))))
                .assertNext(result -> {
                    assertEquals(0, result.segmentsProcessed());
                    assertTrue(result.data().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void userPromptCarriesPagesSectionsAndSchema() {
        List<TextPage> segment = List.of(
                new TextPage(2, "Ubezpieczony: Jan Kowalski, wiek 45"),
                new TextPage(3, "abc"));

        String prompt = extractor.buildUserPrompt(0, 2, segment);

        assertTrue(prompt.startsWith("Segment 1/2. Strony 2-3. Tekst:"));
        assertTrue(prompt.contains("Ubezpieczony: Jan Kowalski"));
        assertTrue(prompt.contains("Sekcje w segmencie: insured("));
        assertTrue(prompt.endsWith(ChatClientOfferExtractor.RESPONSE_SCHEMA));

        String empty = extractor.buildUserPrompt(1, 2, List.of(new TextPage(4, "abc")));
        assertTrue(empty.contains("Sekcje w segmencie: brak sekcji"));
    }

    @Test
    void segmentTextIsCapped() {
        props.setMaxSegmentChars(10);

        String prompt = extractor.buildUserPrompt(0, 1, List.of(new TextPage(1, "0123456789ABCDEF")));

        assertTrue(prompt.contains("0123456789\n\n"));
        assertFalse(prompt.contains("ABCDEF"));
    }

    @Test
    void recognisesDegradableFailuresThroughTheCauseChain() {
        assertTrue(ChatClientOfferExtractor.isDegradable(
                new RuntimeException("wrapper", new IllegalStateException("Maximum context length is 128000 tokens"))));
        assertTrue(ChatClientOfferExtractor.isDegradable(
                new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED, "Failed to extract structured data from segment 1")));
        assertFalse(ChatClientOfferExtractor.isDegradable(new RuntimeException("connection reset")));
        assertFalse(ChatClientOfferExtractor.isDegradable(new RuntimeException((String) null)));
    }

    @Test
    void partitionsPagesIntoFixedSizeSegments() {
        List<TextPage> pages = List.of(new TextPage(1, "a"), new TextPage(2, "b"), new TextPage(3, "c"),
                new TextPage(4, "d"));

        List<List<TextPage>> segments = ChatClientOfferExtractor.partition(pages, 3);

        assertEquals(2, segments.size());
        assertEquals(3, segments.get(0).size());
        assertEquals(4, segments.get(1).get(0).pageNumber());
    }
}
