package com.example.OfferScan.service;

import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.AiExtraction;
import com.example.OfferScan.model.AnalysisPage;
import com.example.OfferScan.model.AnalysisResult;
import com.example.OfferScan.model.AnalyzeRequest;
import com.example.OfferScan.model.OfferDocument;
import com.example.OfferScan.model.OfferExtractionOutcome;
import com.example.OfferScan.model.ProductTypeKeywords;
import com.example.OfferScan.model.SectionKeywords;
import com.example.OfferScan.model.SectionType;
import com.example.OfferScan.model.TextPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OfferExtractionPipelineTest {

    private static final byte[] PDF = {0x25, 0x50, 0x44, 0x46};

    private final ObjectMapper om = new ObjectMapper();

    private DocumentAnalysisClient analysisClient;
    private PdfTextExtractor pdfTextExtractor;
    private OfferAiExtractor aiExtractor;
    private OfferExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        analysisClient = mock(DocumentAnalysisClient.class);
        pdfTextExtractor = mock(PdfTextExtractor.class);
        aiExtractor = mock(OfferAiExtractor.class);
        SectionClassifier classifier = new SectionClassifier(SectionKeywords.defaults(), ProductTypeKeywords.defaults());
        pipeline = new OfferExtractionPipeline(analysisClient, pdfTextExtractor, classifier,
                new UnifiedOfferBuilder(classifier), aiExtractor);
    }

    private void stubLocalText(TextPage... pages) {
        when(pdfTextExtractor.extract(any(), any(), any()))
                .thenReturn(new PdfTextExtractor.PdfText("", pages.length, List.of(pages), "application/pdf"));
    }

    private void stubAi(String json) throws Exception {
        when(aiExtractor.extract(any())).thenReturn(Mono.just(new AiExtraction(om.readTree(json), 1, false)));
    }

    @Test
    void signedUrlDocumentsAreAnalyzedRemotelyAndAiProductTypeWins() throws Exception {
        when(analysisClient.analyze(any(AnalyzeRequest.class))).thenReturn(Mono.just(new AnalysisResult("task-1", "",
                List.of(AnalysisPage.ofText(1, "Ubezpieczony: Jan Kowalski, wiek 45, data urodzenia 1980")), null)));
        stubLocalText(new TextPage(1, "Ubezpieczony: Jan Kowalski, wiek 45"));
        stubAi("{\"product_type\":{\"label\":\"health_insurance\"},\"total_premium_after_discounts\":\"99,00\"}");

        OfferDocument doc = OfferDocument.builder()
                .documentId("doc-1").fileName("oferta.pdf").mimeType("application/pdf")
                .signedUrl("https://files.example.com/oferta.pdf").bytes(PDF)
                .organizationId("org-9").calculationId("calc-1")
                .build();

        StepVerifier.create(pipeline.process(doc))
                .assertNext(outcome -> {
                    assertEquals("health_insurance", outcome.diagnostics().productType().ai());
                    assertEquals("health_insurance", outcome.diagnostics().productType().resolved());
                    assertEquals(99.0, outcome.offer().totalPremiumAfterDiscounts().getAsDouble(), 1e-9);
                    assertEquals("calc-1", outcome.offer().offerId().orElseThrow());
                    assertEquals(SectionType.INSURED, outcome.segmentation().sections().get(0).type());
                    assertEquals(OfferExtractionPipeline.ORIGIN_SEGMENTATION,
                            outcome.diagnostics().sources().get(0).origin());
                    assertTrue(outcome.diagnostics().sources().stream()
                            .anyMatch(s -> s.origin().equals(OfferExtractionPipeline.ORIGIN_BUILDER)));
                    assertEquals(1, outcome.diagnostics().segmentsProcessed());
                })
                .verifyComplete();

        verify(analysisClient).analyze(new AnalyzeRequest("https://files.example.com/oferta.pdf", "doc-1", "org-9"));
    }

    @Test
    void analysisWithoutTextFails() throws Exception {
        when(analysisClient.analyze(any(AnalyzeRequest.class)))
                .thenReturn(Mono.just(new AnalysisResult("task-2", " ", List.of(), null)));
        stubAi("{}");

        OfferDocument doc = OfferDocument.builder().documentId("doc-2").signedUrl("https://files.example.com/x.pdf").build();

        StepVerifier.create(pipeline.process(doc))
                .expectErrorSatisfies(ex -> assertEquals(AnalysisErrorCode.EMPTY_ANALYSIS, ((AnalysisException) ex).getCode()))
                .verify();
    }

    @Test
    void analysisTextWithoutPagesIsSegmentedAsParagraphs() throws Exception {
        when(analysisClient.analyze(any(AnalyzeRequest.class))).thenReturn(Mono.just(new AnalysisResult("task-3",
                "Ubezpieczony: Anna Nowak, wiek 34\n\nSkładka łączna: 120,00 zł", List.of(), null)));
        stubAi("{}");

        OfferDocument doc = OfferDocument.builder().documentId("doc-3").signedUrl("https://files.example.com/x.pdf").build();

        OfferExtractionOutcome outcome = pipeline.process(doc).block();

        assertEquals(2, outcome.segmentation().sections().size());
        assertEquals(120.0, outcome.offer().totalPremiumAfterDiscounts().getAsDouble(), 1e-9);
    }

    @Test
    void localBytesAreSegmentedWhenThereIsNoSignedUrl() throws Exception {
        stubLocalText(
                new TextPage(1, "Ubezpieczony: Jan Kowalski, wiek 45"),
                new TextPage(2, "Składka łączna: 120,00 zł\nUbezpieczenie na życie"));
        stubAi("{}");

        OfferDocument doc = OfferDocument.builder()
                .documentId("doc-4").fileName("oferta.pdf").mimeType("application/pdf").bytes(PDF).build();

        OfferExtractionOutcome outcome = pipeline.process(doc).block();

        assertEquals(2, outcome.segmentation().sections().size());
        assertEquals(SectionType.PREMIUM, outcome.segmentation().sections().get(1).type());
        assertEquals(120.0, outcome.offer().totalPremiumAfterDiscounts().getAsDouble(), 1e-9);
        assertNull(outcome.diagnostics().productType().ai());
        assertEquals("life_insurance", outcome.diagnostics().productType().resolved());
        verify(analysisClient, never()).analyze(any(AnalyzeRequest.class));
    }

    @Test
    void documentWithoutUrlOrBytesIsRejected() {
        StepVerifier.create(pipeline.process(OfferDocument.builder().documentId("doc-5").build()))
                .expectErrorSatisfies(ex -> assertEquals(AnalysisErrorCode.INVALID_ARGUMENT, ((AnalysisException) ex).getCode()))
                .verify();
    }

    @Test
    void aiFailureFailsTheDocument() {
        stubLocalText(new TextPage(1, "Ubezpieczony: Jan Kowalski, wiek 45"));
        when(aiExtractor.extract(any())).thenReturn(Mono.error(
                new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED, "AI extraction failed (degraded attempt): boom")));

        OfferDocument doc = OfferDocument.builder().documentId("doc-6").bytes(PDF).build();

        StepVerifier.create(pipeline.process(doc))
                .expectErrorSatisfies(ex -> assertEquals(AnalysisErrorCode.AI_EXTRACTION_FAILED, ((AnalysisException) ex).getCode()))
                .verify();
    }

    @Test
    void cancellationStopsAPendingDocument() throws Exception {
        when(analysisClient.analyze(any(AnalyzeRequest.class))).thenReturn(Mono.never());
        stubAi("{}");

        OfferDocument doc = OfferDocument.builder().documentId("doc-7").signedUrl("https://files.example.com/x.pdf").build();

        StepVerifier.create(pipeline.process(doc, Mono.delay(Duration.ofMillis(50))))
                .expectErrorSatisfies(ex -> assertEquals(AnalysisErrorCode.CANCELLED, ((AnalysisException) ex).getCode()))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void readsAiProductTypeFromStringsAndObjects() throws Exception {
        assertEquals("travel_insurance",
                OfferExtractionPipeline.readAiProductType(om.readTree("{\"productType\":\" travel_insurance \"}")).orElseThrow());
        assertEquals("auto_insurance",
                OfferExtractionPipeline.readAiProductType(om.readTree("{\"product_type\":{\"value\":\"auto_insurance\"}}")).orElseThrow());
        assertEquals("life_insurance",
                OfferExtractionPipeline.readAiProductType(om.readTree("{\"product_type\":\"\",\"productType\":\"life_insurance\"}")).orElseThrow());
        assertTrue(OfferExtractionPipeline.readAiProductType(om.readTree("{\"product_type\":42}")).isEmpty());
        assertTrue(OfferExtractionPipeline.readAiProductType(null).isEmpty());
    }
}
