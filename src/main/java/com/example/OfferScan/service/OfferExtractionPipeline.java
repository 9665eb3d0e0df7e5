package com.example.OfferScan.service;

import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.AiExtraction;
import com.example.OfferScan.model.AiExtractionRequest;
import com.example.OfferScan.model.AnalysisResult;
import com.example.OfferScan.model.AnalyzeRequest;
import com.example.OfferScan.model.ExtractionDiagnostics;
import com.example.OfferScan.model.OfferDocument;
import com.example.OfferScan.model.OfferExtractionOutcome;
import com.example.OfferScan.model.ProductTypeHeuristic;
import com.example.OfferScan.model.SectionSource;
import com.example.OfferScan.model.SegmentationResult;
import com.example.OfferScan.model.TextDocument;
import com.example.OfferScan.model.TextPage;
import com.example.OfferScan.model.UnifiedOfferBuildResult;
import com.example.OfferScan.util.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for one offer document: text analysis and AI extraction run side by side, then the
 * unified offer is built from both.
 */
@Service
@RequiredArgsConstructor
public class OfferExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(OfferExtractionPipeline.class);

    static final String ORIGIN_SEGMENTATION = "segmentation";
    static final String ORIGIN_BUILDER = "unified_builder";

    private final DocumentAnalysisClient analysisClient;
    private final PdfTextExtractor pdfTextExtractor;
    private final SectionClassifier classifier;
    private final UnifiedOfferBuilder offerBuilder;
    private final OfferAiExtractor aiExtractor;

    public Mono<OfferExtractionOutcome> process(OfferDocument document) {
        return process(document, Mono.never());
    }

    public Mono<OfferExtractionOutcome> process(OfferDocument document, Publisher<?> cancelSignal) {
        if (document == null || (!document.hasSignedUrl() && !document.hasBytes())) {
            return Mono.error(new AnalysisException(AnalysisErrorCode.INVALID_ARGUMENT,
                    "Offer document needs a signed URL or its bytes"));
        }

        Mono<List<TextPage>> localPages = document.hasBytes()
                ? Mono.fromCallable(() -> pdfTextExtractor.extract(document.bytes(), document.fileName(), document.mimeType()).pages())
                        .subscribeOn(Schedulers.boundedElastic())
                        .cache()
                : Mono.just(List.of());

        Mono<SegmentationResult> segmentation = document.hasSignedUrl()
                ? analysisClient.analyze(new AnalyzeRequest(document.signedUrl(), document.documentId(), document.organizationId()))
                        .map(this::segmentAnalysis)
                : localPages.map(pages -> classifier.segment(TextDocument.of(pages)));

        Mono<AiExtraction> ai = localPages.flatMap(pages ->
                aiExtractor.extract(new AiExtractionRequest(document.documentId(), document.fileName(), pages)));

        return Mono.zip(segmentation, ai)
                .map(t -> assemble(document, t.getT1(), t.getT2()))
                .takeUntilOther(cancelSignal)
                .switchIfEmpty(Mono.error(() -> new AnalysisException(AnalysisErrorCode.CANCELLED,
                        "Offer extraction cancelled for document " + document.documentId())));
    }

    private SegmentationResult segmentAnalysis(AnalysisResult result) {
        if (!result.hasUsableText()) {
            throw new AnalysisException(AnalysisErrorCode.EMPTY_ANALYSIS,
                    "Analysis of task " + result.taskId() + " produced no text");
        }
        if (result.pages().isEmpty()) {
            return classifier.segment(new TextDocument(
                    SectionClassifier.legacyTextPages(result.text(), 1), null, null, result.text()));
        }
        return classifier.segmentPages(result.pages());
    }

    private OfferExtractionOutcome assemble(OfferDocument document, SegmentationResult segmentation, AiExtraction ai) {
        UnifiedOfferBuildResult built = offerBuilder.build(segmentation.sections(), ai.data(), document.metadata());

        String aiProductType = readAiProductType(ai.data()).orElse(null);
        ProductTypeHeuristic fromSegmentation = segmentation.productTypeHeuristic();
        ProductTypeHeuristic fromBuilder = built.productTypeHeuristic();
        String resolved = aiProductType != null ? aiProductType
                : predicted(fromSegmentation).orElse(predicted(fromBuilder).orElse(null));

        List<ExtractionDiagnostics.AggregatedSource> sources = new ArrayList<>();
        for (SectionSource s : segmentation.sources()) {
            sources.add(new ExtractionDiagnostics.AggregatedSource(ORIGIN_SEGMENTATION, s));
        }
        for (SectionSource s : built.sources()) {
            sources.add(new ExtractionDiagnostics.AggregatedSource(ORIGIN_BUILDER, s));
        }

        ExtractionDiagnostics diagnostics = new ExtractionDiagnostics(
                segmentation.textConfidence(),
                new ExtractionDiagnostics.ProductTypePredictions(aiProductType, fromSegmentation, fromBuilder, resolved),
                sources,
                ai.segmentsProcessed(),
                ai.degraded());

        log.info("[OfferExtractionPipeline] documentId={} productType={} confidence={} textConfidence={} aiDegraded={}",
                document.documentId(), resolved, built.offer().extractionConfidence(),
                diagnostics.textConfidence(), ai.degraded());
        return new OfferExtractionOutcome(built.offer(), segmentation, ai.data(), diagnostics);
    }

    /** A plain string, or an object carrying the name under value/label/name/type. */
    static Optional<String> readAiProductType(JsonNode data) {
        if (data == null) return Optional.empty();
        for (String key : new String[]{"product_type", "productType"}) {
            JsonNode v = data.path(key);
            if (v.isTextual()) {
                Optional<String> s = JsonValues.text(v);
                if (s.isPresent()) return s;
            } else if (v.isObject()) {
                Optional<String> s = JsonValues.firstText(v, "value", "label", "name", "type");
                if (s.isPresent()) return s;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> predicted(ProductTypeHeuristic heuristic) {
        return heuristic == null ? Optional.empty() : Optional.ofNullable(heuristic.predictedType());
    }
}
