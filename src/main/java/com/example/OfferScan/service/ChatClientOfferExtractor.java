package com.example.OfferScan.service;

import com.example.OfferScan.config.AiExtractionProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.AiExtraction;
import com.example.OfferScan.model.AiExtractionRequest;
import com.example.OfferScan.model.ParsedSection;
import com.example.OfferScan.model.TextDocument;
import com.example.OfferScan.model.TextPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * AI extraction through a Spring AI {@link ChatClient}.
 * <p>
 * Pages are sent in segments, one prompt each, and the per-segment JSON objects are merged.
 * When the full run fails because the input was too much for the model, one more run is made
 * with the first page only.
 */
@Service
@RequiredArgsConstructor
public class ChatClientOfferExtractor implements OfferAiExtractor {

    private static final Logger log = LoggerFactory.getLogger(ChatClientOfferExtractor.class);

    static final String SYSTEM_PROMPT =
            "Jesteś ekspertem od ekstrakcji danych z ofert ubezpieczeniowych.\n" +
            "Ekstrahuj informacje zgodnie z zunifikowanym schematem:\n" +
            "- Priorytetowo używaj danych z tekstu dokumentu\n" +
            "- Dla składek: szukaj \"total_premium_before_discounts\" i \"total_premium_after_discounts\"\n" +
            "- Dla ubezpieczonych: szukaj imion, wieku i przypisanych planów\n" +
            "- Dla assistance: wypisz pełne nazwy usług z limity\n" +
            "- Dla zniżek: wymień wszystkie rabaty i promocje\n" +
            "- Oznacz brakujące wartości jako null lub pomiń pole";

    static final String RESPONSE_SCHEMA =
            "Odpowiedz wyłącznie poprawnym JSON-em o strukturze:\n" +
            "{\n" +
            "  \"insurer\": \"\",\n" +
            "  \"product_type\": \"\",\n" +
            "  \"calculation_id\": \"\",\n" +
            "  \"insured\": [{\"name\": \"\", \"age\": 0, \"role\": \"\", \"plans\": [{\"type\": \"\", \"sum\": 0, \"premium\": 0, \"variant\": \"\", \"duration\": \"\"}]}],\n" +
            "  \"base_contracts\": [{\"name\": \"\", \"sum\": 0, \"premium\": 0, \"variant\": \"\"}],\n" +
            "  \"additional_contracts\": [{\"name\": \"\", \"coverage\": \"\", \"premium\": 0}],\n" +
            "  \"discounts\": [\"\"],\n" +
            "  \"total_premium_before_discounts\": 0,\n" +
            "  \"total_premium_after_discounts\": 0,\n" +
            "  \"assistance\": [{\"name\": \"\", \"coverage\": \"\", \"limits\": \"\"}],\n" +
            "  \"premium\": {\"total\": \"\", \"currency\": \"\", \"period\": \"\"},\n" +
            "  \"valid_from\": \"\",\n" +
            "  \"valid_to\": \"\",\n" +
            "  \"notes\": [\"\"]\n" +
            "}";

    private static final String[] DEGRADABLE_MARKERS = {
            "too large", "failed to extract", "context length", "maximum context"
    };

    enum Attempt { FULL, DEGRADED }

    private final ChatClient offerExtractionChatClient;
    private final SectionClassifier classifier;
    private final AiExtractionProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<AiExtraction> extract(AiExtractionRequest request) {
        List<TextPage> pages = request.pages().stream()
                .filter(p -> p.text() != null && !p.text().isBlank())
                .toList();
        if (pages.isEmpty()) {
            log.info("[ChatClientOfferExtractor] documentId={} has no text, AI pass skipped", request.documentId());
            return Mono.just(new AiExtraction(JsonNodeFactory.instance.objectNode(), 0, false));
        }
        return run(Attempt.FULL, pages, request);
    }

    private Mono<AiExtraction> run(Attempt attempt, List<TextPage> pages, AiExtractionRequest request) {
        List<TextPage> input = attempt == Attempt.FULL ? pages : pages.subList(0, 1);
        List<List<TextPage>> segments = partition(input, props.getPagesPerSegment());

        return Flux.range(0, segments.size())
                .concatMap(i -> callSegment(i, segments.size(), segments.get(i), request))
                .reduce(JsonNodeFactory.instance.objectNode(), ExtractionMerger::merge)
                .map(data -> {
                    log.info("[ChatClientOfferExtractor] documentId={} attempt={} segments={} fields={}",
                            request.documentId(), attempt, segments.size(), data.size());
                    return new AiExtraction(data, segments.size(), attempt == Attempt.DEGRADED);
                })
                .onErrorResume(ex -> {
                    if (attempt == Attempt.FULL && isDegradable(ex)) {
                        log.warn("[ChatClientOfferExtractor] documentId={} degrading to first page after: {}",
                                request.documentId(), ex.getMessage());
                        return run(Attempt.DEGRADED, pages, request);
                    }
                    return Mono.error(asExtractionFailure(ex, attempt));
                });
    }

    private Mono<ObjectNode> callSegment(int index, int total, List<TextPage> segment, AiExtractionRequest request) {
        String userPrompt = buildUserPrompt(index, total, segment);
        log.debug("[ChatClientOfferExtractor] documentId={} segment {}/{} chars={}",
                request.documentId(), index + 1, total, userPrompt.length());

        return Mono.fromCallable(() -> offerExtractionChatClient.prompt()
                        .system(SYSTEM_PROMPT)
                        .user(userPrompt)
                        .call()
                        .content())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(props.getTimeout())
                .onErrorMap(TimeoutException.class, ex -> new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED,
                        "AI processing timeout for segment " + (index + 1) + ", input may be too large", ex))
                .map(content -> parseContent(content, index + 1));
    }

    String buildUserPrompt(int index, int total, List<TextPage> segment) {
        int first = segment.get(0).pageNumber();
        int last = segment.get(segment.size() - 1).pageNumber();
        String text = segment.stream().map(TextPage::text).collect(Collectors.joining("\n\n"));
        if (text.length() > props.getMaxSegmentChars()) {
            text = text.substring(0, props.getMaxSegmentChars());
        }

        return "Segment " + (index + 1) + "/" + total + ". Strony " + first + "-" + last + ". Tekst:\n\n"
                + text
                + "\n\nSekcje w segmencie: " + summarizeSections(segment)
                + "\n\n" + RESPONSE_SCHEMA;
    }

    private String summarizeSections(List<TextPage> segment) {
        List<ParsedSection> sections = classifier.segment(TextDocument.of(segment)).sections();
        if (sections.isEmpty()) return "brak sekcji";
        return sections.stream()
                .map(s -> s.type().key() + "(" + Math.round(s.confidence() * 100) + "%)")
                .collect(Collectors.joining(", "));
    }

    /** Strips markdown fences and surrounding prose, then parses the outermost JSON object. */
    ObjectNode parseContent(String content, int segmentNumber) {
        String s = content == null ? "" : content.trim();
        s = s.replaceAll("(?s)^```[a-zA-Z]*\\s*", "").replaceAll("(?s)\\s*```$", "");

        int start = s.indexOf('{');
        int end = s.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED,
                    "Failed to extract structured data from segment " + segmentNumber + ": no JSON object in response");
        }

        try {
            JsonNode node = objectMapper.readTree(s.substring(start, end + 1));
            if (!node.isObject()) {
                throw new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED,
                        "Failed to extract structured data from segment " + segmentNumber + ": response is not an object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException ex) {
            throw new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED,
                    "Failed to extract structured data from segment " + segmentNumber + ": " + ex.getOriginalMessage(), ex);
        }
    }

    static boolean isDegradable(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg == null) continue;
            String lower = msg.toLowerCase(Locale.ROOT);
            for (String marker : DEGRADABLE_MARKERS) {
                if (lower.contains(marker)) return true;
            }
        }
        return false;
    }

    private static AnalysisException asExtractionFailure(Throwable ex, Attempt attempt) {
        if (ex instanceof AnalysisException
                && ((AnalysisException) ex).getCode() == AnalysisErrorCode.AI_EXTRACTION_FAILED
                && attempt == Attempt.FULL) {
            return (AnalysisException) ex;
        }
        return new AnalysisException(AnalysisErrorCode.AI_EXTRACTION_FAILED,
                "AI extraction failed (" + attempt.name().toLowerCase(Locale.ROOT) + " attempt): " + ex.getMessage(), ex);
    }

    static List<List<TextPage>> partition(List<TextPage> pages, int size) {
        List<List<TextPage>> out = new ArrayList<>();
        for (int i = 0; i < pages.size(); i += size) {
            out.add(pages.subList(i, Math.min(pages.size(), i + size)));
        }
        return out;
    }
}
