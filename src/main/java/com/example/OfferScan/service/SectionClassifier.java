package com.example.OfferScan.service;

import com.example.OfferScan.model.AnalysisBlock;
import com.example.OfferScan.model.AnalysisPage;
import com.example.OfferScan.model.PageRange;
import com.example.OfferScan.model.ParsedSection;
import com.example.OfferScan.model.ProductTypeHeuristic;
import com.example.OfferScan.model.ProductTypeKeywords;
import com.example.OfferScan.model.SectionKeywords;
import com.example.OfferScan.model.SectionSource;
import com.example.OfferScan.model.SectionType;
import com.example.OfferScan.model.SegmentationResult;
import com.example.OfferScan.model.TextDocument;
import com.example.OfferScan.model.TextPage;
import com.example.OfferScan.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword-based segmentation of offer text into typed sections.
 * <p>
 * Two input modes: plain text split into paragraphs ({@link #segment(TextDocument)}), and analyzed
 * pages whose layout blocks are classified one by one ({@link #segmentPages(List)}).
 * Stateless; safe for concurrent use.
 */
@Component
public class SectionClassifier {

    private static final Logger log = LoggerFactory.getLogger(SectionClassifier.class);

    static final int MIN_PARAGRAPH_CHARS = 10;
    static final int MIN_BLOCK_CHARS = 20;

    private final SectionKeywords sectionKeywords;
    private final ProductTypeKeywords productTypeKeywords;

    public SectionClassifier(SectionKeywords sectionKeywords, ProductTypeKeywords productTypeKeywords) {
        this.sectionKeywords = sectionKeywords;
        this.productTypeKeywords = productTypeKeywords;
    }

    // ---------------------------------------------------------------------
    // Paragraph mode
    // ---------------------------------------------------------------------

    public SegmentationResult segment(TextDocument document) {
        if (document == null) return SegmentationResult.empty();

        String fullText = document.fullText() != null
                ? document.fullText()
                : document.pages().stream().map(TextPage::text).collect(Collectors.joining("\n\n"));

        List<String> lines = document.lines() != null
                ? document.lines()
                : Arrays.asList(fullText.replace("\r\n", "\n").split("\n", -1));

        List<Integer> linePageMap = document.linePageMap() != null
                ? document.linePageMap()
                : buildLinePageMap(document.pages(), lines.size());

        List<ParsedSection> sections = new ArrayList<>();
        for (Paragraph p : paragraphs(lines)) {
            if (p.text().trim().length() < MIN_PARAGRAPH_CHARS) continue;

            Match match = classify(p.text().toLowerCase(Locale.ROOT));
            sections.add(new ParsedSection(
                    match.type(),
                    p.text(),
                    match.keywords(),
                    match.ratio(),
                    resolvePageRange(linePageMap, p.startLine(), p.endLine()),
                    Texts.snippet(p.text())));
        }

        ProductTypeHeuristic productType = inferProductType(fullText, ProductTypeHeuristic.Source.SEGMENTATION);
        logBreakdown("paragraph", sections);
        return new SegmentationResult(sections, toSources(sections), productType);
    }

    private static List<Paragraph> paragraphs(List<String> lines) {
        List<Paragraph> out = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= lines.size(); i++) {
            boolean blank = i == lines.size() || lines.get(i) == null || lines.get(i).isBlank();
            if (!blank && start < 0) {
                start = i;
            } else if (blank && start >= 0) {
                out.add(new Paragraph(String.join("\n", lines.subList(start, i)).trim(), start, i - 1));
                start = -1;
            }
        }
        return out;
    }

    /**
     * One entry per page line plus one for the blank separator that follows each page in the joined
     * text; short maps are padded with the last page number.
     */
    static List<Integer> buildLinePageMap(List<TextPage> pages, int lineCount) {
        List<Integer> map = new ArrayList<>(lineCount);
        for (TextPage page : pages) {
            String text = page.text() == null ? "" : page.text().replace("\r\n", "\n");
            int pageLines = text.split("\n", -1).length;
            for (int i = 0; i < pageLines; i++) map.add(page.pageNumber());
            map.add(page.pageNumber());
        }
        int pad = pages.isEmpty() ? 1 : pages.get(pages.size() - 1).pageNumber();
        while (map.size() < lineCount) map.add(pad);
        return map.size() > lineCount ? new ArrayList<>(map.subList(0, lineCount)) : map;
    }

    static PageRange resolvePageRange(List<Integer> linePageMap, int startLine, int endLine) {
        if (linePageMap == null || linePageMap.isEmpty()) return null;
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int i = Math.max(0, startLine); i <= endLine && i < linePageMap.size(); i++) {
            Integer page = linePageMap.get(i);
            if (page == null || page <= 0) continue;
            min = Math.min(min, page);
            max = Math.max(max, page);
        }
        return min == Integer.MAX_VALUE ? null : new PageRange(min, max);
    }

    // ---------------------------------------------------------------------
    // Block mode
    // ---------------------------------------------------------------------

    public SegmentationResult segmentPages(List<AnalysisPage> pages) {
        if (pages == null || pages.isEmpty()) return SegmentationResult.empty();

        List<ParsedSection> sections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> allText = new ArrayList<>();

        for (AnalysisPage page : pages) {
            for (AnalysisBlock block : flatten(pageBlock(page))) {
                String text = block.text().trim();
                if (text.length() < MIN_BLOCK_CHARS) continue;
                allText.add(text);

                String hints = block.hints();
                String haystack = (hints.isEmpty() ? text : text + " " + hints).toLowerCase(Locale.ROOT);
                Match match = classify(haystack);

                String snippet = Texts.snippet(text);
                if (!seen.add(block.pageNumber() + "|" + match.type() + "|" + snippet)) continue;

                sections.add(new ParsedSection(
                        match.type(),
                        text,
                        match.keywords(),
                        blockConfidence(block, match),
                        PageRange.single(block.pageNumber()),
                        snippet));
            }
        }

        ProductTypeHeuristic productType = inferProductType(String.join("\n", allText), ProductTypeHeuristic.Source.SEGMENTATION);
        logBreakdown("block", sections);
        return new SegmentationResult(sections, toSources(sections), productType);
    }

    /** The whole page as a root block whose children are the page's layout blocks. */
    private static AnalysisBlock pageBlock(AnalysisPage page) {
        return AnalysisBlock.builder()
                .type("page")
                .text(page.text())
                .pageNumber(page.pageNumber())
                .children(page.blocks())
                .build();
    }

    /** Pre-order, without recursion. */
    static List<AnalysisBlock> flatten(AnalysisBlock root) {
        List<AnalysisBlock> out = new ArrayList<>();
        Deque<AnalysisBlock> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AnalysisBlock b = stack.pop();
            out.add(b);
            List<AnalysisBlock> children = b.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return out;
    }

    private static double blockConfidence(AnalysisBlock block, Match match) {
        if (block.confidence() != null && Double.isFinite(block.confidence())) {
            return Math.max(0.0, Math.min(1.0, block.confidence()));
        }
        if (match.type() == SectionType.UNKNOWN) return 0.2;
        return Math.min(0.9, 0.4 + match.ratio());
    }

    // ---------------------------------------------------------------------
    // Shared
    // ---------------------------------------------------------------------

    /** Highest matched/total ratio wins; the earlier table entry keeps a tie. */
    Match classify(String lowerText) {
        Match best = null;
        for (Map.Entry<SectionType, List<String>> e : sectionKeywords.table().entrySet()) {
            List<String> matched = e.getValue().stream().filter(lowerText::contains).toList();
            if (matched.isEmpty()) continue;
            double ratio = (double) matched.size() / e.getValue().size();
            if (best == null || ratio > best.ratio()) {
                best = new Match(e.getKey(), matched, ratio);
            }
        }
        return best != null ? best : new Match(SectionType.UNKNOWN, List.of(), 0.0);
    }

    /**
     * @return {@code null} for blank text; a heuristic with no predicted type when nothing matched
     */
    public ProductTypeHeuristic inferProductType(String text, ProductTypeHeuristic.Source source) {
        if (text == null || text.isBlank()) return null;
        String lower = text.toLowerCase(Locale.ROOT);

        Map<String, List<String>> matchesByType = new LinkedHashMap<>();
        String bestType = null;
        double bestScore = 0.0;
        List<String> bestMatches = List.of();

        for (Map.Entry<String, List<String>> e : productTypeKeywords.table().entrySet()) {
            List<String> matched = e.getValue().stream().filter(lower::contains).toList();
            if (matched.isEmpty()) continue;
            matchesByType.put(e.getKey(), matched);
            double score = (double) matched.size() / e.getValue().size();
            if (bestType == null || score > bestScore) {
                bestType = e.getKey();
                bestScore = score;
                bestMatches = matched;
            }
        }

        return new ProductTypeHeuristic(bestType, bestScore, bestMatches,
                Collections.unmodifiableMap(matchesByType), source);
    }

    /** Splits text lines evenly over {@code pageCount} synthetic pages. */
    public static List<TextPage> legacyTextPages(String text, int pageCount) {
        String normalized = text == null ? "" : text.replace("\r\n", "\n");
        List<String> lines = Arrays.asList(normalized.split("\n", -1));
        int pagesWanted = Math.max(1, pageCount);
        int perPage = Math.max(1, (int) Math.ceil((double) lines.size() / pagesWanted));

        List<TextPage> pages = new ArrayList<>(pagesWanted);
        for (int i = 0; i < pagesWanted; i++) {
            int from = Math.min(lines.size(), i * perPage);
            int to = Math.min(lines.size(), from + perPage);
            pages.add(new TextPage(i + 1, String.join("\n", lines.subList(from, to))));
        }
        return pages;
    }

    private static List<SectionSource> toSources(List<ParsedSection> sections) {
        return sections.stream().map(SectionSource::of).toList();
    }

    private static void logBreakdown(String mode, List<ParsedSection> sections) {
        if (!log.isInfoEnabled()) return;
        Map<SectionType, Long> counts = new EnumMap<>(SectionType.class);
        for (ParsedSection s : sections) counts.merge(s.type(), 1L, Long::sum);
        log.info("[SectionClassifier] mode={} sections={} breakdown={}", mode, sections.size(), counts);
    }

    record Match(SectionType type, List<String> keywords, double ratio) {
    }

    private record Paragraph(String text, int startLine, int endLine) {
    }
}
