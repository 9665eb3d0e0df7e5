package com.example.OfferScan.service;

import com.example.OfferScan.model.AnalysisBlock;
import com.example.OfferScan.model.AnalysisPage;
import com.example.OfferScan.model.AnalysisResult;
import com.example.OfferScan.model.BoundingBox;
import com.example.OfferScan.model.StructureSummary;
import com.example.OfferScan.util.JsonValues;
import com.example.OfferScan.util.NumberValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Maps the loosely-shaped analysis JSON onto {@link AnalysisResult}. Every field is looked up
 * through an ordered list of candidate keys since backend versions disagree on naming.
 */
@Component
public class AnalysisPayloadNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPayloadNormalizer.class);

    static final int MAX_BLOCKS_PER_PAGE = 20_000;
    static final int MAX_SUMMARY_HEADINGS = 10;

    public AnalysisResult normalize(JsonNode payload) {
        JsonNode root = payload == null ? MissingNode.getInstance() : payload;
        JsonNode data = root.path("data").isObject() ? root.path("data") : root;

        List<AnalysisPage> pages = readPages(data);
        String text = JsonValues.firstText(data, "text", "full_text", "markdown")
                .orElseGet(() -> joinPageTexts(pages));
        StructureSummary summary = readStructureSummary(data);

        log.debug("[AnalysisPayloadNormalizer] pages={} textChars={} summary={}",
                pages.size(), text.length(), summary != null);
        return new AnalysisResult(null, text, pages, summary);
    }

    private List<AnalysisPage> readPages(JsonNode data) {
        JsonNode array = JsonValues.firstArray(data, "pages", "document.pages", "pdf_info")
                .orElse(MissingNode.getInstance());
        List<AnalysisPage> pages = new ArrayList<>();
        int index = 0;
        for (JsonNode raw : array) {
            index++;
            if (!raw.isObject()) continue;
            pages.add(readPage(raw, index));
        }
        return pages;
    }

    private AnalysisPage readPage(JsonNode raw, int position) {
        int pageNumber = readPageNumber(raw, position);
        List<AnalysisBlock> blocks = readBlocks(
                JsonValues.firstArray(raw, "blocks", "para_blocks").orElse(MissingNode.getInstance()),
                pageNumber);

        String text = readText(raw).orElseGet(() -> blockText(blocks));
        Double width = JsonValues.firstNumber(raw, "width", "pageWidth", "page_width");
        Double height = JsonValues.firstNumber(raw, "height", "pageHeight", "page_height");
        return new AnalysisPage(pageNumber, text, width, height, blocks);
    }

    static int readPageNumber(JsonNode raw, int fallback) {
        Double explicit = JsonValues.firstNumber(raw, "pageNumber", "page_number", "page");
        if (explicit != null && explicit >= 1) return explicit.intValue();
        Double zeroBased = NumberValues.parseNumberValue(raw.path("page_idx"));
        if (zeroBased != null && zeroBased >= 0) return zeroBased.intValue() + 1;
        return fallback;
    }

    /** String {@code text}/{@code content}, arrays of strings or {text}/{content} objects, then {@code lines}. */
    static Optional<String> readText(JsonNode node) {
        for (String key : new String[]{"text", "content", "lines"}) {
            JsonNode v = node.path(key);
            if (v.isTextual() && !v.asText().isBlank()) return Optional.of(v.asText());
            if (v.isArray()) {
                List<String> parts = new ArrayList<>();
                for (JsonNode item : v) {
                    if (item.isTextual()) {
                        if (!item.asText().isBlank()) parts.add(item.asText());
                    } else if (item.isObject()) {
                        JsonValues.firstText(item, "text", "content").ifPresent(parts::add);
                    }
                }
                if (!parts.isEmpty()) return Optional.of(String.join("\n", parts));
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the block tree without recursion: a pre-order pass records each node and its parent,
     * then nodes are materialized back to front so children always exist before their parent.
     */
    List<AnalysisBlock> readBlocks(JsonNode array, int pageNumber) {
        if (array == null || !array.isArray() || array.isEmpty()) return List.of();

        List<PendingBlock> order = new ArrayList<>();
        Deque<PendingBlock> stack = new ArrayDeque<>();
        pushChildren(stack, array, null, pageNumber);

        while (!stack.isEmpty()) {
            if (order.size() >= MAX_BLOCKS_PER_PAGE) {
                log.warn("[AnalysisPayloadNormalizer] page {} has more than {} blocks, rest ignored",
                        pageNumber, MAX_BLOCKS_PER_PAGE);
                break;
            }
            PendingBlock current = stack.pop();
            current.index = order.size();
            order.add(current);
            if (current.parent != null) current.parent.childIndexes.add(current.index);

            JsonNode children = JsonValues.firstArray(current.raw, "children", "blocks")
                    .orElse(MissingNode.getInstance());
            pushChildren(stack, children, current, current.pageNumber);
        }

        AnalysisBlock[] built = new AnalysisBlock[order.size()];
        List<AnalysisBlock> roots = new ArrayList<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            PendingBlock p = order.get(i);
            List<AnalysisBlock> children = new ArrayList<>(p.childIndexes.size());
            for (int ci : p.childIndexes) children.add(built[ci]);
            built[i] = toBlock(p, children);
            if (p.parent == null) roots.add(0, built[i]);
        }
        return roots;
    }

    private static void pushChildren(Deque<PendingBlock> stack, JsonNode array, PendingBlock parent, int pageNumber) {
        for (int i = array.size() - 1; i >= 0; i--) {
            JsonNode raw = array.get(i);
            if (raw == null || !raw.isObject()) continue;
            stack.push(new PendingBlock(raw, parent, readPageNumber(raw, pageNumber)));
        }
    }

    private static AnalysisBlock toBlock(PendingBlock p, List<AnalysisBlock> children) {
        JsonNode raw = p.raw;
        Double level = JsonValues.firstNumber(raw, "headingLevel", "heading_level", "level");
        return AnalysisBlock.builder()
                .id(JsonValues.firstText(raw, "id", "block_id").orElse(null))
                .type(JsonValues.firstText(raw, "type", "block_type").orElse(null))
                .category(JsonValues.firstText(raw, "category").orElse(null))
                .label(JsonValues.firstText(raw, "label").orElse(null))
                .text(JsonValues.firstText(raw, "text", "content", "value").orElse(""))
                .pageNumber(p.pageNumber)
                .confidence(JsonValues.firstNumber(raw, "confidence", "score"))
                .headingLevel(level == null ? null : level.intValue())
                .boundingBox(readBoundingBox(raw))
                .children(children)
                .build();
    }

    static BoundingBox readBoundingBox(JsonNode raw) {
        JsonNode box = JsonValues.firstOf(raw,
                n -> JsonValues.firstObject(n, "boundingBox", "bounding_box", "bbox"),
                n -> JsonValues.firstArray(n, "boundingBox", "bounding_box", "bbox"))
                .orElse(null);
        if (box == null) return null;

        if (box.isArray()) {
            if (box.size() < 4) return null;
            Double x0 = NumberValues.parseNumberValue(box.get(0));
            Double y0 = NumberValues.parseNumberValue(box.get(1));
            Double x1 = NumberValues.parseNumberValue(box.get(2));
            Double y1 = NumberValues.parseNumberValue(box.get(3));
            if (x0 == null || y0 == null || x1 == null || y1 == null) return null;
            return new BoundingBox(x0, y0, x1 - x0, y1 - y0);
        }

        Double x = NumberValues.parseNumberValue(box.path("x"));
        Double y = NumberValues.parseNumberValue(box.path("y"));
        Double w = NumberValues.parseNumberValue(box.path("width"));
        Double h = NumberValues.parseNumberValue(box.path("height"));
        if (x == null || y == null || w == null || h == null) return null;
        return new BoundingBox(x, y, w, h);
    }

    private StructureSummary readStructureSummary(JsonNode data) {
        Optional<JsonNode> raw = JsonValues.firstObject(data,
                "structureSummary", "structure_summary", "structural_summary", "structure");
        if (raw.isEmpty()) return null;

        JsonNode s = raw.get();
        List<StructureSummary.Page> pages = new ArrayList<>();
        JsonNode array = JsonValues.firstArray(s, "pages", "pageSummaries").orElse(MissingNode.getInstance());
        int index = 0;
        for (JsonNode p : array) {
            index++;
            if (!p.isObject()) continue;

            Double blockCount = JsonValues.firstNumber(p, "blockCount", "block_count");
            if (blockCount == null && p.path("blocks").isArray()) blockCount = (double) p.path("blocks").size();
            if (blockCount == null) blockCount = JsonValues.firstNumber(p, "blocks");

            List<String> headings = JsonValues.<List<String>>firstOf(p,
                    n -> JsonValues.firstArray(n, "headings", "heading", "top_headings").map(JsonValues::strings),
                    n -> JsonValues.firstText(n, "headings", "heading").map(List::of))
                    .orElse(List.of());
            if (headings.size() > MAX_SUMMARY_HEADINGS) headings = headings.subList(0, MAX_SUMMARY_HEADINGS);

            pages.add(new StructureSummary.Page(
                    readPageNumber(p, index),
                    blockCount == null ? 0 : blockCount.intValue(),
                    headings,
                    JsonValues.strings(p.path("keywords"))));
        }
        return new StructureSummary(JsonValues.firstNumber(s, "confidence"), pages);
    }

    private static String joinPageTexts(List<AnalysisPage> pages) {
        List<String> texts = new ArrayList<>();
        for (AnalysisPage p : pages) {
            if (!p.text().isBlank()) texts.add(p.text());
        }
        return String.join("\n\n", texts);
    }

    /** Page text when the page itself carries none: own text of every block in reading order. */
    private static String blockText(List<AnalysisBlock> blocks) {
        List<String> parts = new ArrayList<>();
        Deque<AnalysisBlock> stack = new ArrayDeque<>();
        for (int i = blocks.size() - 1; i >= 0; i--) stack.push(blocks.get(i));
        while (!stack.isEmpty()) {
            AnalysisBlock b = stack.pop();
            if (!b.text().isBlank()) parts.add(b.text().trim());
            for (int i = b.children().size() - 1; i >= 0; i--) stack.push(b.children().get(i));
        }
        return String.join("\n", parts);
    }

    private static final class PendingBlock {
        final JsonNode raw;
        final PendingBlock parent;
        final int pageNumber;
        final List<Integer> childIndexes = new ArrayList<>();
        int index;

        PendingBlock(JsonNode raw, PendingBlock parent, int pageNumber) {
            this.raw = raw;
            this.parent = parent;
            this.pageNumber = pageNumber;
        }
    }
}
