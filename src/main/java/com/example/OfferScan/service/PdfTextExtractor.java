package com.example.OfferScan.service;

import com.example.OfferScan.config.AiExtractionProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.TextPage;
import org.apache.tika.exception.TikaException;
import org.apache.tika.extractor.EmbeddedDocumentExtractor;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Text-only document parsing for offers that arrive as raw bytes instead of a signed URL.
 */
@Service
public class PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    private final AutoDetectParser parser = new AutoDetectParser();
    private final int maxChars;

    public PdfTextExtractor(AiExtractionProperties props) {
        this.maxChars = props.getMaxTextChars();
    }

    public PdfText extract(byte[] bytes, String fileName, String declaredMime) {
        if (bytes == null || bytes.length == 0) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_ARGUMENT, "Document bytes are empty");
        }

        Metadata md = new Metadata();
        if (fileName != null && !fileName.isBlank()) {
            md.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
        }
        if (declaredMime != null && !declaredMime.isBlank()) {
            md.set(Metadata.CONTENT_TYPE, declaredMime);
        }

        PageCollector handler = new PageCollector(maxChars);
        ParseContext ctx = new ParseContext();
        // attachments inside the offer are not part of it
        ctx.set(EmbeddedDocumentExtractor.class, new EmbeddedDocumentExtractor() {
            @Override
            public boolean shouldParseEmbedded(Metadata metadata) {
                return false;
            }

            @Override
            public void parseEmbedded(InputStream stream, ContentHandler h, Metadata metadata, boolean outputHtml) {
                // skipped
            }
        });

        try (InputStream is = new ByteArrayInputStream(bytes)) {
            parser.parse(is, handler, md, ctx);
        } catch (IOException | SAXException | TikaException ex) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_ARGUMENT,
                    "Failed to parse document " + (fileName == null ? "" : fileName) + ": " + ex.getMessage(), ex);
        }

        String text = handler.fullText();
        int pageCount = readPageCount(md, handler.pages().size());
        List<TextPage> pages = handler.pages().isEmpty()
                ? SectionClassifier.legacyTextPages(text, pageCount)
                : handler.pages();

        log.info("[PdfTextExtractor] file={} mime={} pages={} chars={} truncated={}",
                fileName, md.get(Metadata.CONTENT_TYPE), pages.size(), text.length(), handler.truncated());
        return new PdfText(text, pages.size(), pages, md.get(Metadata.CONTENT_TYPE));
    }

    static int readPageCount(Metadata md, int collected) {
        if (collected > 0) return collected;
        Integer n = md.getInt(PagedText.N_PAGES);
        return n == null || n < 1 ? 1 : n;
    }

    public record PdfText(String text, int pageCount, List<TextPage> pages, String detectedMime) {
    }

    /**
     * Collects text per {@code <div class="page">} element emitted by page-aware parsers (PDF);
     * other formats end up as a single undivided text.
     */
    static final class PageCollector extends DefaultHandler {
        private final int maxChars;
        private final StringBuilder all = new StringBuilder();
        private final List<TextPage> pages = new ArrayList<>();
        private StringBuilder current;
        private int nestedDivs;
        private int total;
        private boolean truncated;

        PageCollector(int maxChars) {
            this.maxChars = maxChars;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            if (!"div".equals(localName)) return;
            if (current != null) {
                nestedDivs++;
            } else if ("page".equals(atts.getValue("class"))) {
                current = new StringBuilder();
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            if ("p".equals(localName) || "br".equals(localName) || "li".equals(localName)) {
                append("\n");
            } else if ("div".equals(localName) && current != null) {
                if (nestedDivs > 0) {
                    nestedDivs--;
                    return;
                }
                pages.add(new TextPage(pages.size() + 1, current.toString().strip()));
                current = null;
                append("\n");
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            append(new String(ch, start, length));
        }

        @Override
        public void ignorableWhitespace(char[] ch, int start, int length) {
            append(new String(ch, start, length));
        }

        private void append(String s) {
            if (truncated) return;
            int room = maxChars - total;
            if (s.length() > room) {
                s = s.substring(0, Math.max(0, room));
                truncated = true;
            }
            total += s.length();
            all.append(s);
            if (current != null) current.append(s);
        }

        String fullText() {
            return all.toString().strip();
        }

        List<TextPage> pages() {
            return pages;
        }

        boolean truncated() {
            return truncated;
        }
    }
}
