package com.example.OfferScan.service;

import com.example.OfferScan.config.AiExtractionProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.TextPage;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.junit.jupiter.api.Test;
import org.xml.sax.helpers.AttributesImpl;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfTextExtractorTest {

    private static final String XHTML = "http://www.w3.org/1999/xhtml";

    private final AiExtractionProperties props = new AiExtractionProperties();

    @Test
    void collectsOneTextPagePerPageDiv() {
        PdfTextExtractor.PageCollector collector = new PdfTextExtractor.PageCollector(10_000);

        page(collector, () -> {
            paragraph(collector, "Ubezpieczony: Jan Kowalski");
            collector.startElement(XHTML, "div", "div", classAttr("annotation"));
            text(collector, "nested");
            collector.endElement(XHTML, "div", "div");
        });
        page(collector, () -> paragraph(collector, "Składka razem 120,00 zł"));

        List<TextPage> pages = collector.pages();
        assertEquals(2, pages.size());
        assertEquals(1, pages.get(0).pageNumber());
        assertTrue(pages.get(0).text().startsWith("Ubezpieczony: Jan Kowalski"));
        assertTrue(pages.get(0).text().contains("nested"));
        assertEquals(2, pages.get(1).pageNumber());
        assertEquals("Składka razem 120,00 zł", pages.get(1).text());
        assertTrue(collector.fullText().contains("Kowalski"));
        assertTrue(collector.fullText().endsWith("120,00 zł"));
        assertFalse(collector.truncated());
    }

    @Test
    void textOutsidePageDivsStaysUndivided() {
        PdfTextExtractor.PageCollector collector = new PdfTextExtractor.PageCollector(10_000);
        collector.startElement(XHTML, "div", "div", classAttr("header"));
        paragraph(collector, "Oferta");
        collector.endElement(XHTML, "div", "div");

        assertTrue(collector.pages().isEmpty());
        assertEquals("Oferta", collector.fullText());
    }

    @Test
    void stopsCollectingAtTheCharacterCap() {
        PdfTextExtractor.PageCollector collector = new PdfTextExtractor.PageCollector(10);

        page(collector, () -> paragraph(collector, "Hello world and more"));
        page(collector, () -> paragraph(collector, "second page"));

        assertTrue(collector.truncated());
        assertEquals("Hello worl", collector.fullText());
        assertEquals("Hello worl", collector.pages().get(0).text());
        assertEquals("", collector.pages().get(1).text());
    }

    @Test
    void pageCountPrefersCollectedPagesThenMetadata() {
        Metadata md = new Metadata();
        assertEquals(1, PdfTextExtractor.readPageCount(md, 0));

        md.set(PagedText.N_PAGES, 3);
        assertEquals(3, PdfTextExtractor.readPageCount(md, 0));
        assertEquals(2, PdfTextExtractor.readPageCount(md, 2));
    }

    @Test
    void undividedTextIsSplitEvenlyOverTheReportedPages() {
        List<TextPage> pages = SectionClassifier.legacyTextPages("a\nb\nc\nd\ne\nf", 3);

        assertEquals(3, pages.size());
        assertEquals("a\nb", pages.get(0).text());
        assertEquals("c\nd", pages.get(1).text());
        assertEquals("e\nf", pages.get(2).text());
        assertEquals(3, pages.get(2).pageNumber());
    }

    @Test
    void parsesPlainTextIntoASinglePage() {
        PdfTextExtractor extractor = new PdfTextExtractor(props);
        byte[] bytes = "Offer line one\nOffer line two\n".getBytes(StandardCharsets.UTF_8);

        PdfTextExtractor.PdfText result = extractor.extract(bytes, "offer.txt", "text/plain");

        assertTrue(result.text().contains("Offer line one"));
        assertTrue(result.text().contains("Offer line two"));
        assertEquals(1, result.pageCount());
        assertEquals(1, result.pages().size());
        assertTrue(result.detectedMime().startsWith("text/plain"));
    }

    @Test
    void capsParsedText() {
        props.setMaxTextChars(5);
        PdfTextExtractor extractor = new PdfTextExtractor(props);

        PdfTextExtractor.PdfText result = extractor.extract(
                "Offer line one".getBytes(StandardCharsets.UTF_8), "offer.txt", "text/plain");

        assertTrue(result.text().length() <= 5);
        assertFalse(result.text().contains("line"));
    }

    @Test
    void skipsEmbeddedDocuments() {
        PdfTextExtractor extractor = new PdfTextExtractor(props);
        byte[] bundle = TestArchives.zip(Map.of("attachment.txt", "Hidden attachment text"));

        PdfTextExtractor.PdfText result = extractor.extract(bundle, "bundle.zip", "application/zip");

        assertFalse(result.text().contains("Hidden attachment text"));
    }

    @Test
    void corruptPdfIsAnInvalidArgument() {
        PdfTextExtractor extractor = new PdfTextExtractor(props);
        byte[] corrupt = "%PDF-1.7\nnot really a pdf".getBytes(StandardCharsets.US_ASCII);

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> extractor.extract(corrupt, "offer.pdf", "application/pdf"));
        assertEquals(AnalysisErrorCode.INVALID_ARGUMENT, ex.getCode());
        assertTrue(ex.getMessage().contains("offer.pdf"));
    }

    @Test
    void emptyBytesAreAnInvalidArgument() {
        PdfTextExtractor extractor = new PdfTextExtractor(props);

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> extractor.extract(new byte[0], "offer.pdf", "application/pdf"));
        assertEquals(AnalysisErrorCode.INVALID_ARGUMENT, ex.getCode());
    }

    private static void page(PdfTextExtractor.PageCollector collector, Runnable body) {
        collector.startElement(XHTML, "div", "div", classAttr("page"));
        body.run();
        collector.endElement(XHTML, "div", "div");
    }

    private static void paragraph(PdfTextExtractor.PageCollector collector, String value) {
        collector.startElement(XHTML, "p", "p", new AttributesImpl());
        text(collector, value);
        collector.endElement(XHTML, "p", "p");
    }

    private static void text(PdfTextExtractor.PageCollector collector, String value) {
        char[] chars = value.toCharArray();
        collector.characters(chars, 0, chars.length);
    }

    private static AttributesImpl classAttr(String value) {
        AttributesImpl atts = new AttributesImpl();
        atts.addAttribute("", "class", "class", "CDATA", value);
        return atts;
    }
}
