package com.example.OfferScan.service;

import com.example.OfferScan.config.AnalysisProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Unpacks the result archive and returns the analysis JSON inside it.
 */
@Component
public class ResultArchiveDecoder {

    private static final Logger log = LoggerFactory.getLogger(ResultArchiveDecoder.class);

    static final String CANONICAL_ENTRY = "analysis.json";
    private static final String[] CONTENT_KEYS = {"data", "pages", "text", "full_text", "document"};

    private final ObjectMapper objectMapper;
    private final long maxArchiveBytes;

    public ResultArchiveDecoder(ObjectMapper objectMapper, AnalysisProperties props) {
        this.objectMapper = objectMapper;
        this.maxArchiveBytes = props.getMaxArchiveBytes();
    }

    public JsonNode decode(byte[] archive) {
        if (archive == null || archive.length == 0) {
            throw new AnalysisException(AnalysisErrorCode.ARCHIVE_ERROR, "Result archive is empty");
        }

        Candidates candidates = readCandidates(archive);
        if (candidates.seen == 0) {
            throw new AnalysisException(AnalysisErrorCode.ARCHIVE_ERROR,
                    "Result archive is not a zip file or contains no entries");
        }

        for (Map.Entry<String, byte[]> e : candidates.entries.entrySet()) {
            if (isCanonical(e.getKey())) {
                JsonNode json = tryParse(e.getKey(), e.getValue());
                if (json != null) return requireContent(json, e.getKey());
            }
        }

        for (Map.Entry<String, byte[]> e : candidates.entries.entrySet()) {
            JsonNode json = tryParse(e.getKey(), e.getValue());
            if (json != null) return requireContent(json, e.getKey());
        }

        throw new AnalysisException(AnalysisErrorCode.ARCHIVE_ERROR,
                "No JSON entry found in result archive, entries=" + candidates.seen);
    }

    /**
     * Buffers only entries that may hold the analysis JSON; images and other payloads are skipped
     * unread. Buffered bytes count against {@code maxArchiveBytes} across all entries.
     */
    private Candidates readCandidates(byte[] archive) {
        Candidates candidates = new Candidates();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    candidates.seen++;
                    byte[] bytes = readIfJson(zip, entry.getName(), candidates);
                    if (bytes != null) {
                        candidates.entries.put(entry.getName(), bytes);
                    } else {
                        log.debug("[ResultArchiveDecoder] skipping entry {}", entry.getName());
                    }
                }
                zip.closeEntry();
            }
        } catch (IOException ex) {
            throw new AnalysisException(AnalysisErrorCode.ARCHIVE_ERROR,
                    "Failed to read result archive: " + ex.getMessage(), ex);
        }
        return candidates;
    }

    /** @return the entry bytes, or {@code null} when the entry is not JSON */
    private byte[] readIfJson(ZipInputStream zip, String name, Candidates candidates) throws IOException {
        boolean decided = name.toLowerCase(Locale.ROOT).endsWith(".json");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int n;
        while ((n = zip.read(buf)) != -1) {
            if (!decided) {
                int first = firstSignificantByte(buf, n);
                if (first >= 0) {
                    if (first != '{' && first != '[') return null;
                    decided = true;
                }
            }
            candidates.buffered += n;
            if (candidates.buffered > maxArchiveBytes) {
                throw new AnalysisException(AnalysisErrorCode.ARCHIVE_ERROR,
                        "Archive JSON entries exceed " + maxArchiveBytes + " bytes at entry " + name);
            }
            out.write(buf, 0, n);
        }
        return decided ? out.toByteArray() : null;
    }

    private JsonNode tryParse(String name, byte[] bytes) {
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException ex) {
            log.debug("[ResultArchiveDecoder] entry {} is not valid JSON: {}", name, ex.getMessage());
            return null;
        }
    }

    private static JsonNode requireContent(JsonNode json, String entryName) {
        if (json != null && json.isObject()) {
            for (String key : CONTENT_KEYS) {
                if (json.has(key)) {
                    log.debug("[ResultArchiveDecoder] using entry {}", entryName);
                    return json;
                }
            }
        }
        throw new AnalysisException(AnalysisErrorCode.EMPTY_ANALYSIS,
                "Archive entry " + entryName + " holds no analysis content");
    }

    /** First byte that is neither whitespace nor part of a UTF-8 BOM, or -1. */
    private static int firstSignificantByte(byte[] buf, int length) {
        for (int i = 0; i < length; i++) {
            byte b = buf[i];
            if (Character.isWhitespace(b) || b == (byte) 0xEF || b == (byte) 0xBB || b == (byte) 0xBF) continue;
            return b;
        }
        return -1;
    }

    private static boolean isCanonical(String entryName) {
        return CANONICAL_ENTRY.equalsIgnoreCase(baseName(entryName));
    }

    private static String baseName(String entryName) {
        int slash = Math.max(entryName.lastIndexOf('/'), entryName.lastIndexOf('\\'));
        return slash < 0 ? entryName : entryName.substring(slash + 1);
    }

    private static final class Candidates {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        int seen;
        long buffered;
    }
}
