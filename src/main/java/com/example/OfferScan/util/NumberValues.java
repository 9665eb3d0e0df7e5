package com.example.OfferScan.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of amounts written the Polish way ({@code "1 234,56 zł"}, {@code "1.234,56"}).
 */
public final class NumberValues {
    private NumberValues() {}

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9,.-]");
    private static final Pattern DOT_GROUPING = Pattern.compile("\\.(?=\\d{3}(?:\\D|$))");
    private static final Pattern COMMA_GROUPING = Pattern.compile(",(?=\\d{3}(?:\\D|$))");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    /**
     * @return the parsed value, or {@code null} when nothing numeric could be read (never 0, never NaN)
     */
    public static Double parseNumberValue(Object value) {
        if (value instanceof JsonNode) {
            return parseNode((JsonNode) value);
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof CharSequence) {
            return parseString(value.toString());
        }
        return null;
    }

    public static OptionalDouble parseOptional(Object value) {
        Double d = parseNumberValue(value);
        return d == null ? OptionalDouble.empty() : OptionalDouble.of(d);
    }

    private static Double parseNode(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) {
            double d = node.asDouble();
            return Double.isFinite(d) ? d : null;
        }
        if (node.isTextual()) return parseString(node.asText());
        return null;
    }

    private static Double parseString(String raw) {
        if (raw == null) return null;
        String sanitized = NON_NUMERIC.matcher(raw).replaceAll("");
        sanitized = DOT_GROUPING.matcher(sanitized).replaceAll("");
        sanitized = COMMA_GROUPING.matcher(sanitized).replaceAll("");
        sanitized = sanitized.replaceFirst(",", ".");

        Matcher m = NUMBER.matcher(sanitized);
        if (!m.find()) return null;
        try {
            double d = Double.parseDouble(m.group());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
