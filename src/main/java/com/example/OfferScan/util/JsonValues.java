package com.example.OfferScan.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Candidate lookups over untrusted JSON: each helper tries its paths in order and returns the
 * first usable value.
 */
public final class JsonValues {
    private JsonValues() {}

    /** Dotted path lookup ({@code "data.task.task_id"}); returns a missing node when any step is absent. */
    public static JsonNode at(JsonNode root, String dottedPath) {
        if (root == null) return MissingNode.getInstance();
        JsonNode cur = root;
        for (String part : dottedPath.split("\\.")) {
            cur = cur.path(part);
            if (cur.isMissingNode()) return cur;
        }
        return cur;
    }

    public static Optional<String> firstText(JsonNode root, String... paths) {
        for (String p : paths) {
            Optional<String> v = text(at(root, p));
            if (v.isPresent()) return v;
        }
        return Optional.empty();
    }

    /** Non-blank string (numbers are stringified); anything else is empty. */
    public static Optional<String> text(JsonNode node) {
        if (node == null) return Optional.empty();
        if (node.isTextual()) {
            String s = node.asText().trim();
            return s.isEmpty() ? Optional.empty() : Optional.of(s);
        }
        if (node.isNumber()) return Optional.of(node.asText());
        return Optional.empty();
    }

    public static Double firstNumber(JsonNode root, String... paths) {
        for (String p : paths) {
            Double d = NumberValues.parseNumberValue(at(root, p));
            if (d != null) return d;
        }
        return null;
    }

    public static Optional<JsonNode> firstArray(JsonNode root, String... paths) {
        for (String p : paths) {
            JsonNode n = at(root, p);
            if (n.isArray()) return Optional.of(n);
        }
        return Optional.empty();
    }

    public static Optional<JsonNode> firstObject(JsonNode root, String... paths) {
        for (String p : paths) {
            JsonNode n = at(root, p);
            if (n.isObject()) return Optional.of(n);
        }
        return Optional.empty();
    }

    /** Runs extractors in order and returns the first non-empty result. */
    @SafeVarargs
    public static <T> Optional<T> firstOf(JsonNode root, Function<JsonNode, Optional<T>>... extractors) {
        for (Function<JsonNode, Optional<T>> e : extractors) {
            Optional<T> v = e.apply(root);
            if (v.isPresent()) return v;
        }
        return Optional.empty();
    }

    public static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode n : array) {
            if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText().trim());
        }
        return out;
    }

    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }
}
