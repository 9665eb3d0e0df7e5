package com.example.OfferScan.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * Folds per-segment AI results into one object.
 * <p>
 * Null values are skipped, arrays are unioned (structurally equal items kept once), objects are
 * merged field by field. Anything else only fills a slot that is absent, null, empty or "missing".
 * Neither input is modified.
 */
public final class ExtractionMerger {
    private ExtractionMerger() {}

    public static ObjectNode merge(JsonNode base, JsonNode addition) {
        ObjectNode result = base != null && base.isObject()
                ? ((ObjectNode) base).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        if (addition == null || !addition.isObject()) return result;

        Deque<Pair> work = new ArrayDeque<>();
        work.push(new Pair(result, (ObjectNode) addition));

        while (!work.isEmpty()) {
            Pair p = work.pop();
            Iterator<Map.Entry<String, JsonNode>> fields = p.addition().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                String key = f.getKey();
                JsonNode value = f.getValue();
                if (value == null || value.isNull() || value.isMissingNode()) continue;

                JsonNode existing = p.target().get(key);

                if (value.isArray()) {
                    ArrayNode combined;
                    if (existing != null && existing.isArray()) {
                        combined = (ArrayNode) existing;
                    } else if (isEmptySlot(existing)) {
                        combined = p.target().putArray(key);
                    } else {
                        continue;
                    }
                    for (JsonNode item : value) {
                        if (!contains(combined, item)) combined.add(item.deepCopy());
                    }
                } else if (value.isObject()) {
                    ObjectNode nested;
                    if (existing != null && existing.isObject()) {
                        nested = (ObjectNode) existing;
                    } else if (isEmptySlot(existing)) {
                        nested = p.target().putObject(key);
                    } else {
                        continue;
                    }
                    work.push(new Pair(nested, (ObjectNode) value));
                } else if (isEmptySlot(existing)) {
                    p.target().set(key, value.deepCopy());
                }
            }
        }
        return result;
    }

    private static boolean contains(ArrayNode array, JsonNode item) {
        for (JsonNode n : array) {
            if (n.equals(item)) return true;
        }
        return false;
    }

    private static boolean isEmptySlot(JsonNode existing) {
        if (existing == null || existing.isNull() || existing.isMissingNode()) return true;
        if (!existing.isTextual()) return false;
        String s = existing.asText();
        return s.isEmpty() || "missing".equals(s);
    }

    private record Pair(ObjectNode target, ObjectNode addition) {
    }
}
