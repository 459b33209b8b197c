package com.haic.analytics.window;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.haic.analytics.error.InvalidWindowException;
import com.haic.analytics.util.JsonSupport;

import java.util.Locale;

/**
 * Requested evaluation window: {@code {basis: relative|absolute, start?, end?, last?}}.
 *
 * <p>Only the basis is checked here; combinations of start/end/last are checked by
 * {@link WindowResolver}. The verbatim request is kept for the window summary.</p>
 */
public final class WindowSpec {
    public enum Basis {
        RELATIVE,
        ABSOLUTE;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Basis fromWire(JsonNode node) {
            if (node != null && node.isTextual()) {
                String raw = node.asText();
                if ("relative".equals(raw)) {
                    return RELATIVE;
                }
                if ("absolute".equals(raw)) {
                    return ABSOLUTE;
                }
            }
            throw new InvalidWindowException("invalid_basis", "window['basis'] must be 'relative' or 'absolute'");
        }
    }

    private final Basis basis;
    private final ObjectNode requested;

    private WindowSpec(Basis basis, ObjectNode requested) {
        this.basis = basis;
        this.requested = requested;
    }

    public static WindowSpec fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidWindowException("window_not_object", "window must be a JSON object");
        }
        Basis basis = Basis.fromWire(node.get("basis"));
        return new WindowSpec(basis, ((ObjectNode) node).deepCopy());
    }

    public static WindowSpec relative(double startS, double endS) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("basis", "relative");
        node.put("start", startS);
        node.put("end", endS);
        return new WindowSpec(Basis.RELATIVE, node);
    }

    public static WindowSpec relativeLast(double lastS) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("basis", "relative");
        node.put("last", lastS);
        return new WindowSpec(Basis.RELATIVE, node);
    }

    /**
     * @param start epoch seconds (a {@link Number}) or an ISO-8601 string
     * @param end epoch seconds (a {@link Number}) or an ISO-8601 string
     */
    public static WindowSpec absolute(Object start, Object end) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("basis", "absolute");
        node.set("start", JsonSupport.toTree(start));
        node.set("end", JsonSupport.toTree(end));
        return new WindowSpec(Basis.ABSOLUTE, node);
    }

    public Basis basis() {
        return basis;
    }

    public boolean has(String key) {
        return requested.has(key);
    }

    public JsonNode get(String key) {
        return requested.path(key);
    }

    /**
     * Defensive copy of the verbatim request.
     */
    public ObjectNode requested() {
        return requested.deepCopy();
    }

    @Override
    public String toString() {
        return requested.toString();
    }
}
