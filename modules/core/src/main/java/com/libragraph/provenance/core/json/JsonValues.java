package com.libragraph.provenance.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.libragraph.provenance.core.hash.UnhashableTypeException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Jackson trees into plain Java values that
 * {@link com.libragraph.provenance.core.hash.CanonicalHasher} understands.
 *
 * <p>JSON objects become unordered mappings: two documents that differ only
 * in member order hash identically.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * @throws UnhashableTypeException for POJO nodes
     */
    public static Object toHashable(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return switch (node.getNodeType()) {
            case OBJECT -> {
                Map<String, Object> members = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    members.put(field.getKey(), toHashable(field.getValue()));
                }
                yield members;
            }
            case ARRAY -> {
                List<Object> elements = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    elements.add(toHashable(element));
                }
                yield elements;
            }
            case STRING -> node.textValue();
            case BOOLEAN -> node.booleanValue();
            case NUMBER -> number(node);
            case BINARY -> ((BinaryNode) node).binaryValue();
            default -> throw new UnhashableTypeException(node.getClass());
        };
    }

    private static Object number(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.isBigInteger() ? node.bigIntegerValue() : (Object) node.longValue();
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        return node.doubleValue();
    }
}
