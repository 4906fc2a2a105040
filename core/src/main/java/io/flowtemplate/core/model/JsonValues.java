package io.flowtemplate.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowtemplate.core.error.DataFormatException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson trees and {@link Value}s.
 *
 * <p>
 * Integral JSON numbers that fit in a {@code long} become integers, every other number becomes a
 * float. Missing nodes map to null. In the other direction, NaN and the infinities have no JSON
 * form and are written as JSON {@code null}.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {
        // utility class
    }

    /**
     * Parses JSON text into a value.
     *
     * @throws DataFormatException if {@code json} is not well-formed JSON
     */
    public static Value parse(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DataFormatException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Converts a Jackson tree; {@code null}, missing and JSON null nodes all become {@link Value#NULL}. */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.NULL;
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? Value.of(node.longValue()) : Value.of(node.doubleValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return Value.array(items);
        }
        if (node.isObject()) {
            Map<String, Value> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), fromJson(field.getValue()));
            }
            return Value.object(fields);
        }
        // binary and POJO nodes carry no template meaning beyond their text
        return Value.of(node.asText());
    }

    /** Converts a value to a Jackson tree. */
    public static JsonNode toJson(Value value) {
        if (value instanceof Value.BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof Value.IntegerValue i) {
            long v = i.value();
            return v == (int) v ? NODES.numberNode((int) v) : NODES.numberNode(v);
        }
        if (value instanceof Value.FloatValue f) {
            return Double.isFinite(f.value()) ? NODES.numberNode(f.value()) : NODES.nullNode();
        }
        if (value instanceof Value.StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof Value.ArrayValue a) {
            ArrayNode array = NODES.arrayNode(a.items().size());
            a.items().forEach(item -> array.add(toJson(item)));
            return array;
        }
        if (value instanceof Value.ObjectValue o) {
            ObjectNode object = NODES.objectNode();
            o.fields().forEach((k, v) -> object.set(k, toJson(v)));
            return object;
        }
        return NODES.nullNode();
    }
}
