package com.xmas.script;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import com.xmas.script.parser.Value;

/** JSON form of runtime values: numbers, booleans, strings and nested arrays. */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJsonNode(Value value) {
        switch (value.type) {
            case NUMBER:
                return nodes.numberNode(value.asNumber());
            case BOOL:
                return nodes.booleanNode(value.asBool());
            case STRING:
                return nodes.textNode(value.asString());
            case ARRAY:
                return arrayNode(value.asArray());
            case MATRIX: {
                ArrayNode rows = nodes.arrayNode();
                for (List<Value> row : value.asMatrix()) rows.add(arrayNode(row));
                return rows;
            }
            default:
                throw new IllegalArgumentException("Unsupported value type: " + value.type);
        }
    }

    public static String toJson(Value value) throws JsonProcessingException {
        return om.writeValueAsString(toJsonNode(value));
    }

    private static ArrayNode arrayNode(List<Value> items) {
        ArrayNode array = nodes.arrayNode();
        for (Value item : items) array.add(toJsonNode(item));
        return array;
    }
}
