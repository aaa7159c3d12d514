package com.rlang.script.parser.utils;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rlang.script.parser.Environment;
import com.rlang.script.parser.Value;

/**
 * JSON view of an Environment chain, innermost scope first:
 *
 * <pre>
 * { "frames": [ { "depth": 2, "vars": { "i": 1 } }, ..., { "depth": 0, "vars": { ... } } ] }
 * </pre>
 *
 * Numbers, strings, booleans and nil map to their JSON counterparts; functions
 * are written as their display token ({@code "<fn count>"}).
 */
public final class EnvironmentJson {

    private static final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private EnvironmentJson() {}

    public static ObjectNode toJson(Environment env) {
        ObjectNode root = om.createObjectNode();
        ArrayNode frames = root.putArray("frames");
        for (Environment e = env; e != null; e = e.parent) {
            ObjectNode frame = frames.addObject();
            frame.put("depth", e.depth());
            ObjectNode vars = frame.putObject("vars");
            for (Map.Entry<String, Value> b : e.snapshot().entrySet()) {
                vars.set(b.getKey(), valueToJson(b.getValue()));
            }
        }
        return root;
    }

    public static String dump(Environment env) {
        try {
            return om.writeValueAsString(toJson(env));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize environment", e);
        }
    }

    public static JsonNode valueToJson(Value v) {
        JsonNodeFactory f = om.getNodeFactory();
        switch (v.getType()) {
            case NUMBER: return f.numberNode(v.asNumber());
            case STRING: return f.textNode(v.asString());
            case BOOL:   return f.booleanNode(v.asBool());
            case FUNC:   return f.textNode(v.display());
            default:     return f.nullNode();
        }
    }
}
