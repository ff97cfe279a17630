package io.contractdb.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.TypeSignature;
import io.contractdb.core.value.Value;

import java.math.BigInteger;
import java.util.Base64;
import java.util.Iterator;
import java.util.Locale;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson tree form of values and type signatures, used by snapshots and the
 * RocksDB schema column family.
 *
 * Values:  {"type":"int","value":"42"}, {"type":"tuple","fields":{"owner":{...}}}
 * Types:   {"type":"buffer","maxLength":32}, {"type":"tuple","fields":{"owner":{"type":"principal"}}}
 */
public final class JsonCodec {
    private JsonCodec() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode valueToJson(Value value) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", kindName(value.kind()));
        switch (value.kind()) {
            case VOID:
                break;
            case BOOL:
                node.put("value", value.asBool());
                break;
            case INT:
                // string keeps full 128-bit precision
                node.put("value", value.asInt().toString());
                break;
            case PRINCIPAL:
                node.put("value", value.asPrincipal());
                break;
            case BUFFER:
                node.put("value", Base64.getEncoder().encodeToString(value.asBuffer()));
                break;
            case TUPLE: {
                ObjectNode fields = node.putObject("fields");
                for (Map.Entry<String, Value> e : value.asTuple().entrySet()) {
                    fields.set(e.getKey(), valueToJson(e.getValue()));
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled kind " + value.kind());
        }
        return node;
    }

    public static Value valueFromJson(JsonNode node) {
        String type = requireText(node, "type");
        switch (type) {
            case "void":
                return Value.voidValue();
            case "bool":
                return Value.bool(requireBoolean(node, "value"));
            case "int":
                return Value.integer(new BigInteger(requireText(node, "value")));
            case "principal":
                return Value.principal(requireText(node, "value"));
            case "buffer":
                return Value.buffer(Base64.getDecoder().decode(requireText(node, "value")));
            case "tuple": {
                Map<String, Value> fields = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = require(node, "fields").fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    fields.put(e.getKey(), valueFromJson(e.getValue()));
                }
                return Value.tuple(fields);
            }
            default:
                throw new IllegalArgumentException("Unknown value type: " + type);
        }
    }

    public static ObjectNode typeToJson(TypeSignature type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", kindName(type.kind()));
        if (type.kind() == Value.Kind.BUFFER) {
            node.put("maxLength", type.maxLength());
        } else if (type.kind() == Value.Kind.TUPLE) {
            node.set("fields", tupleTypeToJson(type.tupleType()).get("fields"));
        }
        return node;
    }

    public static ObjectNode tupleTypeToJson(TupleTypeSignature tuple) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "tuple");
        ObjectNode fields = node.putObject("fields");
        for (Map.Entry<String, TypeSignature> e : tuple.fields().entrySet()) {
            fields.set(e.getKey(), typeToJson(e.getValue()));
        }
        return node;
    }

    public static TypeSignature typeFromJson(JsonNode node) {
        String type = requireText(node, "type");
        switch (type) {
            case "void": return TypeSignature.VOID;
            case "bool": return TypeSignature.BOOL;
            case "int": return TypeSignature.INT;
            case "principal": return TypeSignature.PRINCIPAL;
            case "buffer": return TypeSignature.buffer(require(node, "maxLength").asInt());
            case "tuple": return TypeSignature.tuple(tupleTypeFromJson(node));
            default:
                throw new IllegalArgumentException("Unknown type: " + type);
        }
    }

    public static TupleTypeSignature tupleTypeFromJson(JsonNode node) {
        if (!"tuple".equals(requireText(node, "type"))) {
            throw new IllegalArgumentException("Expected tuple type but got " + node.get("type"));
        }
        TupleTypeSignature.Builder b = TupleTypeSignature.builder();
        Iterator<Map.Entry<String, JsonNode>> it = require(node, "fields").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            b.field(e.getKey(), typeFromJson(e.getValue()));
        }
        return b.build();
    }

    private static String kindName(Value.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return v;
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode v = require(node, field);
        if (!v.isBoolean()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a boolean");
        }
        return v.booleanValue();
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = require(node, field);
        if (!v.isTextual()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return v.asText();
    }
}
