package io.concourse.driver.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.concourse.driver.Link;
import io.concourse.driver.Tag;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link ValueCodec} that writes stored values as typed JSON objects, {@code {"type":"LONG","data":42}}.
 *
 * <p>
 * Supported types are {@code BOOLEAN}, {@code INTEGER}, {@code LONG}, {@code FLOAT}, {@code DOUBLE}, {@code STRING},
 * {@code TAG} and {@code LINK}. Any other Java object is sent as the {@code STRING} of its {@code toString()}.
 * Decoding walks whole results: typed objects become native values, other objects become maps (numeric field names
 * turn into {@link Long} record ids or timestamps), arrays become lists. An object whose {@code data} does not fit its
 * {@code type} is not a typed value and decodes as a map.
 * </p>
 */
public final class JsonValueCodec implements ValueCodec {

    static final String TYPE = "type";
    static final String DATA = "data";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern INTEGRAL = Pattern.compile("-?\\d{1,19}");

    enum WireType {
        BOOLEAN,
        INTEGER,
        LONG,
        FLOAT,
        DOUBLE,
        STRING,
        TAG,
        LINK;

        static WireType forName(String name) {
            for (WireType type : values()) {
                if (type.name().equals(name)) {
                    return type;
                }
            }
            return null;
        }

        boolean accepts(JsonNode data) {
            switch (this) {
                case BOOLEAN:
                    return data.isBoolean();
                case INTEGER:
                case LONG:
                case LINK:
                    return data.isIntegralNumber();
                case FLOAT:
                case DOUBLE:
                    return data.isNumber();
                default:
                    return data.isTextual();
            }
        }
    }

    @Override
    public JsonNode encode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        ObjectNode node = NODES.objectNode();
        if (value instanceof Boolean) {
            node.put(TYPE, WireType.BOOLEAN.name()).put(DATA, (Boolean) value);
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            node.put(TYPE, WireType.INTEGER.name()).put(DATA, ((Number) value).intValue());
        } else if (value instanceof Long) {
            node.put(TYPE, WireType.LONG.name()).put(DATA, (Long) value);
        } else if (value instanceof Float) {
            node.put(TYPE, WireType.FLOAT.name()).put(DATA, (Float) value);
        } else if (value instanceof Double) {
            node.put(TYPE, WireType.DOUBLE.name()).put(DATA, (Double) value);
        } else if (value instanceof Tag) {
            node.put(TYPE, WireType.TAG.name()).put(DATA, ((Tag) value).value());
        } else if (value instanceof Link) {
            node.put(TYPE, WireType.LINK.name()).put(DATA, ((Link) value).record());
        } else {
            node.put(TYPE, WireType.STRING.name()).put(DATA, value.toString());
        }
        return node;
    }

    @Override
    public Object decode(JsonNode wire) {
        if (wire == null || wire.isNull() || wire.isMissingNode()) {
            return null;
        }
        if (wire.isObject()) {
            WireType type = typeOf(wire);
            if (type != null) {
                return decodeTyped(type, wire.get(DATA));
            }
            Map<Object, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = wire.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(decodeKey(field.getKey()), decode(field.getValue()));
            }
            return map;
        }
        if (wire.isArray()) {
            List<Object> items = new ArrayList<>(wire.size());
            for (JsonNode item : wire) {
                items.add(decode(item));
            }
            return items;
        }
        if (wire.isBoolean()) {
            return wire.booleanValue();
        }
        if (wire.isIntegralNumber()) {
            return wire.canConvertToLong() ? (Object) wire.longValue() : wire.bigIntegerValue();
        }
        if (wire.isNumber()) {
            return wire.doubleValue();
        }
        return wire.asText();
    }

    /**
     * A result object is a typed value only when it has exactly a {@code type} naming a wire type and a {@code data}
     * of the matching JSON kind. Map results never qualify: their entries are typed values, arrays or maps, so a
     * stored key named {@code type} holds an object, not a bare string.
     */
    private static WireType typeOf(JsonNode node) {
        if (node.size() != 2) {
            return null;
        }
        JsonNode type = node.get(TYPE);
        JsonNode data = node.get(DATA);
        if (type == null || data == null || !type.isTextual()) {
            return null;
        }
        WireType wireType = WireType.forName(type.textValue());
        return wireType != null && wireType.accepts(data) ? wireType : null;
    }

    private static Object decodeTyped(WireType type, JsonNode data) {
        switch (type) {
            case BOOLEAN:
                return data.asBoolean();
            case INTEGER:
                return data.asInt();
            case LONG:
                return data.asLong();
            case FLOAT:
                return (float) data.asDouble();
            case DOUBLE:
                return data.asDouble();
            case TAG:
                return new Tag(data.asText());
            case LINK:
                return new Link(data.asLong());
            default:
                return data.asText();
        }
    }

    private static Object decodeKey(String key) {
        if (INTEGRAL.matcher(key).matches()) {
            try {
                return Long.parseLong(key);
            } catch (NumberFormatException ex) {
                return key;
            }
        }
        return key;
    }
}
