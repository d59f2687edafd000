package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Objects;

/**
 * Correlation id of a request: a string or a number. {@code "1"} and {@code 1} are different ids;
 * {@code 1} and {@code 1.0} are the same one.
 */
public final class RequestId {

    private static final double MAX_SAFE_INTEGER = 9007199254740991d;

    private final Object value;

    private RequestId(Object value) {
        this.value = value;
    }

    public static RequestId of(String value) {
        return new RequestId(Objects.requireNonNull(value, "value"));
    }

    public static RequestId of(long value) {
        return new RequestId(value);
    }

    /**
     * Reads an id from its JSON form.
     *
     * @return the id, or {@code null} for a missing or JSON {@code null} id
     * @throws IllegalArgumentException when the node is neither a string nor a number
     */
    public static RequestId fromJson(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new RequestId(node.textValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new RequestId(node.longValue());
        }
        if (node.isNumber() && Double.isFinite(node.doubleValue())) {
            double number = node.doubleValue();
            // 1.0 and 1 name the same JSON number
            if (number == Math.rint(number) && Math.abs(number) <= MAX_SAFE_INTEGER) {
                return new RequestId((long) number);
            }
            return new RequestId(number);
        }
        throw new IllegalArgumentException("Invalid request id");
    }

    public JsonNode toJson() {
        if (value instanceof String text) {
            return TextNode.valueOf(text);
        }
        if (value instanceof Long number) {
            return LongNode.valueOf(number);
        }
        return DoubleNode.valueOf((Double) value);
    }

    public boolean isNumeric() {
        return !(value instanceof String);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof RequestId id && value.equals(id.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
