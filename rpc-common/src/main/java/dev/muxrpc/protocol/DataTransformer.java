package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts application values to and from their wire form. Applied to request inputs, response
 * data and error shapes; the envelope itself is never transformed.
 */
public interface DataTransformer {

    /**
     * @return the wire form; a {@code MissingNode} for {@code null}, which is left out of the envelope
     */
    JsonNode serialize(Object value);

    /**
     * @return the decoded value, or {@code null} for a missing or JSON {@code null} node
     * @throws IllegalArgumentException when the node cannot be converted to {@code type}
     */
    <T> T deserialize(JsonNode value, Class<T> type);
}
