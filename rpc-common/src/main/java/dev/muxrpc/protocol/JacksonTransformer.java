package dev.muxrpc.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * {@link DataTransformer} that maps values through a Jackson {@link ObjectMapper} and leaves JSON
 * trees untouched.
 */
public class JacksonTransformer implements DataTransformer {

    private final ObjectMapper mapper;

    public JacksonTransformer() {
        this(new ObjectMapper());
    }

    public JacksonTransformer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public JsonNode serialize(Object value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(value);
    }

    @Override
    public <T> T deserialize(JsonNode value, Class<T> type) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return mapper.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert " + value.getNodeType() + " to " + type.getSimpleName(), e);
        }
    }
}
