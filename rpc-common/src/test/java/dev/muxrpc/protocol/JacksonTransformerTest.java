package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonTransformerTest {

    private final JacksonTransformer transformer = new JacksonTransformer();

    record Greeting(String text, int count) {
    }

    @Test
    void convertsRecordsThroughJson() {
        JsonNode wire = transformer.serialize(new Greeting("hi", 2));

        assertThat(wire.get("text").asText()).isEqualTo("hi");
        assertThat(transformer.deserialize(wire, Greeting.class)).isEqualTo(new Greeting("hi", 2));
    }

    @Test
    void nullBecomesMissingAndBack() {
        JsonNode wire = transformer.serialize(null);

        assertThat(wire.isMissingNode()).isTrue();
        assertThat(transformer.deserialize(wire, String.class)).isNull();
    }

    @Test
    void passesTreesThrough() {
        JsonNode node = TextNode.valueOf("as-is");

        assertThat(transformer.serialize(node)).isSameAs(node);
        assertThat(transformer.deserialize(node, JsonNode.class)).isSameAs(node);
    }

    @Test
    void serializesCollections() {
        JsonNode wire = transformer.serialize(List.of(1, 2, 3));

        assertThat(wire.isArray()).isTrue();
        assertThat(wire.size()).isEqualTo(3);
    }

    @Test
    void reportsUnconvertibleValues() {
        assertThatThrownBy(() -> transformer.deserialize(TextNode.valueOf("nope"), Greeting.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsErrorShape() {
        RpcError shape = RpcError.from(new RpcException(ErrorCode.NOT_FOUND, "missing"), "a.b");

        RpcError decoded = transformer.deserialize(transformer.serialize(shape), RpcError.class);

        assertThat(decoded.message()).isEqualTo("missing");
        assertThat(decoded.errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(decoded.data().path()).isEqualTo("a.b");
        assertThat(decoded.data().httpStatus()).isEqualTo(404);
    }
}
