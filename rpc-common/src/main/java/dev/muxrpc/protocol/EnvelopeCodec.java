package dev.muxrpc.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes wire envelopes. A frame holds one envelope object or an array of them; each
 * envelope is validated on its own so one malformed member does not spoil the rest of a batch.
 */
public class EnvelopeCodec {

    public static final String JSONRPC_VERSION = "2.0";

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Splits a frame into its envelopes without validating them.
     *
     * @throws RpcException with {@link ErrorCode#PARSE_ERROR} when the frame is not JSON
     */
    public List<JsonNode> readFrame(String frame) {
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new RpcException(ErrorCode.PARSE_ERROR, "Malformed JSON frame", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new RpcException(ErrorCode.PARSE_ERROR, "Empty frame");
        }
        List<JsonNode> envelopes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(envelopes::add);
        } else {
            envelopes.add(root);
        }
        return envelopes;
    }

    /**
     * Validates an envelope received by a responder.
     *
     * @throws RpcException with {@link ErrorCode#PARSE_ERROR} describing the first violation
     */
    public ClientMessage parseClientMessage(JsonNode node) {
        requireObject(node);
        RequestId id = readId(node);
        String jsonrpc = readJsonRpc(node);
        String method = node.path("method").isTextual() ? node.get("method").textValue() : null;
        if (StopMessage.METHOD.equals(method)) {
            return new StopMessage(id, jsonrpc);
        }
        OperationKind kind = OperationKind.fromWireName(method);
        if (kind == null) {
            throw parseError("Invalid procedure type");
        }
        JsonNode params = node.get("params");
        requireObject(params);
        JsonNode path = params.get("path");
        if (path == null || !path.isTextual()) {
            throw parseError("Invalid string");
        }
        return new RequestMessage(id, jsonrpc, kind, path.textValue(), params.path("input"));
    }

    /**
     * Validates an envelope received by a caller. Envelopes with a {@code method} member are
     * unsolicited notices; everything else is a response.
     */
    public ServerMessage parseServerMessage(JsonNode node) {
        requireObject(node);
        RequestId id = readId(node);
        String jsonrpc = readJsonRpc(node);
        JsonNode method = node.get("method");
        if (method != null) {
            if (!method.isTextual()) {
                throw parseError("Invalid string");
            }
            return new ServerNotification(id, jsonrpc, method.textValue());
        }
        JsonNode error = node.get("error");
        if (error != null) {
            return ResponseMessage.error(id, jsonrpc, error);
        }
        JsonNode result = node.get("result");
        requireObject(result);
        ResultType type = ResultType.fromWireName(result.path("type").asText(null));
        if (type == null) {
            throw parseError("Invalid result type");
        }
        return new ResponseMessage(id, jsonrpc, new ResponseResult(type, result.path("data")), null);
    }

    /**
     * Writes queued caller envelopes: a lone envelope as an object, several as an array in order.
     */
    public String writeClientFrame(List<? extends ClientMessage> messages) {
        if (messages.size() == 1) {
            return write(toJson(messages.get(0)));
        }
        ArrayNode batch = mapper.createArrayNode();
        for (ClientMessage message : messages) {
            batch.add(toJson(message));
        }
        return write(batch);
    }

    public String writeServerMessage(ServerMessage message) {
        return write(toJson(message));
    }

    public ObjectNode toJson(ClientMessage message) {
        ObjectNode node = envelope(message.id(), message.jsonrpc());
        if (message instanceof StopMessage) {
            node.put("method", StopMessage.METHOD);
        } else if (message instanceof RequestMessage request) {
            node.put("method", request.method().wireName());
            ObjectNode params = node.putObject("params");
            params.put("path", request.path());
            if (!request.input().isMissingNode()) {
                params.set("input", request.input());
            }
        } else {
            throw new IllegalArgumentException("Unsupported message " + message.getClass().getName());
        }
        return node;
    }

    public ObjectNode toJson(ServerMessage message) {
        ObjectNode node = envelope(message.id(), message.jsonrpc());
        if (message instanceof ServerNotification notification) {
            node.put("method", notification.method());
        } else if (message instanceof ResponseMessage response) {
            if (response.isError()) {
                node.set("error", response.error());
            } else {
                ObjectNode result = node.putObject("result");
                result.put("type", response.result().type().wireName());
                if (!response.result().data().isMissingNode()) {
                    result.set("data", response.result().data());
                }
            }
        } else {
            throw new IllegalArgumentException("Unsupported message " + message.getClass().getName());
        }
        return node;
    }

    private ObjectNode envelope(RequestId id, String jsonrpc) {
        ObjectNode node = mapper.createObjectNode();
        node.set("id", id == null ? NullNode.getInstance() : id.toJson());
        if (jsonrpc != null) {
            node.put("jsonrpc", jsonrpc);
        }
        return node;
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise envelope", e);
        }
    }

    private static RequestId readId(JsonNode node) {
        try {
            return RequestId.fromJson(node.get("id"));
        } catch (IllegalArgumentException e) {
            throw parseError(e.getMessage());
        }
    }

    private static String readJsonRpc(JsonNode node) {
        JsonNode jsonrpc = node.get("jsonrpc");
        if (jsonrpc == null) {
            return null;
        }
        if (!jsonrpc.isTextual() || !JSONRPC_VERSION.equals(jsonrpc.textValue())) {
            throw parseError("Must be JSONRPC 2.0");
        }
        return JSONRPC_VERSION;
    }

    private static void requireObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw parseError("Not an object");
        }
    }

    private static RpcException parseError(String message) {
        return new RpcException(ErrorCode.PARSE_ERROR, message);
    }
}
