package dev.muxrpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.muxrpc.transport.SocketTransport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        String host = option(arguments, "--host", "localhost");
        int port = Integer.parseInt(option(arguments, "--port", "7071"));
        if (arguments.size() < 2) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);
        String path = arguments.remove(0);
        JsonNode input = arguments.isEmpty() ? null : MAPPER.readTree(arguments.remove(0));

        SocketTransport transport = SocketTransport.connect(host, port);
        ChannelClient client = ChannelClient.builder(transport).build();
        transport.start();
        ChannelLink link = new ChannelLink(client);
        try {
            switch (command) {
                case "query" -> print("QUERY", link.query(path, input, JsonNode.class).block(TIMEOUT));
                case "mutate" -> print("MUTATION", link.mutation(path, input, JsonNode.class).block(TIMEOUT));
                case "subscribe" -> handleSubscribe(link, path, input, arguments);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        } catch (RpcClientException e) {
            String code = e.shape().map(shape -> shape.errorCode().name()).orElse("CLIENT");
            System.err.println("ERROR " + code + ": " + e.getMessage());
        } finally {
            client.close();
        }
    }

    private static void handleSubscribe(ChannelLink link, String path, JsonNode input, List<String> arguments) {
        int count = arguments.isEmpty() ? 10 : Integer.parseInt(arguments.get(0));
        link.subscription(path, input, JsonNode.class)
            .take(count)
            .doOnNext(event -> System.out.println("EVENT " + event))
            .blockLast();
        System.out.println("DONE after " + count + " event(s)");
    }

    private static void print(String label, JsonNode result) {
        System.out.println(label + " " + (result == null ? "(no data)" : result.toString()));
    }

    private static String option(List<String> arguments, String name, String fallback) {
        int index = arguments.indexOf(name);
        if (index < 0) {
            return fallback;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        arguments.remove(index);
        return arguments.remove(index);
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar mux-rpc-client.jar [--host <host>] [--port <port>] <command> <path> [args]\n" +
            "Commands:\n" +
            "  query <path> [json-input]\n" +
            "  mutate <path> [json-input]\n" +
            "  subscribe <path> [json-input] [count]");
    }
}
