package dev.muxrpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.ResponseMessage;
import dev.muxrpc.protocol.ResultType;
import dev.muxrpc.transport.ReadyState;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ManualExecutor loop;
    private ScriptedTransport transport;
    private ChannelClient client;

    @BeforeEach
    void setUp() {
        loop = new ManualExecutor();
        transport = new ScriptedTransport("primary");
        client = ChannelClient.builder(transport).executor(loop).build();
    }

    @Test
    void holdsRequestsUntilTheTransportOpens() throws Exception {
        client.request(query(1, "greeting"), new RecordingObserver());
        loop.runAll();
        assertThat(transport.sent).isEmpty();

        transport.open();
        loop.runAll();

        JsonNode frame = mapper.readTree(transport.lastSent());
        assertThat(frame.isObject()).isTrue();
        assertThat(frame.get("id").asLong()).isEqualTo(1);
        assertThat(frame.get("method").asText()).isEqualTo("query");
        assertThat(frame.get("params").get("path").asText()).isEqualTo("greeting");
    }

    @Test
    void batchesRequestsIssuedInTheSameTurn() throws Exception {
        open();

        client.request(query(1, "a"), new RecordingObserver());
        client.request(subscription(2, "b"), new RecordingObserver());
        client.request(query(3, "c"), new RecordingObserver());
        loop.runAll();

        assertThat(transport.sent).hasSize(1);
        JsonNode frame = mapper.readTree(transport.lastSent());
        assertThat(frame.isArray()).isTrue();
        assertThat(frame.size()).isEqualTo(3);
        assertThat(frame.get(1).get("method").asText()).isEqualTo("subscription");
        assertThat(frame.get(2).get("params").get("path").asText()).isEqualTo("c");
    }

    @Test
    void routesResponsesByRequestId() {
        open();
        RecordingObserver first = new RecordingObserver();
        RecordingObserver second = new RecordingObserver();
        client.request(query(1, "a"), first);
        client.request(query(2, "b"), second);
        loop.runAll();

        transport.receive("[{\"id\":2,\"result\":{\"type\":\"data\",\"data\":\"two\"}},{\"id\":9,\"result\":{\"type\":\"data\"}}]");
        loop.runAll();

        assertThat(first.responses).isEmpty();
        assertThat(second.responses).hasSize(1);
        assertThat(second.responses.get(0).result().data().asText()).isEqualTo("two");
    }

    @Test
    void cancellingSubscriptionSendsStopOnce() throws Exception {
        open();
        RecordingObserver observer = new RecordingObserver();
        Disposable handle = client.request(subscription(5, "ticks"), observer);
        loop.runAll();

        handle.dispose();
        handle.dispose();
        loop.runAll();

        assertThat(handle.isDisposed()).isTrue();
        assertThat(observer.completions).isEqualTo(1);
        assertThat(transport.sent).hasSize(2);
        JsonNode stop = mapper.readTree(transport.lastSent());
        assertThat(stop.get("id").asLong()).isEqualTo(5);
        assertThat(stop.get("method").asText()).isEqualTo("subscription.stop");
        assertThat(pendingIds()).isEmpty();
    }

    @Test
    void cancellingBeforeFlushDropsTheQueuedRequest() {
        open();
        RecordingObserver observer = new RecordingObserver();

        Disposable handle = client.request(query(1, "slow"), observer);
        handle.dispose();
        loop.runAll();

        assertThat(transport.sent).isEmpty();
        assertThat(observer.completions).isEqualTo(1);
    }

    @Test
    void stoppedResponseCompletesTheRequest() {
        open();
        RecordingObserver observer = new RecordingObserver();
        client.request(subscription(3, "ticks"), observer);
        loop.runAll();

        transport.receive("{\"id\":3,\"result\":{\"type\":\"started\"}}");
        transport.receive("{\"id\":3,\"result\":{\"type\":\"stopped\"}}");
        loop.runAll();

        assertThat(observer.responses).extracting(response -> response.result().type())
            .containsExactly(ResultType.STARTED, ResultType.STOPPED);
        assertThat(observer.completions).isEqualTo(1);
        assertThat(pendingIds()).isEmpty();
    }

    @Test
    void droppedConnectionFailsPendingRequests() {
        open();
        RecordingObserver observer = new RecordingObserver();
        client.request(query(1, "a"), observer);
        loop.runAll();

        transport.dropConnection();
        loop.runAll();

        assertThat(observer.errors).hasSize(1);
        assertThat(observer.errors.get(0)).isInstanceOf(ChannelClosedException.class)
            .hasMessage("Channel closed prematurely");
        assertThat(observer.completions).isZero();
    }

    @Test
    void requestOnClosedTransportFailsImmediately() {
        open();
        transport.dropConnection();
        loop.runAll();
        RecordingObserver observer = new RecordingObserver();

        client.request(query(1, "late"), observer);
        loop.runAll();

        assertThat(observer.errors).singleElement().isInstanceOf(ChannelClosedException.class);
        assertThat(transport.sent).isEmpty();
    }

    @Test
    void closingWaitsForPendingRequestsThenClosesTransport() throws Exception {
        open();
        RecordingObserver observer = new RecordingObserver();
        Disposable handle = client.request(subscription(1, "ticks"), observer);
        loop.runAll();

        client.close();
        loop.runAll();
        assertThat(transport.readyState()).isEqualTo(ReadyState.OPEN);

        handle.dispose();
        loop.runAll();

        assertThat(mapper.readTree(transport.lastSent()).get("method").asText()).isEqualTo("subscription.stop");
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
        assertThat(observer.completions).isEqualTo(1);
        assertThat(observer.errors).isEmpty();
    }

    @Test
    void closedClientCompletesRequestsWhenTransportGoesAway() {
        open();
        RecordingObserver observer = new RecordingObserver();
        client.request(query(1, "a"), observer);
        loop.runAll();

        client.close();
        transport.dropConnection();
        loop.runAll();

        assertThat(observer.completions).isEqualTo(1);
        assertThat(observer.errors).isEmpty();
    }

    @Test
    void closeBeforeOpenKeepsTheClientClosed() {
        client.close();
        loop.runAll();

        assertThat(transport.closeCalls).isEqualTo(1);
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
    }

    @Test
    void reconnectNoticeClosesIdleTransport() {
        open();

        transport.receive("{\"id\":null,\"jsonrpc\":\"2.0\",\"method\":\"reconnect\"}");
        loop.runAll();

        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
    }

    @Test
    void reconnectNoticeWaitsForPendingRequests() {
        open();
        RecordingObserver observer = new RecordingObserver();
        Disposable handle = client.request(query(1, "a"), observer);
        loop.runAll();

        transport.receive("{\"id\":null,\"method\":\"reconnect\"}");
        loop.runAll();
        assertThat(transport.readyState()).isEqualTo(ReadyState.OPEN);

        transport.receive("{\"id\":1,\"result\":{\"type\":\"data\",\"data\":1}}");
        loop.runAll();
        assertThat(observer.responses).hasSize(1);
        assertThat(transport.readyState()).isEqualTo(ReadyState.OPEN);

        handle.dispose();
        loop.runAll();

        assertThat(transport.closeCalls).isEqualTo(1);
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
        assertThat(observer.errors).isEmpty();
    }

    @Test
    void reconnectNoticeClosesTransportOnceSubscriptionStops() {
        open();
        RecordingObserver observer = new RecordingObserver();
        client.request(subscription(4, "ticks"), observer);
        loop.runAll();
        transport.receive("{\"id\":4,\"result\":{\"type\":\"started\"}}");
        transport.receive("{\"id\":null,\"method\":\"reconnect\"}");
        loop.runAll();
        assertThat(transport.readyState()).isEqualTo(ReadyState.OPEN);

        transport.receive("{\"id\":4,\"result\":{\"type\":\"stopped\"}}");
        loop.runAll();

        assertThat(observer.completions).isEqualTo(1);
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
    }

    @Test
    void ownedLoopStopsWhenClosedAfterTheConnectionDropped() throws Exception {
        ScriptedTransport dropped = new ScriptedTransport("dropped");
        ChannelClient owned = ChannelClient.builder(dropped).build();
        dropped.open();
        dropped.dropConnection();

        CompletableFuture<Thread> loopThread = new CompletableFuture<>();
        owned.request(query(1, "a"), new ResponseObserver() {
            @Override
            public void next(ResponseMessage message) {
            }

            @Override
            public void error(RpcClientException error) {
                loopThread.complete(Thread.currentThread());
            }

            @Override
            public void complete() {
            }
        });
        Thread thread = loopThread.get(5, TimeUnit.SECONDS);
        assertThat(thread.isAlive()).isTrue();

        owned.close();
        thread.join(5000);

        assertThat(thread.isAlive()).isFalse();
    }

    @Test
    void malformedFramesAreDropped() {
        open();
        RecordingObserver observer = new RecordingObserver();
        client.request(query(1, "a"), observer);
        loop.runAll();

        transport.receive("not json");
        transport.receive("[{\"id\":1,\"result\":{\"type\":\"bogus\"}},{\"id\":1,\"result\":{\"type\":\"data\",\"data\":\"ok\"}}]");
        loop.runAll();

        assertThat(observer.responses).singleElement()
            .satisfies(response -> assertThat(response.result().data().asText()).isEqualTo("ok"));
        assertThat(observer.errors).isEmpty();
    }

    @Test
    void switchingTransportRebindsRequestsWhenTheyAnswerOnTheReplacement() throws Exception {
        open();
        RecordingObserver old = new RecordingObserver();
        client.request(subscription(1, "ticks"), old);
        loop.runAll();

        ScriptedTransport replacement = new ScriptedTransport("replacement");
        replacement.open();
        client.switchTransport(replacement);
        loop.runAll();
        assertThat(client.getConnection()).isSameAs(replacement);
        assertThat(transport.readyState()).isEqualTo(ReadyState.OPEN);

        client.request(query(2, "fresh"), new RecordingObserver());
        loop.runAll();
        assertThat(mapper.readTree(replacement.lastSent()).get("id").asLong()).isEqualTo(2);

        replacement.receive("{\"id\":1,\"result\":{\"type\":\"data\",\"data\":\"moved\"}}");
        loop.runAll();

        assertThat(old.responses).hasSize(1);
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
        assertThat(old.errors).isEmpty();
        assertThat(pendingIds()).contains(RequestId.of(1), RequestId.of(2));
    }

    @Test
    void switchingAwayFromIdleTransportClosesIt() {
        open();
        ScriptedTransport replacement = new ScriptedTransport("replacement");

        client.switchTransport(replacement);
        loop.runAll();

        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
        client.request(query(1, "queued"), new RecordingObserver());
        loop.runAll();
        assertThat(replacement.sent).isEmpty();

        replacement.open();
        loop.runAll();
        assertThat(replacement.sent).hasSize(1);
    }

    private void open() {
        transport.open();
        loop.runAll();
    }

    private Set<RequestId> pendingIds() {
        CompletableFuture<Set<RequestId>> ids = client.pendingRequestIds();
        loop.runAll();
        return ids.join();
    }

    private static Operation query(long id, String path) {
        return new Operation(RequestId.of(id), OperationKind.QUERY, path, TextNode.valueOf("in"));
    }

    private static Operation subscription(long id, String path) {
        return new Operation(RequestId.of(id), OperationKind.SUBSCRIPTION, path, null);
    }
}
