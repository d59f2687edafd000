package dev.muxrpc.server;

import dev.muxrpc.client.ChannelClient;
import dev.muxrpc.client.ChannelClosedException;
import dev.muxrpc.client.ChannelLink;
import dev.muxrpc.client.RpcClientException;
import dev.muxrpc.client.SubscriptionEndedException;
import dev.muxrpc.protocol.ErrorCode;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.RpcError;
import dev.muxrpc.protocol.RpcException;
import dev.muxrpc.transport.LoopbackTransport;
import dev.muxrpc.transport.ReadyState;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class LoopbackRoundTripTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    record Name(String name) {
    }

    private LoopbackTransport.Pair pair;
    private ResponderEngine<String> engine;
    private ChannelClient client;
    private ChannelLink link;

    @BeforeEach
    void setUp() {
        Router<String> router = Router.<String>builder()
            .query("greeting", call -> "hello " + call.requireInput(Name.class).name())
            .query("whoami", OperationCall::context)
            .query("hang", call -> Mono.never())
            .mutation("reject", call -> {
                throw new RpcException(ErrorCode.PRECONDITION_FAILED, "version mismatch");
            })
            .subscription("ticks", call -> Flux.interval(Duration.ofMillis(5)))
            .subscription("countdown", call -> Flux.just(3, 2, 1))
            .build();
        pair = LoopbackTransport.pair();
        engine = ResponderFactory.builder(router)
            .contextFactory(transport -> Mono.just("peer:" + transport.id()))
            .build()
            .attach(pair.right());
        client = ChannelClient.builder(pair.left()).build();
        link = new ChannelLink(client);
        pair.open();
    }

    @AfterEach
    void tearDown() {
        pair.left().close();
    }

    @Test
    void queryRoundTrip() {
        StepVerifier.create(link.query("greeting", new Name("world"), String.class))
            .expectNext("hello world")
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void contextIsBuiltFromTheResponderEnd() {
        StepVerifier.create(link.query("whoami", null, String.class))
            .expectNext("peer:" + pair.right().id())
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void concurrentQueriesAreMatchedById() {
        Flux<String> greetings = Flux.merge(
            link.query("greeting", new Name("a"), String.class),
            link.query("greeting", new Name("b"), String.class),
            link.query("greeting", new Name("c"), String.class));

        StepVerifier.create(greetings.collectList())
            .assertNext(list -> assertThat(list).containsExactlyInAnyOrder("hello a", "hello b", "hello c"))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void responderErrorsKeepTheirCode() {
        StepVerifier.create(link.mutation("reject", Map.of("v", 2), Void.class))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(RpcClientException.class).hasMessage("version mismatch");
                RpcError shape = ((RpcClientException) error).shape().orElseThrow();
                assertThat(shape.errorCode()).isEqualTo(ErrorCode.PRECONDITION_FAILED);
                assertThat(shape.data().path()).isEqualTo("reject");
            })
            .verify(TIMEOUT);
    }

    @Test
    void cancellingASubscriptionStopsItOnTheResponder() throws Exception {
        StepVerifier.create(link.subscription("ticks", null, Long.class).take(3))
            .expectNext(0L, 1L, 2L)
            .expectComplete()
            .verify(TIMEOUT);

        await(() -> activeSubscriptions().isEmpty());
        await(() -> pendingRequests().isEmpty());
    }

    @Test
    void responderEndingAStreamEndsItForTheCaller() {
        StepVerifier.create(link.subscription("countdown", null, Integer.class))
            .expectNext(3, 2, 1)
            .expectError(SubscriptionEndedException.class)
            .verify(TIMEOUT);
    }

    @Test
    void closingTheChannelFailsPendingRequests() {
        StepVerifier.create(link.query("hang", null, String.class))
            .then(() -> await(() -> !pendingRequests().isEmpty()))
            .then(() -> pair.right().close())
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(ChannelClosedException.class)
                .hasMessage("Channel closed prematurely"))
            .verify(TIMEOUT);
    }

    @Test
    void reconnectNoticeClosesAnIdleChannel() {
        StepVerifier.create(link.query("greeting", new Name("idle"), String.class))
            .expectNext("hello idle")
            .expectComplete()
            .verify(TIMEOUT);

        engine.sendReconnectNotification();

        await(() -> pair.left().readyState() == ReadyState.CLOSED);
    }

    private Set<RequestId> activeSubscriptions() {
        return engine.activeSubscriptions().orTimeout(1, TimeUnit.SECONDS).join();
    }

    private Set<RequestId> pendingRequests() {
        return client.pendingRequestIds().orTimeout(1, TimeUnit.SECONDS).join();
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + TIMEOUT);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
