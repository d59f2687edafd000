package dev.muxrpc.server.transport;

import dev.muxrpc.client.ChannelClient;
import dev.muxrpc.client.ChannelLink;
import dev.muxrpc.server.ResponderFactory;
import dev.muxrpc.server.Router;
import dev.muxrpc.transport.ReadyState;
import dev.muxrpc.transport.SocketTransport;
import dev.muxrpc.transport.TransportListener;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TcpServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TcpServer server;
    private SocketTransport transport;
    private ChannelClient client;

    @BeforeEach
    void setUp() throws Exception {
        Router<Void> router = Router.<Void>builder()
            .query("ping", call -> "pong")
            .subscription("numbers", call -> Flux.range(1, 3))
            .build();
        server = new TcpServer(ResponderFactory.builder(router).build(), 0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (transport != null) {
            transport.close();
        }
        server.stop();
    }

    private ChannelLink connect() throws Exception {
        transport = SocketTransport.connect("localhost", server.localPort());
        client = ChannelClient.builder(transport).build();
        transport.start();
        return new ChannelLink(client);
    }

    @Test
    void servesOperationsOverTcp() throws Exception {
        ChannelLink link = connect();

        StepVerifier.create(link.query("ping", null, String.class))
            .expectNext("pong")
            .expectComplete()
            .verify(TIMEOUT);
        StepVerifier.create(link.subscription("numbers", null, Integer.class).take(3))
            .expectNext(1, 2, 3)
            .expectComplete()
            .verify(TIMEOUT);
        assertThat(server.connectionCount()).isEqualTo(1);
    }

    @Test
    void forgetsConnectionsThatClose() throws Exception {
        ChannelLink link = connect();
        StepVerifier.create(link.query("ping", null, String.class))
            .expectNext("pong")
            .expectComplete()
            .verify(TIMEOUT);

        client.close();

        await(() -> server.connectionCount() == 0);
        assertThat(transport.readyState()).isEqualTo(ReadyState.CLOSED);
    }

    @Test
    void stopAsksCallersToReconnect() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        ChannelLink link = connect();
        transport.addListener(new TransportListener() {
            @Override
            public void onMessage(String frame) {
                frames.add(frame);
            }
        });
        StepVerifier.create(link.query("ping", null, String.class))
            .expectNext("pong")
            .expectComplete()
            .verify(TIMEOUT);
        frames.clear();

        server.stop();

        assertThat(frames.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).contains("\"method\":\"reconnect\"");
        await(() -> transport.readyState() == ReadyState.CLOSED);
        assertThat(server.connectionCount()).isZero();
    }

    @Test
    void localPortRequiresStart() {
        TcpServer idle = new TcpServer(ResponderFactory.builder(Router.<Void>builder().build()).build(), 0);

        assertThatThrownBy(idle::localPort).isInstanceOf(IllegalStateException.class);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            assertThat(System.nanoTime()).as("condition met in time").isLessThan(deadline);
            Thread.sleep(10);
        }
    }
}
