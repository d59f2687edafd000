package dev.muxrpc.server;

import dev.muxrpc.server.config.ServerProperties;
import dev.muxrpc.server.demo.DemoContext;
import dev.muxrpc.server.transport.TcpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(ServerProperties.class)
public class MuxRpcServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(MuxRpcServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MuxRpcServerApplication.class, args);
    }

    @Bean
    ErrorObserver<DemoContext> loggingErrorObserver() {
        return event -> LOGGER.warn("{} {} failed on {}: {} {}", event.kindName(), event.path(),
            event.context() != null ? event.context().connectionId() : "-",
            event.error().code(), event.error().getMessage());
    }

    @Bean
    ResponderFactory<DemoContext> responderFactory(OperationRegistry<DemoContext> registry,
                                                   ContextFactory<DemoContext> contextFactory,
                                                   ErrorObserver<DemoContext> errorObserver) {
        return ResponderFactory.builder(registry)
            .contextFactory(contextFactory)
            .errorObserver(errorObserver)
            .build();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    TcpServer tcpServer(ResponderFactory<DemoContext> responderFactory, ServerProperties properties) {
        ServerProperties.Tcp tcp = properties.getTcp();
        LOGGER.info("Serving procedures over TCP port {}", tcp.getPort());
        return new TcpServer(responderFactory, tcp.getPort(), tcp.getMaxFrameLength());
    }
}
