package dev.muxrpc.server;

import dev.muxrpc.protocol.DataTransformer;
import dev.muxrpc.protocol.EnvelopeCodec;
import dev.muxrpc.transport.Transport;
import java.util.Objects;

/**
 * Shared responder settings. Every {@link #attach(Transport)} creates a fresh
 * {@link ResponderEngine} with its own subscription registry and event loop.
 *
 * @param <C> context type
 */
public final class ResponderFactory<C> {

    private final OperationRegistry<C> registry;
    private final ContextFactory<C> contextFactory;
    private final ErrorObserver<C> errorObserver;
    private final DataTransformer transformer;
    private final EnvelopeCodec codec;

    private ResponderFactory(Builder<C> builder) {
        this.registry = builder.registry;
        this.contextFactory = builder.contextFactory;
        this.errorObserver = builder.errorObserver;
        this.transformer = builder.transformer;
        this.codec = builder.codec;
    }

    public static <C> Builder<C> builder(OperationRegistry<C> registry) {
        return new Builder<>(registry);
    }

    public ResponderEngine<C> attach(Transport transport) {
        return ResponderEngine.builder(transport, registry)
            .contextFactory(contextFactory)
            .errorObserver(errorObserver)
            .transformer(transformer)
            .codec(codec)
            .build();
    }

    public static final class Builder<C> {

        private final OperationRegistry<C> registry;
        private ContextFactory<C> contextFactory;
        private ErrorObserver<C> errorObserver;
        private DataTransformer transformer;
        private EnvelopeCodec codec;

        private Builder(OperationRegistry<C> registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder<C> contextFactory(ContextFactory<C> contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        public Builder<C> errorObserver(ErrorObserver<C> errorObserver) {
            this.errorObserver = errorObserver;
            return this;
        }

        public Builder<C> transformer(DataTransformer transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder<C> codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public ResponderFactory<C> build() {
            return new ResponderFactory<>(this);
        }
    }
}
