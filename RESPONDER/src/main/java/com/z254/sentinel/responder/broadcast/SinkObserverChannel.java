package com.z254.sentinel.responder.broadcast;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Observer channel backed by a Reactor sink. Sends only enqueue; the WebSocket session drains
 * the sink on its own thread.
 * <p>
 * The queue is bounded. Once an observer falls that far behind, sends fail and the broadcaster
 * drops the channel.
 */
public class SinkObserverChannel implements ObserverChannel {

    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final String name;
    private final Sinks.Many<String> sink;

    public SinkObserverChannel(String name) {
        this(name, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize events held for a slow reader; Reactor rounds it up to a power of two
     */
    public SinkObserverChannel(String name, int bufferSize) {
        this.name = name;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(String payload) {
        Sinks.EmitResult result = sink.tryEmitNext(payload);
        if (result.isFailure()) {
            throw new IllegalStateException("Observer " + name + " rejected event: " + result);
        }
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
    }

    public Flux<String> asFlux() {
        return sink.asFlux();
    }
}
