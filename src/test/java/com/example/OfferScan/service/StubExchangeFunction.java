package com.example.OfferScan.service;

import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Scripted WebClient transport: answers requests in order from a queue, then with the fallback.
 */
final class StubExchangeFunction implements ExchangeFunction {

    private final Queue<Supplier<Mono<ClientResponse>>> script = new ConcurrentLinkedQueue<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private Supplier<Mono<ClientResponse>> fallback;

    StubExchangeFunction json(int status, String body) {
        script.add(() -> Mono.just(jsonResponse(status, body)));
        return this;
    }

    StubExchangeFunction response(Supplier<ClientResponse> response) {
        script.add(() -> Mono.just(response.get()));
        return this;
    }

    StubExchangeFunction bytes(byte[] body) {
        script.add(() -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
                .build()));
        return this;
    }

    StubExchangeFunction otherwiseJson(int status, String body) {
        this.fallback = () -> Mono.just(jsonResponse(status, body));
        return this;
    }

    List<ClientRequest> requests() {
        return requests;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        Supplier<Mono<ClientResponse>> next = script.poll();
        if (next == null) next = fallback;
        if (next == null) {
            return Mono.error(new AssertionError("Unexpected request " + request.method() + " " + request.url()));
        }
        return next.get();
    }

    static ClientResponse jsonResponse(int status, String body) {
        return ClientResponse.create(HttpStatus.valueOf(status))
                .header("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
