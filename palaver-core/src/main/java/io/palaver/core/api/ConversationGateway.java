package io.palaver.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.Channel;
import io.palaver.core.engine.ConversationEngine;
import io.palaver.core.pipeline.FlowResponse;
import io.palaver.core.render.InteractiveRenderer;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic JSON transport for the engine: {@code POST /turns} runs one turn, {@code GET /healthz}
 * reports liveness.
 */
public final class ConversationGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationGateway.class);

    private final ConversationEngine engine;
    private final InteractiveRenderer interactiveRenderer;
    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public ConversationGateway(ConversationEngine engine, String host, int port) {
        this(engine, host, port, PromptSettings.defaults());
    }

    public ConversationGateway(ConversationEngine engine, String host, int port, PromptSettings promptSettings) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.interactiveRenderer = new InteractiveRenderer(promptSettings);
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/turns", this::handleTurn);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Conversation gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleTurn(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleTurn(exchange);
                } catch (Exception e) {
                    LOG.error("Turn handling failed", e);
                    exchange.setStatusCode(500);
                    exchange.endExchange();
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        TurnRequest request;
        try {
            request = readBody(exchange);
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        if (request == null || request.flow() == null || request.flow().isBlank()) {
            sendJson(exchange, 400, Map.of("error", "flow is required"));
            return;
        }
        if (!engine.hasFlow(request.flow())) {
            sendJson(exchange, 400, Map.of("error", "unknown flow: " + request.flow()));
            return;
        }

        FlowResponse response;
        try {
            response = engine.process(request.toTurn());
        } catch (RuntimeException e) {
            LOG.error("Turn failed for flow {}", request.flow(), e);
            sendJson(exchange, 500, Map.of("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            return;
        }
        sendJson(exchange, 200, toPayload(request, response));
    }

    private Map<String, Object> toPayload(TurnRequest request, FlowResponse response) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", response.kind());
        payload.put("text", response.message());
        payload.put("choices", response.choices());
        payload.put("media", response.media());
        if (request.channel() == Channel.INTERACTIVE) {
            payload.put("rendered", interactiveRenderer.render(response));
        }
        return payload;
    }

    private TurnRequest readBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return null;
        }
        return mapper.readValue(bytes, TurnRequest.class);
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port, using {}", fallbackPort, e);
        }
        return fallbackPort;
    }
}
