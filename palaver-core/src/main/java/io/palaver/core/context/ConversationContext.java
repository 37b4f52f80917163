package io.palaver.core.context;

import io.palaver.core.session.SessionStore;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-turn state shared by the pipeline stages. Created by the transport, filled in by the session
 * stage and consumed by the executor; never persisted.
 */
public final class ConversationContext {
    private final String flowName;
    private final String requestId;
    private final Channel channel;
    private final Map<String, Object> attributes;
    private PlatformMetadata metadata;
    private String input;
    private String sessionId;
    private SessionStore session;

    public ConversationContext(String flowName, String requestId, String input, Channel channel, PlatformMetadata metadata) {
        this.flowName = Objects.requireNonNull(flowName, "flowName must not be null");
        this.requestId = requestId;
        this.input = input;
        this.channel = channel == null ? Channel.TEXT : channel;
        this.metadata = metadata == null ? PlatformMetadata.empty() : metadata;
        this.attributes = new LinkedHashMap<>();
    }

    public static ConversationContext from(InboundTurn turn) {
        return new ConversationContext(turn.flow(), turn.requestId(), turn.input(), turn.channel(), turn.metadata());
    }

    public String flowName() {
        return flowName;
    }

    public String requestId() {
        return requestId;
    }

    public Channel channel() {
        return channel;
    }

    public String input() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    /**
     * Returns the raw input and clears it; input is single-use within a replay.
     */
    public String consumeInput() {
        String value = input;
        input = null;
        return value;
    }

    public PlatformMetadata metadata() {
        return metadata;
    }

    public void setMetadata(PlatformMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionStore session() {
        if (session == null) {
            throw new IllegalStateException("session has not been loaded for this turn");
        }
        return session;
    }

    public boolean hasSession() {
        return session != null;
    }

    public void attachSession(String sessionId, SessionStore session) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public void putAttribute(String key, Object value) {
        attributes.put(key, value);
    }
}
