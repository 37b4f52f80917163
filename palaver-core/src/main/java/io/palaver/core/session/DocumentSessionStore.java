package io.palaver.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session handle over a {@link SessionBackend}. The document is read once per handle and every
 * mutation is written through immediately.
 */
public final class DocumentSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentSessionStore.class);

    private final String id;
    private final SessionBackend backend;
    private final SessionCodec codec;
    private final Duration ttl;
    private ObjectNode document;

    public DocumentSessionStore(String id, SessionBackend backend, SessionCodec codec, Duration ttl) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
        this.id = id;
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.ttl = ttl;
    }

    public static SessionStoreFactory factory(SessionBackend backend, Duration ttl) {
        SessionCodec codec = new SessionCodec();
        return sessionId -> new DocumentSessionStore(sessionId, backend, codec, ttl);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Object get(String key) {
        return codec.decode(node(key));
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return codec.decode(node(key), type);
    }

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        return codec.decode(node(key), type);
    }

    @Override
    public <T> T set(String key, T value) {
        requireKey(key);
        if (value == null) {
            delete(key);
            return null;
        }
        JsonNode encoded = codec.encode(value);
        document().set(key, encoded);
        LOG.debug("Session {}: set '{}'", id, key);
        persist();
        return value;
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        if (document().remove(key) != null) {
            LOG.debug("Session {}: deleted '{}'", id, key);
            persist();
        }
    }

    @Override
    public void clear() {
        document().removeAll();
        persist();
    }

    @Override
    public void destroy() {
        LOG.debug("Session {}: destroyed", id);
        document = codec.emptyDocument();
        backend.remove(id);
    }

    @Override
    public boolean exists() {
        return backend.exists(id);
    }

    private JsonNode node(String key) {
        requireKey(key);
        return document().get(key);
    }

    private ObjectNode document() {
        if (document == null) {
            document = backend.read(id).map(codec::read).orElseGet(codec::emptyDocument);
        }
        return document;
    }

    private void persist() {
        backend.write(id, codec.write(document()), ttl);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("session key must not be blank");
        }
    }
}
