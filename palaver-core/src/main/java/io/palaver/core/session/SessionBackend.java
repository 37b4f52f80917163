package io.palaver.core.session;

import java.time.Duration;
import java.util.Optional;

/**
 * Persists whole session documents (serialized JSON) by session id.
 */
public interface SessionBackend {
    Optional<String> read(String sessionId);

    /**
     * @param ttl time to live of the document; {@code null}, zero or negative means no expiry
     */
    void write(String sessionId, String document, Duration ttl);

    void remove(String sessionId);

    boolean exists(String sessionId);
}
