package io.palaver.core.session;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Key/value state of one conversation session. A handle is opened per turn and is not shared
 * between threads; different session ids never contend.
 */
public interface SessionStore {
    String id();

    Object get(String key);

    <T> T get(String key, Class<T> type);

    <T> T get(String key, TypeReference<T> type);

    /**
     * Stores a JSON-serializable value and returns it. A {@code null} value deletes the key.
     */
    <T> T set(String key, T value);

    void delete(String key);

    /**
     * Removes every key but keeps the session document.
     */
    void clear();

    /**
     * Removes the session document from the backend.
     */
    void destroy();

    boolean exists();
}
