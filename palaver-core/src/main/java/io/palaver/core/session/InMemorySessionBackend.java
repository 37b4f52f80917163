package io.palaver.core.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySessionBackend implements SessionBackend {
    private final Map<String, Entry> documents = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionBackend() {
        this(Clock.systemUTC());
    }

    public InMemorySessionBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> read(String sessionId) {
        return live(sessionId).map(Entry::document);
    }

    @Override
    public void write(String sessionId, String document, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        documents.put(sessionId, new Entry(document, expiresAt));
    }

    @Override
    public void remove(String sessionId) {
        documents.remove(sessionId);
    }

    @Override
    public boolean exists(String sessionId) {
        return live(sessionId).isPresent();
    }

    public int size() {
        documents.keySet().forEach(this::live);
        return documents.size();
    }

    private Optional<Entry> live(String sessionId) {
        Entry entry = documents.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            documents.remove(sessionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry(String document, Instant expiresAt) {
    }
}
