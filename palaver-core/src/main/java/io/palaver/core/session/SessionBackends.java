package io.palaver.core.session;

import io.palaver.core.config.ConfigPaths;
import io.palaver.core.config.model.SessionConfig;
import java.io.IOException;
import java.util.Locale;

public final class SessionBackends {

    private SessionBackends() {
    }

    public static SessionBackend fromConfig(SessionConfig config) throws IOException {
        String backend = config.backend() == null ? "memory" : config.backend().trim().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "memory" -> new InMemorySessionBackend();
            case "cache" -> new CacheSessionBackend(config.maximumSize() > 0 ? config.maximumSize() : 100_000);
            case "sqlite" -> new SqliteSessionBackend(ConfigPaths.resolve(config.sqlitePath()));
            default -> throw new IllegalArgumentException("Unknown session backend: " + config.backend());
        };
    }
}
