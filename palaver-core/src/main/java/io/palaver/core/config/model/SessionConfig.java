package io.palaver.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionConfig(
    String backend,
    long ttlSeconds,
    long maximumSize,
    String sqlitePath,
    String boundary
) {

    public static SessionConfig defaults() {
        return new SessionConfig("memory", 3600, 100_000, "~/.palaver/sessions.db", "request");
    }
}
