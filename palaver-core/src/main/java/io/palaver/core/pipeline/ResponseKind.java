package io.palaver.core.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ResponseKind {
    /** More input is needed; the session stays open. */
    PROMPT,
    /** The conversation is over. */
    TERMINAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseKind fromWire(String raw) {
        return ResponseKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
