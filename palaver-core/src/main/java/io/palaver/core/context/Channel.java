package io.palaver.core.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Channel {
    /** Plain text transports such as USSD: numbered choices, media as text. */
    TEXT,
    /** Chat transports with buttons, lists and media messages. */
    INTERACTIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Channel fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        return Channel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
