package io.palaver.core.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MediaType {
    IMAGE("Image"),
    DOCUMENT("Document"),
    AUDIO("Audio"),
    VIDEO("Video"),
    STICKER("Sticker");

    private final String label;

    MediaType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MediaType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return IMAGE;
        }
        return MediaType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
