package io.palaver.core.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class PromptSignal extends FlowSignal {
    private final Map<String, String> choices;
    private final Media media;

    public PromptSignal(String message) {
        this(message, Map.of(), null);
    }

    public PromptSignal(String message, Map<String, String> choices, Media media) {
        super(message == null ? "" : message);
        this.choices = choices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
        this.media = media;
    }

    public Map<String, String> choices() {
        return choices;
    }

    public Media media() {
        return media;
    }
}
