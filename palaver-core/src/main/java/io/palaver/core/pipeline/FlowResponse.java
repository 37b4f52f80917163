package io.palaver.core.pipeline;

import io.palaver.core.signal.Media;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record FlowResponse(ResponseKind kind, String message, Map<String, String> choices, Media media) {

    public FlowResponse {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
        choices = choices == null || choices.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
    }

    public static FlowResponse prompt(String message, Map<String, String> choices, Media media) {
        return new FlowResponse(ResponseKind.PROMPT, message, choices, media);
    }

    public static FlowResponse terminal(String message, Media media) {
        return new FlowResponse(ResponseKind.TERMINAL, message, Map.of(), media);
    }

    public boolean isTerminal() {
        return kind == ResponseKind.TERMINAL;
    }
}
