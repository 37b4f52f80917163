package io.palaver.core.render;

import io.palaver.core.pipeline.FlowResponse;
import io.palaver.core.signal.Media;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flattens a response into plain text: message, then choice lines, then a media line, separated
 * by blank lines.
 */
public final class TextRenderer {
    private static final String SECTION_SEPARATOR = "\n\n";

    public String render(FlowResponse response) {
        return render(response.message(), response.choices(), response.media());
    }

    public String render(String message, Map<String, String> choices, Media media) {
        List<String> parts = new ArrayList<>(3);
        if (message != null && !message.isEmpty()) {
            parts.add(message);
        }
        if (choices != null && !choices.isEmpty()) {
            parts.add(choices.entrySet().stream()
                .map(choice -> choice.getKey() + ". " + choice.getValue())
                .collect(Collectors.joining("\n")));
        }
        if (media != null) {
            parts.add(media.type().label() + ": " + media.url());
        }
        return String.join(SECTION_SEPARATOR, parts);
    }
}
