package io.palaver.core.render;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.pipeline.FlowResponse;
import io.palaver.core.signal.Media;
import io.palaver.core.signal.MediaType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a response onto chat message shapes. Media wins over choices; a few choices become
 * buttons, more become a sectioned list.
 */
public final class InteractiveRenderer {
    static final int BUTTON_TITLE_LIMIT = 20;
    static final int ROW_TITLE_LIMIT = 24;
    static final int ROW_DESCRIPTION_LIMIT = 72;

    private final PromptSettings settings;

    public InteractiveRenderer() {
        this(PromptSettings.defaults());
    }

    public InteractiveRenderer(PromptSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public InteractiveMessage render(FlowResponse response) {
        return render(response.message(), response.choices(), response.media());
    }

    public InteractiveMessage render(String message, Map<String, String> choices, Media media) {
        if (media != null) {
            String caption = media.type() == MediaType.STICKER ? "" : message;
            return new InteractiveMessage(InteractiveMessage.Type.MEDIA, caption, null, null, media);
        }
        if (choices == null || choices.isEmpty()) {
            return new InteractiveMessage(InteractiveMessage.Type.TEXT, message, null, null, null);
        }
        if (choices.size() > settings.maxChoices()) {
            throw new IllegalArgumentException(
                "at most " + settings.maxChoices() + " choices can be rendered, got " + choices.size()
            );
        }
        if (choices.size() <= settings.maxInlineChoices()) {
            List<InteractiveMessage.Button> buttons = new ArrayList<>();
            choices.forEach((id, label) -> buttons.add(new InteractiveMessage.Button(id, truncate(label, BUTTON_TITLE_LIMIT))));
            return new InteractiveMessage(InteractiveMessage.Type.BUTTONS, message, buttons, null, null);
        }
        return new InteractiveMessage(InteractiveMessage.Type.LIST, message, null, sections(choices), null);
    }

    private List<InteractiveMessage.Section> sections(Map<String, String> choices) {
        List<InteractiveMessage.Row> rows = new ArrayList<>();
        choices.forEach((id, label) -> {
            String description = label.length() > ROW_TITLE_LIMIT ? truncate(label, ROW_DESCRIPTION_LIMIT) : null;
            rows.add(new InteractiveMessage.Row(id, truncate(label, ROW_TITLE_LIMIT), description));
        });

        int size = settings.listSectionSize();
        if (rows.size() <= size) {
            return List.of(new InteractiveMessage.Section("Options", rows));
        }
        List<InteractiveMessage.Section> sections = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += size) {
            int to = Math.min(rows.size(), from + size);
            sections.add(new InteractiveMessage.Section((from + 1) + "-" + to, rows.subList(from, to)));
        }
        return sections;
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit - 3) + "...";
    }
}
