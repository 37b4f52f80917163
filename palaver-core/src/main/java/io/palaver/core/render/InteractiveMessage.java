package io.palaver.core.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import io.palaver.core.signal.Media;
import java.util.List;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InteractiveMessage(Type type, String body, List<Button> buttons, List<Section> sections, Media media) {

    public InteractiveMessage {
        body = body == null ? "" : body;
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public enum Type {
        TEXT,
        BUTTONS,
        LIST,
        MEDIA;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record Button(String id, String title) {
    }

    public record Section(String title, List<Row> rows) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Row(String id, String title, String description) {
    }
}
