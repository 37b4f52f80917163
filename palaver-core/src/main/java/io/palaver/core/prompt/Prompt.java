package io.palaver.core.prompt;

import io.palaver.core.signal.Media;
import java.util.List;
import java.util.Map;

/**
 * Question primitives available inside a screen builder. Each returns a value when the turn's
 * input answers the question and raises a prompt signal otherwise.
 */
public interface Prompt {
    String input();

    default String ask(String message) {
        return ask(message, InputSpec.text(), null);
    }

    default String ask(String message, Media media) {
        return ask(message, InputSpec.text(), media);
    }

    default <T> T ask(String message, InputSpec<T> spec) {
        return ask(message, spec, null);
    }

    <T> T ask(String message, InputSpec<T> spec, Media media);

    default String select(String message, List<String> choices) {
        return select(message, choices, null);
    }

    String select(String message, List<String> choices, Media media);

    /**
     * @param choices key to label, in presentation order
     * @return the key of the selected choice
     */
    default String select(String message, Map<String, String> choices) {
        return select(message, choices, null);
    }

    String select(String message, Map<String, String> choices, Media media);

    boolean yes(String message);

    void say(String message, Media media);

    default void say(String message) {
        say(message, null);
    }
}
