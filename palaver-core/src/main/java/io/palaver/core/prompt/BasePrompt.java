package io.palaver.core.prompt;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.signal.Media;
import io.palaver.core.signal.PromptSignal;
import io.palaver.core.signal.TerminateSignal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

abstract class BasePrompt implements Prompt {
    protected final String input;
    protected final PromptSettings settings;

    protected BasePrompt(String input, PromptSettings settings) {
        this.input = input;
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public String input() {
        return input;
    }

    @Override
    public <T> T ask(String message, InputSpec<T> spec, Media media) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (!hasInput()) {
            throw new PromptSignal(message, Map.of(), media);
        }
        T converted;
        try {
            converted = spec.convert(input);
        } catch (IllegalArgumentException e) {
            throw rejection(settings.invalidInputMessage(), message, Map.of(), media);
        }
        String error = spec.validationError(converted);
        if (error != null) {
            throw rejection(error, message, Map.of(), media);
        }
        return spec.finish(converted);
    }

    @Override
    public String select(String message, List<String> choices, Media media) {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalArgumentException("choices must not be empty");
        }
        Map<String, String> keyed = new LinkedHashMap<>();
        for (String choice : choices) {
            keyed.put(choice, choice);
        }
        return select(message, keyed, media);
    }

    @Override
    public String select(String message, Map<String, String> choices, Media media) {
        validateChoices(choices);
        Map<String, String> presented = present(choices);
        if (!hasInput()) {
            throw new PromptSignal(message, presented, media);
        }
        String key = resolve(input.trim(), choices);
        if (key == null) {
            throw rejection(settings.invalidSelectionMessage(), message, presented, media);
        }
        return key;
    }

    @Override
    public void say(String message, Media media) {
        throw new TerminateSignal(message, media);
    }

    protected boolean hasInput() {
        return input != null && !input.isBlank();
    }

    protected PromptSignal rejection(String error, String message, Map<String, String> choices, Media media) {
        String text = settings.combineValidationErrorWithMessage() && message != null && !message.isBlank()
            ? error + "\n\n" + message
            : error;
        return new PromptSignal(text, choices, media);
    }

    protected void validateChoices(Map<String, String> choices) {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalArgumentException("choices must not be empty");
        }
        if (choices.size() > settings.maxChoices()) {
            throw new IllegalArgumentException(
                "at most " + settings.maxChoices() + " choices are supported, got " + choices.size()
            );
        }
        choices.forEach((key, label) -> {
            if (key == null || key.isBlank() || label == null || label.isBlank()) {
                throw new IllegalArgumentException("choice keys and labels must not be blank");
            }
        });
    }

    /**
     * Choices as shown to the user, keyed by what the user is expected to send back.
     */
    protected abstract Map<String, String> present(Map<String, String> choices);

    /**
     * Maps the user's answer to a choice key, or {@code null} when it matches nothing.
     */
    protected abstract String resolve(String answer, Map<String, String> choices);
}
