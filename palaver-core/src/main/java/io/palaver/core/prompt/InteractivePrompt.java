package io.palaver.core.prompt;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.signal.PromptSignal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt for chat transports: choices keep their own keys so they can become buttons or list
 * rows; the user may answer with the key or the label.
 */
public final class InteractivePrompt extends BasePrompt {
    private static final int MAX_CHOICE_LENGTH = 100;
    private static final Map<String, String> YES_NO = Map.of("yes", "Yes", "no", "No");

    public InteractivePrompt(String input, PromptSettings settings) {
        super(input, settings);
    }

    @Override
    public boolean yes(String message) {
        Map<String, String> buttons = new LinkedHashMap<>();
        buttons.put("yes", YES_NO.get("yes"));
        buttons.put("no", YES_NO.get("no"));
        if (!hasInput()) {
            throw new PromptSignal(message, buttons, null);
        }
        switch (input.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "y", "1", "true" -> {
                return true;
            }
            case "no", "n", "0", "false" -> {
                return false;
            }
            default -> throw rejection(settings.yesNoRetryMessage(), message, buttons, null);
        }
    }

    @Override
    protected void validateChoices(Map<String, String> choices) {
        super.validateChoices(choices);
        choices.values().forEach(label -> {
            if (label.length() > MAX_CHOICE_LENGTH) {
                throw new IllegalArgumentException(
                    "choice '" + label.substring(0, 20) + "...' is too long (" + label.length()
                        + " chars), maximum is " + MAX_CHOICE_LENGTH
                );
            }
        });
    }

    @Override
    protected Map<String, String> present(Map<String, String> choices) {
        return new LinkedHashMap<>(choices);
    }

    @Override
    protected String resolve(String answer, Map<String, String> choices) {
        if (choices.containsKey(answer)) {
            return answer;
        }
        for (Map.Entry<String, String> entry : choices.entrySet()) {
            if (entry.getValue().equalsIgnoreCase(answer)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
