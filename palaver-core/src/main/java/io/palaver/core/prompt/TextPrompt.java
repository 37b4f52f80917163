package io.palaver.core.prompt;

import io.palaver.core.config.model.PromptSettings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt for text-only transports: choices are numbered from 1 and answered by number.
 */
public final class TextPrompt extends BasePrompt {
    private static final List<String> YES_NO = List.of("Yes", "No");

    public TextPrompt(String input, PromptSettings settings) {
        super(input, settings);
    }

    @Override
    public boolean yes(String message) {
        return "Yes".equals(select(message, YES_NO));
    }

    @Override
    protected Map<String, String> present(Map<String, String> choices) {
        Map<String, String> numbered = new LinkedHashMap<>();
        int index = 1;
        for (String label : choices.values()) {
            numbered.put(String.valueOf(index++), label);
        }
        return numbered;
    }

    @Override
    protected String resolve(String answer, Map<String, String> choices) {
        List<String> keys = new ArrayList<>(choices.keySet());
        try {
            int selected = Integer.parseInt(answer);
            if (selected >= 1 && selected <= keys.size()) {
                return keys.get(selected - 1);
            }
            return null;
        } catch (NumberFormatException ignored) {
            return choices.containsKey(answer) ? answer : null;
        }
    }
}
