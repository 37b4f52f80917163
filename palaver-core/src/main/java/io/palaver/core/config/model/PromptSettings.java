package io.palaver.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptSettings(
    boolean combineValidationErrorWithMessage,
    String invalidSelectionMessage,
    String invalidInputMessage,
    String yesNoRetryMessage,
    int maxInlineChoices,
    int listSectionSize,
    int maxChoices
) {

    public PromptSettings {
        invalidSelectionMessage = blankToDefault(invalidSelectionMessage, "Invalid selection:");
        invalidInputMessage = blankToDefault(invalidInputMessage, "Invalid input:");
        yesNoRetryMessage = blankToDefault(yesNoRetryMessage, "Please answer with Yes or No.");
        maxInlineChoices = maxInlineChoices <= 0 ? 3 : maxInlineChoices;
        listSectionSize = listSectionSize <= 0 ? 10 : listSectionSize;
        maxChoices = maxChoices <= 0 ? 100 : maxChoices;
    }

    public static PromptSettings defaults() {
        return new PromptSettings(true, "Invalid selection:", "Invalid input:", "Please answer with Yes or No.", 3, 10, 100);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
