package io.palaver.core.flow;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.prompt.Prompt;
import io.palaver.core.prompt.TextPrompt;

public final class TextConversationApp extends AbstractConversationApp {

    public TextConversationApp(ConversationContext context, PromptSettings settings) {
        super(context, settings);
    }

    @Override
    protected Prompt newPrompt(String input) {
        return new TextPrompt(input, settings);
    }
}
