package io.palaver.core.flow;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.prompt.InteractivePrompt;
import io.palaver.core.prompt.Prompt;
import io.palaver.core.session.ReservedKeys;
import java.time.Instant;

/**
 * Chat conversations are opened by the user's first message, which is not an answer to anything.
 * That message is dropped and the session's start time is recorded instead.
 */
public final class InteractiveConversationApp extends AbstractConversationApp {

    public InteractiveConversationApp(ConversationContext context, PromptSettings settings) {
        super(context, settings);
    }

    @Override
    protected String acceptInput() {
        if (session().get(ReservedKeys.STARTED_AT) == null) {
            Instant startedAt = timestamp() == null ? Instant.now() : timestamp();
            session().set(ReservedKeys.STARTED_AT, startedAt.toString());
            return null;
        }
        return super.acceptInput();
    }

    @Override
    protected Prompt newPrompt(String input) {
        return new InteractivePrompt(input, settings);
    }
}
