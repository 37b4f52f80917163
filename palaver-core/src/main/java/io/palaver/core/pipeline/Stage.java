package io.palaver.core.pipeline;

import io.palaver.core.context.ConversationContext;

/**
 * One step of turn processing. A stage may call {@code next} at most once, and may change the
 * context before doing so, transform the result, or return without calling it at all.
 */
@FunctionalInterface
public interface Stage {
    FlowResponse handle(ConversationContext context, Chain next);

    @FunctionalInterface
    interface Chain {
        FlowResponse proceed(ConversationContext context);
    }
}
