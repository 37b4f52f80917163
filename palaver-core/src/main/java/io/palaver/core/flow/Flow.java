package io.palaver.core.flow;

import java.util.Objects;

/**
 * Base class for conversation logic. A new instance is created for every replay, so fields hold
 * nothing across turns; use screens or the session for that.
 */
public abstract class Flow {
    protected final ConversationApp app;

    protected Flow(ConversationApp app) {
        this.app = Objects.requireNonNull(app, "app must not be null");
    }

    public ConversationApp app() {
        return app;
    }
}
