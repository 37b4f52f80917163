package io.palaver.core.flow;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named entry point: how to build the flow and which action to run on it.
 */
public record FlowRoute<F extends Flow>(String name, Function<ConversationApp, F> factory, FlowAction<F> action) {

    public FlowRoute {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("route name must not be blank");
        }
        Objects.requireNonNull(factory, "factory must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    public static <F extends Flow> FlowRoute<F> of(String name, Function<ConversationApp, F> factory, FlowAction<F> action) {
        return new FlowRoute<>(name, factory, action);
    }

    public void run(ConversationApp app) {
        action.invoke(factory.apply(app));
    }
}
