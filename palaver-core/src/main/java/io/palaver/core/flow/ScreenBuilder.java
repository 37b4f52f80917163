package io.palaver.core.flow;

import io.palaver.core.prompt.Prompt;

@FunctionalInterface
public interface ScreenBuilder<T> {
    T build(Prompt prompt);
}
