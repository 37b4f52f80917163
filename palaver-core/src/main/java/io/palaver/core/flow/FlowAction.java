package io.palaver.core.flow;

@FunctionalInterface
public interface FlowAction<F extends Flow> {
    void invoke(F flow);
}
