package io.palaver.core.signal;

/**
 * Aborts the current replay of a flow action. Signals unwind every frame of the flow method and are
 * only caught by the executor stage, which turns them into a {@code FlowResponse}.
 *
 * <p>Signals carry no stack trace: they are control flow, raised once per turn.
 */
public abstract sealed class FlowSignal extends RuntimeException
    permits PromptSignal, TerminateSignal, RestartFlowSignal {

    protected FlowSignal(String message) {
        super(message, null, false, false);
    }
}
