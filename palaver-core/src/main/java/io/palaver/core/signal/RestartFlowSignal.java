package io.palaver.core.signal;

public final class RestartFlowSignal extends FlowSignal {

    public RestartFlowSignal() {
        super("restart_flow");
    }
}
