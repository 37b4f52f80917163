package io.palaver.core.signal;

public final class TerminateSignal extends FlowSignal {
    private final Media media;

    public TerminateSignal(String message) {
        this(message, null);
    }

    public TerminateSignal(String message, Media media) {
        super(message == null ? "" : message);
        this.media = media;
    }

    public Media media() {
        return media;
    }
}
