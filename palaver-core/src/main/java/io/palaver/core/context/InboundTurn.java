package io.palaver.core.context;

import java.util.Objects;

/**
 * One user turn as handed over by a transport adapter.
 *
 * @param flow       registered flow route to run
 * @param requestId  transport session id, may be {@code null} for transports without one
 * @param input      raw user input, {@code null} on the turn that opens a session
 */
public record InboundTurn(String flow, String requestId, String input, Channel channel, PlatformMetadata metadata) {

    public InboundTurn {
        Objects.requireNonNull(flow, "flow must not be null");
        channel = channel == null ? Channel.TEXT : channel;
        metadata = metadata == null ? PlatformMetadata.empty() : metadata;
    }

    public static InboundTurn text(String flow, String requestId, String callerId, String input) {
        return new InboundTurn(flow, requestId, input, Channel.TEXT, PlatformMetadata.of("ussd", callerId));
    }
}
