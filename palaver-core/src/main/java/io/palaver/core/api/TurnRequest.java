package io.palaver.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.palaver.core.context.Channel;
import io.palaver.core.context.InboundTurn;
import io.palaver.core.context.PlatformMetadata;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnRequest(
    String flow,
    @JsonProperty("session_id") String sessionId,
    String input,
    Channel channel,
    @JsonProperty("caller_id") String callerId,
    @JsonProperty("message_id") String messageId,
    @JsonProperty("contact_name") String contactName,
    String platform
) {

    InboundTurn toTurn() {
        PlatformMetadata metadata = PlatformMetadata.of(platform == null || platform.isBlank() ? "http" : platform, callerId)
            .withMessageId(messageId)
            .withContactName(contactName);
        return new InboundTurn(flow, sessionId, input, channel, metadata);
    }
}
