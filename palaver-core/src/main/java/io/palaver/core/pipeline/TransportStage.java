package io.palaver.core.pipeline;

import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.PlatformMetadata;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outermost stage: normalizes what the adapter handed over and logs both directions.
 */
public final class TransportStage implements Stage {
    private static final Logger LOG = LoggerFactory.getLogger(TransportStage.class);

    private final Clock clock;

    public TransportStage() {
        this(Clock.systemUTC());
    }

    public TransportStage(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public FlowResponse handle(ConversationContext context, Chain next) {
        String input = context.input();
        context.setInput(input == null || input.isBlank() ? null : input.trim());

        PlatformMetadata metadata = context.metadata();
        if (metadata.timestamp() == null) {
            metadata = metadata.withTimestamp(clock.instant());
        }
        if (metadata.messageId() == null || metadata.messageId().isBlank()) {
            metadata = metadata.withMessageId(UUID.randomUUID().toString());
        }
        context.setMetadata(metadata);

        LOG.info("Inbound turn flow={} request={} caller={} platform={}",
            context.flowName(), context.requestId(), metadata.callerId(), metadata.platform());
        FlowResponse response = next.proceed(context);
        LOG.info("Outbound {} for flow={} request={} ({} chars)",
            response.kind().wireName(), context.flowName(), context.requestId(), response.message().length());
        return response;
    }
}
