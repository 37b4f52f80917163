package io.palaver.core.engine;

import io.palaver.core.config.model.PalaverConfig;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.InboundTurn;
import io.palaver.core.context.SessionBoundary;
import io.palaver.core.flow.FlowRegistry;
import io.palaver.core.pagination.PaginationConfig;
import io.palaver.core.pipeline.ExecutorStage;
import io.palaver.core.pipeline.FlowResponse;
import io.palaver.core.pipeline.PaginationStage;
import io.palaver.core.pipeline.Pipeline;
import io.palaver.core.pipeline.SessionLoaderStage;
import io.palaver.core.pipeline.Stage;
import io.palaver.core.pipeline.TransportStage;
import io.palaver.core.session.SessionStoreFactory;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Entry point for transports: one {@link InboundTurn} in, one {@link FlowResponse} out.
 */
public final class ConversationEngine {
    private final FlowRegistry registry;
    private final Pipeline pipeline;

    public ConversationEngine(PalaverConfig config, FlowRegistry registry, SessionStoreFactory stores) {
        this(config, registry, stores, UnaryOperator.identity());
    }

    /**
     * @param customizer adds user stages to the standard pipeline
     */
    public ConversationEngine(
        PalaverConfig config,
        FlowRegistry registry,
        SessionStoreFactory stores,
        UnaryOperator<Pipeline.Builder> customizer
    ) {
        Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(stores, "stores must not be null");
        Objects.requireNonNull(customizer, "customizer must not be null");

        Stage transport = new TransportStage();
        Stage session = new SessionLoaderStage(stores, SessionBoundary.fromConfig(config.session().boundary()));
        Stage pagination = new PaginationStage(PaginationConfig.from(config.pagination()));
        Stage executor = new ExecutorStage(registry, config.prompts());
        this.pipeline = customizer.apply(Pipeline.builder(transport, session, pagination, executor)).build();
    }

    public FlowResponse process(InboundTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        return pipeline.handle(ConversationContext.from(turn));
    }

    public boolean hasFlow(String name) {
        return registry.contains(name);
    }

    public FlowRegistry registry() {
        return registry;
    }

    public Pipeline pipeline() {
        return pipeline;
    }
}
