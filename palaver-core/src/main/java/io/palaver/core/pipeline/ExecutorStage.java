package io.palaver.core.pipeline;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.Channel;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.flow.ConversationApp;
import io.palaver.core.flow.FlowRegistry;
import io.palaver.core.flow.FlowRoute;
import io.palaver.core.flow.InteractiveConversationApp;
import io.palaver.core.flow.TextConversationApp;
import io.palaver.core.signal.FlowContractException;
import io.palaver.core.signal.PromptSignal;
import io.palaver.core.signal.RestartFlowSignal;
import io.palaver.core.signal.TerminateSignal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Innermost stage: replays the requested flow and turns the signal that ends the replay into a
 * response.
 */
public final class ExecutorStage implements Stage {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorStage.class);
    public static final int DEFAULT_MAX_RESTARTS = 32;

    private final FlowRegistry registry;
    private final PromptSettings promptSettings;
    private final int maxRestarts;

    public ExecutorStage(FlowRegistry registry, PromptSettings promptSettings) {
        this(registry, promptSettings, DEFAULT_MAX_RESTARTS);
    }

    public ExecutorStage(FlowRegistry registry, PromptSettings promptSettings, int maxRestarts) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.promptSettings = promptSettings == null ? PromptSettings.defaults() : promptSettings;
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative");
        }
        this.maxRestarts = maxRestarts;
    }

    @Override
    public FlowResponse handle(ConversationContext context, Chain next) {
        FlowRoute<?> route = registry.require(context.flowName());
        String sessionId = context.session().id();
        int restarts = 0;
        while (true) {
            ConversationApp app = appFor(context);
            try {
                LOG.info("Running flow {} for session {}", route.name(), sessionId);
                route.run(app);
            } catch (PromptSignal prompt) {
                LOG.info("Flow {} prompted session {}", route.name(), sessionId);
                return FlowResponse.prompt(prompt.getMessage(), prompt.choices(), prompt.media());
            } catch (TerminateSignal terminate) {
                LOG.info("Flow {} terminated session {}", route.name(), sessionId);
                context.session().destroy();
                return FlowResponse.terminal(terminate.getMessage(), terminate.media());
            } catch (RestartFlowSignal restart) {
                restarts++;
                if (restarts > maxRestarts) {
                    throw new FlowContractException(
                        "Flow " + route.name() + " restarted more than " + maxRestarts + " times in one turn"
                    );
                }
                LOG.info("Flow {} restarting for session {} ({})", route.name(), sessionId, restarts);
                continue;
            } catch (FlowContractException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.error("Flow {} failed for session {}", route.name(), sessionId, e);
                throw e;
            }
            LOG.warn("Flow {} ended without prompting or terminating", route.name());
            throw new FlowContractException("Flow " + route.name() + " returned without prompting or terminating");
        }
    }

    private ConversationApp appFor(ConversationContext context) {
        return context.channel() == Channel.INTERACTIVE
            ? new InteractiveConversationApp(context, promptSettings)
            : new TextConversationApp(context, promptSettings);
    }
}
