package io.palaver.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.PlatformMetadata;
import io.palaver.core.flow.ConversationApp;
import io.palaver.core.flow.Flow;
import io.palaver.core.flow.FlowRegistry;
import io.palaver.core.flow.FlowRoute;
import io.palaver.core.session.DocumentSessionStore;
import io.palaver.core.session.InMemorySessionBackend;
import io.palaver.core.session.SessionCodec;
import io.palaver.core.session.SessionStore;
import io.palaver.core.signal.FlowContractException;
import io.palaver.core.signal.Media;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ExecutorStageTest {

    private final InMemorySessionBackend backend = new InMemorySessionBackend();
    private final SessionStore session = new DocumentSessionStore("s1", backend, new SessionCodec(), null);

    @Test
    void promptShouldBecomePromptResponse() {
        ExecutorStage executor = executor(FlowRoute.of("greet", ScriptFlow::new, ScriptFlow::greet));

        FlowResponse response = executor.handle(context("greet", null), unused());

        assertThat(response.kind()).isEqualTo(ResponseKind.PROMPT);
        assertThat(response.message()).isEqualTo("What's your name?");
    }

    @Test
    void terminateShouldBecomeTerminalResponseAndDestroyTheSession() {
        ExecutorStage executor = executor(FlowRoute.of("greet", ScriptFlow::new, ScriptFlow::greet));
        executor.handle(context("greet", "Ama"), unused());

        FlowResponse response = executor.handle(context("greet", "1"), unused());

        assertThat(response.kind()).isEqualTo(ResponseKind.TERMINAL);
        assertThat(response.message()).isEqualTo("Goodbye Ama");
        assertThat(response.media()).isEqualTo(Media.image("https://palaver.example/wave.png"));
        assertThat(backend.exists("s1")).isFalse();
    }

    @Test
    void restartShouldReplayImmediatelyAndRepromptTheRewoundScreen() {
        ExecutorStage executor = executor(FlowRoute.of("greet", ScriptFlow::new, ScriptFlow::greet));
        executor.handle(context("greet", "Ama"), unused());

        FlowResponse response = executor.handle(context("greet", "2"), unused());

        assertThat(response.kind()).isEqualTo(ResponseKind.PROMPT);
        assertThat(response.message()).isEqualTo("Ama, leave now?");
        assertThat(session.get("name")).isEqualTo("Ama");
        assertThat(session.get("leave")).isNull();
    }

    @Test
    void actionReturningWithoutSignalShouldBeFatal() {
        ExecutorStage executor = executor(FlowRoute.of("silent", ScriptFlow::new, flow -> { }));

        assertThatThrownBy(() -> executor.handle(context("silent", null), unused()))
            .isInstanceOf(FlowContractException.class)
            .hasMessageContaining("silent");
    }

    @Test
    void endlessRestartsShouldBeBounded() {
        AtomicInteger runs = new AtomicInteger();
        ExecutorStage executor = new ExecutorStage(
            new FlowRegistry().register(FlowRoute.of("loop", ScriptFlow::new, flow -> {
                runs.incrementAndGet();
                flow.app().screen("a", prompt -> "x");
                flow.app().goBack();
            })),
            PromptSettings.defaults(),
            3
        );

        assertThatThrownBy(() -> executor.handle(context("loop", null), unused()))
            .isInstanceOf(FlowContractException.class);
        assertThat(runs).hasValue(4);
    }

    @Test
    void unknownFlowShouldBeFatal() {
        ExecutorStage executor = executor(FlowRoute.of("greet", ScriptFlow::new, ScriptFlow::greet));

        assertThatThrownBy(() -> executor.handle(context("missing", null), unused()))
            .isInstanceOf(FlowContractException.class);
    }

    @Test
    void unexpectedFailuresShouldPropagate() {
        ExecutorStage executor = executor(FlowRoute.of("broken", ScriptFlow::new, flow -> {
            throw new IllegalStateException("database down");
        }));

        assertThatThrownBy(() -> executor.handle(context("broken", null), unused()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("database down");
    }

    private ExecutorStage executor(FlowRoute<?> route) {
        return new ExecutorStage(new FlowRegistry().register(route), PromptSettings.defaults());
    }

    private ConversationContext context(String flow, String input) {
        ConversationContext context = new ConversationContext(flow, "req-1", input, null, PlatformMetadata.of("ussd", "233200000001"));
        context.attachSession(session.id(), session);
        return context;
    }

    private static Stage.Chain unused() {
        return context -> {
            throw new AssertionError("executor must not call the rest of the pipeline");
        };
    }

    static final class ScriptFlow extends Flow {
        ScriptFlow(ConversationApp app) {
            super(app);
        }

        void greet() {
            String name = app.screen("name", prompt -> prompt.ask("What's your name?"));
            String leave = app.screen("leave", prompt -> prompt.select(name + ", leave now?", List.of("Yes", "Not yet")));
            if ("Not yet".equals(leave)) {
                app.goBack();
            }
            app.say("Goodbye " + name, Media.image("https://palaver.example/wave.png"));
        }
    }
}
