package io.palaver.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.palaver.core.config.model.PalaverConfig;
import io.palaver.core.config.model.PaginationSettings;
import io.palaver.core.context.Channel;
import io.palaver.core.context.InboundTurn;
import io.palaver.core.context.PlatformMetadata;
import io.palaver.core.flow.ConversationApp;
import io.palaver.core.flow.Flow;
import io.palaver.core.flow.FlowRegistry;
import io.palaver.core.flow.FlowRoute;
import io.palaver.core.pipeline.FlowResponse;
import io.palaver.core.pipeline.Pipeline;
import io.palaver.core.pipeline.ResponseKind;
import io.palaver.core.prompt.InputSpec;
import io.palaver.core.session.DocumentSessionStore;
import io.palaver.core.session.InMemorySessionBackend;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConversationEngineTest {

    private final InMemorySessionBackend backend = new InMemorySessionBackend();
    private final FlowRegistry registry = new FlowRegistry()
        .register(FlowRoute.of("signup", SignupFlow::new, SignupFlow::main));

    @Test
    void shouldWalkThroughAMultiTurnTextConversation() {
        ConversationEngine engine = new ConversationEngine(PalaverConfig.defaults(), registry, DocumentSessionStore.factory(backend, null));

        FlowResponse first = engine.process(InboundTurn.text("signup", "dial-1", "233200000001", null));
        assertThat(first.kind()).isEqualTo(ResponseKind.PROMPT);
        assertThat(first.message()).isEqualTo("What's your name?");

        FlowResponse second = engine.process(InboundTurn.text("signup", "dial-1", "233200000001", "  kwame "));
        assertThat(second.message()).isEqualTo("How old are you, Kwame?");

        FlowResponse invalid = engine.process(InboundTurn.text("signup", "dial-1", "233200000001", "12"));
        assertThat(invalid.message()).isEqualTo("You must be 18 or older\n\nHow old are you, Kwame?");

        FlowResponse plan = engine.process(InboundTurn.text("signup", "dial-1", "233200000001", "30"));
        assertThat(plan.message()).isEqualTo("Choose a plan\n\n1. Basic\n2. Premium");
        assertThat(plan.choices()).isEmpty();

        FlowResponse done = engine.process(InboundTurn.text("signup", "dial-1", "233200000001", "2"));
        assertThat(done.kind()).isEqualTo(ResponseKind.TERMINAL);
        assertThat(done.message()).isEqualTo("Kwame (30) signed up for Premium");
        assertThat(backend.size()).isZero();
    }

    @Test
    void differentRequestIdsShouldNotShareState() {
        ConversationEngine engine = new ConversationEngine(PalaverConfig.defaults(), registry, DocumentSessionStore.factory(backend, null));
        engine.process(InboundTurn.text("signup", "dial-1", "233200000001", "Kwame"));

        FlowResponse other = engine.process(InboundTurn.text("signup", "dial-2", "233200000001", null));

        assertThat(other.message()).isEqualTo("What's your name?");
    }

    @Test
    void longTerminalMessageShouldBePagedBeforeTheSessionEnds() {
        PalaverConfig defaults = PalaverConfig.defaults();
        PalaverConfig config = new PalaverConfig(
            new PaginationSettings(60, "#", "More", "0", "Back", false),
            defaults.prompts(),
            defaults.session(),
            defaults.gateway()
        );
        FlowRegistry flows = new FlowRegistry().register(FlowRoute.of("terms", SignupFlow::new, SignupFlow::terms));
        ConversationEngine engine = new ConversationEngine(config, flows, DocumentSessionStore.factory(backend, null));

        List<String> pages = new ArrayList<>();
        FlowResponse response = engine.process(InboundTurn.text("terms", "dial-9", "233200000001", null));
        while (response.kind() == ResponseKind.PROMPT) {
            pages.add(response.message());
            response = engine.process(InboundTurn.text("terms", "dial-9", "233200000001", "#"));
        }
        pages.add(response.message());

        assertThat(pages).hasSizeGreaterThan(2);
        assertThat(pages).allSatisfy(page -> assertThat(page.length()).isLessThanOrEqualTo(60));
        assertThat(pages.get(pages.size() - 1)).endsWith("\n\n0 Back").doesNotContain("# More");
        assertThat(backend.size()).isZero();
    }

    @Test
    void interactiveConversationShouldSkipTheOpeningMessage() {
        ConversationEngine engine = new ConversationEngine(PalaverConfig.defaults(), registry, DocumentSessionStore.factory(backend, null));
        PlatformMetadata metadata = PlatformMetadata.of("whatsapp", "233200000002");

        FlowResponse first = engine.process(new InboundTurn("signup", "chat-1", "hi", Channel.INTERACTIVE, metadata));
        FlowResponse second = engine.process(new InboundTurn("signup", "chat-1", "Esi", Channel.INTERACTIVE, metadata));

        assertThat(first.message()).isEqualTo("What's your name?");
        assertThat(second.message()).isEqualTo("How old are you, Esi?");
    }

    @Test
    void userStagesShouldRunInsideTheStandardPipeline() {
        List<String> seen = new ArrayList<>();
        ConversationEngine engine = new ConversationEngine(
            PalaverConfig.defaults(),
            registry,
            DocumentSessionStore.factory(backend, null),
            builder -> builder.use("audit", (context, next) -> {
                seen.add(context.sessionId());
                return next.proceed(context);
            })
        );

        engine.process(InboundTurn.text("signup", "dial-1", "233200000001", null));

        assertThat(engine.pipeline().stageNames())
            .containsExactly(Pipeline.TRANSPORT, Pipeline.SESSION, Pipeline.PAGINATION, "audit", Pipeline.EXECUTOR);
        assertThat(seen).containsExactly("palaver:session:ussd:dial-1:233200000001");
    }

    static final class SignupFlow extends Flow {
        SignupFlow(ConversationApp app) {
            super(app);
        }

        void main() {
            String name = app.screen("name", prompt -> prompt.ask(
                "What's your name?",
                InputSpec.text().transform(value -> value.substring(0, 1).toUpperCase() + value.substring(1))
            ));
            int age = app.screen("age", prompt -> prompt.ask(
                "How old are you, " + name + "?",
                InputSpec.integer().validate(value -> value < 18 ? "You must be 18 or older" : null)
            ));
            String plan = app.screen("plan", prompt -> prompt.select("Choose a plan", List.of("Basic", "Premium")));
            app.say(name + " (" + age + ") signed up for " + plan);
        }

        void terms() {
            app.say("These terms apply to every order you place with us. ".repeat(5).trim());
        }
    }
}
