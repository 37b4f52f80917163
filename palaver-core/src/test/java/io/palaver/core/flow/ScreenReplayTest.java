package io.palaver.core.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.Channel;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.PlatformMetadata;
import io.palaver.core.prompt.InputSpec;
import io.palaver.core.prompt.Prompt;
import io.palaver.core.session.DocumentSessionStore;
import io.palaver.core.session.InMemorySessionBackend;
import io.palaver.core.session.ReservedKeys;
import io.palaver.core.session.SessionCodec;
import io.palaver.core.session.SessionStore;
import io.palaver.core.signal.FlowContractException;
import io.palaver.core.signal.PromptSignal;
import io.palaver.core.signal.RestartFlowSignal;
import io.palaver.core.signal.TerminateSignal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ScreenReplayTest {

    private final SessionStore session = new DocumentSessionStore("s1", new InMemorySessionBackend(), new SessionCodec(), null);

    @Test
    void shouldReturnCachedValueWithoutInvokingBuilder() {
        session.set("name", "John");
        AtomicInteger calls = new AtomicInteger();
        ConversationApp app = textApp("ignored");

        String name = app.screen("name", prompt -> {
            calls.incrementAndGet();
            return prompt.ask("Name?");
        });

        assertThat(name).isEqualTo("John");
        assertThat(calls).hasValue(0);
        assertThat(app.input()).isEqualTo("ignored");
    }

    @Test
    void shouldPromptWhenThereIsNoInput() {
        ConversationApp app = textApp(null);

        assertThatThrownBy(() -> app.screen("name", prompt -> prompt.ask("Name?")))
            .isInstanceOf(PromptSignal.class)
            .hasMessage("Name?");
        assertThat(session.get("name")).isNull();
    }

    @Test
    void shouldStoreAnswerAndConsumeInput() {
        ConversationApp app = textApp("John");

        String name = app.screen("name", prompt -> prompt.ask("Name?"));

        assertThat(name).isEqualTo("John");
        assertThat(session.get("name")).isEqualTo("John");
        assertThat(app.input()).isNull();
        assertThatThrownBy(() -> app.screen("age", prompt -> prompt.ask("Age?")))
            .isInstanceOf(PromptSignal.class)
            .hasMessage("Age?");
    }

    @Test
    void promptRaisedDeepInsideHelpersShouldEndTheReplay() {
        ConversationApp app = textApp(null);
        AtomicInteger afterRaise = new AtomicInteger();

        assertThatThrownBy(() -> app.screen("deep", prompt -> {
            String value = level1(prompt);
            afterRaise.incrementAndGet();
            return value;
        }))
            .isInstanceOf(PromptSignal.class)
            .hasMessage("Deep question?");
        assertThat(afterRaise).hasValue(0);
    }

    @Test
    void duplicateKeyInOneReplayShouldBeAContractViolation() {
        session.set("name", "John");
        ConversationApp app = textApp(null);
        app.screen("name", prompt -> prompt.ask("Name?"));

        assertThatThrownBy(() -> app.screen("name", prompt -> prompt.ask("Name?")))
            .isInstanceOf(FlowContractException.class)
            .hasMessageContaining("name");
    }

    @Test
    void missingBuilderAndReservedKeysShouldBeContractViolations() {
        ConversationApp app = textApp("x");

        assertThatThrownBy(() -> app.screen("name", null))
            .isInstanceOf(FlowContractException.class);
        assertThatThrownBy(() -> app.screen(ReservedKeys.PAGINATION, prompt -> "x"))
            .isInstanceOf(FlowContractException.class);
    }

    @Test
    void builderReturningNullShouldBeAContractViolation() {
        ConversationApp app = textApp("x");

        assertThatThrownBy(() -> app.screen("name", prompt -> null))
            .isInstanceOf(FlowContractException.class);
    }

    @Test
    void goBackShouldForgetOnlyTheMostRecentScreen() {
        ConversationApp app = textApp("x");
        app.screen("a", prompt -> prompt.ask("A?"));
        session.set("b", "y");
        app.screen("b", prompt -> prompt.ask("B?"));

        assertThat(app.navigationStack()).containsExactly("a", "b");
        assertThatThrownBy(app::goBack).isInstanceOf(RestartFlowSignal.class);
        assertThat(session.get("a")).isEqualTo("x");
        assertThat(session.get("b")).isNull();
    }

    @Test
    void goBackWithEmptyNavigationStackShouldReturnFalse() {
        ConversationApp app = textApp("x");

        assertThat(app.goBack()).isFalse();
    }

    @Test
    void sayShouldTerminate() {
        ConversationApp app = textApp(null);

        assertThatThrownBy(() -> app.say("Goodbye"))
            .isInstanceOf(TerminateSignal.class)
            .hasMessage("Goodbye");
    }

    @Test
    void typedScreenShouldDecodeRecordsFromTheSession() {
        ConversationApp first = textApp("Ama");
        Customer stored = first.screen("customer", Customer.class, prompt -> new Customer(prompt.ask("Name?"), 30));

        Customer replayed = textApp(null).screen("customer", Customer.class, prompt -> new Customer("never", 0));

        assertThat(replayed).isEqualTo(stored);
    }

    @Test
    void interactiveAppShouldIgnoreTheMessageThatOpensTheConversation() {
        ConversationContext context = context("hi", Channel.INTERACTIVE);
        context.setMetadata(context.metadata().withTimestamp(Instant.parse("2026-03-01T10:00:00Z")));
        ConversationApp app = new InteractiveConversationApp(context, PromptSettings.defaults());

        assertThatThrownBy(() -> app.screen("name", prompt -> prompt.ask("Name?")))
            .isInstanceOf(PromptSignal.class)
            .hasMessage("Name?");
        assertThat(session.get(ReservedKeys.STARTED_AT)).isEqualTo("2026-03-01T10:00:00Z");

        ConversationApp next = new InteractiveConversationApp(context("Esi", Channel.INTERACTIVE), PromptSettings.defaults());
        String answered = next.screen("name", prompt -> prompt.ask("Name?"));
        assertThat(answered).isEqualTo("Esi");
    }

    @Test
    void cachedAnswersShouldKeepTheirTypeWhenReadBackOnLaterTurns() {
        InMemorySessionBackend backend = new InMemorySessionBackend();
        SessionCodec codec = new SessionCodec();

        ConversationApp turn1 = textApp(new DocumentSessionStore("turns", backend, codec, null), "5");
        Long amount = turn1.screen("amount", prompt -> prompt.ask("Amount?", InputSpec.converting(Long::parseLong)));

        ConversationApp turn2 = textApp(new DocumentSessionStore("turns", backend, codec, null), "LARGE");
        turn2.screen("amount", prompt -> prompt.ask("Amount?", InputSpec.converting(Long::parseLong)));
        Size size = turn2.screen("size", prompt -> prompt.ask("Size?", InputSpec.converting(Size::valueOf)));

        ConversationApp turn3 = textApp(new DocumentSessionStore("turns", backend, codec, null), "Ama");
        turn3.screen("amount", prompt -> prompt.ask("Amount?", InputSpec.converting(Long::parseLong)));
        turn3.screen("size", prompt -> prompt.ask("Size?", InputSpec.converting(Size::valueOf)));
        Customer customer = turn3.screen("customer", prompt -> new Customer(prompt.ask("Name?"), 30));
        List<String> tags = turn3.screen("tags", prompt -> List.of("vip", "late"));

        ConversationApp replay = textApp(new DocumentSessionStore("turns", backend, codec, null), null);
        Long replayedAmount = replay.screen("amount", prompt -> {
            throw new AssertionError("amount was already answered");
        });
        Size replayedSize = replay.screen("size", prompt -> {
            throw new AssertionError("size was already answered");
        });
        Customer replayedCustomer = replay.screen("customer", prompt -> {
            throw new AssertionError("customer was already answered");
        });
        List<String> replayedTags = replay.screen("tags", prompt -> {
            throw new AssertionError("tags were already answered");
        });

        assertThat(replayedAmount).isInstanceOf(Long.class).isEqualTo(amount).isEqualTo(5L);
        assertThat(replayedSize).isSameAs(size).isSameAs(Size.LARGE);
        assertThat(replayedCustomer).isEqualTo(customer).isEqualTo(new Customer("Ama", 30));
        assertThat(replayedTags).isEqualTo(tags);
    }

    @Test
    void storageTypeShouldUseDeclaredEnumAndCollectionInterfaces() {
        assertThat(AbstractConversationApp.storageType(Size.LARGE)).isEqualTo(Size.class);
        assertThat(AbstractConversationApp.storageType(List.of("a"))).isEqualTo(List.class);
        assertThat(AbstractConversationApp.storageType(Set.of("a"))).isEqualTo(Set.class);
        assertThat(AbstractConversationApp.storageType(Map.of("a", 1))).isEqualTo(Map.class);
        assertThat(AbstractConversationApp.storageType(7L)).isEqualTo(Long.class);
    }

    private String level1(Prompt prompt) {
        return level2(prompt);
    }

    private String level2(Prompt prompt) {
        return level3(prompt);
    }

    private String level3(Prompt prompt) {
        return prompt.ask("Deep question?");
    }

    private ConversationApp textApp(String input) {
        return textApp(session, input);
    }

    private ConversationApp textApp(SessionStore store, String input) {
        return new TextConversationApp(context(store, input, Channel.TEXT), PromptSettings.defaults());
    }

    private ConversationContext context(String input, Channel channel) {
        return context(session, input, channel);
    }

    private ConversationContext context(SessionStore store, String input, Channel channel) {
        ConversationContext context = new ConversationContext(
            "test",
            "req-1",
            input,
            channel,
            PlatformMetadata.of("ussd", "233200000001")
        );
        context.attachSession(store.id(), store);
        return context;
    }

    record Customer(String name, int age) {
    }

    enum Size {
        SMALL,
        LARGE
    }
}
