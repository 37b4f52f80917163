package io.palaver.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.PlatformMetadata;
import io.palaver.core.signal.FlowContractException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineTest {

    private final List<String> trace = new ArrayList<>();

    @Test
    void shouldRunBuiltInStagesInFixedOrderWithUserStagesBeforeTheExecutor() {
        Pipeline pipeline = builder()
            .use("audit", recording("audit"))
            .build();

        FlowResponse response = pipeline.handle(context());

        assertThat(pipeline.stageNames()).containsExactly("transport", "session", "pagination", "audit", "executor");
        assertThat(trace).containsExactly("transport", "session", "pagination", "audit", "executor");
        assertThat(response.message()).isEqualTo("done");
    }

    @Test
    void shouldInsertRelativeToNamedStages() {
        Pipeline pipeline = builder()
            .use("audit", recording("audit"))
            .insertBefore("audit", "auth", recording("auth"))
            .insertAfter("transport", "logging", recording("logging"))
            .build();

        assertThat(pipeline.stageNames())
            .containsExactly("transport", "logging", "session", "pagination", "auth", "audit", "executor");
    }

    @Test
    void shouldRemoveUserStagesOnly() {
        Pipeline.Builder builder = builder().use("audit", recording("audit"));

        builder.remove("audit");

        assertThat(builder.build().stageNames()).containsExactly("transport", "session", "pagination", "executor");
        assertThatThrownBy(() -> builder.remove("session")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.insertBefore("transport", "early", recording("early")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.insertAfter("executor", "late", recording("late")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.use("pagination", recording("dup")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stageMayShortCircuit() {
        Pipeline pipeline = builder()
            .use("auth", (context, next) -> FlowResponse.terminal("Access denied", null))
            .build();

        FlowResponse response = pipeline.handle(context());

        assertThat(response.message()).isEqualTo("Access denied");
        assertThat(trace).containsExactly("transport", "session", "pagination");
    }

    @Test
    void stageMayMutateContextAndTransformResult() {
        Pipeline pipeline = Pipeline.builder(
            recording("transport"),
            recording("session"),
            recording("pagination"),
            (context, next) -> FlowResponse.prompt("echo:" + context.input(), Map.of(), null)
        )
            .use("upper", (context, next) -> {
                context.setInput(context.input().toUpperCase());
                FlowResponse response = next.proceed(context);
                return FlowResponse.prompt(response.message() + "!", response.choices(), response.media());
            })
            .build();

        assertThat(pipeline.handle(context()).message()).isEqualTo("echo:HELLO!");
    }

    @Test
    void callingTheRestOfThePipelineTwiceShouldBeAContractViolation() {
        Pipeline pipeline = builder()
            .use("greedy", (context, next) -> {
                next.proceed(context);
                return next.proceed(context);
            })
            .build();

        assertThatThrownBy(() -> pipeline.handle(context()))
            .isInstanceOf(FlowContractException.class)
            .hasMessageContaining("greedy");
    }

    private Pipeline.Builder builder() {
        return Pipeline.builder(
            recording("transport"),
            recording("session"),
            recording("pagination"),
            (context, next) -> {
                trace.add("executor");
                return FlowResponse.prompt("done", Map.of(), null);
            }
        );
    }

    private Stage recording(String name) {
        return (context, next) -> {
            trace.add(name);
            return next.proceed(context);
        };
    }

    private static ConversationContext context() {
        return new ConversationContext("test", "req-1", "hello", null, PlatformMetadata.of("ussd", "233200000001"));
    }
}
