package io.palaver.core.pipeline;

import io.palaver.core.context.ConversationContext;
import io.palaver.core.signal.FlowContractException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered chain of named stages. The built-in stages always run as
 * {@code transport -> session -> pagination -> ... -> executor}; user stages go anywhere between
 * the transport and the executor.
 */
public final class Pipeline {
    public static final String TRANSPORT = "transport";
    public static final String SESSION = "session";
    public static final String PAGINATION = "pagination";
    public static final String EXECUTOR = "executor";

    private static final Set<String> BUILT_IN = Set.of(TRANSPORT, SESSION, PAGINATION, EXECUTOR);

    private final List<NamedStage> stages;

    private Pipeline(List<NamedStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public static Builder builder(Stage transport, Stage session, Stage pagination, Stage executor) {
        return new Builder(transport, session, pagination, executor);
    }

    public FlowResponse handle(ConversationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        return new GuardedChain(0).proceed(context);
    }

    public List<String> stageNames() {
        return stages.stream().map(NamedStage::name).toList();
    }

    private final class GuardedChain implements Stage.Chain {
        private final int index;
        private boolean called;

        private GuardedChain(int index) {
            this.index = index;
        }

        @Override
        public FlowResponse proceed(ConversationContext context) {
            if (called) {
                String caller = index == 0 ? "pipeline" : stages.get(index - 1).name();
                throw new FlowContractException("Stage '" + caller + "' called the rest of the pipeline more than once");
            }
            called = true;
            if (index >= stages.size()) {
                throw new FlowContractException("Stage '" + EXECUTOR + "' must not call the rest of the pipeline");
            }
            NamedStage current = stages.get(index);
            FlowResponse response = current.stage().handle(context, new GuardedChain(index + 1));
            if (response == null) {
                throw new FlowContractException("Stage '" + current.name() + "' returned no response");
            }
            return response;
        }
    }

    private record NamedStage(String name, Stage stage) {
    }

    public static final class Builder {
        private final List<NamedStage> stages = new ArrayList<>();

        private Builder(Stage transport, Stage session, Stage pagination, Stage executor) {
            stages.add(new NamedStage(TRANSPORT, Objects.requireNonNull(transport, "transport must not be null")));
            stages.add(new NamedStage(SESSION, Objects.requireNonNull(session, "session must not be null")));
            stages.add(new NamedStage(PAGINATION, Objects.requireNonNull(pagination, "pagination must not be null")));
            stages.add(new NamedStage(EXECUTOR, Objects.requireNonNull(executor, "executor must not be null")));
        }

        /**
         * Adds a stage just before the executor.
         */
        public Builder use(String name, Stage stage) {
            return insertBefore(EXECUTOR, name, stage);
        }

        public Builder insertBefore(String anchor, String name, Stage stage) {
            int position = indexOf(anchor);
            if (TRANSPORT.equals(anchor)) {
                throw new IllegalArgumentException("No stage may run before '" + TRANSPORT + "'");
            }
            stages.add(position, newStage(name, stage));
            return this;
        }

        public Builder insertAfter(String anchor, String name, Stage stage) {
            int position = indexOf(anchor);
            if (EXECUTOR.equals(anchor)) {
                throw new IllegalArgumentException("No stage may run after '" + EXECUTOR + "'");
            }
            stages.add(position + 1, newStage(name, stage));
            return this;
        }

        public Builder remove(String name) {
            if (BUILT_IN.contains(name)) {
                throw new IllegalArgumentException("Built-in stage '" + name + "' cannot be removed");
            }
            stages.remove(indexOf(name));
            return this;
        }

        public Pipeline build() {
            return new Pipeline(stages);
        }

        private NamedStage newStage(String name, Stage stage) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("stage name must not be blank");
            }
            Objects.requireNonNull(stage, "stage must not be null");
            if (stages.stream().anyMatch(existing -> existing.name().equals(name))) {
                throw new IllegalArgumentException("Stage '" + name + "' is already registered");
            }
            return new NamedStage(name, stage);
        }

        private int indexOf(String name) {
            for (int i = 0; i < stages.size(); i++) {
                if (stages.get(i).name().equals(name)) {
                    return i;
                }
            }
            throw new IllegalArgumentException("Unknown stage '" + name + "'");
        }
    }
}
