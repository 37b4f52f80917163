package io.palaver.core.flow;

import com.fasterxml.jackson.core.type.TypeReference;
import io.palaver.core.config.model.PromptSettings;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.Location;
import io.palaver.core.prompt.Prompt;
import io.palaver.core.session.ReservedKeys;
import io.palaver.core.session.SessionStore;
import io.palaver.core.session.SessionStoreException;
import io.palaver.core.signal.FlowContractException;
import io.palaver.core.signal.Media;
import io.palaver.core.signal.RestartFlowSignal;
import io.palaver.core.signal.TerminateSignal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractConversationApp implements ConversationApp {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractConversationApp.class);
    private static final TypeReference<Map<String, String>> SCREEN_TYPE_MAP = new TypeReference<>() {
    };

    protected final ConversationContext context;
    protected final PromptSettings settings;
    private final List<String> navigationStack = new ArrayList<>();

    protected AbstractConversationApp(ConversationContext context, PromptSettings settings) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.settings = settings == null ? PromptSettings.defaults() : settings;
    }

    @Override
    public <T> T screen(String key, ScreenBuilder<T> builder) {
        return runScreen(key, builder, stored -> replayed(key, stored));
    }

    @Override
    public <T> T screen(String key, Class<T> type, ScreenBuilder<T> builder) {
        Objects.requireNonNull(type, "type must not be null");
        return runScreen(key, builder, stored -> session().get(key, type));
    }

    private <T> T runScreen(String key, ScreenBuilder<T> builder, Function<Object, T> cachedValue) {
        if (key == null || key.isBlank()) {
            throw new FlowContractException("Screen key must not be blank");
        }
        if (ReservedKeys.isReserved(key)) {
            throw new FlowContractException("Screen key '" + key + "' uses the reserved prefix " + ReservedKeys.PREFIX);
        }
        if (builder == null) {
            throw new FlowContractException("Screen '" + key + "' has no builder");
        }
        if (navigationStack.contains(key)) {
            throw new FlowContractException("Screen '" + key + "' was already presented in this replay");
        }
        navigationStack.add(key);

        Object stored = session().get(key);
        if (stored != null) {
            LOG.debug("Screen {} answered from session {}", key, context.sessionId());
            return cachedValue.apply(stored);
        }

        String raw = acceptInput();
        context.consumeInput();
        T value = builder.build(newPrompt(raw));
        if (value == null) {
            throw new FlowContractException("Screen '" + key + "' builder returned null");
        }
        session().set(key, value);
        recordType(key, value);
        return value;
    }

    /**
     * Decodes a stored answer with the class it had when it was first given. Answers stored
     * without a recorded class keep their plain JSON shape.
     */
    @SuppressWarnings("unchecked")
    private <T> T replayed(String key, Object stored) {
        String typeName = screenTypes().get(key);
        if (typeName == null) {
            return (T) stored;
        }
        return (T) session().get(key, loadType(typeName));
    }

    private void recordType(String key, Object value) {
        Map<String, String> current = screenTypes();
        String typeName = storageType(value).getName();
        if (!typeName.equals(current.get(key))) {
            Map<String, String> types = new LinkedHashMap<>(current);
            types.put(key, typeName);
            session().set(ReservedKeys.SCREEN_TYPES, types);
        }
    }

    private Map<String, String> screenTypes() {
        Map<String, String> types = session().get(ReservedKeys.SCREEN_TYPES, SCREEN_TYPE_MAP);
        return types == null ? Map.of() : types;
    }

    static Class<?> storageType(Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.getDeclaringClass();
        }
        if (value instanceof List) {
            return List.class;
        }
        if (value instanceof Set) {
            return Set.class;
        }
        if (value instanceof Map) {
            return Map.class;
        }
        return value.getClass();
    }

    private Class<?> loadType(String typeName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(typeName, false, loader == null ? getClass().getClassLoader() : loader);
        } catch (ClassNotFoundException e) {
            throw new SessionStoreException("Stored screen answer has unknown type " + typeName, e);
        }
    }

    @Override
    public void say(String message, Media media) {
        throw new TerminateSignal(message, media);
    }

    @Override
    public boolean goBack() {
        if (navigationStack.isEmpty()) {
            return false;
        }
        String last = navigationStack.get(navigationStack.size() - 1);
        session().delete(last);
        LOG.debug("Going back from screen {} in session {}", last, context.sessionId());
        throw new RestartFlowSignal();
    }

    @Override
    public SessionStore session() {
        return context.session();
    }

    @Override
    public String input() {
        return context.input();
    }

    @Override
    public List<String> navigationStack() {
        return Collections.unmodifiableList(navigationStack);
    }

    @Override
    public String callerId() {
        return context.metadata().callerId();
    }

    @Override
    public String messageId() {
        return context.metadata().messageId();
    }

    @Override
    public Instant timestamp() {
        return context.metadata().timestamp();
    }

    @Override
    public String contactName() {
        return context.metadata().contactName();
    }

    @Override
    public Location location() {
        return context.metadata().location();
    }

    @Override
    public Media media() {
        return context.metadata().media();
    }

    /**
     * Input handed to the prompt of a screen that has no stored answer.
     */
    protected String acceptInput() {
        return context.input();
    }

    protected abstract Prompt newPrompt(String input);
}
