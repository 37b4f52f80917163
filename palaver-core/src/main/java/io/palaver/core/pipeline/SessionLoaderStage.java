package io.palaver.core.pipeline;

import io.palaver.core.context.ConversationContext;
import io.palaver.core.context.SessionBoundary;
import io.palaver.core.session.SessionStoreFactory;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SessionLoaderStage implements Stage {
    private static final Logger LOG = LoggerFactory.getLogger(SessionLoaderStage.class);

    private final SessionStoreFactory stores;
    private final SessionBoundary boundary;

    public SessionLoaderStage(SessionStoreFactory stores, SessionBoundary boundary) {
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.boundary = boundary == null ? SessionBoundary.REQUEST : boundary;
    }

    @Override
    public FlowResponse handle(ConversationContext context, Chain next) {
        String sessionId = boundary.resolve(context);
        context.attachSession(sessionId, stores.open(sessionId));
        LOG.debug("Session {} attached ({} boundary)", sessionId, boundary);
        return next.proceed(context);
    }
}
