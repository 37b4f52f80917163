package io.palaver.core.pipeline;

import io.palaver.core.context.Channel;
import io.palaver.core.context.ConversationContext;
import io.palaver.core.pagination.PaginationConfig;
import io.palaver.core.pagination.PaginationState;
import io.palaver.core.pagination.Paginator;
import io.palaver.core.render.TextRenderer;
import io.palaver.core.session.ReservedKeys;
import io.palaver.core.session.SessionStore;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps text-channel output within the page size. Navigation input is answered from the stored
 * state without running the flow; anything else runs the flow and paginates its output afresh.
 * Interactive channels pass through untouched.
 */
public final class PaginationStage implements Stage {
    private static final Logger LOG = LoggerFactory.getLogger(PaginationStage.class);

    private final Paginator paginator;
    private final TextRenderer renderer;

    public PaginationStage(PaginationConfig config) {
        this(new Paginator(config), new TextRenderer());
    }

    public PaginationStage(Paginator paginator, TextRenderer renderer) {
        this.paginator = Objects.requireNonNull(paginator, "paginator must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    @Override
    public FlowResponse handle(ConversationContext context, Chain next) {
        if (context.channel() != Channel.TEXT) {
            return next.proceed(context);
        }
        SessionStore session = context.session();
        PaginationConfig config = paginator.config();
        PaginationState stored = session.get(ReservedKeys.PAGINATION, PaginationState.class);
        String input = context.input();

        if (stored != null && config.isNavigation(input)) {
            PaginationState moved = config.nextToken().equals(input) ? paginator.next(stored) : paginator.back(stored);
            LOG.debug("Session {} moved from page {} to page {}", session.id(), stored.page(), moved.page());
            return respond(session, moved);
        }
        if (stored != null) {
            session.delete(ReservedKeys.PAGINATION);
        }

        FlowResponse response = next.proceed(context);
        String fullText = renderer.render(response);
        if (config.preserveStructure() && paginator.fitsOnePage(fullText)) {
            return response;
        }
        PaginationState state = paginator.start(fullText, response.kind());
        if (!state.isLastPage()) {
            LOG.info("Paginating {} chars of output for session {}", fullText.length(), session.id());
        }
        return respond(session, state);
    }

    private FlowResponse respond(SessionStore session, PaginationState state) {
        Paginator.Page page = paginator.render(state);
        LOG.debug("Session {} page {} covers {}", session.id(), page.number(), state.current());
        if (!page.last()) {
            session.set(ReservedKeys.PAGINATION, state);
        } else if (page.kind() == ResponseKind.TERMINAL) {
            session.delete(ReservedKeys.PAGINATION);
            session.destroy();
        } else if (state.page() > 1) {
            session.set(ReservedKeys.PAGINATION, state);
        }
        return new FlowResponse(page.kind(), page.text(), Map.of(), null);
    }
}
