package io.palaver.core.pagination;

import io.palaver.core.pipeline.ResponseKind;
import java.util.Map;
import java.util.Objects;

/**
 * Pure page arithmetic over a {@link PaginationState}; persistence is left to the caller.
 */
public final class Paginator {
    private final PaginationConfig config;
    private final PageSplitter splitter;

    public Paginator(PaginationConfig config) {
        this(config, new PageSplitter());
    }

    public Paginator(PaginationConfig config, PageSplitter splitter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.splitter = Objects.requireNonNull(splitter, "splitter must not be null");
    }

    public PaginationConfig config() {
        return config;
    }

    public PaginationState start(String fullText, ResponseKind kind) {
        Objects.requireNonNull(fullText, "fullText must not be null");
        return new PaginationState(1, Map.of(1, offsetFor(fullText, 0, 1)), fullText, kind);
    }

    public boolean fitsOnePage(String fullText) {
        return fullText.length() <= config.maxPageSize();
    }

    /**
     * Moves forward one page; on the last page the state is returned unchanged.
     */
    public PaginationState next(PaginationState state) {
        if (state.isLastPage()) {
            return state;
        }
        int target = state.page() + 1;
        PageOffset known = state.offsets().get(target);
        if (known != null) {
            return state.withPage(target);
        }
        int start = PageSplitter.skipWhitespace(state.fullText(), state.current().finish());
        return state.withPage(target, offsetFor(state.fullText(), start, target));
    }

    public PaginationState back(PaginationState state) {
        return state.withPage(Math.max(state.page() - 1, 1));
    }

    public Page render(PaginationState state) {
        PageOffset offset = state.current();
        boolean last = state.isLastPage();
        String body = state.fullText().substring(offset.start(), offset.finish());
        String text = body + config.footer(!last, state.page() > 1);
        ResponseKind kind = last ? state.kind() : ResponseKind.PROMPT;
        return new Page(state.page(), text, kind, last);
    }

    private PageOffset offsetFor(String text, int start, int page) {
        boolean hasBack = page > 1;
        int remaining = text.length() - start;
        if (remaining + config.footer(false, hasBack).length() <= config.maxPageSize()) {
            return new PageOffset(start, text.length());
        }
        int budget = config.maxPageSize() - config.footer(true, hasBack).length();
        return new PageOffset(start, splitter.split(text, start, budget));
    }

    public record Page(int number, String text, ResponseKind kind, boolean last) {
    }
}
