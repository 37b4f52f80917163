package io.palaver.core.pagination;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.palaver.core.pipeline.ResponseKind;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Persisted between navigation turns. Offsets of visited pages are never recomputed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaginationState(int page, Map<Integer, PageOffset> offsets, String fullText, ResponseKind kind) {

    public PaginationState {
        Objects.requireNonNull(fullText, "fullText must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        offsets = offsets == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(offsets));
        if (!offsets.containsKey(page)) {
            throw new IllegalArgumentException("no offsets recorded for page " + page);
        }
    }

    @JsonIgnore
    public PageOffset current() {
        return offsets.get(page);
    }

    @JsonIgnore
    public boolean isLastPage() {
        return PageSplitter.skipWhitespace(fullText, current().finish()) >= fullText.length();
    }

    PaginationState withPage(int target, PageOffset offset) {
        Map<Integer, PageOffset> updated = new TreeMap<>(offsets);
        updated.putIfAbsent(target, offset);
        return new PaginationState(target, updated, fullText, kind);
    }

    PaginationState withPage(int target) {
        return new PaginationState(target, offsets, fullText, kind);
    }
}
