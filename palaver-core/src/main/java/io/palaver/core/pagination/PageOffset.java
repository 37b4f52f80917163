package io.palaver.core.pagination;

/**
 * Half-open range {@code [start, finish)} of a page within the full text, in UTF-16 units.
 */
public record PageOffset(int start, int finish) {

    public PageOffset {
        if (start < 0 || finish < start) {
            throw new IllegalArgumentException("invalid page offset [" + start + ", " + finish + ")");
        }
    }
}
