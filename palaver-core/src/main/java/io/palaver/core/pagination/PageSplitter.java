package io.palaver.core.pagination;

/**
 * Chooses where a page ends. Prefers the last whitespace within the budget; without one the cut
 * is hard but never separates the code points of one user-perceived character.
 */
public final class PageSplitter {
    private static final int ZERO_WIDTH_JOINER = 0x200D;

    /**
     * @return the exclusive end of the page that starts at {@code start}, at most
     *     {@code start + budget} unless the first character alone is wider than the budget
     */
    public int split(String text, int start, int budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("budget must be positive, got " + budget);
        }
        int length = text.length();
        if (start >= length) {
            return length;
        }
        int limit = Math.min(length, start + budget);
        if (limit == length) {
            return length;
        }
        for (int finish = limit; finish > start; finish--) {
            if (Character.isWhitespace(text.charAt(finish))) {
                return finish;
            }
        }
        return hardCut(text, start, limit);
    }

    private int hardCut(String text, int start, int limit) {
        for (int cut = limit; cut > start; cut--) {
            if (isClusterBoundary(text, cut)) {
                return cut;
            }
        }
        int cut = limit;
        if (Character.isLowSurrogate(text.charAt(cut)) && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        if (cut > start) {
            return cut;
        }
        return start + Character.charCount(text.codePointAt(start));
    }

    static boolean isClusterBoundary(String text, int index) {
        if (index <= 0 || index >= text.length()) {
            return true;
        }
        if (Character.isLowSurrogate(text.charAt(index)) && Character.isHighSurrogate(text.charAt(index - 1))) {
            return false;
        }
        int before = text.codePointBefore(index);
        int after = text.codePointAt(index);
        if (before == ZERO_WIDTH_JOINER || after == ZERO_WIDTH_JOINER) {
            return false;
        }
        if (isExtending(after)) {
            return false;
        }
        if (isRegionalIndicator(before) && isRegionalIndicator(after)) {
            return precedingRegionalIndicators(text, index) % 2 == 0;
        }
        return true;
    }

    static int skipWhitespace(String text, int from) {
        int index = from;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isExtending(int codePoint) {
        int type = Character.getType(codePoint);
        if (type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK || type == Character.COMBINING_SPACING_MARK) {
            return true;
        }
        return (codePoint >= 0xFE00 && codePoint <= 0xFE0F)
            || (codePoint >= 0xE0100 && codePoint <= 0xE01EF)
            || (codePoint >= 0x1F3FB && codePoint <= 0x1F3FF)
            || (codePoint >= 0xE0020 && codePoint <= 0xE007F);
    }

    private static boolean isRegionalIndicator(int codePoint) {
        return codePoint >= 0x1F1E6 && codePoint <= 0x1F1FF;
    }

    private static int precedingRegionalIndicators(String text, int index) {
        int count = 0;
        int cursor = index;
        while (cursor > 0) {
            int codePoint = text.codePointBefore(cursor);
            if (!isRegionalIndicator(codePoint)) {
                break;
            }
            count++;
            cursor -= Character.charCount(codePoint);
        }
        return count;
    }
}
