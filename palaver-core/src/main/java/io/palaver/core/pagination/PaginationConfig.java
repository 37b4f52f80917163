package io.palaver.core.pagination;

import io.palaver.core.config.model.PaginationSettings;

public record PaginationConfig(
    int maxPageSize,
    String nextToken,
    String nextLabel,
    String backToken,
    String backLabel,
    boolean preserveStructure
) {
    static final String FOOTER_SEPARATOR = "\n\n";

    public PaginationConfig {
        nextToken = requireText(nextToken, "nextToken");
        nextLabel = requireText(nextLabel, "nextLabel");
        backToken = requireText(backToken, "backToken");
        backLabel = requireText(backLabel, "backLabel");
        if (nextToken.equals(backToken)) {
            throw new IllegalArgumentException("nextToken and backToken must differ");
        }
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException("maxPageSize must be positive, got " + maxPageSize);
        }
        int longestFooter = footer(nextToken, nextLabel, backToken, backLabel, true, true).length();
        if (maxPageSize <= longestFooter) {
            throw new IllegalArgumentException(
                "maxPageSize " + maxPageSize + " leaves no room for content next to a " + longestFooter + " char footer"
            );
        }
    }

    public static PaginationConfig defaults() {
        return from(PaginationSettings.defaults());
    }

    public static PaginationConfig from(PaginationSettings settings) {
        return new PaginationConfig(
            settings.maxPageSize(),
            settings.nextToken(),
            settings.nextLabel(),
            settings.backToken(),
            settings.backLabel(),
            settings.preserveStructure()
        );
    }

    public String footer(boolean hasNext, boolean hasBack) {
        return footer(nextToken, nextLabel, backToken, backLabel, hasNext, hasBack);
    }

    public boolean isNavigation(String input) {
        return nextToken.equals(input) || backToken.equals(input);
    }

    private static String footer(String nextToken, String nextLabel, String backToken, String backLabel,
                                 boolean hasNext, boolean hasBack) {
        if (!hasNext && !hasBack) {
            return "";
        }
        StringBuilder footer = new StringBuilder(FOOTER_SEPARATOR);
        if (hasNext) {
            footer.append(nextToken).append(' ').append(nextLabel);
        }
        if (hasBack) {
            if (hasNext) {
                footer.append('\n');
            }
            footer.append(backToken).append(' ').append(backLabel);
        }
        return footer.toString();
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
