package io.palaver.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaginationSettings(
    int maxPageSize,
    String nextToken,
    String nextLabel,
    String backToken,
    String backLabel,
    boolean preserveStructure
) {

    public static PaginationSettings defaults() {
        return new PaginationSettings(182, "#", "More", "0", "Back", false);
    }
}
