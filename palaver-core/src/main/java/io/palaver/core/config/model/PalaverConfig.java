package io.palaver.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PalaverConfig(
    PaginationSettings pagination,
    PromptSettings prompts,
    SessionConfig session,
    GatewayConfig gateway
) {

    public static PalaverConfig defaults() {
        return new PalaverConfig(
            PaginationSettings.defaults(),
            PromptSettings.defaults(),
            SessionConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
