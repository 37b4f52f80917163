package io.palaver.core.context;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides which turns share a session id.
 */
public enum SessionBoundary {
    /** One session per transport session (a USSD dial). */
    REQUEST,
    /** One session per caller, across flows and platforms. */
    CALLER,
    /** One session per flow and caller. */
    FLOW_CALLER,
    /** One session per platform and caller. */
    PLATFORM_CALLER;

    private static final String KEY_PREFIX = "palaver:session";

    public String resolve(ConversationContext context) {
        PlatformMetadata metadata = context.metadata();
        List<String> parts = new ArrayList<>();
        switch (this) {
            case REQUEST -> {
                parts.add(orUnknown(metadata.platform()));
                parts.add(require(context.requestId(), "request id"));
                if (metadata.callerId() != null && !metadata.callerId().isBlank()) {
                    parts.add(metadata.callerId());
                }
            }
            case CALLER -> parts.add(require(metadata.callerId(), "caller id"));
            case FLOW_CALLER -> {
                parts.add(context.flowName());
                parts.add(require(metadata.callerId(), "caller id"));
            }
            case PLATFORM_CALLER -> {
                parts.add(orUnknown(metadata.platform()));
                parts.add(require(metadata.callerId(), "caller id"));
            }
            default -> throw new IllegalStateException("Unsupported boundary " + this);
        }
        return KEY_PREFIX + ":" + String.join(":", parts);
    }

    public static SessionBoundary fromConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            return REQUEST;
        }
        return SessionBoundary.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    private String require(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Session boundary " + this + " requires a " + what);
        }
        return value;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value.toLowerCase(Locale.ROOT);
    }
}
