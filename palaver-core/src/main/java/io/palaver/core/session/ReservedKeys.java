package io.palaver.core.session;

public final class ReservedKeys {
    public static final String PREFIX = "palaver.";
    public static final String PAGINATION = PREFIX + "pagination";
    public static final String STARTED_AT = PREFIX + "started_at";
    public static final String SCREEN_TYPES = PREFIX + "screen_types";

    private ReservedKeys() {
    }

    public static boolean isReserved(String key) {
        return key != null && key.startsWith(PREFIX);
    }
}
