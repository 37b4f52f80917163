package io.palaver.core.context;

import io.palaver.core.signal.Media;
import java.time.Instant;

public record PlatformMetadata(
    String platform,
    String callerId,
    Instant timestamp,
    String messageId,
    String contactName,
    Location location,
    Media media
) {

    public static PlatformMetadata empty() {
        return new PlatformMetadata(null, null, null, null, null, null, null);
    }

    public static PlatformMetadata of(String platform, String callerId) {
        return new PlatformMetadata(platform, callerId, null, null, null, null, null);
    }

    public PlatformMetadata withTimestamp(Instant value) {
        return new PlatformMetadata(platform, callerId, value, messageId, contactName, location, media);
    }

    public PlatformMetadata withMessageId(String value) {
        return new PlatformMetadata(platform, callerId, timestamp, value, contactName, location, media);
    }

    public PlatformMetadata withContactName(String value) {
        return new PlatformMetadata(platform, callerId, timestamp, messageId, value, location, media);
    }

    public PlatformMetadata withLocation(Location value) {
        return new PlatformMetadata(platform, callerId, timestamp, messageId, contactName, value, media);
    }

    public PlatformMetadata withMedia(Media value) {
        return new PlatformMetadata(platform, callerId, timestamp, messageId, contactName, location, value);
    }
}
