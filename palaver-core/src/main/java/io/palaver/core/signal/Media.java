package io.palaver.core.signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Media(MediaType type, String url, String filename) {

    public Media {
        type = type == null ? MediaType.IMAGE : type;
        Objects.requireNonNull(url, "url must not be null");
    }

    public static Media image(String url) {
        return new Media(MediaType.IMAGE, url, null);
    }

    public static Media document(String url, String filename) {
        return new Media(MediaType.DOCUMENT, url, filename);
    }

    public static Media of(MediaType type, String url) {
        return new Media(type, url, null);
    }
}
