package io.palaver.core.context;

public record Location(double latitude, double longitude, String name, String address) {
}
