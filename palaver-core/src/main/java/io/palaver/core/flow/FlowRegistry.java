package io.palaver.core.flow;

import io.palaver.core.signal.FlowContractException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class FlowRegistry {
    private final Map<String, FlowRoute<?>> routes = new LinkedHashMap<>();

    public FlowRegistry register(FlowRoute<?> route) {
        Objects.requireNonNull(route, "route must not be null");
        if (routes.putIfAbsent(route.name(), route) != null) {
            throw new IllegalArgumentException("Flow route already registered: " + route.name());
        }
        return this;
    }

    public Optional<FlowRoute<?>> find(String name) {
        return Optional.ofNullable(routes.get(name));
    }

    public FlowRoute<?> require(String name) {
        return find(name).orElseThrow(() -> new FlowContractException("Unknown flow route: " + name));
    }

    public boolean contains(String name) {
        return routes.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(routes.keySet());
    }
}
