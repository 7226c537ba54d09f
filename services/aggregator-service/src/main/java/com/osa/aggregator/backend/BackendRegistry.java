package com.osa.aggregator.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the configured backends, ordered by priority (highest
 * first) and then id.
 */
public class BackendRegistry {
    public static final Comparator<Backend> PRIORITY_ORDER = Comparator
        .comparingInt(Backend::getPriority).reversed()
        .thenComparing(Backend::getId);

    private final Map<String, Backend> byId;
    private final List<Backend> ordered;

    public BackendRegistry(List<Backend> backends) {
        List<Backend> sorted = new ArrayList<>(backends == null ? List.of() : backends);
        sorted.sort(PRIORITY_ORDER);
        Map<String, Backend> index = new LinkedHashMap<>();
        for (Backend backend : sorted) {
            if (index.putIfAbsent(backend.getId(), backend) != null) {
                throw new IllegalArgumentException("duplicate backend id: " + backend.getId());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
        this.ordered = List.copyOf(index.values());
    }

    public List<Backend> getAll() {
        return ordered;
    }

    public List<Backend> getEnabled() {
        List<Backend> enabled = new ArrayList<>(ordered.size());
        for (Backend backend : ordered) {
            if (backend.isEnabled()) {
                enabled.add(backend);
            }
        }
        return enabled;
    }

    public Optional<Backend> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return ordered.size();
    }
}
