package com.circuitbox.backend.dto;

import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.CircuitCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CircuitDescriptor(
        String id,
        String name,
        String description,
        CircuitCategory category,
        String endpoint,
        Map<String, Object> settings
) {
    public CircuitDescriptor {
        category = category != null ? category : CircuitCategory.CUSTOM;
        settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
    }

    public static CircuitDescriptor of(String id, String name, CircuitCategory category) {
        return new CircuitDescriptor(id, name, null, category, null, Map.of());
    }

    public static CircuitDescriptor from(Circuit circuit) {
        return new CircuitDescriptor(circuit.getId(), circuit.getName(), circuit.getDescription(),
                circuit.getCategory(), circuit.getEndpoint(), circuit.getSettings());
    }
}
