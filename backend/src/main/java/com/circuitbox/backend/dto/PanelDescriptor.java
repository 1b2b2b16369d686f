package com.circuitbox.backend.dto;

/**
 * Registration request for a panel. A null position appends the panel,
 * a null maxCircuits takes the configured default.
 */
public record PanelDescriptor(
        String id,
        String name,
        String description,
        Integer position,
        Integer maxCircuits
) {
    public static PanelDescriptor of(String id, String name) {
        return new PanelDescriptor(id, name, null, null, null);
    }
}
