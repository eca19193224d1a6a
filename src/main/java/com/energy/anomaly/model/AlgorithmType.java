package com.energy.anomaly.model;

import com.energy.anomaly.exception.ConfigException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The four interchangeable detection algorithms.
 * Ids are matched case-insensitively, with dashes and spaces treated as underscores.
 */
public enum AlgorithmType {
    ISOLATION_FOREST("Isolation Forest", List.of("iforest", "if")),
    RECONSTRUCTION("Reconstruction", List.of("autoencoder", "auto_encoder")),
    CENTROID_DISTANCE("Centroid Distance", List.of("kmeans", "k_means")),
    DENSITY("Density", List.of("dbscan"));

    private final String displayName;
    private final List<String> aliases;

    AlgorithmType(String displayName, List<String> aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlgorithmType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new ConfigException("Algorithm id is required");
        }
        String key = id.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Arrays.stream(values())
                .filter(t -> t.getId().equals(key) || t.aliases.contains(key))
                .findFirst()
                .orElseThrow(() -> new ConfigException("Unknown algorithm id: " + id));
    }
}
