package com.equipment.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of equipment categories.
 *
 * Normalization is total: any raw value that does not match a known category
 * (including blank values) maps to {@link #OTHER}.
 *
 * <ul>
 *   <li>PUMP, COMPRESSOR, VALVE, HEAT_EXCHANGER, REACTOR, CONDENSER – known categories</li>
 *   <li>OTHER – catch-all for unrecognised types</li>
 * </ul>
 */
public enum EquipmentType {

    PUMP("Pump"),
    COMPRESSOR("Compressor"),
    VALVE("Valve"),
    HEAT_EXCHANGER("HeatExchanger"),
    REACTOR("Reactor"),
    CONDENSER("Condenser"),
    OTHER("Other");

    private final String label;

    EquipmentType(String label) {
        this.label = label;
    }

    /**
     * Display and storage label, e.g. {@code HeatExchanger}.
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Maps a raw type value to its category.
     *
     * Matching ignores case as well as whitespace, underscores and hyphens, so
     * {@code "heat exchanger"} and {@code "HEAT_EXCHANGER"} both resolve to
     * {@link #HEAT_EXCHANGER}.
     *
     * @param raw raw cell value, may be null
     * @return the matching category, or {@link #OTHER}
     */
    public static EquipmentType normalize(String raw) {
        return lookup(raw).orElse(OTHER);
    }

    /**
     * Like {@link #normalize(String)}, but without the catch-all.
     *
     * @param raw raw value, may be null
     * @return the matching category, or empty if nothing matches
     */
    public static Optional<EquipmentType> lookup(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.replaceAll("[\\s_\\-]+", "").toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (EquipmentType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a stored label back to its category.
     *
     * @param label label as written by {@link #getLabel()}
     * @return the category
     * @throws IllegalArgumentException if the label is unknown
     */
    public static EquipmentType fromLabel(String label) {
        for (EquipmentType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown equipment type label: " + label);
    }
}
