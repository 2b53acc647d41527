package com.equipment.analytics.model;

import java.util.Locale;

/**
 * The five required columns of an equipment upload.
 *
 * Each field has a canonical key (used in normalized rows and in rejection
 * reasons) and the header text expected in the uploaded CSV. Header matching
 * is case-insensitive.
 */
public enum EquipmentField {

    NAME("name", "Equipment Name"),
    TYPE("type", "Type"),
    FLOWRATE("flowrate", "Flowrate"),
    PRESSURE("pressure", "Pressure"),
    TEMPERATURE("temperature", "Temperature");

    private final String key;
    private final String header;

    EquipmentField(String key, String header) {
        this.key = key;
        this.header = header;
    }

    public String key() {
        return key;
    }

    public String header() {
        return header;
    }

    /**
     * @param candidate a header cell from the uploaded file
     * @return true if the cell names this field, ignoring case and surrounding whitespace
     */
    public boolean matchesHeader(String candidate) {
        return candidate != null
                && candidate.strip().toLowerCase(Locale.ROOT).equals(header.toLowerCase(Locale.ROOT));
    }
}
