package com.equipment.analytics.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EquipmentTypeTest {

    @ParameterizedTest
    @CsvSource({
            "Pump, PUMP",
            "PUMP, PUMP",
            "' compressor ', COMPRESSOR",
            "heat exchanger, HEAT_EXCHANGER",
            "Heat_Exchanger, HEAT_EXCHANGER",
            "heat-exchanger, HEAT_EXCHANGER",
            "Condenser, CONDENSER",
            "other, OTHER",
            "Centrifuge, OTHER",
            "'', OTHER"
    })
    void normalizesRawValues(String raw, EquipmentType expected) {
        assertThat(EquipmentType.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void nullNormalizesToOther() {
        assertThat(EquipmentType.normalize(null)).isEqualTo(EquipmentType.OTHER);
    }

    @Test
    void lookupHasNoCatchAll() {
        assertThat(EquipmentType.lookup("Centrifuge")).isEmpty();
        assertThat(EquipmentType.lookup("reactor")).contains(EquipmentType.REACTOR);
        assertThat(EquipmentType.lookup("Other")).contains(EquipmentType.OTHER);
    }

    @Test
    void fromLabelRoundTripsStoredLabels() {
        for (EquipmentType type : EquipmentType.values()) {
            assertThat(EquipmentType.fromLabel(type.getLabel())).isEqualTo(type);
        }
        assertThatThrownBy(() -> EquipmentType.fromLabel("pump")).isInstanceOf(IllegalArgumentException.class);
    }
}
