package com.equipment.analytics.service;

import com.equipment.analytics.model.EquipmentField;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.equipment.analytics.model.NormalizedRow;
import com.equipment.analytics.model.RowRejection;
import jakarta.inject.Singleton;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Stateless validator that turns one raw row into an {@link EquipmentRecord}
 * or a {@link RowRejection}.
 *
 * Rows are keyed by {@link EquipmentField#key()}. Values may be strings (as read
 * from a CSV file) or numbers. Fields are checked in declaration order and the
 * first failure is reported.
 *
 * <p>Rules:
 * <ol>
 *   <li><b>name</b> – trimmed; absent or blank is MISSING_FIELD.</li>
 *   <li><b>type</b> – absent is MISSING_FIELD; any present value is normalized,
 *       unknown or blank values become {@link EquipmentType#OTHER}.</li>
 *   <li><b>flowrate, pressure, temperature</b> – absent or blank is MISSING_FIELD;
 *       anything that is not a finite decimal number of magnitude at most
 *       {@link #MAX_MAGNITUDE} is INVALID_NUMBER.</li>
 * </ol>
 */
@Singleton
public class RecordNormalizer {

    /** Largest accepted absolute value of a numeric field. */
    static final double MAX_MAGNITUDE = 1e300;

    /**
     * Validates and coerces a single row.
     *
     * @param row raw values keyed by canonical field key
     * @return the accepted record or the rejection reason
     */
    public NormalizedRow normalize(Map<String, ?> row) {
        Object rawName = row.get(EquipmentField.NAME.key());
        String name = rawName == null ? "" : rawName.toString().strip();
        if (name.isEmpty()) {
            return NormalizedRow.rejected(RowRejection.missingField(EquipmentField.NAME.key()));
        }

        if (!row.containsKey(EquipmentField.TYPE.key()) || row.get(EquipmentField.TYPE.key()) == null) {
            return NormalizedRow.rejected(RowRejection.missingField(EquipmentField.TYPE.key()));
        }
        EquipmentType type = EquipmentType.normalize(row.get(EquipmentField.TYPE.key()).toString());

        double[] values = new double[3];
        EquipmentField[] numericFields = {EquipmentField.FLOWRATE, EquipmentField.PRESSURE, EquipmentField.TEMPERATURE};
        for (int i = 0; i < numericFields.length; i++) {
            EquipmentField field = numericFields[i];
            Object raw = row.get(field.key());
            if (raw == null || (raw instanceof CharSequence && raw.toString().isBlank())) {
                return NormalizedRow.rejected(RowRejection.missingField(field.key()));
            }
            Double parsed = parseFinite(raw);
            if (parsed == null) {
                return NormalizedRow.rejected(RowRejection.invalidNumber(field.key(), raw.toString()));
            }
            values[i] = parsed;
        }

        return NormalizedRow.accepted(new EquipmentRecord(name, type, values[0], values[1], values[2]));
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    /**
     * Parses a numeric cell independently of the default locale.
     *
     * Strings follow the {@link BigDecimal} grammar, which has no NaN/Infinity
     * literals and no type suffixes; values beyond {@link #MAX_MAGNITUDE} in
     * magnitude (including those overflowing a double) are treated as invalid.
     *
     * @return the finite value, or null if the input is not a finite number
     */
    private static Double parseFinite(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else {
            try {
                value = new BigDecimal(raw.toString().strip()).doubleValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(value) && Math.abs(value) <= MAX_MAGNITUDE ? value : null;
    }
}
