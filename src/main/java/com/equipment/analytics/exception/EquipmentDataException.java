package com.equipment.analytics.exception;

/**
 * Base type for every failure raised by dataset ingestion, retention and analytics.
 *
 * Per-row validation problems are not exceptions; they are collected as
 * {@link com.equipment.analytics.model.SkippedRow}s and returned with the result.
 */
public abstract class EquipmentDataException extends RuntimeException {

    protected EquipmentDataException(String message) {
        super(message);
    }

    protected EquipmentDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
