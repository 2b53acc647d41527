package com.equipment.analytics.exception;

/**
 * The uploaded content cannot be read as an equipment table at all: unreadable
 * bytes, broken CSV syntax, a missing header or missing required columns, or no
 * data rows. Nothing is persisted.
 */
public class MalformedInputException extends EquipmentDataException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
