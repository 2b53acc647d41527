package com.equipment.analytics.exception;

/**
 * A database operation failed. Any open transaction has been rolled back
 * before this is thrown.
 */
public class DatasetStorageException extends EquipmentDataException {

    public DatasetStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
