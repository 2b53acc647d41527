package com.equipment.analytics.exception;

/**
 * The upload request itself is unacceptable (file extension, size, dataset name),
 * independent of the file's content.
 */
public class InvalidUploadException extends EquipmentDataException {

    public InvalidUploadException(String message) {
        super(message);
    }
}
