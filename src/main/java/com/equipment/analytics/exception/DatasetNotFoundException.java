package com.equipment.analytics.exception;

/**
 * The dataset does not exist or belongs to another owner. Both cases are
 * reported identically so that other owners' datasets stay hidden.
 */
public class DatasetNotFoundException extends EquipmentDataException {

    private final long datasetId;

    public DatasetNotFoundException(long datasetId) {
        super("Dataset " + datasetId + " not found");
        this.datasetId = datasetId;
    }

    public long getDatasetId() {
        return datasetId;
    }
}
