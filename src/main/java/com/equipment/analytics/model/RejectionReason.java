package com.equipment.analytics.model;

/**
 * Why a single uploaded row was left out of its dataset.
 *
 * <ul>
 *   <li>MISSING_FIELD  – a required field is absent or blank</li>
 *   <li>INVALID_NUMBER – a numeric field is unparsable, NaN or infinite</li>
 *   <li>DUPLICATE_NAME – the equipment name was already used by an earlier row
 *                        (only under {@link DuplicateNamePolicy#REJECT})</li>
 * </ul>
 */
public enum RejectionReason {

    MISSING_FIELD,
    INVALID_NUMBER,
    DUPLICATE_NAME
}
