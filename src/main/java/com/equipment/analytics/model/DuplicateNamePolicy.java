package com.equipment.analytics.model;

/**
 * How the dataset builder treats a row whose equipment name repeats an earlier row.
 *
 * <ul>
 *   <li>KEEP_FIRST – keep the earliest row, drop later ones with a warning</li>
 *   <li>KEEP_LAST  – the later row replaces the earlier one, with a warning</li>
 *   <li>REJECT     – later rows are reported as skipped with DUPLICATE_NAME</li>
 * </ul>
 */
public enum DuplicateNamePolicy {

    KEEP_FIRST,
    KEEP_LAST,
    REJECT
}
