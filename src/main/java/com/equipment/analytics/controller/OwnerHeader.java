package com.equipment.analytics.controller;

/**
 * Request header carrying the opaque owner id set by the identity layer.
 */
final class OwnerHeader {

    static final String NAME = "X-Owner-Id";

    private OwnerHeader() {
    }
}
