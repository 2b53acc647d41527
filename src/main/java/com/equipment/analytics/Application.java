package com.equipment.analytics;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the equipment analytics Micronaut application.
 *
 * The service ingests equipment CSV uploads, keeps a bounded history of
 * datasets per owner and serves statistics over them.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting EquipmentAnalyticsService...");
        Micronaut.run(Application.class, args);
    }
}
