package com.equipment.analytics.controller;

import com.equipment.analytics.model.response.EquipmentListResponse;
import com.equipment.analytics.service.EquipmentDatasetService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.QueryValue;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only access to equipment records across an owner's retained datasets.
 *
 * {@code GET /api/equipment?dataset={id}&type={type}}, both filters optional.
 */
@Controller("/api/equipment")
public class EquipmentController {

    private static final Logger log = LoggerFactory.getLogger(EquipmentController.class);

    @Inject
    private EquipmentDatasetService datasetService;

    @Get
    public EquipmentListResponse list(@Header(OwnerHeader.NAME) @NotBlank String ownerId,
                                      @QueryValue @Nullable Long dataset,
                                      @QueryValue @Nullable String type) {
        log.debug("GET /api/equipment owner={} dataset={} type={}", ownerId, dataset, type);
        return datasetService.equipment(ownerId, dataset, type);
    }
}
