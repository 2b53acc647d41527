package com.equipment.analytics.controller;

import com.equipment.analytics.exception.InvalidUploadException;
import com.equipment.analytics.model.response.DashboardResponse;
import com.equipment.analytics.model.response.DatasetAnalyticsResponse;
import com.equipment.analytics.model.response.DatasetDetailResponse;
import com.equipment.analytics.model.response.DatasetEquipmentResponse;
import com.equipment.analytics.model.response.DatasetListResponse;
import com.equipment.analytics.model.response.UploadResponse;
import com.equipment.analytics.service.EquipmentDatasetService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.Part;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Status;
import io.micronaut.http.multipart.CompletedFileUpload;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * REST controller for an owner's datasets.
 *
 * Base path: {@code /api/datasets}. Every request carries the owner id in the
 * {@value OwnerHeader#NAME} header; datasets of other owners are reported as not found.
 *
 * Endpoints:
 * <ul>
 *   <li>{@code GET    /api/datasets}                – retained datasets, newest first</li>
 *   <li>{@code POST   /api/datasets/upload}         – ingest a CSV file (multipart {@code file}, optional {@code name})</li>
 *   <li>{@code GET    /api/datasets/dashboard}      – analytics over all retained datasets</li>
 *   <li>{@code GET    /api/datasets/{id}}           – one dataset with its records</li>
 *   <li>{@code GET    /api/datasets/{id}/analytics} – analytics for one dataset</li>
 *   <li>{@code GET    /api/datasets/{id}/equipment} – records of one dataset</li>
 *   <li>{@code DELETE /api/datasets/{id}}           – delete one dataset</li>
 * </ul>
 *
 * Exceptions are mapped to HTTP statuses by {@link ApiErrorHandler}.
 */
@Controller("/api/datasets")
public class DatasetController {

    private static final Logger log = LoggerFactory.getLogger(DatasetController.class);

    @Inject
    private EquipmentDatasetService datasetService;

    // -----------------------------------------------------------------------
    // GET /api/datasets
    // -----------------------------------------------------------------------

    @Get
    public DatasetListResponse list(@Header(OwnerHeader.NAME) @NotBlank String ownerId) {
        log.debug("GET /api/datasets owner={}", ownerId);
        return datasetService.listDatasets(ownerId);
    }

    // -----------------------------------------------------------------------
    // POST /api/datasets/upload
    // -----------------------------------------------------------------------

    /**
     * Ingests an uploaded CSV file.
     *
     * Returns HTTP 201 with the new dataset, its warnings and the skipped rows.
     * Malformed files and failed upload checks give HTTP 400; a file without a
     * single valid row gives HTTP 422 listing the rejected rows.
     *
     * @param ownerId owner of the new dataset
     * @param file    the CSV file
     * @param name    optional dataset name, defaults to the file name
     */
    @Post(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA)
    public HttpResponse<UploadResponse> upload(@Header(OwnerHeader.NAME) @NotBlank String ownerId,
                                               @Part("file") CompletedFileUpload file,
                                               @Part("name") @Nullable String name) {
        log.info("POST /api/datasets/upload owner={} file={} size={}", ownerId, file.getFilename(), file.getSize());
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read uploaded file={} owner={}", file.getFilename(), ownerId, e);
            throw new InvalidUploadException("The uploaded file could not be read.");
        }
        UploadResponse response = datasetService.upload(ownerId, file.getFilename(), content, name);
        return HttpResponse.created(response);
    }

    // -----------------------------------------------------------------------
    // GET /api/datasets/dashboard
    // -----------------------------------------------------------------------

    @Get("/dashboard")
    public DashboardResponse dashboard(@Header(OwnerHeader.NAME) @NotBlank String ownerId) {
        log.debug("GET /api/datasets/dashboard owner={}", ownerId);
        return datasetService.dashboard(ownerId);
    }

    // -----------------------------------------------------------------------
    // /api/datasets/{id}
    // -----------------------------------------------------------------------

    @Get("/{id}")
    public DatasetDetailResponse detail(@Header(OwnerHeader.NAME) @NotBlank String ownerId, @PathVariable long id) {
        log.debug("GET /api/datasets/{} owner={}", id, ownerId);
        return datasetService.datasetDetail(ownerId, id);
    }

    @Get("/{id}/analytics")
    public DatasetAnalyticsResponse analytics(@Header(OwnerHeader.NAME) @NotBlank String ownerId, @PathVariable long id) {
        log.debug("GET /api/datasets/{}/analytics owner={}", id, ownerId);
        return datasetService.datasetAnalytics(ownerId, id);
    }

    @Get("/{id}/equipment")
    public DatasetEquipmentResponse equipment(@Header(OwnerHeader.NAME) @NotBlank String ownerId, @PathVariable long id) {
        log.debug("GET /api/datasets/{}/equipment owner={}", id, ownerId);
        return datasetService.datasetEquipment(ownerId, id);
    }

    /**
     * Deletes one dataset. Returns HTTP 204, or HTTP 404 if the owner has no such dataset.
     */
    @Delete("/{id}")
    @Status(HttpStatus.NO_CONTENT)
    public void delete(@Header(OwnerHeader.NAME) @NotBlank String ownerId, @PathVariable long id) {
        log.info("DELETE /api/datasets/{} owner={}", id, ownerId);
        datasetService.delete(ownerId, id);
    }
}
