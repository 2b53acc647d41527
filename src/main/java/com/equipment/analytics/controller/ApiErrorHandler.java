package com.equipment.analytics.controller;

import com.equipment.analytics.exception.DatasetNotFoundException;
import com.equipment.analytics.exception.DatasetStorageException;
import com.equipment.analytics.exception.EmptyResultException;
import com.equipment.analytics.exception.InvalidUploadException;
import com.equipment.analytics.exception.MalformedInputException;
import com.equipment.analytics.model.response.ErrorResponse;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Error;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the service's exceptions to HTTP responses for every controller.
 *
 * <ul>
 *   <li>{@link MalformedInputException}, {@link InvalidUploadException} – 400</li>
 *   <li>{@link DatasetNotFoundException} – 404, identical for unknown and foreign ids</li>
 *   <li>{@link EmptyResultException} – 422 with the rejected rows</li>
 *   <li>{@link DatasetStorageException} – 500 without internal details</li>
 * </ul>
 */
@Controller
public class ApiErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

    @Error(global = true, exception = MalformedInputException.class)
    public HttpResponse<ErrorResponse> malformedInput(HttpRequest<?> request, MalformedInputException e) {
        log.warn("Malformed input {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
        return HttpResponse.badRequest(ErrorResponse.of(e.getMessage()));
    }

    @Error(global = true, exception = InvalidUploadException.class)
    public HttpResponse<ErrorResponse> invalidUpload(HttpRequest<?> request, InvalidUploadException e) {
        log.warn("Invalid upload {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
        return HttpResponse.badRequest(ErrorResponse.of(e.getMessage()));
    }

    @Error(global = true, exception = EmptyResultException.class)
    public HttpResponse<ErrorResponse> emptyResult(HttpRequest<?> request, EmptyResultException e) {
        log.warn("No valid rows {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
        ErrorResponse body = new ErrorResponse(false, e.getMessage(), e.getWarnings(), e.getSkippedRows());
        return HttpResponse.<ErrorResponse>status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @Error(global = true, exception = DatasetNotFoundException.class)
    public HttpResponse<ErrorResponse> notFound(HttpRequest<?> request, DatasetNotFoundException e) {
        log.info("Dataset not found {} {} datasetId={}", request.getMethod(), request.getPath(), e.getDatasetId());
        return HttpResponse.<ErrorResponse>notFound().body(ErrorResponse.of("Dataset not found."));
    }

    @Error(global = true, exception = DatasetStorageException.class)
    public HttpResponse<ErrorResponse> storageFailure(HttpRequest<?> request, DatasetStorageException e) {
        log.error("Storage failure {} {}", request.getMethod(), request.getPath(), e);
        return HttpResponse.<ErrorResponse>serverError().body(ErrorResponse.of("Internal storage error."));
    }
}
