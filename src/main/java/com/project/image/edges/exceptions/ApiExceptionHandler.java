package com.project.image.edges.exceptions;

import com.project.image.edges.DTOs.ErrorResponse;
import com.project.image.edges.controller.EdgeApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

/** JSON error bodies for the API; takes precedence over {@link GlobalExceptionHandler}. */
@RestControllerAdvice(assignableTypes = EdgeApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
        log.warn("Rejected raster: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_input", ex);
    }

    @ExceptionHandler(PixelAccessException.class)
    public ResponseEntity<ErrorResponse> handlePixelAccess(PixelAccessException ex) {
        log.warn("Pixel access failed: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "pixel_access", ex);
    }

    @ExceptionHandler(DetectionCancelledException.class)
    public ResponseEntity<ErrorResponse> handleSuperseded(DetectionCancelledException ex) {
        return error(HttpStatus.CONFLICT, "superseded", ex);
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<ErrorResponse> handleComputation(ComputationException ex) {
        log.error("Edge computation failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "computation", ex);
    }

    @ExceptionHandler(EdgeDetectionException.class)
    public ResponseEntity<ErrorResponse> handleDetection(EdgeDetectionException ex) {
        log.error("Edge detection failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "detection", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid upload: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_upload", ex);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIOException(IOException ex) {
        log.error("IO error occurred", ex);
        return error(HttpStatus.BAD_REQUEST, "io", ex);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, Exception ex) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, ex.getMessage()));
    }
}
