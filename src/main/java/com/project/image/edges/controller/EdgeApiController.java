package com.project.image.edges.controller;

import com.project.image.edges.DTOs.EdgeApiResponse;
import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.DetectionCancelledException;
import com.project.image.edges.service.EdgeDetectionJobs;
import com.project.image.edges.service.MaskRenderer;
import com.project.image.edges.service.RasterImageConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * JSON endpoint for viewers that render the mask and anchors themselves.
 * Runs in the background pool; a newer upload for the same viewer supersedes an older one.
 */
@RestController
@RequestMapping("/api")
public class EdgeApiController {
    private static final Logger log = LoggerFactory.getLogger(EdgeApiController.class);

    private final EdgeDetectionJobs jobs;
    private final RasterImageConverter converter;
    private final MaskRenderer renderer;
    private final UploadValidator validator;

    public EdgeApiController(EdgeDetectionJobs jobs, RasterImageConverter converter,
                             MaskRenderer renderer, UploadValidator validator) {
        this.jobs = jobs;
        this.converter = converter;
        this.renderer = renderer;
        this.validator = validator;
    }

    @PostMapping(value = "/edges", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<EdgeApiResponse> detect(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "viewer", defaultValue = "default") String viewer) throws IOException {
        validator.validateFile(file);

        BufferedImage input;
        try (InputStream in = file.getInputStream()) {
            input = converter.decode(in);
        }
        validator.validateDimensions(input);
        RasterImage raster = converter.toRaster(input);

        EdgeDetectionJobs.Ticket ticket = jobs.submit(viewer, raster);
        log.info("Queued edge detection generation {} for viewer {}", ticket.generation(), viewer);

        return ticket.outcome().thenApply(outcome -> {
            EdgeDetectionResult result = outcome.result()
                    .orElseThrow(() -> new DetectionCancelledException(outcome.generation()));
            return new EdgeApiResponse(
                    outcome.generation(),
                    result.width(), result.height(),
                    result.edgePixelCount(),
                    result.boundingBox().orElse(null),
                    result.anchors(),
                    renderer.maskPng(result));
        });
    }
}
