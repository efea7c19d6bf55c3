package com.project.image.edges.controller;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.EdgeDetectionException;
import com.project.image.edges.exceptions.InvalidInputException;
import com.project.image.edges.exceptions.PixelAccessException;
import com.project.image.edges.service.EdgeDetectionService;
import com.project.image.edges.service.MaskRenderer;
import com.project.image.edges.service.RasterImageConverter;
import com.project.image.edges.service.StorageService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;

@Controller
@Validated
public class EdgeDetectionController {
    private static final Logger log = LoggerFactory.getLogger(EdgeDetectionController.class);

    private final EdgeDetectionService detectionService;
    private final StorageService storageService;
    private final RasterImageConverter converter;
    private final MaskRenderer renderer;
    private final UploadValidator validator;

    public EdgeDetectionController(EdgeDetectionService detectionService, StorageService storageService,
                                   RasterImageConverter converter, MaskRenderer renderer, UploadValidator validator) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.converter = converter;
        this.renderer = renderer;
        this.validator = validator;
    }

    @GetMapping("/detect")
    public String showForm(Model model) {
        model.addAttribute("supportedFormats", validator.supportedFormats());
        return "detect";
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(@RequestParam("file") @NotNull MultipartFile file, Model model) throws IOException {
        validator.validateFile(file);
        log.info("Processing file: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        BufferedImage input;
        try (InputStream in = file.getInputStream()) {
            input = converter.decode(in);
        }
        validator.validateDimensions(input);

        var storedOriginal = storageService.store(file);
        log.debug("File stored as: {}", storedOriginal.filename());

        try {
            RasterImage raster = converter.toRaster(input);
            EdgeDetectionResult result = detectionService.detect(raster);

            var maskStored = storageService.storeResultImage(renderer.maskPng(result), "mask");
            var overlayStored = storageService.storeResultImage(renderer.overlayPng(input, result), "overlay");

            model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
            model.addAttribute("maskPath", "/" + maskStored.relativeWebPath());
            model.addAttribute("overlayPath", "/" + overlayStored.relativeWebPath());
            model.addAttribute("width", result.width());
            model.addAttribute("height", result.height());
            model.addAttribute("edgePixels", result.edgePixelCount());
            model.addAttribute("boundingBox", result.boundingBox().orElse(null));
            model.addAttribute("anchors", result.anchors());

            log.info("Edge detection completed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (EdgeDetectionException e) {
            log.warn("Edge detection failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", suggestionFor(e));
            model.addAttribute("supportedFormats", validator.supportedFormats());
            return "detect";
        }
    }

    private static String suggestionFor(EdgeDetectionException e) {
        if (e instanceof InvalidInputException) {
            return "Upload a smaller image or re-export it as PNG.";
        } else if (e instanceof PixelAccessException) {
            return "The pixel data could not be read. Try a PNG or JPEG file.";
        }
        return "Try again with a different image.";
    }
}
