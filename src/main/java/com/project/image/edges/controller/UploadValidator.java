package com.project.image.edges.controller;

import com.project.image.edges.config.EdgeDetectionProperties;
import com.project.image.edges.exceptions.InvalidInputException;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.util.List;

/** Checks shared by the HTML and JSON upload endpoints. */
@Component
public class UploadValidator {

    static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp"
    );

    private final EdgeDetectionProperties props;

    public UploadValidator(EdgeDetectionProperties props) {
        this.props = props;
    }

    public void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file format: " + contentType
                    + ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > props.getMaxUploadBytes()) {
            throw new IllegalArgumentException("File is too large. Maximum size: "
                    + props.getMaxUploadBytes() / (1024 * 1024) + "MB");
        }
    }

    public void validateDimensions(BufferedImage image) {
        int max = props.getMaxDimension();
        if (image.getWidth() > max || image.getHeight() > max) {
            throw new InvalidInputException("Image is too large. Maximum size: " + max + "x" + max + " pixels");
        }
    }

    public String supportedFormats() {
        return String.join(", ", SUPPORTED_FORMATS);
    }
}
