package com.project.image.edges.service;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.ComputationException;
import com.project.image.edges.exceptions.DetectionCancelledException;
import com.project.image.edges.exceptions.EdgeDetectionException;
import com.project.image.edges.pipeline.DirectionalSuppressor;
import com.project.image.edges.pipeline.EdgeMask;
import com.project.image.edges.pipeline.FixedOffsetAnchorStrategy;
import com.project.image.edges.pipeline.GradientEstimator;
import com.project.image.edges.pipeline.GradientField;
import com.project.image.edges.pipeline.HysteresisLinker;
import com.project.image.edges.pipeline.LumaReducer;
import com.project.image.edges.pipeline.AnchorStrategy;
import com.project.image.edges.pipeline.RegionSummarizer;
import com.project.image.edges.pipeline.RegionSummary;
import com.project.image.edges.pipeline.ScalarField;
import com.project.image.edges.pipeline.SmoothingFilter;
import com.project.image.edges.pipeline.ThresholdPolicy;
import com.project.image.edges.pipeline.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs the edge detection pipeline synchronously on the calling thread:
 * luma, smoothing, Sobel gradient, non-maximum suppression, hysteresis linking, region summary.
 * Every call allocates its own buffers; nothing is kept between calls.
 */
@Service
public class EdgeDetectionService {
    private static final Logger log = LoggerFactory.getLogger(EdgeDetectionService.class);

    public static final float DEFAULT_LOW_THRESHOLD = 15f;
    public static final float DEFAULT_HIGH_THRESHOLD = 40f;

    private final LumaReducer lumaReducer = new LumaReducer();
    private final SmoothingFilter smoothingFilter = new SmoothingFilter();
    private final GradientEstimator gradientEstimator = new GradientEstimator();
    private final DirectionalSuppressor suppressor = new DirectionalSuppressor();
    private final HysteresisLinker linker = new HysteresisLinker();
    private final ThresholdPolicy thresholdPolicy;
    private final RegionSummarizer regionSummarizer;

    public EdgeDetectionService() {
        this(ThresholdPolicy.fixed(DEFAULT_LOW_THRESHOLD, DEFAULT_HIGH_THRESHOLD), new FixedOffsetAnchorStrategy());
    }

    @Autowired
    public EdgeDetectionService(ThresholdPolicy thresholdPolicy, AnchorStrategy anchorStrategy) {
        this.thresholdPolicy = thresholdPolicy;
        this.regionSummarizer = new RegionSummarizer(anchorStrategy);
    }

    public EdgeDetectionResult detect(RasterImage image) {
        return detect(image, DetectionToken.NONE);
    }

    /**
     * @throws com.project.image.edges.exceptions.InvalidInputException if the raster is malformed
     * @throws ComputationException on a non-finite intermediate value
     * @throws DetectionCancelledException if {@code token} reports a newer generation between stages
     */
    public EdgeDetectionResult detect(RasterImage image, DetectionToken token) {
        LumaReducer.requireValid(image);
        final int w = image.width(), h = image.height();
        long started = System.nanoTime();
        log.info("Starting edge detection for image {}x{} (generation {})", w, h, token.generation());

        try {
            ScalarField intensity = lumaReducer.reduce(image);
            checkpoint(token);
            ScalarField smoothed = smoothingFilter.smooth(intensity);
            checkpoint(token);
            GradientField gradient = gradientEstimator.estimate(smoothed);
            checkpoint(token);
            ScalarField suppressed = suppressor.suppress(gradient);
            checkpoint(token);

            Thresholds thresholds = thresholdPolicy.thresholdsFor(gradient.magnitude());
            log.debug("Hysteresis thresholds: low={}, high={}", thresholds.low(), thresholds.high());
            EdgeMask classified = linker.classify(suppressed, thresholds);
            log.debug("Classified {} strong and {} weak pixels",
                    classified.count(EdgeMask.STRONG), classified.count(EdgeMask.WEAK));
            byte[] mask = linker.link(classified);
            checkpoint(token);

            RegionSummary summary = regionSummarizer.summarize(mask, w, h);
            EdgeDetectionResult result = new EdgeDetectionResult(w, h, mask, summary.boundingBox(), summary.anchors());

            log.info("Edge detection completed: {} edge pixels, {} anchors in {} ms",
                    result.edgePixelCount(), result.anchors().size(), (System.nanoTime() - started) / 1_000_000);
            return result;
        } catch (EdgeDetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Edge detection failed for image {}x{}", w, h, e);
            throw new ComputationException("Edge detection failed: " + e.getMessage(), e);
        }
    }

    private static void checkpoint(DetectionToken token) {
        if (token.isSuperseded()) {
            throw new DetectionCancelledException(token.generation());
        }
    }
}
