package com.project.image.edges.service;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.DetectionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs detections in the background, one logical stream per viewer.
 * Each submission takes the next generation for its viewer; a result that finishes after a newer
 * submission is discarded and reported as superseded.
 * A viewer is tracked only while it has runs in flight.
 */
@Service
public class EdgeDetectionJobs {
    private static final Logger log = LoggerFactory.getLogger(EdgeDetectionJobs.class);

    public enum Status { COMPLETED, SUPERSEDED }

    public record Outcome(String viewerId, long generation, Status status, Optional<EdgeDetectionResult> result) {

        static Outcome completed(String viewerId, long generation, EdgeDetectionResult result) {
            return new Outcome(viewerId, generation, Status.COMPLETED, Optional.of(result));
        }

        static Outcome superseded(String viewerId, long generation) {
            return new Outcome(viewerId, generation, Status.SUPERSEDED, Optional.empty());
        }
    }

    public record Ticket(String viewerId, long generation, CompletableFuture<Outcome> outcome) {}

    private final EdgeDetectionService detectionService;
    private final TaskExecutor executor;
    private final AtomicLong generations = new AtomicLong();
    private final Map<String, ViewerState> viewers = new ConcurrentHashMap<>();

    /** Newest generation handed out for a viewer and how many of its runs have not settled yet. */
    private record ViewerState(long latest, int inFlight) {

        ViewerState admit(long generation) {
            return new ViewerState(Math.max(latest, generation), inFlight + 1);
        }

        ViewerState release() {
            return inFlight <= 1 ? null : new ViewerState(latest, inFlight - 1);
        }
    }

    public EdgeDetectionJobs(EdgeDetectionService detectionService, TaskExecutor edgeDetectionExecutor) {
        this.detectionService = detectionService;
        this.executor = edgeDetectionExecutor;
    }

    public Ticket submit(String viewerId, RasterImage image) {
        long generation = generations.incrementAndGet();
        viewers.compute(viewerId, (id, state) ->
                state == null ? new ViewerState(generation, 1) : state.admit(generation));
        log.debug("Submitted detection generation {} for viewer {}", generation, viewerId);

        DetectionToken token = new DetectionToken() {
            @Override
            public long generation() {
                return generation;
            }

            @Override
            public boolean isSuperseded() {
                return !isCurrent(viewerId, generation);
            }
        };

        CompletableFuture<EdgeDetectionResult> run;
        try {
            run = CompletableFuture.supplyAsync(() -> detectionService.detect(image, token), executor);
        } catch (RuntimeException e) {
            release(viewerId);
            throw e;
        }

        CompletableFuture<Outcome> future = run.handle((result, error) -> {
            try {
                Throwable cause = unwrap(error);
                if (cause instanceof DetectionCancelledException || (cause == null && token.isSuperseded())) {
                    log.warn("Discarding detection generation {} for viewer {}: superseded", generation, viewerId);
                    return Outcome.superseded(viewerId, generation);
                }
                if (cause != null) {
                    throw cause instanceof RuntimeException re ? re : new IllegalStateException(cause);
                }
                return Outcome.completed(viewerId, generation, result);
            } finally {
                release(viewerId);
            }
        });
        return new Ticket(viewerId, generation, future);
    }

    /** A viewer with no runs in flight has nothing newer queued, so any generation counts as current. */
    public boolean isCurrent(String viewerId, long generation) {
        ViewerState state = viewers.get(viewerId);
        return state == null || state.latest() == generation;
    }

    /** Number of viewers that still have at least one run in flight. */
    public int trackedViewerCount() {
        return viewers.size();
    }

    private void release(String viewerId) {
        viewers.computeIfPresent(viewerId, (id, state) -> state.release());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
