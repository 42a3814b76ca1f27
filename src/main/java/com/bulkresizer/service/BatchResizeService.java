package com.bulkresizer.service;

import com.bulkresizer.config.ResizerProperties;
import com.bulkresizer.exception.BatchSetupException;
import com.bulkresizer.model.BatchSummary;
import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.ResizeJob;
import com.bulkresizer.model.ResizeParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Top-level batch orchestration.
 *
 * For each run:
 * 1. Validate settings and create the destination directory
 * 2. Build one job per source image, named by its lower-cased file name
 * 3. Run the jobs on a worker pool owned by this run and wait for all of them
 * 4. Report succeeded and failed counts
 *
 * Setup problems throw {@link BatchSetupException} before anything is
 * dispatched. Per-image failures only show up in the returned summary.
 */
@Service
public class BatchResizeService {

    private static final Logger log = LoggerFactory.getLogger(BatchResizeService.class);

    private final ResizeJobProcessor processor;
    private final ImageFileEnumerator enumerator;
    private final ResizerProperties properties;

    public BatchResizeService(ResizeJobProcessor processor,
            ImageFileEnumerator enumerator,
            ResizerProperties properties) {
        this.processor = processor;
        this.enumerator = enumerator;
        this.properties = properties;
    }

    /**
     * Resizes the given images into a destination directory.
     *
     * @param imagePaths  source images
     * @param destDir     output directory; the configured default when null
     * @param params      resize settings for every image
     * @param concurrency worker count; host core count when 0
     * @param chunkSize   jobs per scheduling unit, at least 1
     * @return outcome of every job
     * @throws BatchSetupException if the destination cannot be prepared, the
     *                             concurrency is negative or the chunk size is
     *                             not positive
     */
    public BatchSummary batchResize(List<Path> imagePaths, Path destDir, ResizeParams params,
            int concurrency, int chunkSize) {
        if (concurrency < 0) {
            throw new BatchSetupException("Concurrency must not be negative, got " + concurrency);
        }
        if (chunkSize < 1) {
            throw new BatchSetupException("Chunk size must be at least 1, got " + chunkSize);
        }
        int workers = concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
        Path dest = resolveDestination(destDir);
        ensureDirectory(dest);

        List<ResizeJob> jobs = buildJobs(imagePaths, dest, params);
        warnOnNameCollisions(jobs);

        log.info("Resizing {} images into {} ({}, {} workers, chunk size {})",
                jobs.size(), dest, params, workers, chunkSize);
        long startMs = System.currentTimeMillis();

        List<JobOutcome> outcomes;
        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, workers, chunkSize)) {
            outcomes = pool.run(jobs);
        }

        BatchSummary summary = new BatchSummary(outcomes, System.currentTimeMillis() - startMs);
        log.info("Done! Succeeded: {}, Failed: {}, took {} ms",
                summary.getSucceeded(), summary.getFailed(), summary.getElapsedMs());
        return summary;
    }

    /**
     * Resizes every image found in a folder. Pure composition of
     * {@link ImageFileEnumerator#enumerate(Path, boolean)} and
     * {@link #batchResize(List, Path, ResizeParams, int, int)}.
     *
     * @throws BatchSetupException if the source is not a readable directory
     */
    public BatchSummary resizeFolder(Path sourceDir, Path destDir, boolean includeSubfolders,
            ResizeParams params, int concurrency, int chunkSize) {
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new BatchSetupException("Source directory does not exist: " + sourceDir);
        }
        List<Path> imagePaths;
        try {
            imagePaths = enumerator.enumerate(sourceDir, includeSubfolders);
        } catch (IOException | UncheckedIOException e) {
            // Files.walk reports unreadable subdirectories while the stream is consumed
            throw new BatchSetupException("Cannot list source directory " + sourceDir + ": " + e.getMessage(), e);
        }
        return batchResize(imagePaths, destDir, params, concurrency, chunkSize);
    }

    /**
     * Destination for a source image: its file name, lower-cased, directly
     * under the destination directory.
     */
    public static Path destinationFor(Path source, Path destDir) {
        return destDir.resolve(source.getFileName().toString().toLowerCase(Locale.ROOT));
    }

    private Path resolveDestination(Path destDir) {
        return destDir != null ? destDir : Paths.get(properties.getDestDir());
    }

    private void ensureDirectory(Path dest) {
        if (Files.exists(dest) && !Files.isDirectory(dest)) {
            throw new BatchSetupException("Destination exists and is not a directory: " + dest);
        }
        try {
            Files.createDirectories(dest);
        } catch (IOException e) {
            throw new BatchSetupException("Cannot create destination directory " + dest + ": " + e.getMessage(), e);
        }
    }

    private List<ResizeJob> buildJobs(List<Path> imagePaths, Path dest, ResizeParams params) {
        List<ResizeJob> jobs = new ArrayList<>(imagePaths.size());
        for (Path source : imagePaths) {
            jobs.add(new ResizeJob(source, destinationFor(source, dest), params));
        }
        return jobs;
    }

    // Sources sharing a lower-cased name write the same file; the last one to finish wins.
    private void warnOnNameCollisions(List<ResizeJob> jobs) {
        Map<Path, List<Path>> byDest = jobs.stream()
                .collect(Collectors.groupingBy(ResizeJob::getDestPath, LinkedHashMap::new,
                        Collectors.mapping(ResizeJob::getSourcePath, Collectors.toList())));
        byDest.forEach((destPath, sources) -> {
            if (sources.size() > 1) {
                log.warn("{} sources map to {}; only one result will be kept: {}",
                        sources.size(), destPath.getFileName(), sources);
            }
        });
    }
}
