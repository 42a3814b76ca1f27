package com.bulkresizer.cli;

import com.bulkresizer.config.ResizerProperties;
import com.bulkresizer.exception.BatchSetupException;
import com.bulkresizer.model.BatchSummary;
import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.ResampleFilter;
import com.bulkresizer.model.ResizeParams;
import com.bulkresizer.service.BatchResizeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line surface of the resizer.
 *
 * Exit codes: 0 when the batch ran, even if some images failed; 1 when the run
 * could not start (missing source directory, destination not creatable, bad
 * sizes or worker counts); 2 for usage errors.
 */
@Component
@Command(
        name = "bulk-resizer",
        description = "Fast bulk resizing of images into JPEG files using parallel workers.",
        mixinStandardHelpOptions = true,
        version = "bulk-resizer 1.0.0"
)
public class ResizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResizeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILURE = 1;

    private final BatchResizeService batchResizeService;
    private final ResizerProperties properties;

    @Spec
    private CommandSpec commandSpec;

    @Option(names = {"-dir", "--dir"}, required = true,
            description = "Directory to resize the images in.")
    private Path sourceDir;

    @Option(names = {"-dest", "--dest"},
            description = "Directory to save the resized images in (default: resizer.dest-dir, ./resize/).")
    private Path destDir;

    @Option(names = {"-subf", "--subfolders"},
            description = "Include images in subfolders.")
    private boolean includeSubfolders;

    @Option(names = {"-w", "--width"}, required = true,
            description = "Width of resized images.")
    private int width;

    @Option(names = {"-hi", "--height"}, required = true,
            description = "Height of resized images.")
    private int height;

    @Option(names = {"-a", "--aspect"},
            description = "Resized images keep their aspect ratio.")
    private boolean keepAspectRatio;

    @Option(names = {"-p", "--padding"},
            description = "Add black padding so images are exactly the target size (needs --aspect).")
    private boolean addPadding;

    @Option(names = {"-r", "--resample"},
            description = "Resampling filter: NEAREST, BILINEAR, BICUBIC or LANCZOS (default: resizer.resample).")
    private String resample;

    @Option(names = {"-q", "--quality"},
            description = "JPEG quality, conventionally 1-95 (default: resizer.quality).")
    private Integer quality;

    @Option(names = {"-c", "--concurrency"},
            description = "Number of parallel workers; 0 means one per available processor (default: resizer.concurrency).")
    private Integer concurrency;

    @Option(names = {"--chunk-size"},
            description = "Jobs handed to a worker at once (default: resizer.chunk-size).")
    private Integer chunkSize;

    public ResizeCommand(BatchResizeService batchResizeService, ResizerProperties properties) {
        this.batchResizeService = batchResizeService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        PrintWriter out = commandSpec.commandLine().getOut();
        PrintWriter err = commandSpec.commandLine().getErr();

        BatchSummary summary;
        try {
            ResizeParams params = buildParams();
            summary = batchResizeService.resizeFolder(
                    sourceDir,
                    destDir,
                    includeSubfolders,
                    params,
                    concurrency != null ? concurrency : properties.getConcurrency(),
                    chunkSize != null ? chunkSize : properties.getChunkSize());
        } catch (BatchSetupException | IllegalArgumentException e) {
            log.error("Resize run aborted: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_SETUP_FAILURE;
        }

        out.printf("Resized %d of %d images (%d failed) in %d ms%n",
                summary.getSucceeded(), summary.getTotal(), summary.getFailed(), summary.getElapsedMs());
        for (JobOutcome failure : summary.getFailures()) {
            out.println("  " + failure);
        }
        out.flush();
        return EXIT_OK;
    }

    ResizeParams buildParams() {
        return ResizeParams.builder(width, height)
                .keepAspectRatio(keepAspectRatio)
                .addPadding(addPadding)
                .resampleFilter(ResampleFilter.resolve(resample != null ? resample : properties.getResample()))
                .outputQuality(quality != null ? quality : properties.getQuality())
                .build();
    }
}
