package com.bulkresizer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source image to resize into one destination file. Consumed once by a
 * single worker.
 */
public final class ResizeJob {

    private final Path sourcePath;
    private final Path destPath;
    private final ResizeParams params;

    public ResizeJob(Path sourcePath, Path destPath, ResizeParams params) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.destPath = Objects.requireNonNull(destPath, "destPath");
        this.params = Objects.requireNonNull(params, "params");
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public Path getDestPath() {
        return destPath;
    }

    public ResizeParams getParams() {
        return params;
    }

    @Override
    public String toString() {
        return sourcePath + " -> " + destPath;
    }
}
