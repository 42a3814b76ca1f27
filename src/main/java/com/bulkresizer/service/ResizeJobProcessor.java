package com.bulkresizer.service;

import com.bulkresizer.exception.ImageDecodeException;
import com.bulkresizer.exception.ImageEncodeException;
import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.JobOutcome.FailureKind;
import com.bulkresizer.model.ResizeJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Runs one job end to end: decode, transform, encode.
 *
 * This is the failure boundary of a batch. Every error is logged and returned
 * as a failed {@link JobOutcome}; nothing is thrown to the worker pool.
 */
@Service
public class ResizeJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResizeJobProcessor.class);

    private final ImageDecoder decoder;
    private final ImageTransformer transformer;
    private final JpegImageWriter writer;

    public ResizeJobProcessor(ImageDecoder decoder, ImageTransformer transformer, JpegImageWriter writer) {
        this.decoder = decoder;
        this.transformer = transformer;
        this.writer = writer;
    }

    /**
     * Processes a single job.
     *
     * @param job the job to run
     * @return SUCCESS, or FAILED with the stage that failed
     */
    public JobOutcome process(ResizeJob job) {
        long startMs = System.currentTimeMillis();

        BufferedImage source;
        try {
            source = decoder.read(job.getSourcePath());
        } catch (ImageDecodeException | RuntimeException e) {
            return failed(job, FailureKind.DECODE, e, startMs);
        }

        BufferedImage result;
        try {
            result = transformer.transform(source, job.getParams());
        } catch (RuntimeException e) {
            return failed(job, FailureKind.TRANSFORM, e, startMs);
        }

        try {
            writer.write(result, job.getDestPath(), job.getParams().getOutputQuality());
        } catch (ImageEncodeException | RuntimeException e) {
            return failed(job, FailureKind.ENCODE, e, startMs);
        }

        log.debug("Resized {} -> {}", job.getSourcePath().getFileName(), job.getDestPath().getFileName());
        return JobOutcome.success(job, System.currentTimeMillis() - startMs);
    }

    private JobOutcome failed(ResizeJob job, FailureKind kind, Exception e, long startMs) {
        log.warn("Failed to resize {} ({}): {}", job.getSourcePath().getFileName(), kind, e.getMessage());
        log.debug("Failure detail for {}", job.getSourcePath(), e);
        return JobOutcome.failure(job, kind, e.getMessage(), System.currentTimeMillis() - startMs);
    }
}
