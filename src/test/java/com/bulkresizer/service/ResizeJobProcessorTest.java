package com.bulkresizer.service;

import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.JobOutcome.FailureKind;
import com.bulkresizer.model.ResizeJob;
import com.bulkresizer.model.ResizeParams;
import com.bulkresizer.support.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResizeJobProcessorTest {

    private final ResizeJobProcessor processor =
            new ResizeJobProcessor(new ImageDecoder(), new ImageTransformer(), new JpegImageWriter());

    private final ResizeParams params = ResizeParams.builder(40, 30).outputQuality(90).build();

    @TempDir
    Path dir;

    @Test
    void should_WriteJpegWithTargetSize_When_SourceIsValid() throws IOException {
        Path source = TestImages.writePng(dir.resolve("in.png"), 200, 100);
        Path dest = dir.resolve("out.png");

        JobOutcome outcome = processor.process(new ResizeJob(source, dest, params));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getFailureKind()).isNull();
        BufferedImage written = TestImages.read(dest);
        assertThat(written.getWidth()).isEqualTo(40);
        assertThat(written.getHeight()).isEqualTo(30);
        // JPEG start-of-image marker, whatever the file name says
        byte[] bytes = Files.readAllBytes(dest);
        assertThat(bytes[0]).isEqualTo((byte) 0xFF);
        assertThat(bytes[1]).isEqualTo((byte) 0xD8);
    }

    @Test
    void should_ReportDecodeFailure_When_SourceIsCorrupt() throws IOException {
        Path source = TestImages.writeGarbage(dir.resolve("broken.jpg"));
        Path dest = dir.resolve("broken-out.jpg");

        JobOutcome outcome = processor.process(new ResizeJob(source, dest, params));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.DECODE);
        assertThat(outcome.getErrorMessage()).contains("broken.jpg");
        assertThat(dest).doesNotExist();
    }

    @Test
    void should_ReportDecodeFailure_When_SourceIsMissing() {
        JobOutcome outcome = processor.process(
                new ResizeJob(dir.resolve("nope.jpg"), dir.resolve("out.jpg"), params));

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.DECODE);
    }

    @Test
    void should_ReportEncodeFailure_When_DestinationDirectoryIsMissing() throws IOException {
        Path source = TestImages.writeJpeg(dir.resolve("in.jpg"), 50, 50);

        JobOutcome outcome = processor.process(
                new ResizeJob(source, dir.resolve("missing/out.jpg"), params));

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.ENCODE);
    }

    @Test
    void should_ReportEncodeFailure_When_QualityIsRejectedByEncoder() throws IOException {
        Path source = TestImages.writeJpeg(dir.resolve("in.jpg"), 50, 50);
        ResizeParams badQuality = ResizeParams.builder(10, 10).outputQuality(150).build();

        JobOutcome outcome = processor.process(new ResizeJob(source, dir.resolve("out.jpg"), badQuality));

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.ENCODE);
        assertThat(dir.resolve("out.jpg")).doesNotExist();
    }

    @Test
    void should_ReportTransformFailure_When_TransformThrows() throws IOException {
        ImageTransformer failing = mock(ImageTransformer.class);
        when(failing.transform(any(), any())).thenThrow(new IllegalStateException("boom"));
        ResizeJobProcessor withFailingTransform =
                new ResizeJobProcessor(new ImageDecoder(), failing, new JpegImageWriter());
        Path source = TestImages.writeJpeg(dir.resolve("in.jpg"), 50, 50);

        JobOutcome outcome = withFailingTransform.process(new ResizeJob(source, dir.resolve("out.jpg"), params));

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.TRANSFORM);
        assertThat(outcome.getErrorMessage()).isEqualTo("boom");
    }
}
