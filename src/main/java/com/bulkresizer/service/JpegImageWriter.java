package com.bulkresizer.service;

import com.bulkresizer.exception.ImageEncodeException;
import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Encodes an image as JPEG at an exact destination path, replacing any existing
 * file. The destination name is used as given, whatever its extension.
 *
 * The JPEG is first written to a hidden temporary file next to the destination
 * and then moved over it, so the destination only ever holds a complete image.
 * Two jobs writing the same name leave one of the two images intact.
 */
@Service
public class JpegImageWriter {

    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * @param image   RGB image to encode
     * @param dest    file to write; its parent directory must already exist
     * @param quality JPEG quality on the 0-100 scale
     * @throws ImageEncodeException if the quality is rejected by the encoder or
     *                              the file cannot be written
     */
    public void write(BufferedImage image, Path dest, int quality) throws ImageEncodeException {
        Thumbnails.Builder<BufferedImage> builder;
        try {
            builder = Thumbnails.of(image)
                    .scale(1.0)
                    .imageType(BufferedImage.TYPE_INT_RGB)
                    .outputFormat("jpg")
                    .outputQuality(quality / 100f);
        } catch (IllegalArgumentException e) {
            throw new ImageEncodeException("Invalid JPEG quality " + quality + " for " + dest, e);
        }

        Path target = dest.toAbsolutePath();
        Path temp;
        try {
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), TEMP_SUFFIX);
        } catch (IOException e) {
            throw new ImageEncodeException("Cannot write " + dest + ": " + e.getMessage(), e);
        }

        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                builder.toOutputStream(out);
            }
            moveIntoPlace(temp, target);
        } catch (IOException | RuntimeException e) {
            ImageEncodeException failure = new ImageEncodeException("Cannot write " + dest + ": " + e.getMessage(), e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
