package com.bulkresizer.service;

import com.bulkresizer.model.ResampleFilter;
import com.bulkresizer.model.ResizeParams;
import net.coobird.thumbnailator.resizers.Resizer;
import net.coobird.thumbnailator.resizers.Resizers;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.function.IntToDoubleFunction;

/**
 * Turns a decoded image into the image that gets written for a job.
 *
 * Three modes:
 * - stretch to exactly the target size (aspect ratio not kept)
 * - scale to fit inside the target box, never upscaling (thumbnail style)
 * - scale to fit, then paste at the top-left of a black canvas of the target size
 *
 * The result is always TYPE_INT_RGB so it can go straight to the JPEG encoder.
 * Transparent pixels end up over black. The source image is never modified.
 */
@Service
public class ImageTransformer {

    /**
     * Applies the resize settings to an image.
     *
     * @param source decoded source image
     * @param params resize settings for the batch
     * @return a new RGB image
     */
    public BufferedImage transform(BufferedImage source, ResizeParams params) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(params, "params");

        BufferedImage rgb = toRgb(source);
        int targetWidth = params.getTargetWidth();
        int targetHeight = params.getTargetHeight();

        if (!params.isKeepAspectRatio()) {
            return resize(rgb, targetWidth, targetHeight, params.getResampleFilter());
        }

        Dimension size = scaledSize(rgb.getWidth(), rgb.getHeight(), targetWidth, targetHeight);
        BufferedImage scaled = size.width == rgb.getWidth() && size.height == rgb.getHeight()
                ? rgb
                : resize(rgb, size.width, size.height, params.getResampleFilter());

        if (!params.isAddPadding()) {
            return scaled;
        }
        return pad(scaled, targetWidth, targetHeight);
    }

    /**
     * Size of an image scaled to fit inside the target box with its aspect ratio
     * kept. An image that already fits is left at its own size. Otherwise one
     * side equals the matching target side and the other is rounded to whichever
     * whole pixel count keeps the ratio closest.
     */
    public static Dimension scaledSize(int width, int height, int targetWidth, int targetHeight) {
        if (targetWidth >= width && targetHeight >= height) {
            return new Dimension(width, height);
        }
        double aspect = (double) width / height;
        if ((double) targetWidth / targetHeight >= aspect) {
            int scaledWidth = closestToAspect(targetHeight * aspect,
                    n -> Math.abs(aspect - (double) n / targetHeight));
            return new Dimension(scaledWidth, targetHeight);
        }
        int scaledHeight = closestToAspect(targetWidth / aspect,
                n -> n == 0 ? 0 : Math.abs(aspect - (double) targetWidth / n));
        return new Dimension(targetWidth, scaledHeight);
    }

    /**
     * Copies any image into a new TYPE_INT_RGB image over a black background.
     */
    public static BufferedImage toRgb(BufferedImage source) {
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(source, 0, 0, Color.BLACK, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * Maps a filter to the Thumbnailator resizer that implements it. NEAREST and
     * LANCZOS are local resizers; Thumbnailator ships neither kernel.
     */
    static Resizer resizerFor(ResampleFilter filter) {
        switch (filter) {
            case BILINEAR:
                return Resizers.BILINEAR;
            case BICUBIC:
                return Resizers.BICUBIC;
            case LANCZOS:
                return LanczosResizer.INSTANCE;
            case NEAREST:
            default:
                return NearestNeighborResizer.INSTANCE;
        }
    }

    private static BufferedImage resize(BufferedImage rgb, int width, int height, ResampleFilter filter) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        resizerFor(filter).resize(rgb, resized);
        return resized;
    }

    private static BufferedImage pad(BufferedImage scaled, int width, int height) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            g.drawImage(scaled, 0, 0, null);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    // Ties go to the floor value.
    private static int closestToAspect(double exact, IntToDoubleFunction error) {
        int floor = (int) Math.floor(exact);
        int ceil = (int) Math.ceil(exact);
        int best = error.applyAsDouble(ceil) < error.applyAsDouble(floor) ? ceil : floor;
        return Math.max(best, 1);
    }
}
