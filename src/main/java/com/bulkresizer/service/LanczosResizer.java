package com.bulkresizer.service;

import com.mortennobel.imagescaling.ResampleFilters;
import com.mortennobel.imagescaling.ResampleOp;
import net.coobird.thumbnailator.resizers.Resizer;
import net.coobird.thumbnailator.resizers.Resizers;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Thumbnailator resizer backed by the Lanczos3 kernel of java-image-scaling.
 *
 * ResampleOp refuses targets smaller than 3x3, so those fall back to
 * Thumbnailator's bicubic resizer.
 */
public class LanczosResizer implements Resizer {

    public static final LanczosResizer INSTANCE = new LanczosResizer();

    static final int MIN_TARGET_SIZE = 3;

    @Override
    public void resize(BufferedImage srcImage, BufferedImage destImage) {
        int width = destImage.getWidth();
        int height = destImage.getHeight();
        if (width < MIN_TARGET_SIZE || height < MIN_TARGET_SIZE) {
            Resizers.BICUBIC.resize(srcImage, destImage);
            return;
        }

        ResampleOp op = new ResampleOp(width, height);
        op.setFilter(ResampleFilters.getLanczos3Filter());
        BufferedImage resampled = op.filter(srcImage, null);

        Graphics2D g = destImage.createGraphics();
        try {
            g.drawImage(resampled, 0, 0, null);
        } finally {
            g.dispose();
        }
    }
}
