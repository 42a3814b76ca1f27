package com.bulkresizer.service;

import net.coobird.thumbnailator.resizers.Resizer;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Thumbnailator resizer using nearest-neighbour sampling, which the library
 * itself does not ship.
 */
public class NearestNeighborResizer implements Resizer {

    public static final NearestNeighborResizer INSTANCE = new NearestNeighborResizer();

    @Override
    public void resize(BufferedImage srcImage, BufferedImage destImage) {
        Graphics2D g = destImage.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_SPEED);
            g.drawImage(srcImage, 0, 0, destImage.getWidth(), destImage.getHeight(), null);
        } finally {
            g.dispose();
        }
    }
}
