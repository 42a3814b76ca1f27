package com.bulkresizer.service;

import com.bulkresizer.exception.ImageDecodeException;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a source file into memory with ImageIO.
 */
@Service
public class ImageDecoder {

    /**
     * @param path image file to read
     * @return the decoded image
     * @throws ImageDecodeException if the file cannot be read or is not a
     *                              supported image
     */
    public BufferedImage read(Path path) throws ImageDecodeException {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Cannot read image " + path + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Not a readable image: " + path);
        }
        return image;
    }
}
