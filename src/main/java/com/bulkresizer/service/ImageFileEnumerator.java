package com.bulkresizer.service;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Lists the image files a batch should resize.
 */
@Service
public class ImageFileEnumerator {

    private static final String[] SUPPORTED_EXTENSIONS = { "jpg", "jpeg", "png" };

    /**
     * Lists candidate images under a directory. The listing is recomputed on
     * every call and sorted by path.
     *
     * @param root      directory to scan
     * @param recursive whether to descend into subdirectories
     * @return regular files with a supported extension that are not dotfiles
     * @throws IOException if the directory cannot be listed
     */
    public List<Path> enumerate(Path root, boolean recursive) throws IOException {
        try (Stream<Path> paths = recursive ? Files.walk(root) : Files.list(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(this::isSupportedImage)
                    .sorted()
                    .toList();
        }
    }

    /**
     * Returns true for a .jpg, .jpeg or .png name (any case) that does not start
     * with a dot.
     */
    public boolean isSupportedImage(Path path) {
        if (path == null || path.getFileName() == null)
            return false;
        String name = path.getFileName().toString();
        if (name.startsWith("."))
            return false;
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : SUPPORTED_EXTENSIONS) {
            if (lower.endsWith("." + ext))
                return true;
        }
        return false;
    }
}
