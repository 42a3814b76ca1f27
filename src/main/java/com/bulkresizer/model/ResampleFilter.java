package com.bulkresizer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Interpolation kernel used when scaling pixel data.
 */
public enum ResampleFilter {

    NEAREST, BILINEAR, BICUBIC, LANCZOS;

    private static final Logger log = LoggerFactory.getLogger(ResampleFilter.class);

    /**
     * Looks up a filter by name, ignoring case and surrounding whitespace.
     *
     * @param name filter name as typed by the user
     * @return the filter, or empty if the name is unknown or blank
     */
    public static Optional<ResampleFilter> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ResampleFilter filter : values()) {
            if (filter.name().equals(normalized)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a filter name once, when run parameters are built. Unknown names
     * fall back to {@link #NEAREST} with a warning; this is never fatal.
     */
    public static ResampleFilter resolve(String name) {
        return fromName(name).orElseGet(() -> {
            log.warn("Invalid resample filter '{}'; using NEAREST", name);
            return NEAREST;
        });
    }
}
