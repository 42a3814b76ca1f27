package com.bulkresizer.model;

import java.util.Objects;

/**
 * Resize settings shared read-only by every job of a batch.
 *
 * Padding only has a visible effect when the aspect ratio is kept; a stretched
 * image already has the exact target size.
 */
public final class ResizeParams {

    private final int targetWidth;
    private final int targetHeight;
    private final boolean keepAspectRatio;
    private final boolean addPadding;
    private final ResampleFilter resampleFilter;
    private final int outputQuality;

    private ResizeParams(Builder builder) {
        if (builder.targetWidth <= 0 || builder.targetHeight <= 0) {
            throw new IllegalArgumentException("Target size must be positive, got "
                    + builder.targetWidth + "x" + builder.targetHeight);
        }
        this.targetWidth = builder.targetWidth;
        this.targetHeight = builder.targetHeight;
        this.keepAspectRatio = builder.keepAspectRatio;
        this.addPadding = builder.addPadding;
        this.resampleFilter = Objects.requireNonNull(builder.resampleFilter, "resampleFilter");
        this.outputQuality = builder.outputQuality;
    }

    public static Builder builder(int targetWidth, int targetHeight) {
        return new Builder(targetWidth, targetHeight);
    }

    public int getTargetWidth() {
        return targetWidth;
    }

    public int getTargetHeight() {
        return targetHeight;
    }

    public boolean isKeepAspectRatio() {
        return keepAspectRatio;
    }

    public boolean isAddPadding() {
        return addPadding;
    }

    /** True when the output is padded to the exact target size */
    public boolean isPaddingEffective() {
        return keepAspectRatio && addPadding;
    }

    public ResampleFilter getResampleFilter() {
        return resampleFilter;
    }

    /** JPEG quality; values outside 1-95 are handed to the encoder as-is */
    public int getOutputQuality() {
        return outputQuality;
    }

    @Override
    public String toString() {
        return "ResizeParams{" + targetWidth + "x" + targetHeight
                + ", keepAspectRatio=" + keepAspectRatio
                + ", addPadding=" + addPadding
                + ", filter=" + resampleFilter
                + ", quality=" + outputQuality + "}";
    }

    public static final class Builder {

        private final int targetWidth;
        private final int targetHeight;
        private boolean keepAspectRatio = false;
        private boolean addPadding = false;
        private ResampleFilter resampleFilter = ResampleFilter.NEAREST;
        private int outputQuality = 80;

        private Builder(int targetWidth, int targetHeight) {
            this.targetWidth = targetWidth;
            this.targetHeight = targetHeight;
        }

        public Builder keepAspectRatio(boolean keepAspectRatio) {
            this.keepAspectRatio = keepAspectRatio;
            return this;
        }

        public Builder addPadding(boolean addPadding) {
            this.addPadding = addPadding;
            return this;
        }

        public Builder resampleFilter(ResampleFilter resampleFilter) {
            this.resampleFilter = resampleFilter;
            return this;
        }

        public Builder outputQuality(int outputQuality) {
            this.outputQuality = outputQuality;
            return this;
        }

        public ResizeParams build() {
            return new ResizeParams(this);
        }
    }
}
