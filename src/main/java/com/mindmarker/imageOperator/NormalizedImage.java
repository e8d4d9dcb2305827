package com.mindmarker.imageOperator;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * Canonical working image: contrast enhanced, sharpened, long edge capped.
 * Holds its pixels on the Java heap so a pipeline call owns them outright.
 * <ul>
 *   <li>color: BGR, 3 bytes per pixel, row-major</li>
 *   <li>gray: 1 byte per pixel, row-major</li>
 * </ul>
 */
@Getter
public class NormalizedImage {
    private final int width;
    private final int height;
    private final int sourceWidth;
    private final int sourceHeight;
    @Getter(AccessLevel.NONE)
    private final byte[] color;
    @Getter(AccessLevel.NONE)
    private final byte[] gray;

    public NormalizedImage(int width, int height, int sourceWidth, int sourceHeight, byte[] color, byte[] gray) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (color.length != width * height * 3) {
            throw new IllegalArgumentException("Color buffer has " + color.length + " bytes, expected " + (width * height * 3));
        }
        if (gray.length != width * height) {
            throw new IllegalArgumentException("Gray buffer has " + gray.length + " bytes, expected " + (width * height));
        }
        this.width = width;
        this.height = height;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        this.color = Arrays.copyOf(color, color.length);
        this.gray = Arrays.copyOf(gray, gray.length);
    }

    public byte[] getColorPixels() {
        return Arrays.copyOf(color, color.length);
    }

    public byte[] getGrayPixels() {
        return Arrays.copyOf(gray, gray.length);
    }

    public int longEdge() {
        return Math.max(width, height);
    }

    public int shortEdge() {
        return Math.min(width, height);
    }

    public boolean wasResized() {
        return width != sourceWidth || height != sourceHeight;
    }

    @Override
    public String toString() {
        return String.format("NormalizedImage[%dx%d from %dx%d]", width, height, sourceWidth, sourceHeight);
    }
}
