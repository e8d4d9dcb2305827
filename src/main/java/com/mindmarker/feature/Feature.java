package com.mindmarker.feature;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;

/**
 * One trackable point in normalized image coordinates with its binary descriptor.
 */
@Getter
@EqualsAndHashCode
public class Feature {
    public static final int DESCRIPTOR_WIDTH = 32;

    private final float x, y;       // [0,1] relative to width / height
    private final float angle;      // degrees, [0,360)
    private final float response;   // >= 0
    private final float size;       // > 0
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] descriptor;

    public Feature(float x, float y, float angle, float response, float size, byte[] descriptor) {
        if (!(x >= 0f && x <= 1f) || !(y >= 0f && y <= 1f)) {
            throw new IllegalArgumentException("Position outside [0,1]: (" + x + ", " + y + ")");
        }
        if (!(angle >= 0f && angle < 360f)) {
            throw new IllegalArgumentException("Angle outside [0,360): " + angle);
        }
        if (!(response >= 0f)) {
            throw new IllegalArgumentException("Negative response: " + response);
        }
        if (!(size > 0f)) {
            throw new IllegalArgumentException("Size must be positive: " + size);
        }
        if (descriptor == null || descriptor.length != DESCRIPTOR_WIDTH) {
            throw new IllegalArgumentException("Descriptor must be " + DESCRIPTOR_WIDTH + " bytes");
        }
        this.x = x;
        this.y = y;
        this.angle = angle;
        this.response = response;
        this.size = size;
        this.descriptor = Arrays.copyOf(descriptor, descriptor.length);
    }

    public byte[] getDescriptor() {
        return Arrays.copyOf(descriptor, descriptor.length);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Feature[(%.4f, %.4f) angle=%.1f response=%.5f size=%.2f]",
                x, y, angle, response, size);
    }
}
