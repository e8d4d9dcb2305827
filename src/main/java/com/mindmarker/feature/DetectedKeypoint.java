package com.mindmarker.feature;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * Raw detector output in pixel coordinates, before normalization.
 */
@Getter
public class DetectedKeypoint {
    final float x, y;
    private final float angle;
    private final float response;
    private final float size;
    @Getter(AccessLevel.NONE)
    private final byte[] descriptor;

    public DetectedKeypoint(float x, float y, float angle, float response, float size, byte[] descriptor) {
        this.x = x;
        this.y = y;
        this.angle = angle;
        this.response = response;
        this.size = size;
        this.descriptor = descriptor == null ? null : Arrays.copyOf(descriptor, descriptor.length);
    }

    /**
     * Copy of the descriptor bytes, or {@code null} if the detector produced none.
     */
    public byte[] getDescriptor() {
        return descriptor == null ? null : Arrays.copyOf(descriptor, descriptor.length);
    }

    int descriptorLength() {
        return descriptor == null ? 0 : descriptor.length;
    }

    @Override
    public String toString() {
        return String.format("Keypoint at (%.2f, %.2f) angle=%.1f response=%.5f size=%.1f",
                x, y, angle, response, size);
    }
}
