package com.mindmarker.markerFile;

import com.mindmarker.feature.FeatureSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * One logical AR target: identity, declared physical size, embedded image and its features.
 */
@Getter
@EqualsAndHashCode
public class MarkerTarget {
    public static final float DEFAULT_PHYSICAL_SIZE = 1.0f;

    private final int targetId;           // unsigned on the wire
    private final float physicalWidth;
    private final float physicalHeight;
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] imagePayload;
    private final FeatureSet features;

    public MarkerTarget(int targetId, float physicalWidth, float physicalHeight, byte[] imagePayload, FeatureSet features) {
        if (imagePayload == null) throw new IllegalArgumentException("imagePayload is required");
        if (features == null) throw new IllegalArgumentException("features are required");
        this.targetId = targetId;
        this.physicalWidth = physicalWidth;
        this.physicalHeight = physicalHeight;
        this.imagePayload = Arrays.copyOf(imagePayload, imagePayload.length);
        this.features = features;
    }

    public byte[] getImagePayload() {
        return Arrays.copyOf(imagePayload, imagePayload.length);
    }

    public int getImagePayloadSize() {
        return imagePayload.length;
    }

    public long unsignedTargetId() {
        return Integer.toUnsignedLong(targetId);
    }

    @Override
    public String toString() {
        return String.format("MarkerTarget[id=%d, %.3fx%.3f, payload=%d bytes, %d features]",
                unsignedTargetId(), physicalWidth, physicalHeight, imagePayload.length, features.size());
    }
}
