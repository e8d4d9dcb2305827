package com.mindmarker.compiler;

import com.mindmarker.markerFile.MarkerTarget;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-request target metadata written into the marker file.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CompileOptions {
    private static final CompileOptions DEFAULTS =
            new CompileOptions(0, MarkerTarget.DEFAULT_PHYSICAL_SIZE, MarkerTarget.DEFAULT_PHYSICAL_SIZE);

    private final int targetId;
    private final float physicalWidth;
    private final float physicalHeight;

    public CompileOptions(int targetId, float physicalWidth, float physicalHeight) {
        if (!(physicalWidth > 0f) || Float.isInfinite(physicalWidth)
                || !(physicalHeight > 0f) || Float.isInfinite(physicalHeight)) {
            throw new IllegalArgumentException("Physical size must be finite and positive: "
                    + physicalWidth + "x" + physicalHeight);
        }
        this.targetId = targetId;
        this.physicalWidth = physicalWidth;
        this.physicalHeight = physicalHeight;
    }

    public static CompileOptions defaults() {
        return DEFAULTS;
    }
}
