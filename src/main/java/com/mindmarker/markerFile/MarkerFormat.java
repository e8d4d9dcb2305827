package com.mindmarker.markerFile;

import com.mindmarker.feature.Feature;

import java.nio.charset.StandardCharsets;

/**
 * Layout constants of the marker file, version 1. Little-endian throughout.
 *
 * <pre>
 *  0  magic          8 bytes  "MINDAR\0\0"
 *  8  version        uint32
 * 12  target_count   uint32
 *     per target:
 *       target_id      uint32
 *       target_width   float32
 *       target_height  float32
 *       image_size     uint32
 *       image_data     image_size bytes
 *       feature_count  uint32
 *       features       feature_count x 20 bytes (x, y, angle, response, size)
 *       descriptors    feature_count x 32 bytes
 *     terminator     uint32   0xFFFFFFFF
 * </pre>
 */
public final class MarkerFormat {
    private MarkerFormat() {
    }

    public static final byte[] MAGIC = "MINDAR\0\0".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION = 1;
    public static final int TERMINATOR = 0xFFFFFFFF;

    public static final int HEADER_SIZE = MAGIC.length + 4 + 4;
    public static final int TARGET_HEADER_SIZE = 4 + 4 + 4 + 4;
    public static final int FEATURE_RECORD_SIZE = 5 * 4;
    public static final int DESCRIPTOR_WIDTH = Feature.DESCRIPTOR_WIDTH;

    public static final int MAGIC_OFFSET = 0;
    public static final int VERSION_OFFSET = 8;
    public static final int TARGET_COUNT_OFFSET = 12;
    public static final int FIRST_TARGET_OFFSET = HEADER_SIZE;

    /**
     * Bytes a single target block occupies.
     */
    public static long targetBlockSize(int imageSize, int featureCount) {
        return TARGET_HEADER_SIZE + (long) imageSize + 4
                + (long) featureCount * (FEATURE_RECORD_SIZE + DESCRIPTOR_WIDTH);
    }
}
