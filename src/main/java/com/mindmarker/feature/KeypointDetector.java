package com.mindmarker.feature;

import com.mindmarker.error.InternalException;

import java.util.List;

/**
 * Keypoint/descriptor capability. Any algorithm that yields position, angle, response,
 * size and a 32-byte binary descriptor per point can be plugged in.
 */
public interface KeypointDetector {

    /**
     * @param gray     8-bit grayscale pixels, row-major, {@code width * height} bytes
     * @param maxCount upper bound the detector should aim for
     * @return keypoints in detection order, possibly empty
     */
    List<DetectedKeypoint> detect(byte[] gray, int width, int height, int maxCount) throws InternalException;

    /**
     * A variant with looser thresholds, used for the single fallback re-extraction.
     */
    default KeypointDetector relaxed() {
        return this;
    }

    String name();
}
