package com.mindmarker.feature;

import com.mindmarker.error.InternalException;
import com.mindmarker.imageOperator.NormalizedImage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns detector output into a canonical {@link FeatureSet}: strongest first, capped,
 * coordinates normalized to [0,1].
 */
@Slf4j
public class FeatureExtractor {
    // List.sort is stable, so equal responses keep detection order.
    private static final Comparator<DetectedKeypoint> BY_RESPONSE_DESC =
            (a, b) -> Float.compare(b.getResponse(), a.getResponse());

    @Getter
    private final KeypointDetector detector;

    public FeatureExtractor(KeypointDetector detector) {
        this.detector = detector;
    }

    public FeatureSet extract(NormalizedImage image, int maxFeatures) throws InternalException {
        return extractWith(detector, image, maxFeatures);
    }

    public FeatureSet extractRelaxed(NormalizedImage image, int maxFeatures) throws InternalException {
        return extractWith(detector.relaxed(), image, maxFeatures);
    }

    private static FeatureSet extractWith(KeypointDetector det, NormalizedImage image, int maxFeatures)
            throws InternalException {
        if (maxFeatures <= 0) return FeatureSet.empty();
        List<DetectedKeypoint> detected = det.detect(image.getGrayPixels(), image.getWidth(), image.getHeight(), maxFeatures);
        if (detected.isEmpty()) {
            log.debug("{} found no keypoints on {}", det.name(), image);
            return FeatureSet.empty();
        }

        List<DetectedKeypoint> sorted = new ArrayList<>(detected);
        sorted.sort(BY_RESPONSE_DESC);
        if (sorted.size() > maxFeatures) sorted = sorted.subList(0, maxFeatures);

        List<Feature> features = new ArrayList<>(sorted.size());
        for (DetectedKeypoint kp : sorted) {
            features.add(toFeature(kp, image.getWidth(), image.getHeight()));
        }
        return FeatureSet.of(features);
    }

    static Feature toFeature(DetectedKeypoint kp, int width, int height) throws InternalException {
        if (kp.descriptorLength() != Feature.DESCRIPTOR_WIDTH) {
            throw new InternalException("Detector returned a descriptor of "
                    + kp.descriptorLength() + " bytes, expected " + Feature.DESCRIPTOR_WIDTH);
        }
        float x = clampUnit(kp.getX() / width);
        float y = clampUnit(kp.getY() / height);
        float response = Float.isNaN(kp.getResponse()) ? 0f : Math.max(0f, kp.getResponse());
        float size = kp.getSize() > 0f ? kp.getSize() : 1f;
        return new Feature(x, y, wrapAngle(kp.getAngle()), response, size, kp.getDescriptor());
    }

    static float clampUnit(float v) {
        if (Float.isNaN(v) || v < 0f) return 0f;
        return Math.min(v, 1f);
    }

    static float wrapAngle(float degrees) {
        if (Float.isNaN(degrees) || Float.isInfinite(degrees)) return 0f;
        float a = degrees % 360f;
        if (a < 0f) a += 360f;
        // -1e-8f % 360 + 360 rounds to exactly 360
        return a >= 360f ? 0f : a;
    }
}
