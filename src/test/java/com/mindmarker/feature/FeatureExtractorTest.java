package com.mindmarker.feature;

import com.mindmarker.error.InternalException;
import com.mindmarker.imageOperator.NormalizedImage;
import com.mindmarker.testsupport.FakeKeypointDetector;
import com.mindmarker.testsupport.TestImages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mindmarker.testsupport.FakeKeypointDetector.keypoint;
import static org.junit.jupiter.api.Assertions.*;

/**
 * FeatureExtractorTest
 * -----------------------------------------------------------------------------
 * Ordering, capping and normalization around a canned detector.
 */
final class FeatureExtractorTest {
    private final NormalizedImage image = TestImages.normalizedSolid(400, 200, 128);

    @Test
    void sortsByDescendingResponseKeepingDetectionOrderOnTies() throws Exception {
        List<DetectedKeypoint> detected = List.of(
                keypoint(10, 10, 0.1f),
                keypoint(20, 20, 0.5f),
                keypoint(30, 30, 0.1f),
                keypoint(40, 40, 0.9f));
        FeatureSet set = new FeatureExtractor(new FakeKeypointDetector(detected)).extract(image, 10);

        assertEquals(4, set.size());
        assertEquals(0.9f, set.get(0).getResponse());
        assertEquals(0.5f, set.get(1).getResponse());
        // tie: (10,10) was detected before (30,30)
        assertEquals(10f / 400f, set.get(2).getX());
        assertEquals(30f / 400f, set.get(3).getX());
    }

    @Test
    void truncatesToMaxFeaturesKeepingStrongest() throws Exception {
        List<DetectedKeypoint> detected = FakeKeypointDetector.spread(120, 400, 200);
        FeatureSet set = new FeatureExtractor(new FakeKeypointDetector(detected)).extract(image, 50);

        assertEquals(50, set.size());
        assertEquals(0.001f * 120, set.get(0).getResponse(), 1e-7);
        for (int i = 1; i < set.size(); i++) {
            assertTrue(set.get(i - 1).getResponse() >= set.get(i).getResponse());
        }
    }

    @Test
    void normalizesCoordinatesByWidthAndHeight() throws Exception {
        FeatureSet set = new FeatureExtractor(new FakeKeypointDetector(List.of(keypoint(100, 50, 1f))))
                .extract(image, 10);

        assertEquals(0.25f, set.get(0).getX());
        assertEquals(0.25f, set.get(0).getY());
    }

    @Test
    void emptyDetectionGivesEmptySetNotFailure() throws Exception {
        FeatureSet set = new FeatureExtractor(new FakeKeypointDetector(List.of())).extract(image, 500);
        assertTrue(set.isEmpty());
        assertTrue(set.isInsufficient(50));
    }

    @Test
    void relaxedExtractionUsesRelaxedDetector() throws Exception {
        FakeKeypointDetector detector = new FakeKeypointDetector(List.of(), FakeKeypointDetector.spread(60, 400, 200));
        FeatureExtractor extractor = new FeatureExtractor(detector);

        assertEquals(60, extractor.extractRelaxed(image, 500).size());
        assertEquals(0, detector.calls.get());
        assertEquals(1, detector.relaxedCalls.get());
    }

    @Test
    void wrongDescriptorWidthIsInternalError() {
        DetectedKeypoint bad = new DetectedKeypoint(1, 1, 0, 1, 1, new byte[16]);
        FeatureExtractor extractor = new FeatureExtractor(new FakeKeypointDetector(List.of(bad)));
        assertThrows(InternalException.class, () -> extractor.extract(image, 10));
    }

    @Test
    void sanitizesDetectorValues() throws Exception {
        DetectedKeypoint odd = new DetectedKeypoint(-3, 999, -90, -1, 0, FakeKeypointDetector.descriptor(1));
        Feature f = FeatureExtractor.toFeature(odd, 400, 200);

        assertEquals(0f, f.getX());
        assertEquals(1f, f.getY());
        assertEquals(270f, f.getAngle());
        assertEquals(0f, f.getResponse());
        assertEquals(1f, f.getSize());
    }

    @Test
    void wrapsAnglesIntoHalfOpenRange() {
        assertEquals(0f, FeatureExtractor.wrapAngle(360f));
        assertEquals(10f, FeatureExtractor.wrapAngle(730f));
        assertEquals(350f, FeatureExtractor.wrapAngle(-10f));
        assertEquals(0f, FeatureExtractor.wrapAngle(Float.NaN));
    }
}
