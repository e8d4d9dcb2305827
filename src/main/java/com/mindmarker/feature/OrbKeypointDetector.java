package com.mindmarker.feature;

import com.mindmarker.error.InternalException;
import com.mindmarker.imageOperator.ImageUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.ORB;

import java.util.ArrayList;
import java.util.List;

/**
 * ORB from OpenCV: oriented FAST corners with rotated BRIEF, 32-byte descriptors.
 */
@Slf4j
@Getter
public class OrbKeypointDetector implements KeypointDetector {
    private final float scaleFactor;
    private final int levels;
    private final int edgeThreshold;
    private final int fastThreshold;
    private final int relaxedEdgeThreshold;
    private final int relaxedFastThreshold;

    public OrbKeypointDetector(float scaleFactor, int levels, int edgeThreshold, int fastThreshold,
                               int relaxedEdgeThreshold, int relaxedFastThreshold) {
        this.scaleFactor = scaleFactor;
        this.levels = levels;
        this.edgeThreshold = edgeThreshold;
        this.fastThreshold = fastThreshold;
        this.relaxedEdgeThreshold = relaxedEdgeThreshold;
        this.relaxedFastThreshold = relaxedFastThreshold;
    }

    public static OrbKeypointDetector withDefaults() {
        return new OrbKeypointDetector(1.2f, 8, 31, 20, 15, 5);
    }

    @Override
    public List<DetectedKeypoint> detect(byte[] gray, int width, int height, int maxCount) throws InternalException {
        if (maxCount <= 0) return List.of();
        Mat image = ImageUtils.grayMat(gray, width, height);
        Mat mask = new Mat();
        Mat descriptors = new Mat();
        KeyPointVector keypoints = new KeyPointVector();
        ORB orb = ORB.create();
        try {
            orb.setMaxFeatures(maxCount);
            orb.setScaleFactor(scaleFactor);
            orb.setNLevels(levels);
            orb.setEdgeThreshold(edgeThreshold);
            orb.setPatchSize(edgeThreshold);
            orb.setFastThreshold(fastThreshold);
            orb.detectAndCompute(image, mask, keypoints, descriptors);

            int n = (int) keypoints.size();
            if (n == 0 || descriptors.empty()) return List.of();
            if (descriptors.cols() != Feature.DESCRIPTOR_WIDTH || descriptors.rows() != n) {
                throw new InternalException("ORB produced " + descriptors.rows() + "x" + descriptors.cols()
                        + " descriptors for " + n + " keypoints");
            }
            byte[] raw = ImageUtils.toBytes(descriptors);

            List<DetectedKeypoint> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                KeyPoint kp = keypoints.get(i);
                byte[] desc = new byte[Feature.DESCRIPTOR_WIDTH];
                System.arraycopy(raw, i * Feature.DESCRIPTOR_WIDTH, desc, 0, Feature.DESCRIPTOR_WIDTH);
                out.add(new DetectedKeypoint(kp.pt().x(), kp.pt().y(), kp.angle(), kp.response(), kp.size(), desc));
            }
            log.debug("ORB(fast={}, edge={}) found {} keypoints on {}x{}", fastThreshold, edgeThreshold, n, width, height);
            return out;
        } catch (RuntimeException e) {
            throw new InternalException("ORB detection failed: " + e.getMessage(), e);
        } finally {
            ImageUtils.release(image, mask, descriptors);
            keypoints.close();
            orb.close();
        }
    }

    @Override
    public KeypointDetector relaxed() {
        return new OrbKeypointDetector(scaleFactor, levels, relaxedEdgeThreshold, relaxedFastThreshold,
                relaxedEdgeThreshold, relaxedFastThreshold);
    }

    @Override
    public String name() {
        return "ORB";
    }
}
