package com.mindmarker.quality;

import com.mindmarker.feature.FeatureSet;
import com.mindmarker.imageOperator.ImageUtils;
import com.mindmarker.imageOperator.NormalizedImage;
import lombok.Getter;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.meanStdDev;
import static org.bytedeco.opencv.global.opencv_imgproc.Laplacian;

/**
 * Scores a normalized image against the minimum trackability thresholds.
 * Pure: the feature count comes from the caller's single extraction pass.
 */
@Getter
public class TrackabilityValidator {
    public static final String TOO_BLURRY = "Image too blurry";
    public static final String NOT_ENOUGH_FEATURES = "Not enough trackable features";
    public static final String TOO_SMALL = "Image too small";

    private final int minFeatures;
    private final double sharpnessThreshold;
    private final int minDimension;

    public TrackabilityValidator(int minFeatures, double sharpnessThreshold, int minDimension) {
        this.minFeatures = minFeatures;
        this.sharpnessThreshold = sharpnessThreshold;
        this.minDimension = minDimension;
    }

    public QualityReport validate(NormalizedImage image, FeatureSet features) {
        double sharpness = sharpness(image);
        List<String> issues = new ArrayList<>();
        int count = features.size();
        if (count < minFeatures) {
            issues.add(String.format("%s (%d found, need %d+)", NOT_ENOUGH_FEATURES, count, minFeatures));
        }
        addSharpnessIssue(sharpness, issues);
        addDimensionIssue(image, issues);
        return new QualityReport(count, sharpness, image.getWidth(), image.getHeight(), issues, true);
    }

    /**
     * Report for an image that never reached feature extraction (it is too small).
     */
    public QualityReport validateWithoutFeatures(NormalizedImage image) {
        double sharpness = sharpness(image);
        List<String> issues = new ArrayList<>();
        addSharpnessIssue(sharpness, issues);
        addDimensionIssue(image, issues);
        return new QualityReport(0, sharpness, image.getWidth(), image.getHeight(), issues, false);
    }

    public boolean isTooSmall(NormalizedImage image) {
        return image.getWidth() < minDimension || image.getHeight() < minDimension;
    }

    public boolean isBlurry(double sharpness) {
        return sharpness < sharpnessThreshold;
    }

    /**
     * Focus measure: population variance of the Laplacian response over the gray image.
     */
    public static double sharpness(NormalizedImage image) {
        Mat gray = ImageUtils.grayMat(image);
        Mat lap = new Mat();
        Mat mean = new Mat();
        Mat std = new Mat();
        try {
            Laplacian(gray, lap, CV_64F);
            meanStdDev(lap, mean, std);
            DoubleIndexer idx = std.createIndexer();
            double sd = idx.get(0);
            idx.release();
            return sd * sd;
        } finally {
            ImageUtils.release(gray, lap, mean, std);
        }
    }

    private void addSharpnessIssue(double sharpness, List<String> issues) {
        if (isBlurry(sharpness)) {
            issues.add(String.format(Locale.ROOT, "%s (sharpness: %.1f)", TOO_BLURRY, sharpness));
        }
    }

    private void addDimensionIssue(NormalizedImage image, List<String> issues) {
        if (isTooSmall(image)) {
            issues.add(String.format("%s (%dx%d, need %dx%d+)", TOO_SMALL,
                    image.getWidth(), image.getHeight(), minDimension, minDimension));
        }
    }
}
