package com.mindmarker.quality;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of scoring one image for trackability. Immutable.
 */
@Getter
@ToString
@EqualsAndHashCode
public class QualityReport {
    public static final String GOOD = "Good for AR tracking";
    public static final String IMPROVE = "Improve image quality for better tracking";

    private final int featureCount;
    private final double sharpness;
    private final int width;
    private final int height;
    private final boolean valid;
    private final List<String> issues;
    private final boolean featuresEvaluated;

    public QualityReport(int featureCount, double sharpness, int width, int height,
                         List<String> issues, boolean featuresEvaluated) {
        if (featureCount < 0) throw new IllegalArgumentException("featureCount < 0");
        if (sharpness < 0 || Double.isNaN(sharpness)) throw new IllegalArgumentException("sharpness must be >= 0");
        this.featureCount = featureCount;
        this.sharpness = sharpness;
        this.width = width;
        this.height = height;
        this.issues = List.copyOf(issues);
        this.valid = this.issues.isEmpty();
        this.featuresEvaluated = featuresEvaluated;
    }

    public String recommendation() {
        return valid ? GOOD : IMPROVE;
    }

    public boolean hasIssueContaining(String fragment) {
        return issues.stream().anyMatch(i -> i.contains(fragment));
    }
}
