package com.mindmarker.fallback;

import com.mindmarker.error.InternalException;
import com.mindmarker.error.QualityException;
import com.mindmarker.feature.FeatureExtractor;
import com.mindmarker.feature.FeatureSet;
import com.mindmarker.imageOperator.NormalizedImage;
import com.mindmarker.markerFile.MarkerTarget;
import com.mindmarker.quality.QualityReport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decides what gets encoded when extraction comes up short.
 *
 * <pre>
 *   ACCEPTED  -> extracted features
 *   MARGINAL  -> (a) one relaxed re-extraction
 *                (b) synthetic grid, flagged degraded
 *                (c) cached reference target, flagged degraded (only when the grid is off)
 *                otherwise REJECTED
 *   REJECTED  -> QualityException, no file
 * </pre>
 * One pass per request: the relaxed re-extraction is attempted at most once.
 */
@Slf4j
@Getter
public class FallbackStrategy {
    private final FeatureExtractor extractor;
    private final int minFeatures;
    private final int maxFeatures;
    private final boolean syntheticGridEnabled;
    private final int gridSize;
    private final ReferenceTargetProvider referenceTargets;

    public FallbackStrategy(FeatureExtractor extractor, int minFeatures, int maxFeatures,
                            boolean syntheticGridEnabled, int gridSize, ReferenceTargetProvider referenceTargets) {
        if (gridSize <= 0 || (long) gridSize * gridSize > maxFeatures) {
            throw new IllegalArgumentException("gridSize " + gridSize + " does not fit within " + maxFeatures + " features");
        }
        this.extractor = extractor;
        this.minFeatures = minFeatures;
        this.maxFeatures = maxFeatures;
        this.syntheticGridEnabled = syntheticGridEnabled;
        this.gridSize = gridSize;
        this.referenceTargets = referenceTargets == null ? ReferenceTargetProvider.NONE : referenceTargets;
    }

    public FallbackState classify(QualityReport report, FeatureSet extracted) {
        if (!report.isFeaturesEvaluated()) return FallbackState.REJECTED;
        return extracted.isInsufficient(minFeatures) ? FallbackState.MARGINAL : FallbackState.ACCEPTED;
    }

    public FallbackOutcome resolve(NormalizedImage image, QualityReport report, FeatureSet extracted)
            throws QualityException, InternalException {
        FallbackState state = classify(report, extracted);
        switch (state) {
            case ACCEPTED:
                return FallbackOutcome.accepted(extracted);
            case MARGINAL:
                return recover(image, report, extracted);
            default:
                throw reject(report, "Image was not evaluated for features");
        }
    }

    private FallbackOutcome recover(NormalizedImage image, QualityReport report, FeatureSet extracted)
            throws QualityException, InternalException {
        log.info("Only {} features (need {}), retrying with relaxed detector", extracted.size(), minFeatures);
        FeatureSet relaxed = extractor.extractRelaxed(image, maxFeatures);
        if (!relaxed.isInsufficient(minFeatures)) {
            return FallbackOutcome.marginal(FeatureSource.RELAXED_EXTRACTION, relaxed,
                    relaxed.size() + " features after relaxed re-extraction");
        }

        if (syntheticGridEnabled) {
            log.warn("Relaxed extraction found {} features, emitting {}x{} synthetic grid", relaxed.size(), gridSize, gridSize);
            return FallbackOutcome.marginal(FeatureSource.SYNTHETIC_GRID, SyntheticGrid.generate(gridSize),
                    "synthetic " + gridSize + "x" + gridSize + " grid, tracking quality is degraded");
        }

        Optional<MarkerTarget> reference = referenceTargets.load();
        if (reference.isPresent()) {
            log.warn("Relaxed extraction found {} features, substituting reference target", relaxed.size());
            return FallbackOutcome.reference(reference.get(),
                    "reference target substituted, features do not describe the uploaded image");
        }

        throw reject(report, String.format("Not enough trackable features (%d found, %d after relaxed extraction, need %d+)",
                extracted.size(), relaxed.size(), minFeatures));
    }

    private static QualityException reject(QualityReport report, String reason) {
        log.info("Fallback rejected: {}", reason);
        return new QualityException(reason, report);
    }
}
