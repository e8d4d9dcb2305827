package com.mindmarker.fallback;

import com.mindmarker.feature.FeatureSet;
import com.mindmarker.markerFile.MarkerTarget;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * What the fallback decided to emit. {@link #isDegraded()} is the flag downstream
 * consumers must surface: tracking quality will be poor or unrelated to the photo.
 */
@Getter
@ToString
public class FallbackOutcome {
    private final FallbackState state;
    private final FeatureSource source;
    private final FeatureSet features;
    private final String note;
    @Getter(lombok.AccessLevel.NONE)
    @ToString.Exclude
    private final MarkerTarget referenceTarget;

    private FallbackOutcome(FallbackState state, FeatureSource source, FeatureSet features, String note,
                            MarkerTarget referenceTarget) {
        this.state = state;
        this.source = source;
        this.features = features;
        this.note = note;
        this.referenceTarget = referenceTarget;
    }

    public static FallbackOutcome accepted(FeatureSet features) {
        return new FallbackOutcome(FallbackState.ACCEPTED, FeatureSource.EXTRACTED, features,
                features.size() + " extracted features", null);
    }

    public static FallbackOutcome marginal(FeatureSource source, FeatureSet features, String note) {
        return new FallbackOutcome(FallbackState.MARGINAL, source, features, note, null);
    }

    public static FallbackOutcome reference(MarkerTarget target, String note) {
        return new FallbackOutcome(FallbackState.MARGINAL, FeatureSource.REFERENCE_TARGET, target.getFeatures(), note, target);
    }

    public boolean isDegraded() {
        return source.isDegraded();
    }

    /**
     * Present only when the whole target was substituted from the cached reference file.
     */
    public Optional<MarkerTarget> getReferenceTarget() {
        return Optional.ofNullable(referenceTarget);
    }
}
