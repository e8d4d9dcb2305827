package com.mindmarker.fallback;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Where the features of an emitted target came from.
 */
@AllArgsConstructor
@Getter
public enum FeatureSource {
    EXTRACTED(false),
    RELAXED_EXTRACTION(false),
    SYNTHETIC_GRID(true),
    REFERENCE_TARGET(true);

    private final boolean degraded;
}
