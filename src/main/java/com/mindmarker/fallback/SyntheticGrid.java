package com.mindmarker.fallback;

import com.mindmarker.feature.Feature;
import com.mindmarker.feature.FeatureSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic N x N lattice of placeholder features at cell centres, row by row.
 * Neutral angle and response, unit size, all-zero descriptors.
 */
public final class SyntheticGrid {
    private SyntheticGrid() {
    }

    public static FeatureSet generate(int gridSize) {
        if (gridSize <= 0) throw new IllegalArgumentException("gridSize must be positive");
        byte[] zero = new byte[Feature.DESCRIPTOR_WIDTH];
        List<Feature> features = new ArrayList<>(gridSize * gridSize);
        for (int row = 0; row < gridSize; row++) {
            float y = (row + 0.5f) / gridSize;
            for (int col = 0; col < gridSize; col++) {
                float x = (col + 0.5f) / gridSize;
                features.add(new Feature(x, y, 0f, 0f, 1f, zero));
            }
        }
        return FeatureSet.of(features);
    }
}
