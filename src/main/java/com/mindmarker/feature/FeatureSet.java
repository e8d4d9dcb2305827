package com.mindmarker.feature;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable sequence of features. Order is significant for encoding and is
 * descending response for extracted sets.
 */
public final class FeatureSet implements Iterable<Feature> {
    private static final FeatureSet EMPTY = new FeatureSet(List.of());

    private final List<Feature> features;

    private FeatureSet(List<Feature> features) {
        this.features = features;
    }

    public static FeatureSet of(List<Feature> features) {
        return features.isEmpty() ? EMPTY : new FeatureSet(List.copyOf(features));
    }

    public static FeatureSet empty() {
        return EMPTY;
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public Feature get(int index) {
        return features.get(index);
    }

    public List<Feature> asList() {
        return features;
    }

    public boolean isInsufficient(int minimum) {
        return features.size() < minimum;
    }

    @Override
    public Iterator<Feature> iterator() {
        return features.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet)) return false;
        return features.equals(((FeatureSet) o).features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(features);
    }

    @Override
    public String toString() {
        return "FeatureSet[" + features.size() + " features]";
    }
}
