package com.mindmarker.feature;

import com.mindmarker.testsupport.FakeKeypointDetector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FeatureTest {

    @Test
    void rejectsValuesOutsideTheirRanges() {
        byte[] d = FakeKeypointDetector.descriptor(0);
        assertThrows(IllegalArgumentException.class, () -> new Feature(1.01f, 0f, 0f, 0f, 1f, d));
        assertThrows(IllegalArgumentException.class, () -> new Feature(0f, -0.1f, 0f, 0f, 1f, d));
        assertThrows(IllegalArgumentException.class, () -> new Feature(0f, 0f, 360f, 0f, 1f, d));
        assertThrows(IllegalArgumentException.class, () -> new Feature(0f, 0f, 0f, -1f, 1f, d));
        assertThrows(IllegalArgumentException.class, () -> new Feature(0f, 0f, 0f, 0f, 0f, d));
        assertThrows(IllegalArgumentException.class, () -> new Feature(0f, 0f, 0f, 0f, 1f, new byte[31]));
        assertThrows(IllegalArgumentException.class, () -> new Feature(Float.NaN, 0f, 0f, 0f, 1f, d));
    }

    @Test
    void descriptorIsDefensivelyCopied() {
        byte[] d = FakeKeypointDetector.descriptor(3);
        Feature f = new Feature(0.5f, 0.5f, 10f, 1f, 2f, d);
        d[0] = 99;
        f.getDescriptor()[1] = 99;

        assertArrayEquals(FakeKeypointDetector.descriptor(3), f.getDescriptor());
    }

    @Test
    void equalityIncludesDescriptorContents() {
        Feature a = new Feature(0.5f, 0.5f, 10f, 1f, 2f, FakeKeypointDetector.descriptor(3));
        Feature b = new Feature(0.5f, 0.5f, 10f, 1f, 2f, FakeKeypointDetector.descriptor(3));
        Feature c = new Feature(0.5f, 0.5f, 10f, 1f, 2f, FakeKeypointDetector.descriptor(4));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void featureSetIsImmutableSnapshot() {
        List<Feature> source = new ArrayList<>();
        source.add(new Feature(0.1f, 0.1f, 0f, 0f, 1f, FakeKeypointDetector.descriptor(0)));
        FeatureSet set = FeatureSet.of(source);
        source.clear();

        assertEquals(1, set.size());
        assertThrows(UnsupportedOperationException.class, () -> set.asList().clear());
    }
}
