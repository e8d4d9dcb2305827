package com.mindmarker.config;

import com.mindmarker.compiler.BlurPolicy;
import com.mindmarker.imageOperator.PayloadFormat;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the marker pipeline, bound from {@code marker.*}. Field defaults are the
 * values the CLI runs with.
 */
@ConfigurationProperties(prefix = "marker")
@Getter
@Setter
public class CompilerProperties {
    private Image image = new Image();
    private Quality quality = new Quality();
    private Features features = new Features();
    private Fallback fallback = new Fallback();
    private Target target = new Target();

    @Getter
    @Setter
    public static class Image {
        private int maxDimension = 512;
        private int minDimension = 200;
        private double claheClipLimit = 2.0;
        private int claheTileGrid = 8;
        private PayloadFormat payloadFormat = PayloadFormat.JPEG;
        private int payloadQuality = 90;
    }

    @Getter
    @Setter
    public static class Quality {
        private int minFeatures = 50;
        private double sharpnessThreshold = 100.0;
        private BlurPolicy blurPolicy = BlurPolicy.WARN;
    }

    @Getter
    @Setter
    public static class Features {
        private int maxFeatures = 500;
        private float scaleFactor = 1.2f;
        private int levels = 8;
        private int edgeThreshold = 31;
        private int fastThreshold = 20;
        private int relaxedEdgeThreshold = 15;
        private int relaxedFastThreshold = 5;
    }

    @Getter
    @Setter
    public static class Fallback {
        private boolean syntheticGridEnabled = true;
        private int gridSize = 10;
        /** previously compiled marker file used when the grid is disabled; unset means none */
        private String referenceTarget;
    }

    @Getter
    @Setter
    public static class Target {
        private float defaultWidth = 1.0f;
        private float defaultHeight = 1.0f;
    }
}
