package com.mindmarker.config;

import com.mindmarker.compiler.MarkerCompiler;
import com.mindmarker.fallback.FallbackStrategy;
import com.mindmarker.fallback.FileReferenceTargetProvider;
import com.mindmarker.fallback.ReferenceTargetProvider;
import com.mindmarker.feature.FeatureExtractor;
import com.mindmarker.feature.KeypointDetector;
import com.mindmarker.feature.OrbKeypointDetector;
import com.mindmarker.imageOperator.ImageCodec;
import com.mindmarker.imageOperator.ImageNormalizer;
import com.mindmarker.imageOperator.OpenCvImageCodec;
import com.mindmarker.markerFile.MarkerDecoder;
import com.mindmarker.markerFile.MarkerEncoder;
import com.mindmarker.quality.TrackabilityValidator;

import java.nio.file.Paths;

/**
 * Wires a {@link MarkerCompiler} from properties. Shared by the Spring context and the CLI.
 */
public final class MarkerCompilerFactory {
    private MarkerCompilerFactory() {
    }

    public static MarkerCompiler create(CompilerProperties props) {
        return create(props, new OpenCvImageCodec(), orbDetector(props.getFeatures()));
    }

    public static MarkerCompiler create(CompilerProperties props, ImageCodec codec, KeypointDetector detector) {
        CompilerProperties.Image img = props.getImage();
        CompilerProperties.Quality quality = props.getQuality();
        CompilerProperties.Features feat = props.getFeatures();
        CompilerProperties.Fallback fb = props.getFallback();

        ImageNormalizer normalizer = new ImageNormalizer(codec, img.getMaxDimension(), img.getClaheClipLimit(),
                img.getClaheTileGrid(), img.getPayloadFormat(), img.getPayloadQuality());
        TrackabilityValidator validator = new TrackabilityValidator(quality.getMinFeatures(),
                quality.getSharpnessThreshold(), img.getMinDimension());
        FeatureExtractor extractor = new FeatureExtractor(detector);
        FallbackStrategy fallback = new FallbackStrategy(extractor, quality.getMinFeatures(), feat.getMaxFeatures(),
                fb.isSyntheticGridEnabled(), fb.getGridSize(), referenceTargets(fb));

        return new MarkerCompiler(normalizer, validator, extractor, fallback, new MarkerEncoder(),
                feat.getMaxFeatures(), quality.getBlurPolicy());
    }

    public static OrbKeypointDetector orbDetector(CompilerProperties.Features feat) {
        return new OrbKeypointDetector(feat.getScaleFactor(), feat.getLevels(), feat.getEdgeThreshold(),
                feat.getFastThreshold(), feat.getRelaxedEdgeThreshold(), feat.getRelaxedFastThreshold());
    }

    private static ReferenceTargetProvider referenceTargets(CompilerProperties.Fallback fb) {
        String path = fb.getReferenceTarget();
        if (path == null || path.isBlank()) return ReferenceTargetProvider.NONE;
        return new FileReferenceTargetProvider(Paths.get(path), new MarkerDecoder());
    }
}
