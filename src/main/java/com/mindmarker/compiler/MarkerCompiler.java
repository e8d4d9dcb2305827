package com.mindmarker.compiler;

import com.mindmarker.error.CompileException;
import com.mindmarker.error.DecodeException;
import com.mindmarker.error.DimensionException;
import com.mindmarker.error.InternalException;
import com.mindmarker.error.QualityException;
import com.mindmarker.fallback.FallbackOutcome;
import com.mindmarker.fallback.FallbackStrategy;
import com.mindmarker.feature.FeatureExtractor;
import com.mindmarker.feature.FeatureSet;
import com.mindmarker.imageOperator.ImageNormalizer;
import com.mindmarker.imageOperator.NormalizedImage;
import com.mindmarker.imageOperator.RawImage;
import com.mindmarker.markerFile.MarkerEncoder;
import com.mindmarker.markerFile.MarkerFile;
import com.mindmarker.markerFile.MarkerTarget;
import com.mindmarker.quality.QualityReport;
import com.mindmarker.quality.TrackabilityValidator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * The marker pipeline: raw bytes -> normalize -> size gate -> extract (once) -> validate
 * -> fallback -> encode.
 *
 * <p>Stateless; every call owns its buffers, so one instance serves concurrent requests.</p>
 */
@Slf4j
@Getter
public class MarkerCompiler {
    private final ImageNormalizer normalizer;
    private final TrackabilityValidator validator;
    private final FeatureExtractor extractor;
    private final FallbackStrategy fallback;
    private final MarkerEncoder encoder;
    private final int maxFeatures;
    private final BlurPolicy blurPolicy;

    public MarkerCompiler(ImageNormalizer normalizer, TrackabilityValidator validator, FeatureExtractor extractor,
                          FallbackStrategy fallback, MarkerEncoder encoder, int maxFeatures, BlurPolicy blurPolicy) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.extractor = extractor;
        this.fallback = fallback;
        this.encoder = encoder;
        this.maxFeatures = maxFeatures;
        this.blurPolicy = blurPolicy;
    }

    /**
     * Score an image without producing a file. Images under the minimum size are
     * reported without running extraction.
     */
    public QualityReport validate(byte[] imageBytes) throws DecodeException, InternalException {
        try {
            NormalizedImage image = normalizer.normalize(RawImage.of(imageBytes));
            if (validator.isTooSmall(image)) {
                return validator.validateWithoutFeatures(image);
            }
            FeatureSet features = extractor.extract(image, maxFeatures);
            return validator.validate(image, features);
        } catch (RuntimeException e) {
            throw new InternalException("Validation failed unexpectedly: " + e.getMessage(), e);
        }
    }

    public CompileResult compile(byte[] imageBytes) throws CompileException {
        return compile(imageBytes, CompileOptions.defaults());
    }

    public CompileResult compile(byte[] imageBytes, CompileOptions options) throws CompileException {
        try {
            return doCompile(imageBytes, options);
        } catch (RuntimeException e) {
            throw new InternalException("Compilation failed unexpectedly: " + e.getMessage(), e);
        }
    }

    private CompileResult doCompile(byte[] imageBytes, CompileOptions options) throws CompileException {
        RawImage raw = RawImage.of(imageBytes);
        log.info("Compiling {} image, {} bytes", raw.getEncoding(), raw.size());

        NormalizedImage image = normalizer.normalize(raw);
        if (validator.isTooSmall(image)) {
            throw new DimensionException(image.getWidth(), image.getHeight(), validator.getMinDimension());
        }

        FeatureSet features = extractor.extract(image, maxFeatures);
        QualityReport report = validator.validate(image, features);
        log.info("{}: {} features, sharpness {}", image, report.getFeatureCount(), String.format("%.1f", report.getSharpness()));

        if (validator.isBlurry(report.getSharpness())) {
            if (blurPolicy == BlurPolicy.REJECT) {
                throw new QualityException(String.format(Locale.ROOT, "Image too blurry (sharpness: %.1f)", report.getSharpness()), report);
            }
            log.warn("Image below sharpness threshold ({}), compiling anyway", String.format("%.1f", report.getSharpness()));
        }

        FallbackOutcome outcome = fallback.resolve(image, report, features);
        MarkerTarget target = outcome.getReferenceTarget().isPresent()
                ? outcome.getReferenceTarget().get()
                : new MarkerTarget(options.getTargetId(), options.getPhysicalWidth(), options.getPhysicalHeight(),
                normalizer.encodePayload(image), outcome.getFeatures());

        MarkerFile file = MarkerFile.single(target);
        byte[] bytes = encoder.encode(file);
        if (outcome.isDegraded()) {
            log.warn("Emitted degraded marker ({}): {}", outcome.getSource(), outcome.getNote());
        }
        log.info("Marker file created: {} bytes, {} features from {}", bytes.length, target.getFeatures().size(), outcome.getSource());
        return new CompileResult(bytes, file, report, outcome);
    }
}
