package com.mindmarker.compiler;

import com.mindmarker.fallback.FallbackOutcome;
import com.mindmarker.fallback.FeatureSource;
import com.mindmarker.markerFile.MarkerFile;
import com.mindmarker.quality.QualityReport;
import lombok.Getter;

import java.util.Arrays;

@Getter
public class CompileResult {
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] bytes;
    private final MarkerFile markerFile;
    private final QualityReport report;
    private final FallbackOutcome outcome;

    public CompileResult(byte[] bytes, MarkerFile markerFile, QualityReport report, FallbackOutcome outcome) {
        this.bytes = Arrays.copyOf(bytes, bytes.length);
        this.markerFile = markerFile;
        this.report = report;
        this.outcome = outcome;
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int size() {
        return bytes.length;
    }

    public FeatureSource getFeatureSource() {
        return outcome.getSource();
    }

    public int getFeatureCount() {
        return markerFile.firstTarget().getFeatures().size();
    }

    public boolean isDegraded() {
        return outcome.isDegraded();
    }
}
