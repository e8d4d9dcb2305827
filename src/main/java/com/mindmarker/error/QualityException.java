package com.mindmarker.error;

import com.mindmarker.quality.QualityReport;
import lombok.Getter;

/**
 * Blur or feature-count failure that the fallback could not recover from.
 */
@Getter
public class QualityException extends CompileException {
    private final QualityReport report;

    public QualityException(String message, QualityReport report) {
        super(ErrorKind.QUALITY, message);
        this.report = report;
    }
}
