package com.mindmarker.compiler;

/**
 * What compile does with an image under the sharpness threshold.
 */
public enum BlurPolicy {
    /** keep the issue in the report and carry on */
    WARN,
    /** fail with a QualityException */
    REJECT
}
