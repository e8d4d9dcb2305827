package com.mindmarker.error;

/**
 * The structural check a marker file failed while being decoded.
 */
public enum FormatCheck {
    MAGIC,
    VERSION,
    TRUNCATED,
    TARGET_COUNT,
    TERMINATOR,
    TRAILING_BYTES,
    VALUE
}
