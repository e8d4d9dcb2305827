package com.mindmarker.error;

/**
 * Machine-readable category of a compilation failure.
 */
public enum ErrorKind {
    DECODE,
    DIMENSION,
    QUALITY,
    FORMAT,
    INTERNAL
}
