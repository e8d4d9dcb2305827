package com.mindmarker.imageOperator;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Encoding used for the image embedded in a marker file.
 */
@AllArgsConstructor
@Getter
public enum PayloadFormat {
    JPEG(".jpg"),
    PNG(".png");

    private final String extension;
}
