package com.mindmarker.error;

import lombok.Getter;

@Getter
public class DimensionException extends CompileException {
    private final int width;
    private final int height;
    private final int minimum;

    public DimensionException(int width, int height, int minimum) {
        super(ErrorKind.DIMENSION, String.format("Image too small (%dx%d, need %dx%d+)", width, height, minimum, minimum));
        this.width = width;
        this.height = height;
        this.minimum = minimum;
    }
}
