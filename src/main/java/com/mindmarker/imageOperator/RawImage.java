package com.mindmarker.imageOperator;

import lombok.Getter;

import java.util.Arrays;

/**
 * Encoded image bytes as received from a front end.
 */
public class RawImage {
    private final byte[] data;
    @Getter
    private final ImageEncoding encoding;

    public RawImage(byte[] data, ImageEncoding encoding) {
        this.data = data == null ? new byte[0] : Arrays.copyOf(data, data.length);
        this.encoding = encoding == null ? ImageEncoding.UNKNOWN : encoding;
    }

    public static RawImage of(byte[] data) {
        return new RawImage(data, ImageEncoding.sniff(data));
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    // package-private view for the codec, avoids a second copy
    byte[] bytes() {
        return data;
    }
}
