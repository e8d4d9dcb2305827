package com.mindmarker.imageOperator;

public enum ImageEncoding {
    JPEG,
    PNG,
    BMP,
    WEBP,
    UNKNOWN;

    /**
     * Guess the container from its leading magic bytes.
     */
    public static ImageEncoding sniff(byte[] data) {
        if (data == null || data.length < 4) return UNKNOWN;
        int b0 = data[0] & 0xFF, b1 = data[1] & 0xFF, b2 = data[2] & 0xFF, b3 = data[3] & 0xFF;
        if (b0 == 0xFF && b1 == 0xD8 && b2 == 0xFF) return JPEG;
        if (b0 == 0x89 && b1 == 'P' && b2 == 'N' && b3 == 'G') return PNG;
        if (b0 == 'B' && b1 == 'M') return BMP;
        if (data.length >= 12 && b0 == 'R' && b1 == 'I' && b2 == 'F' && b3 == 'F'
                && data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') return WEBP;
        return UNKNOWN;
    }
}
