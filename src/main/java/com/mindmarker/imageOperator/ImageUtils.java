package com.mindmarker.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

/**
 * Copies between native 8-bit Mats and heap byte buffers.
 */
public final class ImageUtils {
    private ImageUtils() {
    }

    public static Mat colorMat(NormalizedImage image) {
        return toMat(image.getColorPixels(), image.getWidth(), image.getHeight(), CV_8UC3);
    }

    public static Mat grayMat(NormalizedImage image) {
        return toMat(image.getGrayPixels(), image.getWidth(), image.getHeight(), CV_8UC1);
    }

    public static Mat grayMat(byte[] gray, int width, int height) {
        return toMat(gray, width, height, CV_8UC1);
    }

    public static Mat toMat(byte[] pixels, int width, int height, int type) {
        Mat mat = new Mat(height, width, type);
        mat.data().put(pixels);
        return mat;
    }

    // Only valid for 8-bit depth, which is all the pipeline produces.
    public static byte[] toBytes(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        byte[] buf = new byte[(int) (continuous.total() * continuous.channels())];
        continuous.data().get(buf);
        if (continuous != mat) continuous.release();
        return buf;
    }

    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null && !m.isNull()) m.release();
        }
    }
}
