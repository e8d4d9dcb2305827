package com.mindmarker.imageOperator;

import com.mindmarker.error.DecodeException;
import com.mindmarker.error.InternalException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

@Slf4j
public class OpenCvImageCodec implements ImageCodec {

    @Override
    public Mat decode(RawImage raw) throws DecodeException {
        if (raw == null || raw.isEmpty()) {
            throw new DecodeException("No image data provided");
        }
        byte[] bytes = raw.bytes();
        Mat buffer = new Mat(1, bytes.length, CV_8UC1);
        buffer.data().put(bytes);
        Mat img;
        try {
            img = imdecode(buffer, IMREAD_COLOR);
        } catch (RuntimeException e) {
            throw new DecodeException("Could not decode image: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }
        if (img == null || img.empty()) {
            throw new DecodeException("Could not decode image (" + raw.getEncoding() + ", " + bytes.length + " bytes)");
        }
        log.debug("Decoded {} image {}x{}", raw.getEncoding(), img.cols(), img.rows());
        return img;
    }

    @Override
    public byte[] encode(Mat image, PayloadFormat format, int quality) throws InternalException {
        BytePointer buf = new BytePointer();
        IntPointer params = format == PayloadFormat.JPEG
                ? new IntPointer(IMWRITE_JPEG_QUALITY, clampQuality(quality))
                : new IntPointer(IMWRITE_PNG_COMPRESSION, 3);
        try {
            if (!imencode(format.getExtension(), image, buf, params)) {
                throw new InternalException("OpenCV refused to encode " + format + " payload");
            }
            byte[] out = new byte[(int) buf.limit()];
            buf.get(out);
            return out;
        } catch (RuntimeException e) {
            throw new InternalException("Encoding " + format + " payload failed: " + e.getMessage(), e);
        } finally {
            buf.deallocate();
            params.deallocate();
        }
    }

    private static int clampQuality(int quality) {
        return Math.max(1, Math.min(100, quality));
    }
}
