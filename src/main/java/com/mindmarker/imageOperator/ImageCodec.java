package com.mindmarker.imageOperator;

import com.mindmarker.error.DecodeException;
import com.mindmarker.error.InternalException;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Decode/encode capability the pipeline consumes. Callers own and release returned Mats.
 */
public interface ImageCodec {

    /**
     * @return a BGR 8-bit, 3-channel image
     * @throws DecodeException if the bytes are empty or not a decodable image
     */
    Mat decode(RawImage raw) throws DecodeException;

    byte[] encode(Mat image, PayloadFormat format, int quality) throws InternalException;
}
