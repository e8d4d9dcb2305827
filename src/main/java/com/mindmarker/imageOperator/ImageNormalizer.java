package com.mindmarker.imageOperator;

import com.mindmarker.error.DecodeException;
import com.mindmarker.error.InternalException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Brings a decoded photo into the canonical working form used by the rest of the pipeline:
 * <ol>
 *   <li>Downsample with Lanczos so the long edge is at most {@code maxDimension}</li>
 *   <li>CLAHE on the L channel of Lab, so colours are left alone</li>
 *   <li>3x3 sharpen (centre 9, neighbours -1) to undo resampling blur</li>
 * </ol>
 */
@Slf4j
@Getter
public class ImageNormalizer {
    private final ImageCodec codec;
    private final int maxDimension;
    private final double claheClipLimit;
    private final int claheTileGrid;
    private final PayloadFormat payloadFormat;
    private final int payloadQuality;

    public ImageNormalizer(ImageCodec codec, int maxDimension, double claheClipLimit, int claheTileGrid,
                           PayloadFormat payloadFormat, int payloadQuality) {
        if (maxDimension <= 0) throw new IllegalArgumentException("maxDimension must be positive");
        if (claheTileGrid <= 0) throw new IllegalArgumentException("claheTileGrid must be positive");
        this.codec = codec;
        this.maxDimension = maxDimension;
        this.claheClipLimit = claheClipLimit;
        this.claheTileGrid = claheTileGrid;
        this.payloadFormat = payloadFormat;
        this.payloadQuality = payloadQuality;
    }

    public NormalizedImage normalize(RawImage raw) throws DecodeException {
        Mat decoded = codec.decode(raw);
        Mat resized = null, enhanced = null, sharpened = null, gray = null;
        try {
            int srcW = decoded.cols();
            int srcH = decoded.rows();
            resized = resizeToCap(decoded);
            enhanced = enhanceContrast(resized);
            sharpened = sharpen(enhanced);
            gray = new Mat();
            cvtColor(sharpened, gray, COLOR_BGR2GRAY);

            NormalizedImage out = new NormalizedImage(sharpened.cols(), sharpened.rows(), srcW, srcH,
                    ImageUtils.toBytes(sharpened), ImageUtils.toBytes(gray));
            log.debug("Normalized {}x{} -> {}x{}", srcW, srcH, out.getWidth(), out.getHeight());
            return out;
        } finally {
            ImageUtils.release(decoded, resized, enhanced, sharpened, gray);
        }
    }

    /**
     * Encode the normalized colour image as the payload embedded in the marker file.
     */
    public byte[] encodePayload(NormalizedImage image) throws InternalException {
        Mat color = ImageUtils.colorMat(image);
        try {
            return codec.encode(color, payloadFormat, payloadQuality);
        } finally {
            color.release();
        }
    }

    /**
     * Target size for a {@code width x height} image: the larger side becomes {@code cap},
     * the other is scaled proportionally and rounded to the nearest pixel.
     * Images already within the cap keep their size.
     */
    public static int[] targetSize(int width, int height, int cap) {
        int longEdge = Math.max(width, height);
        if (longEdge <= cap) return new int[]{width, height};
        double scale = (double) cap / longEdge;
        if (width >= height) {
            return new int[]{cap, Math.max(1, (int) Math.round(height * scale))};
        }
        return new int[]{Math.max(1, (int) Math.round(width * scale)), cap};
    }

    private Mat resizeToCap(Mat src) {
        int[] size = targetSize(src.cols(), src.rows(), maxDimension);
        if (size[0] == src.cols() && size[1] == src.rows()) {
            return src.clone();
        }
        Mat dst = new Mat();
        resize(src, dst, new Size(size[0], size[1]), 0, 0, INTER_LANCZOS4);
        return dst;
    }

    private Mat enhanceContrast(Mat bgr) {
        Mat lab = new Mat();
        Mat equalized = new Mat();
        Mat merged = new Mat();
        MatVector channels = new MatVector();
        CLAHE clahe = createCLAHE(claheClipLimit, new Size(claheTileGrid, claheTileGrid));
        try {
            cvtColor(bgr, lab, COLOR_BGR2Lab);
            split(lab, channels);
            clahe.apply(channels.get(0), equalized);
            channels.put(0, equalized);
            merge(channels, merged);

            Mat out = new Mat();
            cvtColor(merged, out, COLOR_Lab2BGR);
            return out;
        } finally {
            ImageUtils.release(lab, equalized, merged);
            channels.close();
            clahe.close();
        }
    }

    private static Mat sharpen(Mat src) {
        Mat kernel = sharpenKernel();
        try {
            Mat dst = new Mat();
            filter2D(src, dst, -1, kernel);
            return dst;
        } finally {
            kernel.release();
        }
    }

    static Mat sharpenKernel() {
        Mat kernel = new Mat(3, 3, CV_32F);
        FloatIndexer idx = kernel.createIndexer();
        for (int y = 0; y < 3; y++)
            for (int x = 0; x < 3; x++)
                idx.put(y, x, -1f);
        idx.put(1, 1, 9f);
        idx.release();
        return kernel;
    }
}
