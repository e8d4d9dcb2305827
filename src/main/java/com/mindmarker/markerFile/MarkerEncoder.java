package com.mindmarker.markerFile;

import com.mindmarker.feature.Feature;
import com.mindmarker.feature.FeatureSet;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Writes {@link MarkerFile}s in the layout described by {@link MarkerFormat}.
 * Output depends only on the file's contents, so equal inputs give byte-identical files.
 */
public class MarkerEncoder {

    public byte[] encode(MarkerTarget target) {
        return encode(MarkerFile.single(target));
    }

    public byte[] encode(MarkerFile file) {
        if (file.getVersion() != MarkerFormat.VERSION) {
            throw new IllegalArgumentException("Encoder writes version " + MarkerFormat.VERSION
                    + " only, got " + file.getVersion());
        }
        ByteBuffer buf = ByteBuffer.allocate(Math.toIntExact(encodedSize(file))).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(MarkerFormat.MAGIC);
        buf.putInt(MarkerFormat.VERSION);
        buf.putInt(file.targetCount());
        for (MarkerTarget target : file.getTargets()) {
            writeTarget(buf, target);
        }
        buf.putInt(MarkerFormat.TERMINATOR);
        return buf.array();
    }

    public static long encodedSize(MarkerFile file) {
        long size = MarkerFormat.HEADER_SIZE + 4L;
        for (MarkerTarget t : file.getTargets()) {
            size += MarkerFormat.targetBlockSize(t.getImagePayloadSize(), t.getFeatures().size());
        }
        return size;
    }

    private static void writeTarget(ByteBuffer buf, MarkerTarget target) {
        buf.putInt(target.getTargetId());
        buf.putFloat(target.getPhysicalWidth());
        buf.putFloat(target.getPhysicalHeight());
        byte[] payload = target.getImagePayload();
        buf.putInt(payload.length);
        buf.put(payload);

        FeatureSet features = target.getFeatures();
        buf.putInt(features.size());
        // fixed-stride records first, descriptors after, both in FeatureSet order
        for (Feature f : features) {
            buf.putFloat(f.getX());
            buf.putFloat(f.getY());
            buf.putFloat(f.getAngle());
            buf.putFloat(f.getResponse());
            buf.putFloat(f.getSize());
        }
        for (Feature f : features) {
            buf.put(f.getDescriptor());
        }
    }
}
