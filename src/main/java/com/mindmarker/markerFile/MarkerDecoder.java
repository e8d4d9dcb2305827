package com.mindmarker.markerFile;

import com.mindmarker.error.FormatCheck;
import com.mindmarker.error.FormatException;
import com.mindmarker.feature.Feature;
import com.mindmarker.feature.FeatureSet;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses marker files written by {@link MarkerEncoder}.
 *
 * <p>Magic and version are checked before any length-prefixed field is read. Every
 * length is checked against the bytes actually remaining; a corrupt file is rejected
 * as a whole with a {@link FormatException} naming the failed check. There is no
 * partial or best-effort result.</p>
 */
public class MarkerDecoder {

    public MarkerFile decode(byte[] data) throws FormatException {
        ByteBuffer buf = header(data);
        long targetCount = Integer.toUnsignedLong(buf.getInt());
        if (targetCount == 0) {
            throw new FormatException(FormatCheck.TARGET_COUNT, "file declares no targets");
        }
        // a bogus count runs out of bytes after a few iterations, so cap only the initial capacity
        List<MarkerTarget> targets = new ArrayList<>((int) Math.min(targetCount, 16));
        for (int t = 0; t < targetCount; t++) {
            targets.add(readTarget(buf, t));
        }

        require(buf, 4, "terminator");
        int terminator = buf.getInt();
        if (terminator != MarkerFormat.TERMINATOR) {
            throw new FormatException(FormatCheck.TERMINATOR,
                    String.format("expected 0x%08X, found 0x%08X", MarkerFormat.TERMINATOR, terminator));
        }
        if (buf.hasRemaining()) {
            throw new FormatException(FormatCheck.TRAILING_BYTES, buf.remaining() + " bytes after terminator");
        }
        return new MarkerFile(MarkerFormat.VERSION, targets);
    }

    /**
     * Checks magic and returns the declared version without validating it.
     */
    public int peekVersion(byte[] data) throws FormatException {
        ByteBuffer buf = magic(data);
        require(buf, 4, "version");
        return buf.getInt();
    }

    /**
     * Reads feature {@code index} of the first target straight from its fixed-stride slot,
     * without parsing the features before it.
     */
    public Feature readFeature(byte[] data, int index) throws FormatException {
        ByteBuffer buf = header(data);
        long targetCount = Integer.toUnsignedLong(buf.getInt());
        if (targetCount == 0) {
            throw new FormatException(FormatCheck.TARGET_COUNT, "file declares no targets");
        }
        require(buf, MarkerFormat.TARGET_HEADER_SIZE, "target header");
        buf.position(buf.position() + 12);
        int imageSize = readLength(buf, "image_size");
        require(buf, imageSize, "image_data");
        buf.position(buf.position() + imageSize);
        require(buf, 4, "feature_count");
        int featureCount = readLength(buf, "feature_count");
        if (index < 0 || index >= featureCount) {
            throw new IndexOutOfBoundsException("Feature " + index + " of " + featureCount);
        }
        int recordsStart = buf.position();
        long descriptorsStart = recordsStart + (long) featureCount * MarkerFormat.FEATURE_RECORD_SIZE;
        require(buf, (long) featureCount * (MarkerFormat.FEATURE_RECORD_SIZE + MarkerFormat.DESCRIPTOR_WIDTH), "feature blocks");

        buf.position(recordsStart + index * MarkerFormat.FEATURE_RECORD_SIZE);
        float x = buf.getFloat(), y = buf.getFloat(), angle = buf.getFloat(), response = buf.getFloat(), size = buf.getFloat();
        int descOffset = (int) (descriptorsStart + (long) index * MarkerFormat.DESCRIPTOR_WIDTH);
        byte[] descriptor = Arrays.copyOfRange(data, descOffset, descOffset + MarkerFormat.DESCRIPTOR_WIDTH);
        return feature(x, y, angle, response, size, descriptor, index);
    }

    private static ByteBuffer magic(byte[] data) throws FormatException {
        if (data == null) {
            throw new FormatException(FormatCheck.TRUNCATED, "no data");
        }
        int n = Math.min(data.length, MarkerFormat.MAGIC.length);
        for (int i = 0; i < n; i++) {
            if (data[i] != MarkerFormat.MAGIC[i]) {
                throw new FormatException(FormatCheck.MAGIC, "not a marker file (bad magic at byte " + i + ")");
            }
        }
        if (data.length < MarkerFormat.MAGIC.length) {
            throw new FormatException(FormatCheck.TRUNCATED, "file ends inside the magic value");
        }
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        buf.position(MarkerFormat.VERSION_OFFSET);
        return buf;
    }

    private static ByteBuffer header(byte[] data) throws FormatException {
        ByteBuffer buf = magic(data);
        require(buf, 4, "version");
        int version = buf.getInt();
        if (version != MarkerFormat.VERSION) {
            throw new FormatException(FormatCheck.VERSION,
                    "unsupported version " + Integer.toUnsignedString(version) + ", expected " + MarkerFormat.VERSION);
        }
        require(buf, 4, "target_count");
        return buf;
    }

    private static MarkerTarget readTarget(ByteBuffer buf, int index) throws FormatException {
        require(buf, MarkerFormat.TARGET_HEADER_SIZE, "target " + index + " header");
        int targetId = buf.getInt();
        float width = buf.getFloat();
        float height = buf.getFloat();
        int imageSize = readLength(buf, "image_size");
        require(buf, imageSize, "image_data");
        byte[] image = new byte[imageSize];
        buf.get(image);

        require(buf, 4, "feature_count");
        int featureCount = readLength(buf, "feature_count");
        require(buf, (long) featureCount * (MarkerFormat.FEATURE_RECORD_SIZE + MarkerFormat.DESCRIPTOR_WIDTH), "feature blocks");

        float[][] records = new float[featureCount][5];
        for (int i = 0; i < featureCount; i++) {
            for (int k = 0; k < 5; k++) records[i][k] = buf.getFloat();
        }
        List<Feature> features = new ArrayList<>(featureCount);
        for (int i = 0; i < featureCount; i++) {
            byte[] descriptor = new byte[MarkerFormat.DESCRIPTOR_WIDTH];
            buf.get(descriptor);
            float[] r = records[i];
            features.add(feature(r[0], r[1], r[2], r[3], r[4], descriptor, i));
        }
        return new MarkerTarget(targetId, width, height, image, FeatureSet.of(features));
    }

    private static Feature feature(float x, float y, float angle, float response, float size,
                                   byte[] descriptor, int index) throws FormatException {
        try {
            return new Feature(x, y, angle, response, size, descriptor);
        } catch (IllegalArgumentException e) {
            throw new FormatException(FormatCheck.VALUE, "feature " + index + ": " + e.getMessage());
        }
    }

    // uint32 length that must also fit a Java array
    private static int readLength(ByteBuffer buf, String field) throws FormatException {
        long value = Integer.toUnsignedLong(buf.getInt());
        if (value > buf.remaining()) {
            throw new FormatException(FormatCheck.TRUNCATED,
                    field + " is " + value + " but only " + buf.remaining() + " bytes remain");
        }
        return (int) value;
    }

    private static void require(ByteBuffer buf, long bytes, String field) throws FormatException {
        if (bytes > buf.remaining()) {
            throw new FormatException(FormatCheck.TRUNCATED,
                    "need " + bytes + " bytes for " + field + ", " + buf.remaining() + " remain");
        }
    }
}
