package flowclaim.worker.codec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes Middlebury .flo files.
 *
 * Layout (little-endian):
 * - float32 magic 202021.25
 * - uint32 width
 * - uint32 height
 * - width * height * 2 float32 values, row-major, (dx, dy) per pixel
 *
 * The consistency checker reads this format directly, so there is no
 * versioning or compression.
 */
public final class FlowFileCodec {

    public static final float MAGIC = 202021.25f;

    private static final int HEADER_BYTES = 12;

    public byte[] encode(FlowField field) {
        float[] values = field.values();
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + values.length * Float.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putFloat(MAGIC);
        buffer.putInt(field.width());
        buffer.putInt(field.height());
        buffer.asFloatBuffer().put(values);
        return buffer.array();
    }

    public FlowField decode(byte[] bytes) throws IOException {
        if (bytes.length < HEADER_BYTES) {
            throw new IOException("Truncated .flo header: " + bytes.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        float magic = buffer.getFloat();
        if (Float.compare(magic, MAGIC) != 0) {
            throw new IOException("Not a .flo file, magic was " + magic);
        }

        long width = Integer.toUnsignedLong(buffer.getInt());
        long height = Integer.toUnsignedLong(buffer.getInt());
        long expected = width * height * 2 * Float.BYTES;
        if (expected != bytes.length - HEADER_BYTES) {
            throw new IOException("Payload size mismatch for " + width + "x" + height
                    + ": expected " + expected + " bytes, got " + (bytes.length - HEADER_BYTES));
        }

        float[] values = new float[(int) (width * height * 2)];
        buffer.asFloatBuffer().get(values);
        return new FlowField((int) width, (int) height, values);
    }

    /**
     * Write a field to disk, replacing whatever is at {@code path}.
     */
    public void write(Path path, FlowField field) throws IOException {
        Files.write(path, encode(field));
    }

    public FlowField read(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }
}
