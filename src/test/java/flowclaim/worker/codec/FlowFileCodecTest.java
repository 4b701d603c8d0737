package flowclaim.worker.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the .flo binary layout.
 */
class FlowFileCodecTest {

    private final FlowFileCodec codec = new FlowFileCodec();

    @TempDir
    Path dir;

    private static FlowField sample() {
        // 3x2 field, dx = x + 0.5, dy = -y
        float[] values = new float[3 * 2 * 2];
        int i = 0;
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) {
                values[i++] = x + 0.5f;
                values[i++] = -y;
            }
        }
        return new FlowField(3, 2, values);
    }

    @Test
    @DisplayName("Header is magic, width, height in little-endian")
    void encode_header() {
        byte[] bytes = codec.encode(sample());

        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(202021.25f, buf.getFloat());
        assertEquals(3, buf.getInt());
        assertEquals(2, buf.getInt());
        assertEquals(12 + 3 * 2 * 2 * 4, bytes.length);

        // first bytes spell "PIEH"
        assertEquals('P', bytes[0]);
        assertEquals('I', bytes[1]);
        assertEquals('E', bytes[2]);
        assertEquals('H', bytes[3]);
    }

    @Test
    @DisplayName("Payload is row-major with interleaved (dx, dy)")
    void encode_payloadOrder() {
        byte[] bytes = codec.encode(sample());

        ByteBuffer buf = ByteBuffer.wrap(bytes, 12, bytes.length - 12).order(ByteOrder.LITTLE_ENDIAN);
        // pixel (0,0)
        assertEquals(0.5f, buf.getFloat());
        assertEquals(0.0f, buf.getFloat());
        // pixel (1,0)
        assertEquals(1.5f, buf.getFloat());
        assertEquals(0.0f, buf.getFloat());
        // skip (2,0), then pixel (0,1)
        buf.getFloat();
        buf.getFloat();
        assertEquals(0.5f, buf.getFloat());
        assertEquals(-1.0f, buf.getFloat());
    }

    @Test
    @DisplayName("Written file reads back with the same dimensions and vectors")
    void writeThenRead() throws IOException {
        Path file = dir.resolve("forward_1_2.flo");
        FlowField original = sample();

        codec.write(file, original);
        FlowField loaded = codec.read(file);

        assertEquals(3, loaded.width());
        assertEquals(2, loaded.height());
        assertEquals(original, loaded);
        assertEquals(2.5f, loaded.dx(2, 1));
        assertEquals(-1.0f, loaded.dy(2, 1));
    }

    @Test
    @DisplayName("Writing replaces a larger existing file completely")
    void write_overwritesExisting() throws IOException {
        Path file = dir.resolve("backward_2_1.flo");
        Files.write(file, new byte[4096]);

        codec.write(file, FlowField.zeros(1, 1));

        assertEquals(12 + 8, Files.size(file));
        assertEquals(FlowField.zeros(1, 1), codec.read(file));
    }

    @Test
    void read_rejectsWrongMagic() throws IOException {
        Path file = dir.resolve("bogus.flo");
        byte[] bytes = codec.encode(FlowField.zeros(1, 1));
        bytes[0] = 'X';
        Files.write(file, bytes);

        IOException e = assertThrows(IOException.class, () -> codec.read(file));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void read_rejectsTruncatedPayload() throws IOException {
        Path file = dir.resolve("short.flo");
        byte[] bytes = codec.encode(FlowField.zeros(4, 4));
        Files.write(file, java.util.Arrays.copyOf(bytes, bytes.length - 4));

        assertThrows(IOException.class, () -> codec.read(file));
    }

    @Test
    @DisplayName("Write into a missing directory fails with IOException")
    void write_missingDirectory() {
        Path file = dir.resolve("nope").resolve("forward_1_2.flo");

        assertThrows(IOException.class, () -> codec.write(file, FlowField.zeros(1, 1)));
    }

    @Test
    void field_rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new FlowField(2, 2, new float[7]));
    }

    @Test
    void field_boundsChecked() {
        FlowField field = FlowField.zeros(2, 2);

        assertThrows(IndexOutOfBoundsException.class, () -> field.dx(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> field.dy(0, -1));
    }
}
