package flowclaim.worker.backend;

import flowclaim.worker.codec.FlowField;
import flowclaim.worker.codec.FlowFileCodec;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_video;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs OpenCV Farneback on two synthetic frames. Skipped when the OpenCV
 * natives are not available for this platform.
 */
class FarnebackBackendTest {

    private static final int W = 48;
    private static final int H = 32;

    @TempDir
    Path dir;

    @BeforeAll
    static void requireOpenCv() {
        boolean loaded;
        try {
            Loader.load(opencv_video.class);
            loaded = true;
        } catch (Throwable t) {
            loaded = false;
        }
        assumeTrue(loaded, "OpenCV natives not available");
    }

    @Test
    void computeFlows_writesFieldsOfFrameSize() throws Exception {
        Path start = writePpm(dir.resolve("frame_00001.ppm"), 0);
        Path end = writePpm(dir.resolve("frame_00002.ppm"), 2);
        Path forward = dir.resolve("forward_1_2.flo");
        Path backward = dir.resolve("backward_2_1.flo");

        FlowFileCodec codec = new FlowFileCodec();
        new FarnebackBackend(codec).computeFlows(start, end, forward, backward);

        FlowField f = codec.read(forward);
        FlowField b = codec.read(backward);
        assertEquals(W, f.width());
        assertEquals(H, f.height());
        assertEquals(W, b.width());
        assertEquals(H, b.height());
        for (float v : f.toArray()) {
            assertTrue(Float.isFinite(v));
        }
    }

    @Test
    void computeFlows_undecodableFrame() throws Exception {
        Path start = Files.write(dir.resolve("frame_00001.ppm"), new byte[] { 1, 2, 3 });
        Path end = writePpm(dir.resolve("frame_00002.ppm"), 0);

        assertThrows(IOException.class, () -> new FarnebackBackend(new FlowFileCodec())
                .computeFlows(start, end, dir.resolve("f.flo"), dir.resolve("b.flo")));
    }

    // binary PPM with a smooth pattern shifted right by `shift` pixels
    private static Path writePpm(Path file, int shift) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            out.write(("P6\n" + W + " " + H + "\n255\n").getBytes(StandardCharsets.US_ASCII));
            for (int y = 0; y < H; y++) {
                for (int x = 0; x < W; x++) {
                    double sx = x - shift;
                    int v = (int) (127 + 100 * Math.sin(sx / 4.0) * Math.cos(y / 5.0));
                    out.write(v);
                    out.write(v);
                    out.write(v);
                }
            }
        }
        return file;
    }
}
