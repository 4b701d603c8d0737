package flowclaim.worker.backend;

import flowclaim.worker.codec.FlowField;
import flowclaim.worker.codec.FlowFileCodec;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_GRAYSCALE;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;
import static org.bytedeco.opencv.global.opencv_video.calcOpticalFlowFarneback;

/**
 * Fast backend: OpenCV Farneback dense flow computed in-process on grayscale
 * frames. Tuning is fixed.
 */
public class FarnebackBackend implements FlowBackend {

    private static final Logger log = LoggerFactory.getLogger(FarnebackBackend.class);

    static final double PYR_SCALE = 0.5;
    static final int LEVELS = 3;
    static final int WIN_SIZE = 15;
    static final int ITERATIONS = 3;
    static final int POLY_N = 5;
    static final double POLY_SIGMA = 1.2;
    static final int FLAGS = 0;

    private final FlowFileCodec codec;

    public FarnebackBackend(FlowFileCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec is required");
    }

    @Override
    public String name() {
        return "farneback";
    }

    @Override
    public void computeFlows(Path startFrame, Path endFrame, Path forwardOut, Path backwardOut)
            throws IOException {
        try (Mat start = readGray(startFrame);
                Mat end = readGray(endFrame)) {
            codec.write(forwardOut, estimate(start, end));
            codec.write(backwardOut, estimate(end, start));
        }
    }

    private static Mat readGray(Path frame) throws IOException {
        Mat image = imread(frame.toString(), IMREAD_GRAYSCALE);
        if (image == null || image.empty()) {
            throw new IOException("Failed to decode frame: " + frame);
        }
        return image;
    }

    static FlowField estimate(Mat from, Mat to) {
        try (Mat flow = new Mat()) {
            calcOpticalFlowFarneback(from, to, flow,
                    PYR_SCALE, LEVELS, WIN_SIZE, ITERATIONS, POLY_N, POLY_SIGMA, FLAGS);
            return toField(flow);
        }
    }

    // flow is CV_32FC2: rows x cols x (dx, dy)
    private static FlowField toField(Mat flow) {
        int width = flow.cols();
        int height = flow.rows();
        float[] values = new float[width * height * 2];

        try (FloatIndexer indexer = flow.createIndexer()) {
            int i = 0;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    values[i++] = indexer.get(y, x, 0);
                    values[i++] = indexer.get(y, x, 1);
                }
            }
        }
        log.trace("Farneback produced {}x{} field", width, height);
        return new FlowField(width, height, values);
    }
}
