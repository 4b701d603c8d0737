package flowclaim.worker.backend;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Estimates forward and backward optical flow for one frame pair and writes
 * both fields as .flo files.
 */
public interface FlowBackend {

    /** Short name for logs. */
    String name();

    /**
     * @param startFrame    frame i
     * @param endFrame      frame i+1
     * @param forwardOut    destination of the i -> i+1 field
     * @param backwardOut   destination of the i+1 -> i field
     */
    void computeFlows(Path startFrame, Path endFrame, Path forwardOut, Path backwardOut)
            throws IOException, InterruptedException;
}
