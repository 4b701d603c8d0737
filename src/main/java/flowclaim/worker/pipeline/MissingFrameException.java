package flowclaim.worker.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A claimed job refers to a frame that is not in the shared directory, for
 * example the last index of a sequence whose end frame does not exist.
 */
public class MissingFrameException extends IOException {

    private final Path frame;

    public MissingFrameException(int jobIndex, Path frame) {
        super("Job " + jobIndex + " is missing frame " + frame);
        this.frame = frame;
    }

    public Path frame() {
        return frame;
    }
}
