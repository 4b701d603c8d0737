package flowclaim.worker.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compares backward and forward flow and writes a per-pixel reliability map.
 */
public interface ConsistencyCheck {

    void check(Path backwardFlow, Path forwardFlow, Path reliabilityOut, Path endFrame)
            throws IOException, InterruptedException;
}
