package flowclaim.worker.model;

import java.nio.file.Path;

/**
 * A frame pair this worker owns after a successful claim.
 */
public record ClaimedJob(int index, Path startFrame, Path endFrame) {
}
