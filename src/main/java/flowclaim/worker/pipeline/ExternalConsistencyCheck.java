package flowclaim.worker.pipeline;

import flowclaim.worker.backend.ProcessRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@code consistencyChecker <backward> <forward> <reliable> <endFrame>}.
 */
public class ExternalConsistencyCheck implements ConsistencyCheck {

    private final Path executable;

    public ExternalConsistencyCheck(Path executable) {
        this.executable = Objects.requireNonNull(executable, "executable is required");
    }

    @Override
    public void check(Path backwardFlow, Path forwardFlow, Path reliabilityOut, Path endFrame)
            throws IOException, InterruptedException {
        ProcessRunner.run(List.of(
                executable.toString(),
                backwardFlow.toString(),
                forwardFlow.toString(),
                reliabilityOut.toString(),
                endFrame.toString()));
    }
}
