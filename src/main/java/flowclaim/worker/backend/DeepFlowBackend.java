package flowclaim.worker.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Accurate backend: DeepMatching piped into DeepFlow2, once per direction.
 *
 * Equivalent to
 * {@code deepmatching a b -nt 0 -downscale 2 | deepflow2 a b out.flo -match}.
 */
public class DeepFlowBackend implements FlowBackend {

    private static final Logger log = LoggerFactory.getLogger(DeepFlowBackend.class);

    private final Path deepMatching;
    private final Path deepFlow;

    public DeepFlowBackend(Path deepMatching, Path deepFlow) {
        this.deepMatching = Objects.requireNonNull(deepMatching, "deepMatching is required");
        this.deepFlow = Objects.requireNonNull(deepFlow, "deepFlow is required");
    }

    @Override
    public String name() {
        return "deepflow";
    }

    @Override
    public void computeFlows(Path startFrame, Path endFrame, Path forwardOut, Path backwardOut)
            throws IOException, InterruptedException {
        direction(startFrame, endFrame, forwardOut);
        direction(endFrame, startFrame, backwardOut);
    }

    private void direction(Path from, Path to, Path out) throws IOException, InterruptedException {
        log.debug("DeepFlow {} -> {}", from.getFileName(), to.getFileName());

        ProcessRunner.runPiped(
                matchingCommand(from, to),
                refinementCommand(from, to, out));

        if (!Files.isRegularFile(out)) {
            throw new BackendExecutionException(deepFlow + " did not write " + out);
        }
    }

    List<String> matchingCommand(Path from, Path to) {
        return List.of(deepMatching.toString(), from.toString(), to.toString(),
                "-nt", "0", "-downscale", "2");
    }

    List<String> refinementCommand(Path from, Path to, Path out) {
        return List.of(deepFlow.toString(), from.toString(), to.toString(), out.toString(), "-match");
    }
}
