package flowclaim.worker.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs external tools and turns failures into {@link BackendExecutionException}.
 * No timeouts: a hung tool blocks its job forever.
 */
public final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final int OUTPUT_TAIL_CHARS = 500;

    private ProcessRunner() {
    }

    /**
     * Run a single command, capturing stdout and stderr together.
     *
     * @return the combined output
     */
    public static String run(List<String> command) throws IOException, InterruptedException {
        Process process = start(new ProcessBuilder(command).redirectErrorStream(true), command);
        byte[] out = process.getInputStream().readAllBytes();
        int exit = process.waitFor();
        String output = new String(out, StandardCharsets.UTF_8);

        if (exit != 0) {
            throw new BackendExecutionException(
                    executable(command) + " exited with " + exit + ": " + tail(output), exit);
        }
        log.debug("{} finished: {}", executable(command), tail(output));
        return output;
    }

    /**
     * Run {@code producer | consumer}. Both must exit with status 0.
     */
    public static void runPiped(List<String> producer, List<String> consumer)
            throws IOException, InterruptedException {
        List<ProcessBuilder> builders = List.of(
                new ProcessBuilder(producer).redirectError(ProcessBuilder.Redirect.INHERIT),
                new ProcessBuilder(consumer).redirectErrorStream(true));

        List<Process> processes;
        try {
            processes = ProcessBuilder.startPipeline(builders);
        } catch (IOException e) {
            throw new BackendExecutionException(
                    "Failed to start " + executable(producer) + " | " + executable(consumer), e);
        }

        byte[] out = processes.get(1).getInputStream().readAllBytes();
        String output = new String(out, StandardCharsets.UTF_8);

        int producerExit = processes.get(0).waitFor();
        int consumerExit = processes.get(1).waitFor();

        // consumer first: if it dies early the producer only sees a broken pipe
        if (consumerExit != 0) {
            throw new BackendExecutionException(
                    executable(consumer) + " exited with " + consumerExit + ": " + tail(output), consumerExit);
        }
        if (producerExit != 0) {
            throw new BackendExecutionException(
                    executable(producer) + " exited with " + producerExit, producerExit);
        }
        log.debug("{} | {} finished: {}", executable(producer), executable(consumer), tail(output));
    }

    private static Process start(ProcessBuilder builder, List<String> command) throws BackendExecutionException {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new BackendExecutionException("Failed to start " + executable(command), e);
        }
    }

    private static String executable(List<String> command) {
        return command.isEmpty() ? "<empty>" : command.get(0);
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        return trimmed.length() <= OUTPUT_TAIL_CHARS
                ? trimmed
                : "..." + trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
    }
}
