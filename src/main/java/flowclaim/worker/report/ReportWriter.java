package flowclaim.worker.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import flowclaim.worker.model.PoolReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a {@link PoolReport} as JSON next to the artifacts it describes.
 * One file per claimant, replaced on every run.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public ReportWriter(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(PoolReport report) throws IOException {
        Path target = reportPath(report.claimant());
        mapper.writeValue(target.toFile(), report);
        log.info("Wrote run report to {}", target);
        return target;
    }

    public Path reportPath(String claimant) {
        String safe = claimant.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve("report-" + safe + ".json");
    }
}
