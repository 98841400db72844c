package org.imppg.engine.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.imppg.engine.model.AlignmentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link AlignmentReport}s as JSON.
 */
public class AlignmentReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentReportWriter.class);

    public static final String REPORT_FILE = "alignment_report.json";

    private final Gson gson;

    public AlignmentReportWriter() {
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                .create();
    }

    /**
     * Writes {@code report} to {@code <directory>/alignment_report.json}.
     *
     * @return path of the written file
     */
    public Path write(AlignmentReport report, Path directory) throws IOException {
        Path target = directory.resolve(REPORT_FILE);
        Files.writeString(target, gson.toJson(report));
        logger.info("Saved alignment report for {} images to {}", report.getImages().size(), target);
        return target;
    }

    public AlignmentReport read(Path path) throws IOException {
        String json = Files.readString(path);
        try {
            AlignmentReport report = gson.fromJson(json, AlignmentReport.class);
            if (report == null) {
                throw new IOException("Empty alignment report: " + path);
            }
            return report;
        } catch (JsonParseException e) {
            throw new IOException("Malformed alignment report: " + path, e);
        }
    }
}
