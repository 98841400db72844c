package org.imppg.engine.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.model.AlignmentMethod;
import org.imppg.engine.model.AlignmentReport;
import org.imppg.engine.model.CropMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tests for {@link AlignmentReportWriter} and {@link RunLogger}.
 */
class AlignmentReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Report is written as JSON and read back")
    void testWriteAndRead() throws Exception {
        AlignmentReport report = new AlignmentReport(AlignmentMethod.LIMB, CropMode.CROP_TO_INTERSECTION,
                2, -1, 90, 88, 25.5,
                List.of(new AlignmentReport.ImageEntry("a.tif", "a_aligned.tif", 0, 0, 25.0, null),
                        new AlignmentReport.ImageEntry("b.tif", "b_aligned.tif", 0, 0, null, "Disc not found")));
        AlignmentReportWriter writer = new AlignmentReportWriter();

        Path file = writer.write(report, tempDir);

        assertEquals(tempDir.resolve(AlignmentReportWriter.REPORT_FILE), file);
        String json = Files.readString(file);
        assertTrue(json.contains("\"method\": \"LIMB\""), json);
        AlignmentReport read = writer.read(file);
        assertEquals(AlignmentMethod.LIMB, read.getMethod());
        assertEquals(90, read.getFrameWidth());
        assertEquals(2, read.getImages().size());
        assertEquals("Disc not found", read.getImages().get(1).getFailure());
        assertNull(read.getImages().get(1).getDiscRadius());
    }

    @Test
    @DisplayName("Malformed JSON is an I/O error")
    void testMalformed() throws Exception {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ \"method\": ");
        assertThrows(IOException.class, () -> new AlignmentReportWriter().read(file));
    }

    @Test
    @DisplayName("Run log session writes engine log lines into the output directory")
    void testRunLogger() throws Exception {
        try (RunLogger.Session session = RunLogger.start(tempDir)) {
            assertTrue(session.isActive());
            // tests log org.imppg at WARN
            LoggerFactory.getLogger(AlignmentReportWriterTest.class.getPackageName())
                    .warn("run log marker");
        }
        Path log = tempDir.resolve(RunLogger.LOG_FILE_NAME);
        assertTrue(Files.exists(log));
        assertTrue(Files.readString(log).contains("run log marker"));
    }

    @Test
    @DisplayName("Run log session is inactive for a missing directory")
    void testRunLoggerInvalidDirectory() {
        try (RunLogger.Session session = RunLogger.start(tempDir.resolve("missing"))) {
            assertFalse(session.isActive());
        }
    }
}
