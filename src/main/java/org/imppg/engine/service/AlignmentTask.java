package org.imppg.engine.service;

import org.imppg.engine.model.AlignmentMethod;
import org.imppg.engine.model.AlignmentReport;
import org.imppg.engine.model.AlignmentRun;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.OutputPolicy;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.processing.AlignmentFrame;
import org.imppg.engine.utilities.AlignmentReportWriter;
import org.imppg.engine.utilities.ImageFiles;
import org.imppg.engine.utilities.LimbDetectionException;
import org.imppg.engine.utilities.LimbDetector;
import org.imppg.engine.utilities.LimbDetector.Disc;
import org.imppg.engine.utilities.PhaseCorrelation;
import org.imppg.engine.utilities.PhaseCorrelation.Translation;
import org.imppg.engine.utilities.RunLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aligns an ordered image sequence and writes the translated images.
 *
 * <p>Phases and their events, for {@code n} files:</p>
 * <ol>
 *   <li><b>Phase correlation:</b> {@code TranslationComputed(i, n-1, dx, dy)} for {@code i = 1..n-1},
 *       carrying the cumulative translation of image {@code i} relative to the first image</li>
 *   <li><b>Limb:</b> {@code DiscRadiusFound(i, n, r)} per image, {@code AverageRadiusUsed(r)}, then
 *       {@code StabilizationProgress(i, n)} per image while each centre is refitted with the average
 *       radius. A disc that cannot be found yields {@code StabilizationFailure} and the image keeps the
 *       translation of the image before it.</li>
 *   <li><b>Save:</b> {@code ImageSaved(i, n, path)} for {@code i = 0..n-1}</li>
 * </ol>
 * Abort is checked once per file in every phase.
 */
public class AlignmentTask extends WorkerTask<AlignmentReport> {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentTask.class);

    private final AlignmentRun run;
    private final LimbDetector limbDetector;
    private final boolean writeReport;
    private final boolean runLog;

    public AlignmentTask(AlignmentRun run, LimbDetector limbDetector, boolean writeReport, boolean runLog) {
        this.run = run;
        this.limbDetector = limbDetector;
        this.writeReport = writeReport;
        this.runLog = runLog;
    }

    @Override
    public String getName() {
        return "alignment of " + run.fileCount() + " images";
    }

    @Override
    protected AlignmentReport compute(WorkerContext context) throws IOException {
        OutputPolicy output = run.output();
        Files.createDirectories(output.outputDirectory());
        try (RunLogger.Session session = runLog ? RunLogger.start(output.outputDirectory()) : null) {
            logger.info("Aligning {} images ({}) into {}", run.fileCount(), run.method(), output.outputDirectory());

            int n = run.fileCount();
            List<Dimension> sizes = new ArrayList<>(n);
            Double[] radii = new Double[n];
            String[] failures = new String[n];
            Double averageRadius = null;

            List<Translation> translations;
            if (run.method() == AlignmentMethod.PHASE_CORRELATION) {
                translations = computePhaseCorrelation(context, sizes);
            } else {
                Disc[] discs = detectDiscs(context, sizes, radii, failures);
                averageRadius = averageRadius(discs);
                context.publish(new ProgressEvent.AverageRadiusUsed(averageRadius));
                logger.info("Using average disc radius {}", averageRadius);
                stabilize(context, discs, averageRadius, failures);
                translations = translationsFromDiscs(discs);
            }

            Rectangle frame;
            try {
                frame = AlignmentFrame.compute(translations, sizes, output.cropMode());
            } catch (IllegalArgumentException e) {
                throw new IOException("Cannot build output frame: " + e.getMessage(), e);
            }
            logger.info("Output frame {}x{} at ({}, {})", frame.width, frame.height, frame.x, frame.y);

            List<AlignmentReport.ImageEntry> entries = saveAligned(context, translations, frame, radii, failures);
            AlignmentReport report = new AlignmentReport(run.method(), output.cropMode(),
                    frame.x, frame.y, frame.width, frame.height, averageRadius, entries);
            if (writeReport) {
                new AlignmentReportWriter().write(report, output.outputDirectory());
            }
            return report;
        }
    }

    private List<Translation> computePhaseCorrelation(WorkerContext context, List<Dimension> sizes) throws IOException {
        int n = run.fileCount();
        List<Translation> translations = new ArrayList<>(n);
        translations.add(Translation.ZERO);

        context.check();
        FloatImage previous = ImageFiles.read(run.files().get(0));
        sizes.add(new Dimension(previous.getWidth(), previous.getHeight()));
        Translation cumulative = Translation.ZERO;

        for (int i = 1; i < n; i++) {
            context.check();
            FloatImage current = ImageFiles.read(run.files().get(i));
            sizes.add(new Dimension(current.getWidth(), current.getHeight()));
            Translation step = PhaseCorrelation.determineTranslation(previous, current);
            cumulative = cumulative.plus(step);
            translations.add(cumulative);
            logger.info("Image {}/{}: translated by {}, {}", i + 1, n,
                    String.format("%.2f", cumulative.dx()), String.format("%.2f", cumulative.dy()));
            context.publish(new ProgressEvent.TranslationComputed(i, n - 1, cumulative.dx(), cumulative.dy()));
            previous = current;
        }
        return translations;
    }

    private Disc[] detectDiscs(WorkerContext context, List<Dimension> sizes, Double[] radii, String[] failures)
            throws IOException {
        int n = run.fileCount();
        Disc[] discs = new Disc[n];
        for (int i = 0; i < n; i++) {
            context.check();
            FloatImage image = ImageFiles.read(run.files().get(i));
            sizes.add(new Dimension(image.getWidth(), image.getHeight()));
            try {
                discs[i] = limbDetector.detect(image);
                radii[i] = discs[i].radius();
                context.publish(new ProgressEvent.DiscRadiusFound(i, n, discs[i].radius()));
            } catch (LimbDetectionException e) {
                failures[i] = e.getMessage();
                logger.warn("Image {}/{} ({}): {}", i + 1, n, run.files().get(i).getFileName(), e.getMessage());
                context.publish(new ProgressEvent.StabilizationFailure(i,
                        "Disc not found in " + run.files().get(i).getFileName() + ": " + e.getMessage()));
            }
        }
        return discs;
    }

    private static double averageRadius(Disc[] discs) throws IOException {
        double sum = 0;
        int count = 0;
        for (Disc d : discs) {
            if (d != null) {
                sum += d.radius();
                count++;
            }
        }
        if (count == 0) {
            throw new IOException("Disc not found in any image");
        }
        return sum / count;
    }

    private void stabilize(WorkerContext context, Disc[] discs, double radius, String[] failures) throws IOException {
        int n = run.fileCount();
        for (int i = 0; i < n; i++) {
            context.check();
            if (discs[i] != null) {
                FloatImage image = ImageFiles.read(run.files().get(i));
                try {
                    discs[i] = limbDetector.refineCenter(image, radius, discs[i]);
                } catch (LimbDetectionException e) {
                    failures[i] = e.getMessage();
                    logger.warn("Stabilization of image {}/{} failed: {}", i + 1, n, e.getMessage());
                    context.publish(new ProgressEvent.StabilizationFailure(i,
                            "Stabilization of " + run.files().get(i).getFileName() + " failed: " + e.getMessage()));
                }
            }
            context.publish(new ProgressEvent.StabilizationProgress(i, n));
        }
    }

    // Images without a disc inherit the translation of the previous image
    static List<Translation> translationsFromDiscs(Disc[] discs) {
        Disc reference = Arrays.stream(discs).filter(Objects::nonNull).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No disc available"));
        List<Translation> translations = new ArrayList<>(discs.length);
        Translation last = Translation.ZERO;
        for (Disc d : discs) {
            if (d != null) {
                last = new Translation(d.centerX() - reference.centerX(), d.centerY() - reference.centerY());
            }
            translations.add(last);
        }
        return translations;
    }

    private List<AlignmentReport.ImageEntry> saveAligned(WorkerContext context, List<Translation> translations,
                                                         Rectangle frame, Double[] radii, String[] failures)
            throws IOException {
        OutputPolicy output = run.output();
        int n = run.fileCount();
        List<AlignmentReport.ImageEntry> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            context.check();
            Path input = run.files().get(i);
            FloatImage image = ImageFiles.read(input);
            FloatImage aligned = AlignmentFrame.translate(image, translations.get(i), frame, output.subpixel());
            Path target = output.outputPathFor(input);
            ImageFiles.write(aligned, target, output.format());
            logger.info("Translated and saved image {}/{}", i + 1, n);
            entries.add(new AlignmentReport.ImageEntry(input.toString(), target.toString(),
                    translations.get(i).dx(), translations.get(i).dy(), radii[i], failures[i]));
            context.publish(new ProgressEvent.ImageSaved(i, n, target));
        }
        return entries;
    }
}
