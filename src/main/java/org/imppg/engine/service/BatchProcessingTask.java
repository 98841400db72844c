package org.imppg.engine.service;

import org.imppg.engine.model.BatchRun;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProgressEvent;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.utilities.ImageFiles;
import org.imppg.engine.utilities.RunLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Processes every file of a {@link BatchRun} with the same settings and writes the results.
 *
 * <p>Checks for abort before each file and in each deconvolution iteration. Emits
 * {@code ImageSaved(i, n, path)} after each file. A file that cannot be read or written fails the run.</p>
 */
public class BatchProcessingTask extends WorkerTask<List<Path>> {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessingTask.class);

    private final BatchRun run;
    private final PixelPipeline pipeline;
    private final boolean runLog;

    public BatchProcessingTask(BatchRun run, PixelPipeline pipeline, boolean runLog) {
        this.run = run;
        this.pipeline = pipeline;
        this.runLog = runLog;
    }

    @Override
    public String getName() {
        return "batch processing of " + run.files().size() + " files";
    }

    @Override
    protected List<Path> compute(WorkerContext context) throws IOException {
        Files.createDirectories(run.outputDirectory());
        try (RunLogger.Session session = runLog ? RunLogger.start(run.outputDirectory()) : null) {
            int n = run.files().size();
            logger.info("Batch processing {} files into {}", n, run.outputDirectory());
            List<Path> outputs = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                context.check();
                Path input = run.files().get(i);
                FloatImage image = ImageFiles.read(input);
                FloatImage processed = pipeline.process(image, run.settings(), null, context,
                        (stage, done, total) -> context.publish(new ProgressEvent.StageProgress(stage, done, total)))
                        .output();
                Path output = run.outputPathFor(input);
                ImageFiles.write(processed, output, run.format());
                outputs.add(output);
                logger.info("Processed image {}/{}: {} -> {}", i + 1, n, input.getFileName(), output.getFileName());
                context.publish(new ProgressEvent.ImageSaved(i, n, output));
            }
            return outputs;
        }
    }
}
