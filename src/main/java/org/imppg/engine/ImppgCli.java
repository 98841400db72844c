package org.imppg.engine;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import org.imppg.engine.controller.AbstractEngine;
import org.imppg.engine.controller.AlignmentEngine;
import org.imppg.engine.controller.BatchEngine;
import org.imppg.engine.model.AlignmentMethod;
import org.imppg.engine.model.AlignmentRun;
import org.imppg.engine.model.BatchRun;
import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.CropMode;
import org.imppg.engine.model.OutputFormat;
import org.imppg.engine.model.OutputPolicy;
import org.imppg.engine.preferences.ProcessingSettingsStore;
import org.imppg.engine.ui.AlignmentProgressModel;
import org.imppg.engine.utilities.EngineConfig;
import org.imppg.engine.utilities.EngineConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Headless entry point.
 *
 * <pre>
 * imppg-engine [--config engine.yml] align --output DIR [--method limb] [--pad] files...
 * imppg-engine [--config engine.yml] process --settings settings.xml --output DIR files...
 * </pre>
 *
 * The main thread owns the engine: it pumps progress events until the run ends. Ctrl+C aborts the run.
 */
public class ImppgCli {
    private static final Logger logger = LoggerFactory.getLogger(ImppgCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final long PUMP_INTERVAL_MS = 200;

    static class MainOptions {
        @Parameter(names = "--config", description = "YAML file overriding engine defaults")
        String config;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show usage")
        boolean help;
    }

    @Parameters(commandDescription = "Align an image sequence and save the translated images")
    static class AlignCommand {
        @Parameter(description = "Input images, in sequence order", required = true)
        List<String> files = new ArrayList<>();

        @Parameter(names = {"-o", "--output"}, description = "Output directory", required = true)
        String output;

        @Parameter(names = "--method", description = "phase-correlation or limb")
        String method = "phase-correlation";

        @Parameter(names = "--pad", description = "Pad to the bounding box instead of cropping to the intersection")
        boolean pad;

        @Parameter(names = "--format", description = "Output format: tiff-16, png-16 or png-8")
        String format;

        @Parameter(names = "--suffix", description = "Suffix appended to output file names")
        String suffix;

        @Parameter(names = "--no-subpixel", description = "Translate by whole pixels only")
        boolean noSubpixel;
    }

    @Parameters(commandDescription = "Process images with saved settings")
    static class ProcessCommand {
        @Parameter(description = "Input images", required = true)
        List<String> files = new ArrayList<>();

        @Parameter(names = {"-s", "--settings"}, description = "Processing settings XML file", required = true)
        String settings;

        @Parameter(names = {"-o", "--output"}, description = "Output directory", required = true)
        String output;

        @Parameter(names = "--format", description = "Output format: tiff-16, png-16 or png-8")
        String format = "tiff-16";

        @Parameter(names = "--suffix", description = "Suffix appended to output file names")
        String suffix = "";
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        MainOptions main = new MainOptions();
        AlignCommand align = new AlignCommand();
        ProcessCommand process = new ProcessCommand();
        JCommander jc = JCommander.newBuilder()
                .programName("imppg-engine")
                .addObject(main)
                .addCommand("align", align)
                .addCommand("process", process)
                .build();
        try {
            jc.parse(args);
        } catch (ParameterException e) {
            logger.error("{}", e.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }
        if (main.help || jc.getParsedCommand() == null) {
            jc.usage();
            return main.help ? EXIT_OK : EXIT_USAGE;
        }

        try {
            EngineConfigManager configManager = main.config != null
                    ? EngineConfigManager.load(Paths.get(main.config))
                    : EngineConfigManager.loadDefaults();
            EngineConfig config = configManager.toEngineConfig();
            return switch (jc.getParsedCommand()) {
                case "align" -> runAlignment(align, config);
                case "process" -> runBatch(process, config);
                default -> EXIT_USAGE;
            };
        } catch (IOException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid argument: {}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static int runAlignment(AlignCommand cmd, EngineConfig config) {
        OutputPolicy output = new OutputPolicy(
                Paths.get(cmd.output),
                cmd.pad ? CropMode.PAD_TO_BOUNDING_BOX : config.alignmentCropMode(),
                cmd.format != null ? OutputFormat.fromString(cmd.format) : config.alignmentOutputFormat(),
                cmd.suffix != null ? cmd.suffix : config.alignmentOutputSuffix(),
                !cmd.noSubpixel && config.alignmentSubpixel());
        AlignmentRun run = new AlignmentRun(toPaths(cmd.files), AlignmentMethod.fromString(cmd.method), output);

        AlignmentEngine engine = new AlignmentEngine(config);
        AlignmentProgressModel progress = new AlignmentProgressModel(run.method(), run.fileCount());
        AtomicInteger printed = new AtomicInteger();
        progress.addChangeListener(model -> {
            List<String> lines = model.getLog();
            for (int i = printed.get(); i < lines.size(); i++) {
                if (!lines.get(i).isEmpty()) {
                    logger.info("{}", lines.get(i));
                }
            }
            printed.set(lines.size());
        });
        engine.addProgressListener(progress);

        CompletionStatus status = runToCompletion(engine, () -> engine.startAlignment(run));
        engine.getReport().ifPresent(r ->
                logger.info("Aligned {} images, output frame {}x{}", r.getImages().size(), r.getFrameWidth(), r.getFrameHeight()));
        progress.getOutcomeMessage().ifPresent(message -> logger.info("{}", message));
        return status == CompletionStatus.COMPLETED ? EXIT_OK : EXIT_FAILED;
    }

    private static int runBatch(ProcessCommand cmd, EngineConfig config) throws IOException {
        ProcessingSettingsStore.LoadedSettings loaded = ProcessingSettingsStore.load(Paths.get(cmd.settings));
        BatchRun run = new BatchRun(toPaths(cmd.files), loaded.settings(), Paths.get(cmd.output),
                OutputFormat.fromString(cmd.format), cmd.suffix);

        BatchEngine engine = new BatchEngine(config);
        engine.setProgressTextHandler(text -> {
            if (!text.isEmpty()) {
                logger.debug("{}", text);
            }
        });
        CompletionStatus status = runToCompletion(engine, () -> engine.startBatch(run));
        if (status == CompletionStatus.COMPLETED) {
            logger.info("Processed {} files into {}", engine.getOutputs().size(), run.outputDirectory());
            return EXIT_OK;
        }
        return EXIT_FAILED;
    }

    private interface RunStarter {
        long start();
    }

    private static CompletionStatus runToCompletion(AbstractEngine engine, RunStarter starter) {
        AtomicReference<CompletionStatus> outcome = new AtomicReference<>(CompletionStatus.ABORTED);
        engine.setProcessingCompletedHandler(outcome::set);
        Thread abortOnExit = new Thread(engine::abortProcessing, "imppg-shutdown");
        Runtime.getRuntime().addShutdownHook(abortOnExit);
        try {
            long runId = starter.start();
            if (runId < 0) {
                return CompletionStatus.ABORTED;
            }
            while (!engine.awaitCompletion(runId, PUMP_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                logger.trace("Run {} still in progress", runId);
            }
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            engine.abortProcessing();
            return CompletionStatus.ABORTED;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(abortOnExit);
            } catch (IllegalStateException e) {
                logger.debug("Shutdown in progress, hook stays registered");
            }
        }
    }

    private static List<Path> toPaths(List<String> files) {
        List<Path> paths = new ArrayList<>(files.size());
        for (String f : files) {
            paths.add(Paths.get(f));
        }
        return paths;
    }
}
