package org.imppg.engine.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.TestImages;
import org.imppg.engine.model.CompletionStatus;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.model.ProcessingSettings.LucyRichardson;
import org.imppg.engine.model.ProcessingSettings.UnsharpMask;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.utilities.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link ProcessingEngine}.
 */
class ProcessingEngineTest {

    private final ProcessingEngine engine = new ProcessingEngine(EngineConfig.defaults());

    @AfterEach
    void tearDown() {
        engine.abortProcessing();
    }

    @Test
    @DisplayName("Output is unavailable before a run completes")
    void testOutputBeforeCompletion() {
        assertThrows(IllegalStateException.class, engine::getProcessedOutput);
        assertFalse(engine.hasProcessedOutput());
    }

    @Test
    @DisplayName("Completed run yields the same image as the pipeline itself")
    void testProcessedOutput() throws Exception {
        FloatImage image = TestImages.spots(40, 32, 21);
        ProcessingSettings settings = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(1.1f, 6, false))
                .withUnsharpMask(new UnsharpMask(false, 1.2f, 1.0f, 1.6f, 0.5f, 0.1f));
        List<CompletionStatus> statuses = new ArrayList<>();
        engine.setProcessingCompletedHandler(statuses::add);

        long runId = engine.startProcessing(image, settings);
        assertTrue(engine.awaitCompletion(runId, 10, TimeUnit.SECONDS));

        assertEquals(List.of(CompletionStatus.COMPLETED), statuses);
        FloatImage expected = new PixelPipeline().process(image, settings);
        assertArrayEquals(expected.getPixels(), engine.getProcessedOutput().getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("Aborted run leaves no output and reports ABORTED")
    void testAbortedRun() throws Exception {
        List<CompletionStatus> statuses = new ArrayList<>();
        engine.setProcessingCompletedHandler(statuses::add);
        ProcessingSettings slow = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(2.0f, 1_000_000, false));

        engine.startProcessing(TestImages.spots(64, 64, 22), slow);
        engine.abortProcessing();
        assertFalse(engine.isProcessingInProgress());
        assertTrue(engine.awaitIdle(5, TimeUnit.SECONDS));

        assertEquals(List.of(CompletionStatus.ABORTED), statuses);
        assertThrows(IllegalStateException.class, engine::getProcessedOutput);
    }

    @Test
    @DisplayName("Starting again replaces the running job and only the latest result is kept")
    void testRestartKeepsLatest() throws Exception {
        FloatImage image = TestImages.spots(32, 32, 23);
        ProcessingSettings slow = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(2.0f, 1_000_000, false));
        ProcessingSettings quick = ProcessingSettings.defaults()
                .withUnsharpMask(new UnsharpMask(false, 1.0f, 1.0f, 2.0f, 0.5f, 0.1f));

        engine.startProcessing(image, slow);
        engine.startProcessing(image, quick);
        assertTrue(engine.awaitIdle(10, TimeUnit.SECONDS));

        FloatImage expected = new PixelPipeline().process(image, quick);
        assertArrayEquals(expected.getPixels(), engine.getProcessedOutput().getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("The caller's image may change after the run started")
    void testInputCopied() throws Exception {
        FloatImage image = TestImages.spots(24, 24, 24);
        FloatImage original = image.copy();
        long runId = engine.startProcessing(image, ProcessingSettings.defaults());
        image.getPixels()[0] = 123f;
        assertTrue(engine.awaitCompletion(runId, 5, TimeUnit.SECONDS));
        assertEquals(original.getPixels()[0], engine.getProcessedOutput().getPixels()[0]);
    }
}
