package org.imppg.engine.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.imppg.engine.TestImages;
import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.Histogram;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.model.ProcessingSettings.LucyRichardson;
import org.imppg.engine.model.ProcessingSettings.Normalization;
import org.imppg.engine.model.ProcessingSettings.UnsharpMask;
import org.imppg.engine.model.ToneCurve;
import org.imppg.engine.processing.PixelPipeline;
import org.imppg.engine.service.Checkpoint;
import org.imppg.engine.processing.PipelineProgress;
import org.imppg.engine.utilities.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link DisplayEngine}: selection processing, incremental re-runs and view geometry.
 */
class DisplayEngineTest {

    private final DisplayEngine engine = new DisplayEngine(EngineConfig.defaults());
    private final PixelPipeline pipeline = new PixelPipeline();
    private final FloatImage image = TestImages.spots(64, 48, 31);
    private final Rectangle selection = new Rectangle(10, 8, 30, 20);

    @AfterEach
    void tearDown() {
        engine.abortProcessing();
    }

    private FloatImage expectedSelection(ProcessingSettings settings) {
        return pipeline.process(image.crop(selection), settings, image.minMax(), Checkpoint.NONE, PipelineProgress.NONE)
                .output();
    }

    private void awaitIdle() throws InterruptedException {
        assertTrue(engine.awaitIdle(10, TimeUnit.SECONDS));
    }

    // ==================== Preconditions ====================

    @Test
    @DisplayName("Without an image there is nothing to show")
    void testNoImage() {
        assertTrue(engine.getImage().isEmpty());
        assertTrue(engine.getSelection().isEmpty());
        assertThrows(IllegalStateException.class, engine::getProcessedSelection);
        assertThrows(IllegalStateException.class, () -> engine.newSelection(new Rectangle(0, 0, 5, 5)));
        engine.newProcessingSettings(ProcessingSettings.defaults());
    }

    // ==================== Selection Processing ====================

    @Test
    @DisplayName("Processed selection matches the pipeline run on the cropped image")
    void testProcessedSelection() throws Exception {
        ProcessingSettings settings = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(1.2f, 5, false))
                .withUnsharpMask(new UnsharpMask(false, 1.0f, 1.0f, 1.5f, 0.5f, 0.1f));
        engine.setImage(image, selection);
        engine.newProcessingSettings(settings);
        awaitIdle();

        FloatImage processed = engine.getProcessedSelection();
        assertEquals(selection.width, processed.getWidth());
        assertEquals(selection.height, processed.getHeight());
        assertArrayEquals(expectedSelection(settings).getPixels(), processed.getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("Normalization of a selection uses the brightness range of the whole image")
    void testSelectionNormalizedAgainstWholeImage() throws Exception {
        ProcessingSettings settings = ProcessingSettings.defaults()
                .withNormalization(new Normalization(true, 0.0f, 1.0f));
        engine.setImage(image, selection);
        engine.newProcessingSettings(settings);
        awaitIdle();

        assertArrayEquals(expectedSelection(settings).getPixels(), engine.getProcessedSelection().getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("Null selection selects the whole image")
    void testWholeImageSelection() throws Exception {
        engine.setImage(image, null);
        awaitIdle();
        assertEquals(image.getBounds(), engine.getSelection().orElseThrow().logical());
        assertEquals(image.getWidth(), engine.getProcessedSelection().getWidth());
    }

    @Test
    @DisplayName("New selection is clipped and processed")
    void testNewSelection() throws Exception {
        engine.setImage(image, null);
        engine.newSelection(new Rectangle(50, 40, 30, 30));
        awaitIdle();
        FloatImage processed = engine.getProcessedSelection();
        assertEquals(14, processed.getWidth());
        assertEquals(8, processed.getHeight());
    }

    // ==================== Incremental Updates ====================

    @Test
    @DisplayName("Each settings change re-runs from its stage and matches a full run")
    void testIncrementalChanges() throws Exception {
        ProcessingSettings settings = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(1.3f, 4, false));
        engine.setImage(image, selection);
        engine.newProcessingSettings(settings);
        awaitIdle();

        settings = settings.withUnsharpMask(new UnsharpMask(false, 1.5f, 1.0f, 2.0f, 0.5f, 0.1f));
        engine.unsharpMaskSettingsChanged(settings);
        awaitIdle();
        assertArrayEquals(expectedSelection(settings).getPixels(), engine.getProcessedSelection().getPixels(), 1e-6f);

        settings = settings.withToneCurve(ToneCurve.identity().withGamma(true, 1.6f));
        engine.toneCurveChanged(settings);
        awaitIdle();
        assertArrayEquals(expectedSelection(settings).getPixels(), engine.getProcessedSelection().getPixels(), 1e-6f);

        settings = settings.withLucyRichardson(new LucyRichardson(0.9f, 3, true));
        engine.lrSettingsChanged(settings);
        awaitIdle();
        assertArrayEquals(expectedSelection(settings).getPixels(), engine.getProcessedSelection().getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("Reading the selection during a slow run returns the last completed result, never a partial one")
    void testProcessedSelectionDuringRun() throws Exception {
        ProcessingSettings first = ProcessingSettings.defaults()
                .withUnsharpMask(new UnsharpMask(false, 1.0f, 1.0f, 1.7f, 0.5f, 0.1f));
        engine.setImage(image, selection);
        engine.newProcessingSettings(first);
        awaitIdle();

        engine.lrSettingsChanged(first.withLucyRichardson(new LucyRichardson(2.0f, 1_000_000, false)));
        FloatImage shown = engine.getProcessedSelection();

        assertFalse(engine.isProcessingInProgress());
        assertArrayEquals(expectedSelection(first).getPixels(), shown.getPixels(), 1e-6f);
    }

    @Test
    @DisplayName("Before any run completes the unprocessed selection is shown")
    void testUnprocessedFallback() {
        ProcessingSettings slow = ProcessingSettings.defaults()
                .withLucyRichardson(new LucyRichardson(2.0f, 1_000_000, false));
        engine.newProcessingSettings(slow);
        engine.setImage(image, selection);

        FloatImage shown = engine.getProcessedSelection();
        assertArrayEquals(image.crop(selection).getPixels(), shown.getPixels());
    }

    @Test
    @DisplayName("Histogram describes the selection before the tone curve")
    void testHistogram() throws Exception {
        ProcessingSettings settings = ProcessingSettings.defaults()
                .withToneCurve(ToneCurve.identity().withGamma(true, 3.0f));
        engine.setImage(image, selection);
        engine.newProcessingSettings(settings);
        awaitIdle();

        Histogram histogram = engine.getHistogram();
        Histogram unprocessed = Histogram.of(image.crop(selection));
        assertArrayEquals(unprocessed.bins(), histogram.bins());
        assertEquals(selection.width * selection.height,
                Arrays.stream(histogram.bins()).sum());
    }

    // ==================== View Geometry ====================

    @Test
    @DisplayName("Zoom and scroll update the scaled and physical selection")
    void testViewGeometry() {
        engine.setImage(image, selection);
        engine.imageViewZoomChanged(2.0f);
        assertEquals(new Rectangle(20, 16, 60, 40), engine.getScaledLogicalSelection());

        engine.imageViewScrolledOrResized(2.0f, 15, 6);
        assertEquals(new Rectangle(5, 10, 60, 40), engine.getPhysicalSelection());
        assertEquals(selection, engine.getSelection().orElseThrow().logical());
    }
}
