package org.imppg.engine.utilities;

import org.imppg.engine.model.FloatImage;
import org.imppg.engine.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads image files into mono {@link FloatImage}s and writes them back as 8- or 16-bit greyscale.
 *
 * <p>Integer samples are scaled to [0, 1] by their bit depth, colour images are converted to
 * luminance (Rec. 601 weights), float samples are taken as they are.</p>
 */
public final class ImageFiles {
    private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);

    private ImageFiles() {
    }

    public static FloatImage read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        BufferedImage img = ImageIO.read(path.toFile());
        if (img == null) {
            throw new ImageFormatException("Unsupported image format: " + path);
        }
        FloatImage result = toFloatImage(img);
        logger.debug("Read {} ({}x{}, {} bands)", path.getFileName(), img.getWidth(), img.getHeight(),
                img.getRaster().getNumBands());
        return result;
    }

    public static FloatImage toFloatImage(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        float[] out = new float[w * h];

        if (img.getColorModel() instanceof IndexColorModel) {
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int rgb = img.getRGB(x, y);
                    out[y * w + x] = luminance((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF) / 255f;
                }
            }
            return new FloatImage(w, h, out);
        }

        Raster raster = img.getRaster();
        int bands = raster.getNumBands();
        boolean floating = raster.getDataBuffer().getDataType() == DataBuffer.TYPE_FLOAT
                || raster.getDataBuffer().getDataType() == DataBuffer.TYPE_DOUBLE;
        float scale = floating ? 1f : (float) ((1L << raster.getSampleModel().getSampleSize(0)) - 1);
        boolean colour = bands >= 3;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float v;
                if (colour) {
                    v = luminance(raster.getSampleFloat(x, y, 0),
                            raster.getSampleFloat(x, y, 1),
                            raster.getSampleFloat(x, y, 2));
                } else {
                    v = raster.getSampleFloat(x, y, 0);
                }
                out[y * w + x] = v / scale;
            }
        }
        return new FloatImage(w, h, out);
    }

    private static float luminance(float r, float g, float b) {
        return 0.299f * r + 0.587f * g + 0.114f * b;
    }

    /**
     * Writes {@code image} clamped to [0, 1] in the given format, replacing an existing file.
     */
    public static void write(FloatImage image, Path path, OutputFormat format) throws IOException {
        BufferedImage out = toBufferedImage(image, format.getBitsPerSample());
        if (!ImageIO.write(out, format.getImageIoName(), path.toFile())) {
            throw new ImageFormatException("No image writer available for " + format);
        }
        logger.debug("Wrote {} as {}", path, format);
    }

    public static BufferedImage toBufferedImage(FloatImage image, int bitsPerSample) {
        int type = switch (bitsPerSample) {
            case 8 -> BufferedImage.TYPE_BYTE_GRAY;
            case 16 -> BufferedImage.TYPE_USHORT_GRAY;
            default -> throw new IllegalArgumentException("Unsupported bit depth: " + bitsPerSample);
        };
        int maxValue = (1 << bitsPerSample) - 1;
        BufferedImage out = new BufferedImage(image.getWidth(), image.getHeight(), type);
        WritableRaster raster = out.getRaster();
        float[] px = image.getPixels();
        int w = image.getWidth();
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < w; x++) {
                float v = Math.max(0f, Math.min(1f, px[y * w + x]));
                raster.setSample(x, y, 0, Math.round(v * maxValue));
            }
        }
        return out;
    }
}
