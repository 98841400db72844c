package org.imppg.engine.preferences;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.imppg.engine.model.ProcessingSettings;
import org.imppg.engine.model.ProcessingSettings.LucyRichardson;
import org.imppg.engine.model.ProcessingSettings.Normalization;
import org.imppg.engine.model.ProcessingSettings.UnsharpMask;
import org.imppg.engine.model.ToneCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes processing settings as an XML file.
 *
 * <p>File layout:</p>
 * <pre>{@code
 * <imppg>
 *     <lucy-richardson sigma="1.3000" iterations="50" deringing="false"/>
 *     <unsharp_mask adaptive="false" sigma="1.3000" amount_min="1.0000" amount_max="1.5000"
 *                   amount_threshold="0.0100" amount_width="0.0010"/>
 *     <tone_curve smooth="true" is_gamma="false">0.0000;0.0000;1.0000;1.0000;</tone_curve>
 *     <normalization enabled="false" min="0.0000" max="1.0000"/>
 * </imppg>
 * }</pre>
 *
 * <p>Every section is optional when loading. Missing sections keep their defaults, with deringing and
 * normalization off. A section that is present but holds an invalid value fails the whole load.</p>
 */
public final class ProcessingSettingsStore {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingSettingsStore.class);

    static final String ROOT = "imppg";
    static final String LUCY_RICHARDSON = "lucy-richardson";
    static final String UNSHARP_MASK = "unsharp_mask";
    static final String TONE_CURVE = "tone_curve";
    static final String NORMALIZATION = "normalization";

    private static final String TRUE = "true";
    private static final String FALSE = "false";

    /**
     * Settings read from a file, with the sections that were present.
     */
    public record LoadedSettings(
            ProcessingSettings settings,
            boolean lucyRichardsonLoaded,
            boolean unsharpMaskLoaded,
            boolean toneCurveLoaded,
            boolean normalizationLoaded) { }

    private ProcessingSettingsStore() {
    }

    /**
     * Writes all sections of {@code settings} to {@code file}, replacing it.
     *
     * @throws IOException if the file cannot be written
     */
    public static void save(ProcessingSettings settings, Path file) throws IOException {
        XMLConfiguration xml = newConfiguration();
        xml.setRootElementName(ROOT);

        LucyRichardson lr = settings.lucyRichardson();
        xml.addProperty(LUCY_RICHARDSON + "[@sigma]", format(lr.sigma()));
        xml.addProperty(LUCY_RICHARDSON + "[@iterations]", Integer.toString(lr.iterations()));
        xml.addProperty(LUCY_RICHARDSON + "[@deringing]", format(lr.deringing()));

        UnsharpMask um = settings.unsharpMask();
        xml.addProperty(UNSHARP_MASK + "[@adaptive]", format(um.adaptive()));
        xml.addProperty(UNSHARP_MASK + "[@sigma]", format(um.sigma()));
        xml.addProperty(UNSHARP_MASK + "[@amount_min]", format(um.amountMin()));
        xml.addProperty(UNSHARP_MASK + "[@amount_max]", format(um.amountMax()));
        xml.addProperty(UNSHARP_MASK + "[@amount_threshold]", format(um.threshold()));
        xml.addProperty(UNSHARP_MASK + "[@amount_width]", format(um.width()));

        ToneCurve curve = settings.toneCurve();
        StringBuilder points = new StringBuilder();
        String lastX = null;
        for (ToneCurve.Point p : curve.getPoints()) {
            String x = format(p.x());
            // points closer than the written precision would read back as duplicates
            if (x.equals(lastX)) {
                logger.debug("Tone curve point {} collapsed into the previous one at x={}", p, x);
                continue;
            }
            points.append(x).append(';').append(format(p.y())).append(';');
            lastX = x;
        }
        xml.addProperty(TONE_CURVE, points.toString());
        xml.addProperty(TONE_CURVE + "[@smooth]", format(curve.isSmooth()));
        xml.addProperty(TONE_CURVE + "[@is_gamma]", format(curve.isGammaMode()));
        if (curve.isGammaMode()) {
            xml.addProperty(TONE_CURVE + "[@gamma]", format(curve.getGamma()));
        }

        Normalization norm = settings.normalization();
        xml.addProperty(NORMALIZATION + "[@enabled]", format(norm.enabled()));
        xml.addProperty(NORMALIZATION + "[@min]", format(norm.min()));
        xml.addProperty(NORMALIZATION + "[@max]", format(norm.max()));

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            xml.save(writer);
        } catch (ConfigurationException e) {
            throw new IOException("Cannot write settings to " + file + ": " + e.getMessage(), e);
        }
        logger.info("Saved processing settings to {}", file);
    }

    /**
     * Reads settings from {@code file}.
     *
     * @throws SettingsFormatException if the file is not valid XML or a present section is malformed
     * @throws IOException if the file cannot be read
     */
    public static LoadedSettings load(Path file) throws IOException {
        if (!Files.isReadable(file)) {
            throw new IOException("Settings file not readable: " + file);
        }
        XMLConfiguration xml = newConfiguration();
        try {
            xml.load(file.toFile());
        } catch (ConfigurationException e) {
            throw new SettingsFormatException("Cannot parse settings file " + file + ": " + e.getMessage(), e);
        }

        ProcessingSettings settings = ProcessingSettings.defaults();
        boolean lrLoaded = hasSection(xml, LUCY_RICHARDSON);
        boolean umLoaded = hasSection(xml, UNSHARP_MASK);
        boolean tcLoaded = hasSection(xml, TONE_CURVE);
        boolean normLoaded = hasSection(xml, NORMALIZATION);

        try {
            if (lrLoaded) {
                settings = settings.withLucyRichardson(parseLucyRichardson(xml));
            }
            if (umLoaded) {
                settings = settings.withUnsharpMask(parseUnsharpMask(xml));
            }
            if (tcLoaded) {
                settings = settings.withToneCurve(parseToneCurve(xml));
            }
            if (normLoaded) {
                settings = settings.withNormalization(parseNormalization(xml));
            }
        } catch (IllegalArgumentException e) {
            throw new SettingsFormatException("Invalid settings in " + file + ": " + e.getMessage(), e);
        }

        logger.info("Loaded processing settings from {} (L-R: {}, unsharp mask: {}, tone curve: {}, normalization: {})",
                file, lrLoaded, umLoaded, tcLoaded, normLoaded);
        return new LoadedSettings(settings, lrLoaded, umLoaded, tcLoaded, normLoaded);
    }

    private static XMLConfiguration newConfiguration() {
        XMLConfiguration xml = new XMLConfiguration();
        // tone curve points and numbers must reach us unsplit
        xml.setDelimiterParsingDisabled(true);
        xml.setAttributeSplittingDisabled(true);
        xml.setEncoding(StandardCharsets.UTF_8.name());
        return xml;
    }

    private static boolean hasSection(XMLConfiguration xml, String name) {
        return !xml.configurationsAt(name).isEmpty();
    }

    private static LucyRichardson parseLucyRichardson(XMLConfiguration xml) throws SettingsFormatException {
        float sigma = parseFloat(xml, LUCY_RICHARDSON, "sigma");
        String iterationsText = requireAttribute(xml, LUCY_RICHARDSON, "iterations");
        int iterations;
        try {
            iterations = Integer.parseInt(iterationsText.trim());
        } catch (NumberFormatException e) {
            throw new SettingsFormatException(LUCY_RICHARDSON + ": invalid iterations '" + iterationsText + "'", e);
        }
        boolean deringing = parseBoolean(xml, LUCY_RICHARDSON, "deringing");
        return new LucyRichardson(sigma, iterations, deringing);
    }

    private static UnsharpMask parseUnsharpMask(XMLConfiguration xml) throws SettingsFormatException {
        return new UnsharpMask(
                parseBoolean(xml, UNSHARP_MASK, "adaptive"),
                parseFloat(xml, UNSHARP_MASK, "sigma"),
                parseFloat(xml, UNSHARP_MASK, "amount_min"),
                parseFloat(xml, UNSHARP_MASK, "amount_max"),
                parseFloat(xml, UNSHARP_MASK, "amount_threshold"),
                parseFloat(xml, UNSHARP_MASK, "amount_width"));
    }

    private static ToneCurve parseToneCurve(XMLConfiguration xml) throws SettingsFormatException {
        boolean smooth = parseBoolean(xml, TONE_CURVE, "smooth");
        boolean gammaMode = parseBoolean(xml, TONE_CURVE, "is_gamma");
        float gamma = gammaMode ? parseFloat(xml, TONE_CURVE, "gamma") : 1.0f;

        String text = xml.getString(TONE_CURVE, "");
        List<Float> values = new ArrayList<>();
        for (String token : text.split(";")) {
            if (token.isBlank()) {
                continue;
            }
            try {
                values.add(Float.parseFloat(token.trim()));
            } catch (NumberFormatException e) {
                throw new SettingsFormatException(TONE_CURVE + ": invalid coordinate '" + token + "'", e);
            }
        }
        if (values.size() % 2 != 0) {
            throw new SettingsFormatException(TONE_CURVE + ": odd number of coordinates (" + values.size() + ")");
        }
        if (values.size() / 2 < ToneCurve.MIN_POINTS) {
            throw new SettingsFormatException(TONE_CURVE + ": needs at least " + ToneCurve.MIN_POINTS
                    + " points, got " + values.size() / 2);
        }
        List<ToneCurve.Point> points = new ArrayList<>(values.size() / 2);
        for (int i = 0; i < values.size(); i += 2) {
            points.add(new ToneCurve.Point(values.get(i), values.get(i + 1)));
        }
        return ToneCurve.of(points, smooth, gammaMode, gamma);
    }

    private static Normalization parseNormalization(XMLConfiguration xml) throws SettingsFormatException {
        return new Normalization(
                parseBoolean(xml, NORMALIZATION, "enabled"),
                parseFloat(xml, NORMALIZATION, "min"),
                parseFloat(xml, NORMALIZATION, "max"));
    }

    private static String requireAttribute(XMLConfiguration xml, String section, String attribute)
            throws SettingsFormatException {
        String value = xml.getString(section + "[@" + attribute + "]");
        if (value == null) {
            throw new SettingsFormatException(section + ": missing attribute '" + attribute + "'");
        }
        return value;
    }

    private static float parseFloat(XMLConfiguration xml, String section, String attribute)
            throws SettingsFormatException {
        String value = requireAttribute(xml, section, attribute);
        try {
            float parsed = Float.parseFloat(value.trim());
            if (!Float.isFinite(parsed)) {
                throw new SettingsFormatException(section + ": " + attribute + " is not finite: '" + value + "'");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new SettingsFormatException(section + ": invalid " + attribute + " '" + value + "'", e);
        }
    }

    // only the literal strings are accepted, unlike Boolean.parseBoolean
    private static boolean parseBoolean(XMLConfiguration xml, String section, String attribute)
            throws SettingsFormatException {
        String value = requireAttribute(xml, section, attribute);
        return switch (value) {
            case TRUE -> true;
            case FALSE -> false;
            default -> throw new SettingsFormatException(section + ": " + attribute
                    + " must be true or false, got '" + value + "'");
        };
    }

    static String format(float value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String format(boolean value) {
        return value ? TRUE : FALSE;
    }
}
