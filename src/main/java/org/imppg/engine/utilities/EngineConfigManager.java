package org.imppg.engine.utilities;

import org.imppg.engine.model.CropMode;
import org.imppg.engine.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * EngineConfigManager
 *
 * <p>Loads the engine YAML configuration:
 *   - Parses the bundled {@code imppg-engine.yml} into a nested Map.
 *   - Optionally overlays a user file; keys present there replace the bundled ones, sections are merged.
 *   - Offers typed getters over key paths (getDouble, getInteger, getSection, ...).
 *   - Produces an immutable {@link EngineConfig} for the engines.
 */
public class EngineConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfigManager.class);

    public static final String DEFAULT_RESOURCE = "/imppg-engine.yml";

    private final Map<String, Object> configData;

    EngineConfigManager(Map<String, Object> configData) {
        this.configData = configData;
    }

    /**
     * Loads the bundled defaults only.
     */
    public static EngineConfigManager loadDefaults() {
        return new EngineConfigManager(loadResource(DEFAULT_RESOURCE));
    }

    /**
     * Loads the bundled defaults and overlays {@code userConfig}.
     *
     * @param userConfig YAML file with overrides
     * @throws IOException if the file cannot be read or its root is not a map
     */
    public static EngineConfigManager load(Path userConfig) throws IOException {
        Map<String, Object> merged = loadResource(DEFAULT_RESOURCE);
        Map<String, Object> overlay;
        try (InputStream in = Files.newInputStream(userConfig)) {
            overlay = parse(in, userConfig.toString());
        }
        mergeInto(merged, overlay);
        logger.info("Loaded engine configuration overrides from {}", userConfig);
        return new EngineConfigManager(merged);
    }

    private static Map<String, Object> loadResource(String resource) {
        try (InputStream in = EngineConfigManager.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Engine configuration resource {} not found, using built-in defaults", resource);
                return new LinkedHashMap<>();
            }
            return parse(in, resource);
        } catch (IOException e) {
            logger.error("Error reading engine configuration resource {}", resource, e);
            return new LinkedHashMap<>();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) throws IOException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Error parsing YAML: " + source, e);
        }
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map)) {
            throw new IOException("YAML root is not a map: " + source);
        }
        return new LinkedHashMap<>((Map<String, Object>) loaded);
    }

    @SuppressWarnings("unchecked")
    private static void mergeInto(Map<String, Object> target, Map<String, Object> overlay) {
        for (Map.Entry<String, Object> e : overlay.entrySet()) {
            Object existing = target.get(e.getKey());
            if (existing instanceof Map<?, ?> existingMap && e.getValue() instanceof Map<?, ?> overlayMap) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existingMap);
                mergeInto(copy, (Map<String, Object>) overlayMap);
                target.put(e.getKey(), copy);
            } else {
                target.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * Retrieves a nested value.
     *
     * @param keys sequence of keys, e.g. "worker", "thread_name_prefix"
     * @return the value, or null if any key along the path is missing
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                logger.debug("Config key not found: {}", String.join("/", keys));
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v != null) ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return (v != null) ? Boolean.parseBoolean(v.toString().trim()) : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    /**
     * Builds the engine configuration; missing or unparsable keys fall back to {@link EngineConfig#defaults()}.
     */
    public EngineConfig toEngineConfig() {
        EngineConfig d = EngineConfig.defaults();
        String formatName = getString("alignment", "output_format");
        String cropName = getString("alignment", "crop_mode");
        return new EngineConfig(
                orDefault(getString("worker", "thread_name_prefix"), d.threadNamePrefix()),
                orDefault(asLong(getInteger("worker", "abort_wait_warning_ms")), d.abortWaitWarningMs()),
                orDefault(getDouble("gaussian", "kernel_radius_sigmas"), d.kernelRadiusSigmas()),
                orDefault(asFloat(getDouble("deconvolution", "deringing_saturation_threshold")), d.deringingSaturationThreshold()),
                orDefault(asFloat(getDouble("deconvolution", "deringing_max_correction")), d.deringingMaxCorrection()),
                orDefault(getDouble("deconvolution", "deringing_margin_sigmas"), d.deringingMarginSigmas()),
                orDefault(asFloat(getDouble("deconvolution", "ratio_epsilon")), d.ratioEpsilon()),
                orDefault(getString("alignment", "output_suffix"), d.alignmentOutputSuffix()),
                formatName != null ? OutputFormat.fromString(formatName) : d.alignmentOutputFormat(),
                cropName != null ? CropMode.valueOf(cropName.trim().toUpperCase().replace('-', '_')) : d.alignmentCropMode(),
                orDefault(getBoolean("alignment", "subpixel"), d.alignmentSubpixel()),
                orDefault(getBoolean("alignment", "write_report"), d.writeAlignmentReport()),
                orDefault(getBoolean("logging", "run_log"), d.runLogEnabled()),
                orDefault(getInteger("limb", "ray_count"), d.limbRayCount()));
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static Long asLong(Integer v) {
        return v != null ? v.longValue() : null;
    }

    private static Float asFloat(Double v) {
        return v != null ? v.floatValue() : null;
    }
}
