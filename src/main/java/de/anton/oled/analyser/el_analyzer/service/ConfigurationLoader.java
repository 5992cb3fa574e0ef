package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.model.PhotodiodeGain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Builds the {@link AnalysisConfiguration} from {@code el-analysis.properties} on the classpath,
 * overlaid by an optional user properties file. Keys that are absent keep the rig defaults.
 */
public class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String DEFAULT_RESOURCE = "el-analysis.properties";

    public static final String LIBRARY_DIR = "library.dir";
    public static final String REFERENCE_PHOTOPIC = "reference.photopic";
    public static final String REFERENCE_RESPONSIVITY = "reference.responsivity";
    public static final String REFERENCE_CIE = "reference.cie";
    public static final String REFERENCE_CALIBRATION = "reference.calibration";
    public static final String OLED_AREA = "oled.area";
    public static final String PHOTODIODE_AREA = "photodiode.area";
    public static final String PHOTODIODE_DISTANCE = "photodiode.distance";
    public static final String PHOTODIODE_GAIN = "photodiode.gain";
    public static final String HEADER_SPECTRUM = "header.spectrum";
    public static final String HEADER_KEITHLEY = "header.keithley";
    public static final String SMOOTHING_WINDOW = "smoothing.window";
    public static final String FORWARD_NAMES = "forward.names";
    public static final String FILE_OLED_VOLTAGES = "file.oledVoltages";
    public static final String FILE_PD_VOLTAGES = "file.pdVoltages";
    public static final String ANGLE_TOLERANCE = "angle.tolerance";

    /**
     * Loads the classpath defaults only.
     */
    public AnalysisConfiguration load() throws ConfigurationException {
        return load(null);
    }

    /**
     * @param overrideFile user properties file, may be null
     */
    public AnalysisConfiguration load(Path overrideFile) throws ConfigurationException {
        Properties properties = new Properties();
        try (InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } else {
                logger.warn("{} not found on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }

        if (overrideFile != null) {
            if (!Files.isRegularFile(overrideFile)) {
                throw new ConfigurationException("Configuration file not found: " + overrideFile);
            }
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException | IllegalArgumentException e) {
                throw new ConfigurationException("Cannot read " + overrideFile + ": " + e.getMessage(), e);
            }
            logger.info("Configuration overrides loaded from {}", overrideFile);
        }
        return fromProperties(properties);
    }

    /**
     * Maps properties onto the configuration record, falling back to the defaults per key.
     */
    public AnalysisConfiguration fromProperties(Properties properties) throws ConfigurationException {
        Path libraryDirectory = Paths.get(properties.getProperty(LIBRARY_DIR, "library").trim());
        AnalysisConfiguration defaults = AnalysisConfiguration.defaults(libraryDirectory);

        PhotodiodeGain gain = properties.containsKey(PHOTODIODE_GAIN)
            ? PhotodiodeGain.fromDecibels(intValue(properties, PHOTODIODE_GAIN, 0))
            : defaults.gain();
        List<String> forwardNames = properties.containsKey(FORWARD_NAMES)
            ? Arrays.stream(properties.getProperty(FORWARD_NAMES).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList())
            : defaults.forwardSpectrumNames();

        try {
            AnalysisConfiguration config = new AnalysisConfiguration(
                libraryDirectory,
                stringValue(properties, REFERENCE_PHOTOPIC, defaults.photopicFile()),
                stringValue(properties, REFERENCE_RESPONSIVITY, defaults.responsivityFile()),
                stringValue(properties, REFERENCE_CIE, defaults.cieFile()),
                stringValue(properties, REFERENCE_CALIBRATION, defaults.calibrationFile()),
                doubleValue(properties, OLED_AREA, defaults.oledArea()),
                doubleValue(properties, PHOTODIODE_AREA, defaults.photodiodeArea()),
                doubleValue(properties, PHOTODIODE_DISTANCE, defaults.photodiodeDistance()),
                gain,
                intValue(properties, HEADER_SPECTRUM, defaults.spectrumHeaderLines()),
                intValue(properties, HEADER_KEITHLEY, defaults.keithleyHeaderLines()),
                intValue(properties, SMOOTHING_WINDOW, defaults.smoothingWindow()),
                forwardNames,
                stringValue(properties, FILE_OLED_VOLTAGES, defaults.oledVoltagesFile()),
                stringValue(properties, FILE_PD_VOLTAGES, defaults.photodiodeVoltagesFile()),
                doubleValue(properties, ANGLE_TOLERANCE, defaults.angleTolerance()));
            logger.debug("Effective configuration: {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static String stringValue(Properties properties, String key, String fallback) {
        String value = properties.getProperty(key);
        return value == null ? fallback : value.trim();
    }

    private static double doubleValue(Properties properties, String key, double fallback) throws ConfigurationException {
        String value = properties.getProperty(key);
        if (value == null) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' is not a number: " + value, e);
        }
    }

    private static int intValue(Properties properties, String key, int fallback) throws ConfigurationException {
        String value = properties.getProperty(key);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' is not an integer: " + value, e);
        }
    }
}
