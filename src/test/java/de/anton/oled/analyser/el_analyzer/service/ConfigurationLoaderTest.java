package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.model.PhotodiodeGain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigurationLoader loader = new ConfigurationLoader();

    @Test
    void bundledPropertiesMatchTheRigDefaults() throws Exception {
        assertEquals(AnalysisConfiguration.defaults(Paths.get("library")), loader.load());
    }

    @Test
    void defaultGeometry() {
        AnalysisConfiguration config = AnalysisConfiguration.defaults(Paths.get("library"));
        double r2 = 7.5e-5 / Math.PI;
        assertEquals(Math.sqrt(r2), config.photodiodeRadius(), 1e-15);
        assertEquals(r2 / (0.115 * 0.115 + r2), config.sqSinAlpha(), 1e-15);
        assertEquals(PhotodiodeGain.DB_70, config.gain());
        assertEquals(List.of("Angle0.0.txt", "Angle000.txt"), config.forwardSpectrumNames());
    }

    @Test
    void overrideFileReplacesSelectedKeys() throws Exception {
        Path file = tempDir.resolve("rig.properties");
        Files.write(file, List.of(
            "library.dir=" + tempDir.resolve("lib").toString().replace('\\', '/'),
            "photodiode.gain=50",
            "oled.area=1e-5",
            "smoothing.window=1",
            "forward.names=Angle000.txt, Angle0.txt"));

        AnalysisConfiguration config = loader.load(file);

        assertEquals(PhotodiodeGain.DB_50, config.gain());
        assertEquals(1e-5, config.oledArea());
        assertEquals(1, config.smoothingWindow());
        assertEquals(List.of("Angle000.txt", "Angle0.txt"), config.forwardSpectrumNames());
        assertEquals(tempDir.resolve("lib").resolve("Photopic_response.txt"), config.photopicPath());
        assertEquals(0.115, config.photodiodeDistance());
    }

    @Test
    void invalidValuesAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("photodiode.gain", "45")));
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("photodiode.gain", "high")));
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("oled.area", "-4e-6")));
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("photodiode.distance", "far")));
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("smoothing.window", "0")));
        assertThrows(ConfigurationException.class, () -> loader.fromProperties(props("forward.names", " , ")));
    }

    @Test
    void missingOverrideFileIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("absent.properties")));
    }

    private static Properties props(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }
}
