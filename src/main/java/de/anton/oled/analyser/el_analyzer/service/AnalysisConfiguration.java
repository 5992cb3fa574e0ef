package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.model.PhotodiodeGain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for an analysis run:
 * reference library, rig geometry, photodiode gain and the file conventions of the raw data.
 */
public record AnalysisConfiguration(
    Path libraryDirectory,
    String photopicFile,
    String responsivityFile,
    String cieFile,
    String calibrationFile,
    double oledArea,          // m2
    double photodiodeArea,    // m2
    double photodiodeDistance, // m
    PhotodiodeGain gain,
    int spectrumHeaderLines,
    int keithleyHeaderLines,
    int smoothingWindow,
    List<String> forwardSpectrumNames, // tried in order for the 0 degree spectrum
    String oledVoltagesFile,
    String photodiodeVoltagesFile,
    double angleTolerance     // degrees
) {

    public static final List<String> DEFAULT_FORWARD_NAMES = List.of("Angle0.0.txt", "Angle000.txt");

    public AnalysisConfiguration {
        Objects.requireNonNull(libraryDirectory, "libraryDirectory");
        Objects.requireNonNull(gain, "gain");
        requireName(photopicFile, "photopicFile");
        requireName(responsivityFile, "responsivityFile");
        requireName(cieFile, "cieFile");
        requireName(calibrationFile, "calibrationFile");
        requireName(oledVoltagesFile, "oledVoltagesFile");
        requireName(photodiodeVoltagesFile, "photodiodeVoltagesFile");
        requirePositive(oledArea, "oledArea");
        requirePositive(photodiodeArea, "photodiodeArea");
        requirePositive(photodiodeDistance, "photodiodeDistance");
        requirePositive(angleTolerance, "angleTolerance");
        if (spectrumHeaderLines < 0 || keithleyHeaderLines < 0) {
            throw new IllegalArgumentException("Header line counts must not be negative.");
        }
        if (smoothingWindow < 1) {
            throw new IllegalArgumentException("smoothingWindow must be at least 1, was " + smoothingWindow);
        }
        if (forwardSpectrumNames == null || forwardSpectrumNames.isEmpty()) {
            throw new IllegalArgumentException("At least one forward spectrum file name is required.");
        }
        forwardSpectrumNames = List.copyOf(forwardSpectrumNames);
    }

    /** Rig defaults: 2x2 mm pixel, PDA100A2 at 115 mm and 70 dB gain. */
    public static AnalysisConfiguration defaults(Path libraryDirectory) {
        return new AnalysisConfiguration(
            libraryDirectory,
            "Photopic_response.txt",
            "Responsivity_PD.txt",
            "NormCurves_400-800.txt",
            "CalibrationData.txt",
            4e-6,
            7.5e-5,
            0.115,
            PhotodiodeGain.DB_70,
            11,
            11,
            10,
            DEFAULT_FORWARD_NAMES,
            "keithleyOLEDvoltages.txt",
            "keithleyPDvoltages.txt",
            1e-3);
    }

    public Path photopicPath() { return libraryDirectory.resolve(photopicFile); }
    public Path responsivityPath() { return libraryDirectory.resolve(responsivityFile); }
    public Path ciePath() { return libraryDirectory.resolve(cieFile); }
    public Path calibrationPath() { return libraryDirectory.resolve(calibrationFile); }

    /** Radius of a circle with the photodiode's area. */
    public double photodiodeRadius() {
        return Math.sqrt(photodiodeArea / Math.PI);
    }

    /** sin²(α) of the half angle subtended by the photodiode as seen from the OLED. */
    public double sqSinAlpha() {
        double r = photodiodeRadius();
        return r * r / (photodiodeDistance * photodiodeDistance + r * r);
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number, was " + value);
        }
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank.");
        }
    }
}
