package de.anton.oled.analyser.el_analyzer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One measurement run of a sample: {@code <dataRoot>/<sample>/<timestamp>/}.
 */
public record SampleRun(String sampleName, String timestamp, Path runDirectory) {

    public static final String RAW_FOLDER = "raw";
    public static final String KEITHLEY_FOLDER = "keithleydata";
    public static final String SPECTRUM_FOLDER = "spectrumdata";
    public static final String OUTPUT_FOLDER = "processedEL";

    public SampleRun {
        Objects.requireNonNull(sampleName, "Sample name cannot be null.");
        Objects.requireNonNull(timestamp, "Run timestamp cannot be null.");
        Objects.requireNonNull(runDirectory, "Run directory cannot be null.");
    }

    public Path rawDirectory() { return runDirectory.resolve(RAW_FOLDER); }
    public Path keithleyDirectory() { return rawDirectory().resolve(KEITHLEY_FOLDER); }
    public Path spectrumDirectory() { return rawDirectory().resolve(SPECTRUM_FOLDER); }
    public Path outputDirectory() { return runDirectory.resolve(OUTPUT_FOLDER); }

    /** Sample name followed by the run timestamp, as written in result headers. */
    public String measurementCode() { return sampleName + timestamp; }

    @Override
    public String toString() {
        return sampleName + "/" + timestamp;
    }
}
