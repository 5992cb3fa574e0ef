package de.anton.oled.analyser.el_analyzer;

import de.anton.oled.analyser.el_analyzer.model.ReferenceCurve;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.SampleRun;
import de.anton.oled.analyser.el_analyzer.model.WavelengthGrid;
import de.anton.oled.analyser.el_analyzer.service.AnalysisConfiguration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleBinaryOperator;

/**
 * Writes synthetic reference libraries and sample runs in the rig's file layout.
 */
public final class TestFixtures {

    public static final int HEADER_LINES = 11;
    public static final String BACKGROUND = "background.txt";

    /** OLED voltage, OLED current in mA, photodiode voltage; one row below the 70 dB cutoff, one above. */
    public static final double[][] DEFAULT_SWEEP = {
        {3.0, 1.0, 0.001},
        {5.0, 2.0, 0.1},
        {6.0, 4.0, 0.3}
    };

    private TestFixtures() { throw new IllegalStateException("Utility class"); }

    public static double[] range(double start, double stop, double step) {
        int n = (int) Math.round((stop - start) / step) + 1;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = Math.round((start + i * step) * 1e6) / 1e6;
        return values;
    }

    public static double[] filled(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    /** Writes the given columns after {@code headerLines} lines of text. */
    public static void writeTable(Path file, int headerLines, double[]... columns) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int h = 0; h < headerLines; h++) lines.add("Header line " + (h + 1) + ": rig metadata");
        for (int r = 0; r < columns[0].length; r++) {
            StringBuilder row = new StringBuilder();
            for (int c = 0; c < columns.length; c++) {
                if (c > 0) row.append('\t');
                row.append(String.format(Locale.ROOT, "%.9g", columns[c][r]));
            }
            lines.add(row.toString());
        }
        Files.createDirectories(file.getParent());
        Files.write(file, lines, StandardCharsets.UTF_8);
    }

    /**
     * Library with V = 1, R = 0.5, calibration 1 and CIE curves (1, 2, 1) in the historical
     * five-column layout.
     */
    public static Path writeLibrary(Path directory, double[] wavelengths) throws IOException {
        int n = wavelengths.length;
        writeTable(directory.resolve("Photopic_response.txt"), 0, wavelengths, filled(n, 1.0));
        writeTable(directory.resolve("Responsivity_PD.txt"), 0, wavelengths, filled(n, 0.5));
        writeTable(directory.resolve("NormCurves_400-800.txt"), 0,
            wavelengths, filled(n, 0.0), filled(n, 1.0), filled(n, 2.0), filled(n, 1.0));
        writeTable(directory.resolve("CalibrationData.txt"), 0, wavelengths, filled(n, 1.0));
        return directory;
    }

    public static String angleFileName(double angle) {
        return String.format(Locale.ROOT, "Angle%.1f.txt", angle);
    }

    /**
     * Writes a complete run below {@code dataRoot/sample/timestamp/raw}: a zero background,
     * one spectrum per angle with {@code intensity(angle, wavelength)} and both keithley files.
     */
    public static SampleRun writeRun(Path dataRoot, String sample, String timestamp, double[] angles,
                                     double[] wavelengths, DoubleBinaryOperator intensity) throws IOException {
        SampleRun run = new SampleRun(sample, timestamp, dataRoot.resolve(sample).resolve(timestamp));
        Path spectra = run.spectrumDirectory();
        writeTable(spectra.resolve(BACKGROUND), HEADER_LINES, wavelengths, filled(wavelengths.length, 0.0));
        for (double angle : angles) {
            writeTable(spectra.resolve(angleFileName(angle)), HEADER_LINES, wavelengths, spectrum(angle, wavelengths, intensity));
        }
        writeTable(run.keithleyDirectory().resolve("keithleyOLEDvoltages.txt"), HEADER_LINES,
            angles, filled(angles.length, 4.0), filled(angles.length, 1e-3));
        writeSweep(run, DEFAULT_SWEEP);
        return run;
    }

    public static void writeSweep(SampleRun run, double[][] rows) throws IOException {
        double[] voltage = new double[rows.length];
        double[] current = new double[rows.length];
        double[] photodiode = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            voltage[i] = rows[i][0];
            current[i] = rows[i][1];
            photodiode[i] = rows[i][2];
        }
        writeTable(run.keithleyDirectory().resolve("keithleyPDvoltages.txt"), HEADER_LINES, voltage, current, photodiode);
    }

    public static double[] spectrum(double angle, double[] wavelengths, DoubleBinaryOperator intensity) {
        double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) values[i] = intensity.applyAsDouble(angle, wavelengths[i]);
        return values;
    }

    /** In-memory reference data with constant curves. */
    public static ReferenceData referenceData(double[] wavelengths, double photopic, double responsivity,
                                              double x, double y, double z) {
        WavelengthGrid grid = new WavelengthGrid(wavelengths);
        int n = wavelengths.length;
        return new ReferenceData(grid,
            new ReferenceCurve("V(lambda)", grid, filled(n, photopic)),
            new ReferenceCurve("R(lambda)", grid, filled(n, responsivity)),
            new ReferenceCurve("CIE x", grid, filled(n, x)),
            new ReferenceCurve("CIE y", grid, filled(n, y)),
            new ReferenceCurve("CIE z", grid, filled(n, z)),
            new ReferenceCurve("calibration", grid, filled(n, 1.0)));
    }

    public static AnalysisConfiguration withSmoothingWindow(AnalysisConfiguration c, int window) {
        return new AnalysisConfiguration(c.libraryDirectory(), c.photopicFile(), c.responsivityFile(), c.cieFile(),
            c.calibrationFile(), c.oledArea(), c.photodiodeArea(), c.photodiodeDistance(), c.gain(),
            c.spectrumHeaderLines(), c.keithleyHeaderLines(), window, c.forwardSpectrumNames(),
            c.oledVoltagesFile(), c.photodiodeVoltagesFile(), c.angleTolerance());
    }
}
