package de.anton.oled.analyser.el_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes the text result files of a sample run into its {@code processedEL} folder. Every
 * file starts with the same metadata block; existing files are overwritten.
 */
public class ResultWriter {

    private static final Logger logger = LoggerFactory.getLogger(ResultWriter.class);

    public static final String DATA_MARKER = "### Formatted data ###";
    static final String PROGRAMME = "EL Analyzer";
    private static final DateTimeFormatter ANALYSIS_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private static final String LAM_COLUMNS = columns("V", "I", "J", "Abs(J)", "L", "EQE", "LE", "CE", "PoD");
    private static final String LAM_UNITS = columns("V", "mA", "mA/cm2", "mA/cm2", "cd/m2", "%", "lm/W", "cd/A", "mW/mm2");
    private static final String NONLAM_COLUMNS = columns("V", "I", "J", "Abs(J)", "L", "AvLum", "EQE", "LE", "CE", "PoD");
    private static final String NONLAM_UNITS = columns("V", "mA", "mA/cm2", "mA/cm2", "cd/m2", "cd/m2", "%", "lm/W", "cd/A", "mW/mm2");

    private final double oledArea;
    private final double photodiodeDistance;
    private final double photodiodeArea;
    private final String analysisTime;

    public ResultWriter(double oledArea, double photodiodeDistance, double photodiodeArea, LocalDateTime analysisTime) {
        this.oledArea = oledArea;
        this.photodiodeDistance = photodiodeDistance;
        this.photodiodeArea = photodiodeArea;
        this.analysisTime = ANALYSIS_TIME.format(Objects.requireNonNull(analysisTime));
    }

    /**
     * Writes all text files of the result and returns their paths.
     */
    public List<Path> writeAll(SampleResult result) throws IOException {
        Path outputDirectory = result.run().outputDirectory();
        Files.createDirectories(outputDirectory);
        String sample = result.run().sampleName();

        List<Path> written = new ArrayList<>();
        for (EfficiencySeries series : List.of(result.lambertian(), result.actual())) {
            String name = sample + "_effdata_" + series.getModel().getFileTag() + ".txt";
            written.add(writeEfficiency(result, series, outputDirectory.resolve(name)));
        }
        written.add(writeSpectralMap(result, outputDirectory.resolve(sample + "_specdatafull_LAM.txt")));
        written.add(writeAngularProfile(result, outputDirectory.resolve(sample + "_lamdata.txt")));
        logger.info("Wrote {} result files to {}", written.size(), outputDirectory);
        return written;
    }

    public Path writeEfficiency(SampleResult result, EfficiencySeries series, Path file) throws IOException {
        boolean actual = series.getModel() == EmissionModel.ACTUAL;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeHeader(writer, result);
            writeLine(writer, actual ? NONLAM_COLUMNS : LAM_COLUMNS);
            writeLine(writer, actual ? NONLAM_UNITS : LAM_UNITS);
            for (EfficiencyRecord record : series.getRecords()) {
                if (!record.isValid()) {
                    logger.warn("Omitting {} from {}", record, file.getFileName());
                    continue;
                }
                StringBuilder row = new StringBuilder();
                appendValue(row, record.getVoltage());
                appendValue(row, record.getCurrentMilliAmps());
                appendValue(row, record.getCurrentDensity());
                appendValue(row, record.getAbsCurrentDensity());
                appendValue(row, record.getLuminance());
                if (actual) appendValue(row, record.getAverageLuminance());
                appendValue(row, record.getEqe());
                appendValue(row, record.getLuminousEfficacy());
                appendValue(row, record.getCurrentEfficiency());
                appendValue(row, record.getPowerDensity());
                writeLine(writer, row.toString());
            }
        }
        logger.debug("Wrote {}", file);
        return file;
    }

    /** First row: 0 followed by the angles; then one row per wavelength. */
    public Path writeSpectralMap(SampleResult result, Path file) throws IOException {
        SpectralMap map = result.spectralMap();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeHeader(writer, result);
            writeLine(writer, "Intensity for all Wavelengths / Angles");
            StringBuilder angles = new StringBuilder("0");
            for (int a = 0; a < map.angleCount(); a++) {
                angles.append('\t').append(String.format(Locale.ROOT, "%.6f", map.angle(a)));
            }
            writeLine(writer, angles.toString());
            WavelengthGrid grid = map.getGrid();
            for (int w = 0; w < grid.size(); w++) {
                StringBuilder row = new StringBuilder(String.format(Locale.ROOT, "%.6f", grid.get(w)));
                for (int a = 0; a < map.angleCount(); a++) {
                    row.append('\t').append(String.format(Locale.ROOT, "%.6f", map.value(a, w)));
                }
                writeLine(writer, row.toString());
            }
        }
        logger.debug("Wrote {}", file);
        return file;
    }

    public Path writeAngularProfile(SampleResult result, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeHeader(writer, result);
            writeLine(writer, "angles    Lambertian    Actual    Actual_v");
            writeLine(writer, "degree    a.u.    a.u.    a.u.");
            for (AngularProfile.Row row : result.angularProfile().rows()) {
                writeLine(writer, String.format(Locale.ROOT, "%.2f %.4f %.4f %.4f",
                    row.angle(), row.lambertian(), row.actualRadiant(), row.actualLuminous()));
            }
        }
        logger.debug("Wrote {}", file);
        return file;
    }

    private void writeHeader(BufferedWriter writer, SampleResult result) throws IOException {
        ChromaticityPoint chromaticity = result.chromaticity();
        writeLine(writer, "Measurement code : " + result.run().measurementCode());
        writeLine(writer, "Calculation programme :\t" + PROGRAMME);
        writeLine(writer, "Measurement time : " + result.run().timestamp() + "\tAnalysis time :" + analysisTime);
        writeLine(writer, "OLED active area:     " + oledArea + " m2");
        writeLine(writer, "Distance OLED - Photodiode:   " + photodiodeDistance + " m");
        writeLine(writer, "Photodiode area:    " + photodiodeArea + " m2");
        writeLine(writer, "Maximum intensity at:     " + chromaticity.peakWavelength() + " nm");
        writeLine(writer, "CIE coordinates:      " + chromaticity.formatted());
        writeLine(writer, "");
        writeLine(writer, "");
        writeLine(writer, DATA_MARKER);
    }

    private static void appendValue(StringBuilder row, double value) {
        row.append(String.format(Locale.ROOT, "%14.6e", value));
    }

    private static void writeLine(BufferedWriter writer, String line) throws IOException {
        writer.write(line);
        writer.write('\n');
    }

    private static String columns(String... names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) sb.append(String.format(Locale.ROOT, "%14s", name));
        return sb.toString();
    }
}
