package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.algorithms.SignalProcessing;
import de.anton.oled.analyser.el_analyzer.exceptions.IngestionException;
import de.anton.oled.analyser.el_analyzer.exceptions.NoForwardSpectrumException;
import de.anton.oled.analyser.el_analyzer.model.AngleSeries;
import de.anton.oled.analyser.el_analyzer.model.ElectricalSample;
import de.anton.oled.analyser.el_analyzer.model.ElectricalTrace;
import de.anton.oled.analyser.el_analyzer.model.NumericTable;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.SampleRun;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import de.anton.oled.analyser.el_analyzer.model.SpectrumSet;
import de.anton.oled.analyser.el_analyzer.model.TextTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the raw data of one sample run: background and angle spectra from
 * {@code raw/spectrumdata}, the angle series and photodiode sweep from {@code raw/keithleydata}.
 * Spectra are resampled onto the master grid, background-subtracted, calibrated and smoothed.
 */
public class SpectrumIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumIngestionService.class);
    static final String ANGLE_PREFIX = "Angle";
    private static final Pattern ANGLE_FILE = Pattern.compile("Angle(-?\\d+(?:\\.\\d+)?)\\.txt");

    private final AnalysisConfiguration config;
    private final ReferenceData reference;
    private final TextTableReader tableReader;

    /**
     * Everything read from disk for one sample run.
     */
    public record IngestedSample(AngleSeries angles, SpectrumSet spectra, Spectrum forward, ElectricalTrace trace) {
    }

    /**
     * Spectrum files of a run, keyed by angle, plus the background file.
     */
    public record SpectrumFiles(Path background, Map<Double, Path> angleFiles) {
    }

    public SpectrumIngestionService(AnalysisConfiguration config, ReferenceData reference) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.reference = Objects.requireNonNull(reference, "Reference data cannot be null.");
        this.tableReader = new TextTableReader();
    }

    /**
     * Reads all raw data of the run.
     */
    public IngestedSample ingest(SampleRun run) throws IngestionException {
        logger.info("Ingesting sample run {}", run);
        Path spectrumDirectory = run.spectrumDirectory();
        int header = config.spectrumHeaderLines();

        Path forwardFile = resolveForwardSpectrum(spectrumDirectory);
        SpectrumFiles files = discoverSpectrumFiles(spectrumDirectory);
        double[] background = loadBackground(files.background(), header);
        Spectrum forward = loadAngleSpectrum(forwardFile, 0.0, background, header);

        AngleSeries angles = loadAngleSeries(run.keithleyDirectory());
        SpectrumSet spectra = new SpectrumSet(angles, reference.getGrid(), config.angleTolerance());
        for (Map.Entry<Double, Path> entry : files.angleFiles().entrySet()) {
            if (angles.indexOf(entry.getKey(), config.angleTolerance()) < 0) {
                logger.warn("Ignoring {}: angle {} is not part of the measured series", entry.getValue().getFileName(), entry.getKey());
                continue;
            }
            Spectrum spectrum = loadAngleSpectrum(entry.getValue(), entry.getKey(), background, header);
            try {
                spectra.put(spectrum);
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new IngestionException("Cannot use spectrum file " + entry.getValue() + ": " + e.getMessage(), e);
            }
        }
        List<Double> missing = spectra.missingAngles();
        if (!missing.isEmpty()) {
            throw new IngestionException("No spectrum file in " + spectrumDirectory + " for angles " + missing);
        }

        ElectricalTrace trace = loadElectricalTrace(run.keithleyDirectory());
        logger.info("Ingested {}: {} spectra, {}", run, angles.size(), trace);
        return new IngestedSample(angles, spectra, forward, trace);
    }

    /**
     * Splits the spectrum folder into angle files and the single background file.
     * Hidden files and directories are ignored. Of the accepted forward spectrum names only the
     * first existing one is used; the other accepted names are skipped.
     *
     * @throws IngestionException if an angle file name cannot be parsed, two files carry the
     *                            same angle within the angle tolerance, or there is not exactly
     *                            one background candidate.
     */
    public SpectrumFiles discoverSpectrumFiles(Path spectrumDirectory) throws IngestionException {
        List<Path> entries;
        try (Stream<Path> stream = Files.list(spectrumDirectory)) {
            entries = stream
                .filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IngestionException("Cannot list spectrum folder " + spectrumDirectory + ": " + e.getMessage(), e);
        }

        String forwardName = firstExistingForwardName(spectrumDirectory);
        TreeMap<Double, Path> angleFiles = new TreeMap<>();
        List<Path> backgroundCandidates = new ArrayList<>();
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (forwardName != null && !forwardName.equals(name) && config.forwardSpectrumNames().contains(name)) {
                logger.info("Skipping {}: forward spectrum {} takes precedence", name, forwardName);
                continue;
            }
            if (!name.startsWith(ANGLE_PREFIX)) {
                backgroundCandidates.add(entry);
                continue;
            }
            Matcher matcher = ANGLE_FILE.matcher(name);
            if (!matcher.matches()) {
                throw new IngestionException("Cannot parse the angle of spectrum file " + entry);
            }
            // + 0.0 folds -0.0 into 0.0
            double angle = Double.parseDouble(matcher.group(1)) + 0.0;
            Path previous = fileWithinTolerance(angleFiles, angle);
            if (previous != null) {
                throw new IngestionException(String.format("Two spectrum files for angle %s: %s and %s",
                    angle, previous.getFileName(), name));
            }
            angleFiles.put(angle, entry);
        }

        if (backgroundCandidates.size() != 1) {
            throw new IngestionException(backgroundCandidates.isEmpty()
                ? "No background spectrum in " + spectrumDirectory
                : "Ambiguous background spectrum in " + spectrumDirectory + ": " + backgroundCandidates);
        }
        logger.debug("Found {} angle spectra and background {} in {}", angleFiles.size(),
            backgroundCandidates.get(0).getFileName(), spectrumDirectory);
        return new SpectrumFiles(backgroundCandidates.get(0), angleFiles);
    }

    private Path fileWithinTolerance(TreeMap<Double, Path> angleFiles, double angle) {
        Map.Entry<Double, Path> below = angleFiles.floorEntry(angle);
        if (below != null && Math.abs(below.getKey() - angle) <= config.angleTolerance()) {
            return below.getValue();
        }
        Map.Entry<Double, Path> above = angleFiles.ceilingEntry(angle);
        if (above != null && Math.abs(above.getKey() - angle) <= config.angleTolerance()) {
            return above.getValue();
        }
        return null;
    }

    /**
     * The first accepted forward spectrum name that exists in the folder.
     */
    public Path resolveForwardSpectrum(Path spectrumDirectory) throws NoForwardSpectrumException {
        String name = firstExistingForwardName(spectrumDirectory);
        if (name == null) {
            throw new NoForwardSpectrumException(spectrumDirectory, config.forwardSpectrumNames());
        }
        Path forward = spectrumDirectory.resolve(name);
        logger.debug("Forward spectrum: {}", forward);
        return forward;
    }

    private String firstExistingForwardName(Path spectrumDirectory) {
        for (String name : config.forwardSpectrumNames()) {
            if (Files.isRegularFile(spectrumDirectory.resolve(name))) {
                return name;
            }
        }
        return null;
    }

    /**
     * Background counts resampled onto the master grid.
     */
    public double[] loadBackground(Path file, int headerLinesToSkip) throws IngestionException {
        NumericTable table = readTable(file, headerLinesToSkip, 2);
        return resample(table);
    }

    /**
     * Resamples, subtracts the background, applies the calibration and smooths.
     */
    public Spectrum loadAngleSpectrum(Path file, double angle, double[] background, int headerLinesToSkip)
            throws IngestionException {
        double[] raw = resample(readTable(file, headerLinesToSkip, 2));
        double[] calibrated = SignalProcessing.multiply(
            SignalProcessing.subtract(raw, background), reference.getCalibration().values());
        double[] smoothed = SignalProcessing.movingAverage(calibrated, config.smoothingWindow());
        return new Spectrum(angle, reference.getGrid(), smoothed);
    }

    /**
     * Angles of the sweep, column 0 of the OLED voltage file.
     */
    public AngleSeries loadAngleSeries(Path keithleyDirectory) throws IngestionException {
        NumericTable table = readTable(keithleyDirectory.resolve(config.oledVoltagesFile()), config.keithleyHeaderLines(), 1);
        try {
            return new AngleSeries(table.column(0));
        } catch (IllegalArgumentException e) {
            throw new IngestionException("Invalid angle series in " + table.getSource() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Photodiode sweep: OLED voltage, OLED current (stored in mA, returned in A) and photodiode voltage.
     */
    public ElectricalTrace loadElectricalTrace(Path keithleyDirectory) throws IngestionException {
        NumericTable table = readTable(keithleyDirectory.resolve(config.photodiodeVoltagesFile()), config.keithleyHeaderLines(), 3);
        double[] voltage = table.column(0);
        double[] currentMilliAmps = table.column(1);
        double[] photodiodeVoltage = table.column(2);
        List<ElectricalSample> samples = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            samples.add(new ElectricalSample(voltage[i], currentMilliAmps[i] * 1e-3, photodiodeVoltage[i]));
        }
        return new ElectricalTrace(samples);
    }

    private double[] resample(NumericTable table) throws IngestionException {
        try {
            return SignalProcessing.interpolate(table.column(0), table.column(1), reference.getGrid());
        } catch (IllegalArgumentException e) {
            throw new IngestionException("Cannot resample " + table.getSource() + ": " + e.getMessage(), e);
        }
    }

    private NumericTable readTable(Path file, int headerLinesToSkip, int minimumColumns) throws IngestionException {
        NumericTable table;
        try {
            table = tableReader.read(file, headerLinesToSkip);
        } catch (IOException e) {
            throw new IngestionException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        if (table.columnCount() < minimumColumns) {
            throw new IngestionException(String.format("%s has %d columns, at least %d are required.",
                file, table.columnCount(), minimumColumns));
        }
        return table;
    }
}
