package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.algorithms.SignalProcessing;
import de.anton.oled.analyser.el_analyzer.exceptions.ReferenceDataException;
import de.anton.oled.analyser.el_analyzer.model.NumericTable;
import de.anton.oled.analyser.el_analyzer.model.ReferenceCurve;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.TextTableReader;
import de.anton.oled.analyser.el_analyzer.model.WavelengthGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Service responsible for loading the reference library: V(λ), photodiode responsivity,
 * CIE colour matching functions and spectrometer calibration. The wavelength grid of the
 * photopic file becomes the master grid; all other curves are resampled onto it.
 */
public class ReferenceDataService {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataService.class);
    private static final int REFERENCE_HEADER_LINES = 0;

    private final TextTableReader tableReader;

    public ReferenceDataService() {
        this.tableReader = new TextTableReader();
    }

    /**
     * Loads and resamples all reference curves named in the configuration.
     *
     * @throws ReferenceDataException if a file is missing or malformed, or the photopic
     *                                wavelengths are not strictly increasing.
     */
    public ReferenceData load(AnalysisConfiguration config) throws ReferenceDataException {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        logger.info("Loading reference library from {}", config.libraryDirectory());

        NumericTable photopicTable = readTable(config.photopicPath(), 2);
        WavelengthGrid grid;
        try {
            grid = new WavelengthGrid(photopicTable.column(0));
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException("Invalid wavelength grid in " + config.photopicPath() + ": " + e.getMessage(), e);
        }
        ReferenceCurve photopic = new ReferenceCurve("V(lambda)", grid, photopicTable.column(1));

        NumericTable responsivityTable = readTable(config.responsivityPath(), 2);
        ReferenceCurve responsivity = resample("R(lambda)", responsivityTable, 1, grid);

        NumericTable cieTable = readTable(config.ciePath(), 4);
        int last = cieTable.columnCount() - 1;
        ReferenceCurve cieX = resample("CIE x", cieTable, last - 2, grid);
        ReferenceCurve cieY = resample("CIE y", cieTable, last - 1, grid);
        ReferenceCurve cieZ = resample("CIE z", cieTable, last, grid);

        NumericTable calibrationTable = readTable(config.calibrationPath(), 2);
        ReferenceCurve calibration = resample("calibration", calibrationTable, 1, grid);

        ReferenceData data = new ReferenceData(grid, photopic, responsivity, cieX, cieY, cieZ, calibration);
        logger.info("Reference library loaded: {}", data);
        return data;
    }

    private NumericTable readTable(Path file, int minimumColumns) throws ReferenceDataException {
        NumericTable table;
        try {
            table = tableReader.read(file, REFERENCE_HEADER_LINES);
        } catch (IOException e) {
            logger.error("Failed to read reference file {}", file, e);
            throw new ReferenceDataException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        if (table.columnCount() < minimumColumns) {
            throw new ReferenceDataException(String.format("%s has %d columns, at least %d are required.",
                file, table.columnCount(), minimumColumns));
        }
        return table;
    }

    private static ReferenceCurve resample(String name, NumericTable table, int valueColumn, WavelengthGrid grid)
            throws ReferenceDataException {
        try {
            double[] values = SignalProcessing.interpolate(table.column(0), table.column(valueColumn), grid);
            return new ReferenceCurve(name, grid, values);
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException("Cannot resample " + name + " from " + table.getSource() + ": " + e.getMessage(), e);
        }
    }
}
