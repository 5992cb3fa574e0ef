package de.anton.oled.analyser.el_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads the tab/space delimited numeric tables written by the measurement rig and the
 * reference library. A fixed number of header lines is skipped; after that, blank lines and
 * lines starting with '#' are ignored and every remaining cell must be a number.
 * Every row must have the column count of the first data row.
 */
public class TextTableReader {

    private static final Logger logger = LoggerFactory.getLogger(TextTableReader.class);
    private static final Pattern DELIMITER = Pattern.compile("[\\s,;]+");

    /**
     * Reads the file into a {@link NumericTable}.
     *
     * @param file              The file to read.
     * @param headerLinesToSkip Number of leading lines to drop unparsed.
     * @return the parsed table, never empty.
     * @throws IOException If the file cannot be read, holds no data rows, or a cell is not numeric.
     */
    public NumericTable read(Path file, int headerLinesToSkip) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        if (headerLinesToSkip < 0) {
            throw new IllegalArgumentException("Header line count cannot be negative: " + headerLinesToSkip);
        }
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "file not found");
        }
        logger.debug("Reading numeric table {} (skipping {} header lines)", file, headerLinesToSkip);

        List<double[]> rows = new ArrayList<>();
        int expectedColumns = -1;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber <= headerLinesToSkip) continue;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

                String[] cells = DELIMITER.split(trimmed);
                double[] row = new double[cells.length];
                for (int c = 0; c < cells.length; c++) {
                    try {
                        row[c] = Double.parseDouble(cells[c]);
                    } catch (NumberFormatException e) {
                        throw new IOException(String.format("Malformed table %s: line %d, column %d is not numeric ('%s').",
                            file.getFileName(), lineNumber, c + 1, cells[c]), e);
                    }
                }
                if (expectedColumns == -1) {
                    expectedColumns = row.length;
                } else if (row.length != expectedColumns) {
                    throw new IOException(String.format("Malformed table %s: line %d has %d columns, expected %d.",
                        file.getFileName(), lineNumber, row.length, expectedColumns));
                }
                rows.add(row);
            }
        }

        if (rows.isEmpty()) {
            throw new IOException("Malformed table " + file.getFileName() + ": no data rows after "
                + headerLinesToSkip + " header lines.");
        }

        double[][] columns = new double[expectedColumns][rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            double[] row = rows.get(r);
            for (int c = 0; c < expectedColumns; c++) {
                columns[c][r] = row[c];
            }
        }
        logger.trace("Read {} rows x {} columns from {}", rows.size(), expectedColumns, file.getFileName());
        return new NumericTable(file, columns);
    }
}
