package de.anton.oled.analyser.el_analyzer.model;

import java.nio.file.Path;

/**
 * Column-major numeric content of a whitespace delimited text file.
 */
public final class NumericTable {

    private final Path source;
    private final double[][] columns;

    NumericTable(Path source, double[][] columns) {
        this.source = source;
        this.columns = columns;
    }

    public Path getSource() { return source; }
    public int columnCount() { return columns.length; }
    public int rowCount() { return columns.length == 0 ? 0 : columns[0].length; }

    /** @return a copy of the column. */
    public double[] column(int index) {
        if (index < 0 || index >= columns.length) {
            throw new IndexOutOfBoundsException("Column " + index + " does not exist in " + source
                + " (" + columns.length + " columns).");
        }
        return columns[index].clone();
    }

    @Override
    public String toString() {
        return "NumericTable{" + source.getFileName() + ", rows=" + rowCount() + ", cols=" + columnCount() + '}';
    }
}
