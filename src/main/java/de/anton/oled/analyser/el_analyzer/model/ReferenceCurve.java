package de.anton.oled.analyser.el_analyzer.model;

import java.util.Objects;

/**
 * A named reference curve already resampled onto the master {@link WavelengthGrid}.
 */
public final class ReferenceCurve {

    private final String name;
    private final WavelengthGrid grid;
    private final double[] values;

    public ReferenceCurve(String name, WavelengthGrid grid, double[] values) {
        this.name = Objects.requireNonNull(name, "Curve name cannot be null.");
        this.grid = Objects.requireNonNull(grid, "Grid cannot be null for curve '" + name + "'.");
        Objects.requireNonNull(values, "Values cannot be null for curve '" + name + "'.");
        if (values.length != grid.size()) {
            throw new IllegalArgumentException(String.format(
                "Curve '%s' has %d values but the grid has %d points.", name, values.length, grid.size()));
        }
        this.values = values.clone();
    }

    public String getName() { return name; }
    public WavelengthGrid getGrid() { return grid; }
    public double value(int index) { return values[index]; }

    /** @return a copy of the values. */
    public double[] values() { return values.clone(); }

    @Override
    public String toString() {
        return String.format("ReferenceCurve[%s, %d points]", name, values.length);
    }
}
