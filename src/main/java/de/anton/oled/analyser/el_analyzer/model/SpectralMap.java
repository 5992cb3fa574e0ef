package de.anton.oled.analyser.el_analyzer.model;

import java.util.Objects;

/**
 * Angle x wavelength intensity matrix normalized to its global maximum.
 */
public final class SpectralMap {

    private final double[] angles;
    private final WavelengthGrid grid;
    private final double[][] normalized;

    public SpectralMap(double[] angles, WavelengthGrid grid, double[][] normalized) {
        this.angles = Objects.requireNonNull(angles).clone();
        this.grid = Objects.requireNonNull(grid);
        if (normalized.length != angles.length) {
            throw new IllegalArgumentException("One row per angle expected.");
        }
        this.normalized = new double[normalized.length][];
        for (int i = 0; i < normalized.length; i++) {
            if (normalized[i].length != grid.size()) {
                throw new IllegalArgumentException("Row " + i + " does not match the grid size.");
            }
            this.normalized[i] = normalized[i].clone();
        }
    }

    public int angleCount() { return angles.length; }
    public double angle(int row) { return angles[row]; }
    public WavelengthGrid getGrid() { return grid; }
    public double value(int angleRow, int wavelengthIndex) { return normalized[angleRow][wavelengthIndex]; }
}
