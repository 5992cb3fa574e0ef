package de.anton.oled.analyser.el_analyzer.model;

import java.util.Objects;

/**
 * Calibrated, background corrected and smoothed emission spectrum (W/nm/sr) measured at one angle.
 */
public final class Spectrum {

    private final double angle;
    private final WavelengthGrid grid;
    private final double[] intensities;

    public Spectrum(double angle, WavelengthGrid grid, double[] intensities) {
        this.angle = angle;
        this.grid = Objects.requireNonNull(grid, "Grid cannot be null.");
        Objects.requireNonNull(intensities, "Intensities cannot be null.");
        if (intensities.length != grid.size()) {
            throw new IllegalArgumentException(String.format(
                "Spectrum at %.2f deg has %d values but the grid has %d points.", angle, intensities.length, grid.size()));
        }
        this.intensities = intensities.clone();
    }

    public double getAngle() { return angle; }
    public WavelengthGrid getGrid() { return grid; }
    public double intensity(int index) { return intensities[index]; }
    public int size() { return intensities.length; }

    /** @return a copy of the intensities. */
    public double[] intensities() { return intensities.clone(); }

    /** Σ I(λ). */
    public double total() {
        double sum = 0.0;
        for (double value : intensities) sum += value;
        return sum;
    }

    /** Σ I(λ)·λ. */
    public double wavelengthMoment() {
        double sum = 0.0;
        for (int i = 0; i < intensities.length; i++) sum += intensities[i] * grid.get(i);
        return sum;
    }

    /** Σ I(λ)·w(λ) for a curve on the same grid. */
    public double weightedSum(ReferenceCurve weights) {
        if (!grid.equals(weights.getGrid())) {
            throw new IllegalArgumentException("Curve '" + weights.getName() + "' is not on the spectrum grid.");
        }
        double sum = 0.0;
        for (int i = 0; i < intensities.length; i++) sum += intensities[i] * weights.value(i);
        return sum;
    }

    @Override
    public String toString() {
        return String.format("Spectrum[angle=%.2f deg, %d points]", angle, intensities.length);
    }
}
