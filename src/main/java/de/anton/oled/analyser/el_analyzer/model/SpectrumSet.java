package de.anton.oled.analyser.el_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The per-angle spectra of one sample, stored in a matrix preallocated from the angle series.
 * Row {@code i} holds the spectrum of {@code series.angle(i)}. Angles are matched with an
 * explicit tolerance. Filled once during ingestion.
 */
public final class SpectrumSet {

    private final AngleSeries series;
    private final WavelengthGrid grid;
    private final double tolerance;
    private final double[][] intensities;
    private final boolean[] present;

    public SpectrumSet(AngleSeries series, WavelengthGrid grid, double tolerance) {
        this.series = Objects.requireNonNull(series);
        this.grid = Objects.requireNonNull(grid);
        if (!(tolerance > 0)) throw new IllegalArgumentException("Angle tolerance must be positive: " + tolerance);
        this.tolerance = tolerance;
        this.intensities = new double[series.size()][grid.size()];
        this.present = new boolean[series.size()];
    }

    /**
     * Stores a spectrum in the row of its angle.
     *
     * @return false if the spectrum's angle is not part of the series.
     */
    public boolean put(Spectrum spectrum) {
        if (!grid.equals(spectrum.getGrid())) {
            throw new IllegalArgumentException("Spectrum " + spectrum + " is not on the master grid.");
        }
        int row = series.indexOf(spectrum.getAngle(), tolerance);
        if (row < 0) return false;
        if (present[row]) {
            throw new IllegalStateException(String.format("Duplicate spectrum for angle %.3f deg.", series.angle(row)));
        }
        System.arraycopy(spectrum.intensities(), 0, intensities[row], 0, grid.size());
        present[row] = true;
        return true;
    }

    public AngleSeries getSeries() { return series; }
    public WavelengthGrid getGrid() { return grid; }
    public double getTolerance() { return tolerance; }

    public boolean contains(int row) { return present[row]; }

    public Spectrum spectrum(int row) {
        if (!present[row]) {
            throw new IllegalStateException(String.format("No spectrum loaded for angle %.3f deg.", series.angle(row)));
        }
        return new Spectrum(series.angle(row), grid, intensities[row]);
    }

    /** Angles of the series without a loaded spectrum. */
    public List<Double> missingAngles() {
        List<Double> missing = new ArrayList<>();
        for (int i = 0; i < present.length; i++) {
            if (!present[i]) missing.add(series.angle(i));
        }
        return Collections.unmodifiableList(missing);
    }

    /** Largest intensity over all loaded angles and wavelengths. */
    public double globalMax() {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < intensities.length; i++) {
            if (!present[i]) continue;
            for (double value : intensities[i]) max = Math.max(max, value);
        }
        return max;
    }
}
