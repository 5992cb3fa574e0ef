package de.anton.oled.analyser.el_analyzer.model;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;

import java.util.Arrays;

/**
 * The angles of a goniometer sweep as listed in the OLED voltage file. Monotonically
 * increasing; the step is derived as (max - min) / (n - 1).
 */
public final class AngleSeries {

    private static final double RANGE_EPSILON = 1e-6;

    private final double[] angles;

    public AngleSeries(double[] angles) {
        if (angles == null || angles.length < 2) {
            throw new IllegalArgumentException("An angle series needs at least two angles.");
        }
        for (int i = 1; i < angles.length; i++) {
            if (!(angles[i] > angles[i - 1])) {
                throw new IllegalArgumentException(String.format(
                    "Angles must increase monotonically: %.3f follows %.3f at index %d", angles[i], angles[i - 1], i));
            }
        }
        this.angles = angles.clone();
    }

    public int size() { return angles.length; }
    public double angle(int index) { return angles[index]; }
    public double min() { return angles[0]; }
    public double max() { return angles[angles.length - 1]; }
    public double step() { return (max() - min()) / (angles.length - 1); }
    public double[] toArray() { return angles.clone(); }

    /**
     * Index of the angle equal to {@code angle} within {@code tolerance}, or -1.
     */
    public int indexOf(double angle, double tolerance) {
        for (int i = 0; i < angles.length; i++) {
            if (Math.abs(angles[i] - angle) <= tolerance) return i;
        }
        return -1;
    }

    /**
     * Selects the operative half of the sweep from the maximum measured angle.
     *
     * @throws ConfigurationException if the sweep ends neither at 90 nor at 180 degrees.
     */
    public AngularRange operativeRange() throws ConfigurationException {
        double max = max();
        if (Math.abs(max - 90.0) < RANGE_EPSILON) return AngularRange.HALF_90;
        if (Math.abs(max - 180.0) < RANGE_EPSILON) return AngularRange.FULL_180;
        throw new ConfigurationException(String.format(
            "Unsupported angle range: sweep ends at %.3f deg, expected 90 or 180.", max));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(angles, ((AngleSeries) o).angles);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(angles); }

    @Override
    public String toString() {
        return String.format("AngleSeries[%d angles, %.2f to %.2f deg, step %.3f]", angles.length, min(), max(), step());
    }
}
