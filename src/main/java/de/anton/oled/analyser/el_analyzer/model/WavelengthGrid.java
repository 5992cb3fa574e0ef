package de.anton.oled.analyser.el_analyzer.model;

import java.util.Arrays;

/**
 * The master wavelength axis (nm) every reference curve and spectrum is resampled onto.
 * Strictly increasing. Immutable.
 */
public final class WavelengthGrid {

    private final double[] wavelengths;

    public WavelengthGrid(double[] wavelengths) {
        if (wavelengths == null || wavelengths.length < 2) {
            throw new IllegalArgumentException("A wavelength grid needs at least two points.");
        }
        for (int i = 1; i < wavelengths.length; i++) {
            if (!(wavelengths[i] > wavelengths[i - 1])) {
                throw new IllegalArgumentException(String.format(
                    "Wavelength grid must be strictly increasing: %.4f nm follows %.4f nm at index %d",
                    wavelengths[i], wavelengths[i - 1], i));
            }
        }
        this.wavelengths = wavelengths.clone();
    }

    public int size() { return wavelengths.length; }
    public double get(int index) { return wavelengths[index]; }
    public double first() { return wavelengths[0]; }
    public double last() { return wavelengths[wavelengths.length - 1]; }

    /** @return a copy of the wavelengths. */
    public double[] toArray() { return wavelengths.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(wavelengths, ((WavelengthGrid) o).wavelengths);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(wavelengths); }

    @Override
    public String toString() {
        return String.format("WavelengthGrid[%d points, %.1f-%.1f nm]", wavelengths.length, first(), last());
    }
}
