package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.model.WavelengthGrid;

import java.util.Arrays;

/**
 * Array operations used to bring raw spectra onto the master wavelength grid.
 */
public final class SignalProcessing {

    private SignalProcessing() { throw new IllegalStateException("Utility class"); }

    /**
     * Piecewise-linear resampling of (xs, ys) onto the grid. Targets outside the source range
     * take the nearest end value. A target that coincides with a source point returns the
     * source value unchanged, so resampling onto an identical grid is the identity.
     *
     * @param xs source abscissae, strictly increasing
     * @param ys source values, same length as xs
     */
    public static double[] interpolate(double[] xs, double[] ys, WavelengthGrid grid) {
        if (xs == null || ys == null || xs.length == 0 || xs.length != ys.length) {
            throw new IllegalArgumentException("Source abscissae and values must be non-empty and of equal length.");
        }
        for (int i = 1; i < xs.length; i++) {
            if (!(xs[i] > xs[i - 1])) {
                throw new IllegalArgumentException(String.format(
                    "Source wavelengths must be strictly increasing: %.4f follows %.4f at index %d", xs[i], xs[i - 1], i));
            }
        }

        int last = xs.length - 1;
        double[] result = new double[grid.size()];
        for (int i = 0; i < result.length; i++) {
            double target = grid.get(i);
            if (target <= xs[0]) {
                result[i] = ys[0];
            } else if (target >= xs[last]) {
                result[i] = ys[last];
            } else {
                int found = Arrays.binarySearch(xs, target);
                if (found >= 0) {
                    result[i] = ys[found];
                } else {
                    int hi = -(found + 1);
                    int lo = hi - 1;
                    double slope = (ys[hi] - ys[lo]) / (xs[hi] - xs[lo]);
                    result[i] = ys[lo] + slope * (target - xs[lo]);
                }
            }
        }
        return result;
    }

    /**
     * Centered boxcar moving average with output length equal to input length ("same" mode
     * convolution). For an even window the kernel spans {@code window/2} samples before and
     * {@code window/2 - 1} after the centre. Edge values average over the truncated kernel
     * but are still divided by the full window, so they are biased low.
     */
    public static double[] movingAverage(double[] values, int window) {
        if (window < 1) throw new IllegalArgumentException("Smoothing window must be at least 1: " + window);
        int offset = (window - 1) / 2;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < window; j++) {
                int k = i + offset - j;
                if (k >= 0 && k < values.length) sum += values[k];
            }
            result[i] = sum / window;
        }
        return result;
    }

    /** Elementwise a - b. */
    public static double[] subtract(double[] a, double[] b) {
        requireSameLength(a, b);
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] - b[i];
        return result;
    }

    /** Elementwise a * b. */
    public static double[] multiply(double[] a, double[] b) {
        requireSameLength(a, b);
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] * b[i];
        return result;
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Length mismatch: " + a.length + " vs " + b.length);
        }
    }
}
