package de.anton.oled.analyser.el_analyzer.model;

import java.util.Locale;

/**
 * CIE 1931 chromaticity of the forward spectrum together with its peak wavelength (nm).
 */
public record ChromaticityPoint(double x, double y, double peakWavelength) {

    public double z() { return 1.0 - x - y; }

    /** "(0.522, 0.476)" */
    public String formatted() {
        return String.format(Locale.ROOT, "(%.3f, %.3f)", x, y);
    }
}
