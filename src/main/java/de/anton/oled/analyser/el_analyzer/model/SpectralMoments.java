package de.anton.oled.analyser.el_analyzer.model;

/**
 * Spectral integrals of the forward spectrum: Σ I·λ, Σ I, Σ I·V(λ) and Σ I·R(λ).
 */
public record SpectralMoments(double wavelength, double total, double luminous, double responsivity) {
}
