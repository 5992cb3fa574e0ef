package de.anton.oled.analyser.el_analyzer.model;

/**
 * Everything computed for one sample run.
 */
public record SampleResult(
    SampleRun run,
    AngleSeries angles,
    AngularRange range,
    AngularFactors factors,
    SpectralMoments forwardMoments,
    ChromaticityPoint chromaticity,
    EfficiencySeries actual,
    EfficiencySeries lambertian,
    AngularProfile angularProfile,
    SpectralMap spectralMap
) {
}
