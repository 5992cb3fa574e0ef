package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateSpectrumException;
import de.anton.oled.analyser.el_analyzer.model.ChromaticityPoint;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CIE 1931 (x, y) and peak wavelength of the forward spectrum.
 */
public class ChromaticityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(ChromaticityCalculator.class);
    private static final double NEAR_ZERO = 1e-30;

    public ChromaticityPoint calculate(Spectrum forward, ReferenceData reference) throws DegenerateSpectrumException {
        int peakIndex = 0;
        for (int i = 1; i < forward.size(); i++) {
            if (forward.intensity(i) > forward.intensity(peakIndex)) peakIndex = i; // first occurrence wins
        }
        double peakWavelength = forward.getGrid().get(peakIndex);

        double x = forward.weightedSum(reference.getCieX());
        double y = forward.weightedSum(reference.getCieY());
        double z = forward.weightedSum(reference.getCieZ());
        double sum = x + y + z;
        if (!Double.isFinite(sum) || Math.abs(sum) < NEAR_ZERO) {
            throw new DegenerateSpectrumException(String.format(
                "tristimulus sum X+Y+Z = %s for the spectrum at %.2f deg", sum, forward.getAngle()));
        }

        ChromaticityPoint point = new ChromaticityPoint(x / sum, y / sum, peakWavelength);
        logger.debug("Chromaticity {} with peak at {} nm", point.formatted(), peakWavelength);
        return point;
    }
}
