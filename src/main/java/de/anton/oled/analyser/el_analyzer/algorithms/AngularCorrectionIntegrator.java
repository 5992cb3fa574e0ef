package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateComputationException;
import de.anton.oled.analyser.el_analyzer.model.AngleSeries;
import de.anton.oled.analyser.el_analyzer.model.AngularFactors;
import de.anton.oled.analyser.el_analyzer.model.AngularProfile;
import de.anton.oled.analyser.el_analyzer.model.AngularRange;
import de.anton.oled.analyser.el_analyzer.model.ReferenceCurve;
import de.anton.oled.analyser.el_analyzer.model.SpectralMap;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import de.anton.oled.analyser.el_analyzer.model.SpectrumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Integrates the measured angular emission over the hemisphere.
 * <p>
 * For every angle of the operative half-range the spectrum is compared with the forward
 * spectrum, once weighted by wavelength (radiant) and once by V(λ) (luminous). The ratios
 * replace cos(θ) of the Lambertian law and are summed as a left Riemann sum of
 * ratio(φ)·sin(φ)·Δφ, φ being the angle from the surface normal.
 */
public class AngularCorrectionIntegrator {

    private static final Logger logger = LoggerFactory.getLogger(AngularCorrectionIntegrator.class);
    private static final double NEAR_ZERO = 1e-30;

    /**
     * @param spectra  all angle spectra of the sample
     * @param forward  spectrum at 0 degrees
     * @param photopic V(λ) on the spectra's grid
     * @throws ConfigurationException         if the sweep does not end at 90 or 180 degrees
     * @throws DegenerateComputationException if a forward integral vanishes or the result is not finite
     */
    public AngularFactors integrate(SpectrumSet spectra, Spectrum forward, ReferenceCurve photopic)
            throws ConfigurationException, DegenerateComputationException {
        AngleSeries series = spectra.getSeries();
        AngularRange range = series.operativeRange();
        double tolerance = spectra.getTolerance();
        double stepRad = Math.toRadians(series.step());

        double forwardRadiant = forward.wavelengthMoment();
        double forwardLuminous = forward.weightedSum(photopic);
        requireUsable(forwardRadiant, "radiant moment of the forward spectrum at " + forward.getAngle() + " deg");
        requireUsable(forwardLuminous, "luminous moment of the forward spectrum at " + forward.getAngle() + " deg");

        logger.debug("Integrating {} over range {} ({}-{} deg)", series, range, range.lowerBound(), range.upperBound());
        double radiantFactor = 0.0;
        double luminousFactor = 0.0;
        int used = 0;
        for (int i = 0; i < series.size(); i++) {
            double angle = series.angle(i);
            if (angle < range.lowerBound() - tolerance || angle >= range.upperBound() - tolerance) continue;

            Spectrum spectrum = spectra.spectrum(i);
            double radiantRatio = spectrum.wavelengthMoment() / forwardRadiant;
            double luminousRatio = spectrum.weightedSum(photopic) / forwardLuminous;
            double weight = Math.sin(Math.toRadians(range.toPhysicalAngle(angle))) * stepRad;
            radiantFactor += radiantRatio * weight;
            luminousFactor += luminousRatio * weight;
            used++;
        }

        if (used == 0) {
            throw new DegenerateComputationException(String.format(
                "no measured angle inside the operative range %.1f-%.1f deg", range.lowerBound(), range.upperBound()));
        }
        if (!Double.isFinite(radiantFactor) || !Double.isFinite(luminousFactor)) {
            throw new DegenerateComputationException("angular factors are not finite (radiant="
                + radiantFactor + ", luminous=" + luminousFactor + ")");
        }
        AngularFactors factors = new AngularFactors(radiantFactor, luminousFactor);
        logger.info("Angular factors from {} angles: {}", used, factors);
        return factors;
    }

    /**
     * Per-angle emission normalized to the operative lower bound angle, next to the cosine of
     * an ideal emitter.
     */
    public AngularProfile angularProfile(SpectrumSet spectra, ReferenceCurve photopic)
            throws ConfigurationException, DegenerateComputationException {
        AngleSeries series = spectra.getSeries();
        AngularRange range = series.operativeRange();
        int referenceRow = series.indexOf(range.lowerBound(), spectra.getTolerance());
        if (referenceRow < 0) {
            throw new DegenerateComputationException(String.format(
                "no spectrum at the reference angle %.1f deg for the angular profile", range.lowerBound()));
        }

        Spectrum reference = spectra.spectrum(referenceRow);
        double referenceRadiant = reference.total();
        double referenceLuminous = reference.weightedSum(photopic);
        requireUsable(referenceRadiant, "radiant intensity at " + reference.getAngle() + " deg");
        requireUsable(referenceLuminous, "luminous intensity at " + reference.getAngle() + " deg");

        List<AngularProfile.Row> rows = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            Spectrum spectrum = spectra.spectrum(i);
            double angle = series.angle(i);
            rows.add(new AngularProfile.Row(
                angle,
                Math.cos(Math.toRadians(range.toPhysicalAngle(angle))),
                spectrum.total() / referenceRadiant,
                spectrum.weightedSum(photopic) / referenceLuminous));
        }
        return new AngularProfile(rows);
    }

    /**
     * All angle spectra divided by their common maximum.
     */
    public SpectralMap spectralMap(SpectrumSet spectra) throws DegenerateComputationException {
        double max = spectra.globalMax();
        if (!(max > NEAR_ZERO) || !Double.isFinite(max)) {
            throw new DegenerateComputationException("spectral map maximum is " + max + ", cannot normalize");
        }
        AngleSeries series = spectra.getSeries();
        double[][] normalized = new double[series.size()][];
        for (int i = 0; i < series.size(); i++) {
            double[] row = spectra.spectrum(i).intensities();
            for (int w = 0; w < row.length; w++) row[w] /= max;
            normalized[i] = row;
        }
        return new SpectralMap(series.toArray(), spectra.getGrid(), normalized);
    }

    private static void requireUsable(double denominator, String what) throws DegenerateComputationException {
        if (!Double.isFinite(denominator) || Math.abs(denominator) < NEAR_ZERO) {
            throw new DegenerateComputationException(what + " is " + denominator);
        }
    }
}
