package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.TestFixtures;
import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateComputationException;
import de.anton.oled.analyser.el_analyzer.model.AngleSeries;
import de.anton.oled.analyser.el_analyzer.model.AngularFactors;
import de.anton.oled.analyser.el_analyzer.model.AngularProfile;
import de.anton.oled.analyser.el_analyzer.model.ReferenceCurve;
import de.anton.oled.analyser.el_analyzer.model.SpectralMap;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import de.anton.oled.analyser.el_analyzer.model.SpectrumSet;
import de.anton.oled.analyser.el_analyzer.model.WavelengthGrid;
import org.junit.jupiter.api.Test;

import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class AngularCorrectionIntegratorTest {

    private static final WavelengthGrid GRID = new WavelengthGrid(new double[] {450, 550, 650});
    private static final ReferenceCurve PHOTOPIC = new ReferenceCurve("V(lambda)", GRID, new double[] {0.04, 1.0, 0.1});

    private final AngularCorrectionIntegrator integrator = new AngularCorrectionIntegrator();

    /** Spectra of shape (1, 2, 1) scaled by {@code scale(angle)}. */
    private static SpectrumSet spectra(double[] angles, DoubleUnaryOperator scale) {
        SpectrumSet set = new SpectrumSet(new AngleSeries(angles), GRID, 1e-3);
        for (double angle : angles) {
            double s = scale.applyAsDouble(angle);
            assertTrue(set.put(new Spectrum(angle, GRID, new double[] {s, 2 * s, s})));
        }
        return set;
    }

    private static Spectrum forward() {
        return new Spectrum(0.0, GRID, new double[] {1, 2, 1});
    }

    @Test
    void flatEmissionGivesFactorsOfOne() throws Exception {
        AngularFactors factors = integrator.integrate(spectra(TestFixtures.range(0, 90, 0.1), a -> 1.0), forward(), PHOTOPIC);
        assertEquals(1.0, factors.radiantFactor(), 1e-3);
        assertEquals(1.0, factors.luminousFactor(), 1e-3);
    }

    @Test
    void cosineEmitterConvergesToOneHalf() throws Exception {
        SpectrumSet set = spectra(TestFixtures.range(0, 90, 0.1), a -> Math.cos(Math.toRadians(a)));
        AngularFactors factors = integrator.integrate(set, forward(), PHOTOPIC);
        assertEquals(0.5, factors.radiantFactor(), 1e-4);
        assertEquals(0.5, factors.luminousFactor(), 1e-4);
    }

    @Test
    void fullSweepUsesOnlyTheUpperHalfShiftedBy90() throws Exception {
        // below 90 deg only the 0 deg row matters, as the forward reference
        SpectrumSet set = spectra(TestFixtures.range(0, 180, 0.5), a -> a < 90 ? 2.0 : Math.cos(Math.toRadians(a - 90)));
        AngularFactors factors = integrator.integrate(set, set.spectrum(0), PHOTOPIC);
        assertEquals(0.5 / 2.0, factors.radiantFactor(), 1e-3);
        assertEquals(0.5 / 2.0, factors.luminousFactor(), 1e-3);
    }

    @Test
    void unsupportedMaximumAngleIsAConfigurationError() {
        SpectrumSet set = spectra(TestFixtures.range(0, 45, 1), a -> 1.0);
        assertThrows(ConfigurationException.class, () -> integrator.integrate(set, forward(), PHOTOPIC));
    }

    @Test
    void zeroForwardSpectrumIsDegenerate() {
        SpectrumSet set = spectra(TestFixtures.range(0, 90, 1), a -> 1.0);
        Spectrum dark = new Spectrum(0.0, GRID, new double[3]);
        DegenerateComputationException e = assertThrows(DegenerateComputationException.class,
            () -> integrator.integrate(set, dark, PHOTOPIC));
        assertTrue(e.getMessage().contains("0.0 deg"));
    }

    @Test
    void angularProfileIsNormalizedToTheNormal() throws Exception {
        SpectrumSet set = spectra(TestFixtures.range(0, 90, 10), a -> 3.0 * Math.cos(Math.toRadians(a)));
        AngularProfile profile = integrator.angularProfile(set, PHOTOPIC);

        assertEquals(10, profile.rows().size());
        for (AngularProfile.Row row : profile.rows()) {
            double expected = Math.cos(Math.toRadians(row.angle()));
            assertEquals(expected, row.lambertian(), 1e-12);
            assertEquals(expected, row.actualRadiant(), 1e-12);
            assertEquals(expected, row.actualLuminous(), 1e-12);
        }
    }

    @Test
    void spectralMapPeaksAtOne() throws Exception {
        SpectrumSet set = spectra(TestFixtures.range(0, 90, 30), a -> 1.0 + a);
        SpectralMap map = integrator.spectralMap(set);

        assertEquals(4, map.angleCount());
        assertEquals(1.0, map.value(3, 1), 1e-12);           // 2 * 91 is the maximum
        assertEquals(1.0 / 182.0, map.value(0, 0), 1e-12);
    }
}
