package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.TestFixtures;
import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateSpectrumException;
import de.anton.oled.analyser.el_analyzer.model.ChromaticityPoint;
import de.anton.oled.analyser.el_analyzer.model.ReferenceCurve;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import de.anton.oled.analyser.el_analyzer.model.WavelengthGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChromaticityCalculatorTest {

    private static final double[] WAVELENGTHS = {450, 500, 550, 600, 650};

    private final ChromaticityCalculator calculator = new ChromaticityCalculator();

    @Test
    void coordinatesSumToOne() throws Exception {
        WavelengthGrid grid = new WavelengthGrid(WAVELENGTHS);
        ReferenceData reference = new ReferenceData(grid,
            new ReferenceCurve("V(lambda)", grid, TestFixtures.filled(5, 1.0)),
            new ReferenceCurve("R(lambda)", grid, TestFixtures.filled(5, 1.0)),
            new ReferenceCurve("CIE x", grid, new double[] {0.34, 0.005, 0.43, 1.06, 0.28}),
            new ReferenceCurve("CIE y", grid, new double[] {0.04, 0.32, 0.99, 0.63, 0.11}),
            new ReferenceCurve("CIE z", grid, new double[] {1.77, 0.27, 0.009, 0.001, 0.0}),
            new ReferenceCurve("calibration", grid, TestFixtures.filled(5, 1.0)));
        Spectrum spectrum = new Spectrum(0.0, grid, new double[] {0.1, 0.4, 1.0, 0.6, 0.2});

        ChromaticityPoint point = calculator.calculate(spectrum, reference);

        assertEquals(1.0, point.x() + point.y() + point.z(), 1e-12);
        assertTrue(point.x() > 0 && point.y() > 0 && point.z() > 0);
        assertEquals(550.0, point.peakWavelength());
    }

    @Test
    void equalCurvesGiveTheWhitePoint() throws Exception {
        ReferenceData reference = TestFixtures.referenceData(WAVELENGTHS, 1, 1, 1, 1, 1);
        ChromaticityPoint point = calculator.calculate(
            new Spectrum(0.0, reference.getGrid(), new double[] {1, 2, 3, 2, 1}), reference);
        assertEquals(1.0 / 3, point.x(), 1e-12);
        assertEquals(1.0 / 3, point.y(), 1e-12);
        assertEquals("(0.333, 0.333)", point.formatted());
    }

    @Test
    void firstMaximumWinsOnTies() throws Exception {
        ReferenceData reference = TestFixtures.referenceData(WAVELENGTHS, 1, 1, 1, 2, 1);
        ChromaticityPoint point = calculator.calculate(
            new Spectrum(0.0, reference.getGrid(), new double[] {0.5, 1.0, 1.0, 1.0, 0.5}), reference);
        assertEquals(500.0, point.peakWavelength());
        assertEquals(0.5, point.y(), 1e-12);
    }

    @Test
    void darkSpectrumIsDegenerate() {
        ReferenceData reference = TestFixtures.referenceData(WAVELENGTHS, 1, 1, 1, 1, 1);
        Spectrum dark = new Spectrum(0.0, reference.getGrid(), new double[5]);
        assertThrows(DegenerateSpectrumException.class, () -> calculator.calculate(dark, reference));
    }
}
