package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.algorithms.AngularCorrectionIntegrator;
import de.anton.oled.analyser.el_analyzer.algorithms.ChromaticityCalculator;
import de.anton.oled.analyser.el_analyzer.algorithms.EfficiencyCalculator;
import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateComputationException;
import de.anton.oled.analyser.el_analyzer.exceptions.IngestionException;
import de.anton.oled.analyser.el_analyzer.model.AngularFactors;
import de.anton.oled.analyser.el_analyzer.model.AngularProfile;
import de.anton.oled.analyser.el_analyzer.model.AngularRange;
import de.anton.oled.analyser.el_analyzer.model.ChromaticityPoint;
import de.anton.oled.analyser.el_analyzer.model.EfficiencySeries;
import de.anton.oled.analyser.el_analyzer.model.EmissionModel;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.SampleResult;
import de.anton.oled.analyser.el_analyzer.model.SampleRun;
import de.anton.oled.analyser.el_analyzer.model.SpectralMap;
import de.anton.oled.analyser.el_analyzer.model.SpectralMoments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Service responsible for the analysis of a single sample run: ingestion, angular
 * correction, efficiency calculation for both emission models and chromaticity.
 * Holds no state between runs.
 */
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final ReferenceData reference;
    private final SpectrumIngestionService ingestionService;
    private final AngularCorrectionIntegrator integrator;
    private final EfficiencyCalculator efficiencyCalculator;
    private final ChromaticityCalculator chromaticityCalculator;

    public AnalysisService(AnalysisConfiguration config, ReferenceData reference) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        this.reference = Objects.requireNonNull(reference, "Reference data cannot be null.");
        this.ingestionService = new SpectrumIngestionService(config, reference);
        this.integrator = new AngularCorrectionIntegrator();
        this.efficiencyCalculator = new EfficiencyCalculator(config);
        this.chromaticityCalculator = new ChromaticityCalculator();
    }

    public SpectrumIngestionService getIngestionService() {
        return ingestionService;
    }

    /**
     * Executes the complete pipeline for one run.
     *
     * @throws ConfigurationException         if the angle sweep does not end at 90 or 180 degrees
     * @throws IngestionException             if the raw data is missing, ambiguous or malformed
     * @throws DegenerateComputationException if a sample-level integral vanishes
     */
    public SampleResult runSample(SampleRun run)
            throws ConfigurationException, IngestionException, DegenerateComputationException {
        logger.info("Service: Starting analysis of {}", run);
        SpectrumIngestionService.IngestedSample sample = ingestionService.ingest(run);

        AngularRange range = sample.angles().operativeRange();
        AngularFactors factors = integrator.integrate(sample.spectra(), sample.forward(), reference.getPhotopic());
        AngularProfile profile = integrator.angularProfile(sample.spectra(), reference.getPhotopic());
        SpectralMap map = integrator.spectralMap(sample.spectra());

        SpectralMoments moments = EfficiencyCalculator.moments(sample.forward(), reference);
        EfficiencySeries actual = efficiencyCalculator.calculate(sample.trace(), moments, factors, EmissionModel.ACTUAL);
        EfficiencySeries lambertian = efficiencyCalculator.calculate(sample.trace(), moments, factors, EmissionModel.LAMBERTIAN);
        ChromaticityPoint chromaticity = chromaticityCalculator.calculate(sample.forward(), reference);

        logger.info("Service: {} done. Range {}, {}, CIE {} peak {} nm", run, range, factors,
            chromaticity.formatted(), chromaticity.peakWavelength());
        return new SampleResult(run, sample.angles(), range, factors, moments, chromaticity,
            actual, lambertian, profile, map);
    }
}
