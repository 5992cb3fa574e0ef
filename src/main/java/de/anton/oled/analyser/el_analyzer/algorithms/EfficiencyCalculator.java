package de.anton.oled.analyser.el_analyzer.algorithms;

import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateComputationException;
import de.anton.oled.analyser.el_analyzer.model.AngularFactors;
import de.anton.oled.analyser.el_analyzer.model.EfficiencyRecord;
import de.anton.oled.analyser.el_analyzer.model.EfficiencySeries;
import de.anton.oled.analyser.el_analyzer.model.ElectricalSample;
import de.anton.oled.analyser.el_analyzer.model.ElectricalTrace;
import de.anton.oled.analyser.el_analyzer.model.EmissionModel;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.SpectralMoments;
import de.anton.oled.analyser.el_analyzer.model.Spectrum;
import de.anton.oled.analyser.el_analyzer.service.AnalysisConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts the photodiode sweep into EQE, luminance, luminous efficacy, current efficiency
 * and power density, either for an ideal Lambertian emitter or corrected with the measured
 * angular factors.
 */
public class EfficiencyCalculator {

    private static final Logger logger = LoggerFactory.getLogger(EfficiencyCalculator.class);

    public static final double PLANCK = 6.62606896e-34;        // J s
    public static final double SPEED_OF_LIGHT = 299792458;     // m/s
    public static final double ELEMENTARY_CHARGE = 1.602176462e-19; // C
    public static final double KM = 683;                        // lm/W, peak luminous efficacy

    private static final double NEAR_ZERO = 1e-30;

    private final double oledArea;
    private final double resistance;
    private final double cutoff;
    private final double sqSinAlpha;

    public EfficiencyCalculator(AnalysisConfiguration configuration) {
        this.oledArea = configuration.oledArea();
        this.resistance = configuration.gain().getResistanceOhm();
        this.cutoff = configuration.gain().getCutoffVolt();
        this.sqSinAlpha = configuration.sqSinAlpha();
    }

    /**
     * Spectral integrals of the forward spectrum against λ, 1, V(λ) and R(λ).
     *
     * @throws DegenerateComputationException if the responsivity integral vanishes
     */
    public static SpectralMoments moments(Spectrum forward, ReferenceData reference) throws DegenerateComputationException {
        double responsivity = forward.weightedSum(reference.getResponsivity());
        if (!Double.isFinite(responsivity) || Math.abs(responsivity) < NEAR_ZERO) {
            throw new DegenerateComputationException(String.format(Locale.ROOT,
                "photodiode responsivity integral of the spectrum at %.2f deg is %s", forward.getAngle(), responsivity));
        }
        return new SpectralMoments(
            forward.wavelengthMoment(),
            forward.total(),
            forward.weightedSum(reference.getPhotopic()),
            responsivity);
    }

    /**
     * Computes one record per electrical sample.
     *
     * @param factors angular factors; ignored for {@link EmissionModel#LAMBERTIAN}
     */
    public EfficiencySeries calculate(ElectricalTrace trace, SpectralMoments moments,
                                      AngularFactors factors, EmissionModel model) {
        boolean actual = model == EmissionModel.ACTUAL;
        double coefficientFactor = actual ? 2.0 : 1.0;
        double radiantFactor = actual ? factors.radiantFactor() : 1.0;
        double luminousFactor = actual ? factors.luminousFactor() : 1.0;

        double wavelengthRatio = moments.wavelength() / moments.responsivity();
        double totalRatio = moments.total() / moments.responsivity();
        double luminousRatio = moments.luminous() / moments.responsivity();

        List<EfficiencyRecord> records = new ArrayList<>(trace.size());
        for (ElectricalSample sample : trace.getSamples()) {
            double v = sample.voltage();
            double i = sample.current();
            double currentMilliAmps = i * 1e3;
            double currentDensity = i * 1e3 / (oledArea * 1e4); // mA/cm2

            if (!(sample.photodiodeVoltage() > cutoff)) {
                records.add(new EfficiencyRecord(v, currentMilliAmps, currentDensity, 0, 0, 0, 0, 0, 0, false));
                continue;
            }
            if (Math.abs(i) < NEAR_ZERO) {
                records.add(invalid(model, sample, currentMilliAmps, currentDensity, "zero OLED current"));
                continue;
            }
            // LE is the only quantity divided by V
            boolean zeroVoltage = Math.abs(v) < NEAR_ZERO;

            double eCoeff = coefficientFactor * sample.photodiodeVoltage() / resistance / sqSinAlpha;
            double vCoeff = KM * eCoeff;
            double eqe = 100 * (ELEMENTARY_CHARGE / 1e9 / PLANCK / SPEED_OF_LIGHT / i * eCoeff * wavelengthRatio * radiantFactor);
            double luminance = 1 / Math.PI / oledArea * vCoeff / coefficientFactor * luminousRatio;
            double efficacy = zeroVoltage ? Double.NaN : 1 / v / i * vCoeff * luminousRatio * luminousFactor;
            double currentEfficiency = oledArea / i * luminance;
            double powerDensity = 1 / (oledArea * 1e6) * eCoeff * totalRatio * radiantFactor * 1e3;
            double averageLuminance = actual ? 2 * factors.luminousFactor() * luminance : luminance;

            if (!allFinite(eqe, luminance, currentEfficiency, powerDensity, averageLuminance)
                    || (!zeroVoltage && !Double.isFinite(efficacy))) {
                records.add(invalid(model, sample, currentMilliAmps, currentDensity, "non-finite result"));
                continue;
            }
            if (zeroVoltage) {
                logger.warn("{} record at 0 V: luminous efficacy left blank", model);
            }
            records.add(new EfficiencyRecord(v, currentMilliAmps, currentDensity, luminance, averageLuminance,
                eqe, efficacy, currentEfficiency, powerDensity, true));
        }

        EfficiencySeries series = new EfficiencySeries(model, records);
        logger.debug("{} efficiency series: {} records, {} invalid", model, series.size(), series.invalidCount());
        return series;
    }

    private static EfficiencyRecord invalid(EmissionModel model, ElectricalSample sample,
                                            double currentMilliAmps, double currentDensity, String cause) {
        String reason = String.format(Locale.ROOT, "%s at %.4f V", cause, sample.voltage());
        logger.warn("{} record skipped: {}", model, reason);
        return EfficiencyRecord.invalid(sample.voltage(), currentMilliAmps, currentDensity, reason);
    }

    private static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) return false;
        }
        return true;
    }
}
