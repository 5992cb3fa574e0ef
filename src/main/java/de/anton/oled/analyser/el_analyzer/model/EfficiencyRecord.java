package de.anton.oled.analyser.el_analyzer.model;

/**
 * Device performance at one point of the IV sweep. Photometric fields are exactly zero when
 * the photodiode reading is at or below the gain cutoff. Records whose computation hit a zero
 * denominator are marked invalid and carry the reason. At 0 V only the luminous efficacy is NaN.
 */
public final class EfficiencyRecord {

    private final double voltage;            // V
    private final double currentMilliAmps;   // mA
    private final double currentDensity;     // mA/cm2
    private final double luminance;          // cd/m2
    private final double averageLuminance;   // cd/m2
    private final double eqe;                // %
    private final double luminousEfficacy;   // lm/W
    private final double currentEfficiency;  // cd/A
    private final double powerDensity;       // mW/mm2
    private final boolean aboveCutoff;
    private final String invalidReason;

    public EfficiencyRecord(double voltage, double currentMilliAmps, double currentDensity,
                            double luminance, double averageLuminance, double eqe,
                            double luminousEfficacy, double currentEfficiency, double powerDensity,
                            boolean aboveCutoff) {
        this(voltage, currentMilliAmps, currentDensity, luminance, averageLuminance, eqe,
             luminousEfficacy, currentEfficiency, powerDensity, aboveCutoff, null);
    }

    private EfficiencyRecord(double voltage, double currentMilliAmps, double currentDensity,
                             double luminance, double averageLuminance, double eqe,
                             double luminousEfficacy, double currentEfficiency, double powerDensity,
                             boolean aboveCutoff, String invalidReason) {
        this.voltage = voltage;
        this.currentMilliAmps = currentMilliAmps;
        this.currentDensity = currentDensity;
        this.luminance = luminance;
        this.averageLuminance = averageLuminance;
        this.eqe = eqe;
        this.luminousEfficacy = luminousEfficacy;
        this.currentEfficiency = currentEfficiency;
        this.powerDensity = powerDensity;
        this.aboveCutoff = aboveCutoff;
        this.invalidReason = invalidReason;
    }

    /** Record for a sample whose photometric quantities could not be computed. */
    public static EfficiencyRecord invalid(double voltage, double currentMilliAmps, double currentDensity, String reason) {
        return new EfficiencyRecord(voltage, currentMilliAmps, currentDensity,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, true, reason);
    }

    public double getVoltage() { return voltage; }
    public double getCurrentMilliAmps() { return currentMilliAmps; }
    public double getCurrentDensity() { return currentDensity; }
    public double getAbsCurrentDensity() { return Math.abs(currentDensity); }
    public double getLuminance() { return luminance; }
    public double getAverageLuminance() { return averageLuminance; }
    public double getEqe() { return eqe; }
    public double getLuminousEfficacy() { return luminousEfficacy; }
    public double getCurrentEfficiency() { return currentEfficiency; }
    public double getPowerDensity() { return powerDensity; }
    public boolean isAboveCutoff() { return aboveCutoff; }
    public boolean isValid() { return invalidReason == null; }
    public String getInvalidReason() { return invalidReason; }

    @Override
    public String toString() {
        if (!isValid()) {
            return String.format("EfficiencyRecord[V=%.3f, invalid: %s]", voltage, invalidReason);
        }
        return String.format("EfficiencyRecord[V=%.3f, I=%.4e mA, L=%.4e cd/m2, EQE=%.4f %%, LE=%.4f lm/W]",
            voltage, currentMilliAmps, luminance, eqe, luminousEfficacy);
    }
}
