package de.anton.oled.analyser.el_analyzer.model;

/**
 * Physically meaningful half of a goniometer sweep. A rig sweeping up to 90 deg measures the
 * hemisphere directly; a rig sweeping up to 180 deg has its surface normal at 90 deg, so the
 * operative angles 90-180 are shifted down by 90 deg.
 */
public enum AngularRange {
    HALF_90(0.0),
    FULL_180(90.0);

    public static final double HEMISPHERE_SPAN = 90.0;

    private final double lowerBound;

    AngularRange(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    /** First operative measured angle (inclusive). */
    public double lowerBound() { return lowerBound; }

    /** Last operative measured angle (exclusive). */
    public double upperBound() { return lowerBound + HEMISPHERE_SPAN; }

    /** Angle from the surface normal for a measured angle. */
    public double toPhysicalAngle(double measuredAngle) { return measuredAngle - lowerBound; }
}
