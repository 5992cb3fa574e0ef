package de.anton.oled.analyser.el_analyzer.model;

import java.util.Objects;

/**
 * All reference curves of a run, resampled onto one grid. Loaded once and shared read-only
 * by every sample of the batch.
 */
public final class ReferenceData {

    private final WavelengthGrid grid;
    private final ReferenceCurve photopic;
    private final ReferenceCurve responsivity;
    private final ReferenceCurve cieX;
    private final ReferenceCurve cieY;
    private final ReferenceCurve cieZ;
    private final ReferenceCurve calibration;

    public ReferenceData(WavelengthGrid grid, ReferenceCurve photopic, ReferenceCurve responsivity,
                         ReferenceCurve cieX, ReferenceCurve cieY, ReferenceCurve cieZ,
                         ReferenceCurve calibration) {
        this.grid = Objects.requireNonNull(grid);
        this.photopic = requireOnGrid(photopic, grid);
        this.responsivity = requireOnGrid(responsivity, grid);
        this.cieX = requireOnGrid(cieX, grid);
        this.cieY = requireOnGrid(cieY, grid);
        this.cieZ = requireOnGrid(cieZ, grid);
        this.calibration = requireOnGrid(calibration, grid);
    }

    private static ReferenceCurve requireOnGrid(ReferenceCurve curve, WavelengthGrid grid) {
        Objects.requireNonNull(curve, "Reference curve cannot be null.");
        if (!grid.equals(curve.getGrid())) {
            throw new IllegalArgumentException("Curve '" + curve.getName() + "' is not resampled onto the master grid.");
        }
        return curve;
    }

    public WavelengthGrid getGrid() { return grid; }
    /** Luminous efficiency function V(λ). */
    public ReferenceCurve getPhotopic() { return photopic; }
    /** Photodiode responsivity R(λ). */
    public ReferenceCurve getResponsivity() { return responsivity; }
    public ReferenceCurve getCieX() { return cieX; }
    public ReferenceCurve getCieY() { return cieY; }
    public ReferenceCurve getCieZ() { return cieZ; }
    /** Spectrometer counts to W/nm/sr. */
    public ReferenceCurve getCalibration() { return calibration; }

    @Override
    public String toString() {
        return "ReferenceData{" + grid + '}';
    }
}
