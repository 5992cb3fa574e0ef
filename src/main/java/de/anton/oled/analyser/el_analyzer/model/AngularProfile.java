package de.anton.oled.analyser.el_analyzer.model;

import java.util.List;

/**
 * Angular emission profile compared with an ideal cosine emitter, one row per measured angle.
 */
public record AngularProfile(List<Row> rows) {

    public AngularProfile {
        rows = List.copyOf(rows);
    }

    /**
     * @param lambertian     cos of the physical angle
     * @param actualRadiant  Σ I normalized to the operative lower bound angle
     * @param actualLuminous Σ I·V normalized to the operative lower bound angle
     */
    public record Row(double angle, double lambertian, double actualRadiant, double actualLuminous) {
    }
}
