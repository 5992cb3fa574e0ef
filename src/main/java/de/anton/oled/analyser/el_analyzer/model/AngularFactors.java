package de.anton.oled.analyser.el_analyzer.model;

/**
 * Solid-angle integrated emission relative to the on-axis beam, radiant and luminous weighted.
 * A cosine emitter yields 0.5 for both.
 */
public record AngularFactors(double radiantFactor, double luminousFactor) {

    @Override
    public String toString() {
        return String.format("AngularFactors[radiant=%.5f, luminous=%.5f]", radiantFactor, luminousFactor);
    }
}
