package de.anton.oled.analyser.el_analyzer.model;

import java.util.List;

/**
 * The photodiode IV sweep of a sample, in measurement order.
 */
public final class ElectricalTrace {

    private final List<ElectricalSample> samples;

    public ElectricalTrace(List<ElectricalSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("An electrical trace needs at least one sample.");
        }
        this.samples = List.copyOf(samples);
    }

    public List<ElectricalSample> getSamples() { return samples; }
    public int size() { return samples.size(); }
    public ElectricalSample get(int index) { return samples.get(index); }

    @Override
    public String toString() {
        return "ElectricalTrace{" + samples.size() + " samples}";
    }
}
