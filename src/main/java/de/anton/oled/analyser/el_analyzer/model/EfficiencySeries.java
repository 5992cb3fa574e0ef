package de.anton.oled.analyser.el_analyzer.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Efficiency records of one emission model, aligned with the electrical trace.
 */
public final class EfficiencySeries {

    private final EmissionModel model;
    private final List<EfficiencyRecord> records;

    public EfficiencySeries(EmissionModel model, List<EfficiencyRecord> records) {
        this.model = Objects.requireNonNull(model);
        this.records = List.copyOf(records);
    }

    public EmissionModel getModel() { return model; }
    public List<EfficiencyRecord> getRecords() { return records; }
    public EfficiencyRecord get(int index) { return records.get(index); }
    public int size() { return records.size(); }

    public List<EfficiencyRecord> validRecords() {
        return records.stream().filter(EfficiencyRecord::isValid).collect(Collectors.toUnmodifiableList());
    }

    public long invalidCount() {
        return records.stream().filter(r -> !r.isValid()).count();
    }
}
