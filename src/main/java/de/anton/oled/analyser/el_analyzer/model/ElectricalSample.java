package de.anton.oled.analyser.el_analyzer.model;

/**
 * One point of the IV sweep: OLED voltage (V), OLED current (A), photodiode voltage (V).
 */
public record ElectricalSample(double voltage, double current, double photodiodeVoltage) {
}
