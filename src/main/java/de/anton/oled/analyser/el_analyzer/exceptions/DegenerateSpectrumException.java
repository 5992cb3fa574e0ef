package de.anton.oled.analyser.el_analyzer.exceptions;

public class DegenerateSpectrumException extends DegenerateComputationException {

    public DegenerateSpectrumException(String message) {
        super(message);
    }
}
