package de.anton.oled.analyser.el_analyzer.exceptions;

/**
 * A denominator of an angular or photometric integral vanished, or a result was not finite.
 * The message names the offending angle or voltage.
 */
public class DegenerateComputationException extends ElAnalysisException {

    public DegenerateComputationException(String message) {
        super("Degenerate computation: " + message);
    }
}
