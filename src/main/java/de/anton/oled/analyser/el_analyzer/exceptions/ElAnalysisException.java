package de.anton.oled.analyser.el_analyzer.exceptions;

/**
 * Base class of all checked errors raised while analysing EL measurements.
 */
public class ElAnalysisException extends Exception {

    public ElAnalysisException(String message) {
        super(message);
    }

    public ElAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
