package de.anton.oled.analyser.el_analyzer.exceptions;

/**
 * A reference curve file (photopic response, responsivity, CIE curves, calibration)
 * is missing or malformed. Aborts the whole run.
 */
public class ReferenceDataException extends ElAnalysisException {

    public ReferenceDataException(String message) {
        super("Reference data error: " + message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super("Reference data error: " + message, cause);
    }
}
