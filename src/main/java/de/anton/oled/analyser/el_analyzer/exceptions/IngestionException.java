package de.anton.oled.analyser.el_analyzer.exceptions;

/**
 * Raw data of a single sample run could not be ingested. Aborts only that sample.
 */
public class IngestionException extends ElAnalysisException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
