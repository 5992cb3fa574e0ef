package de.anton.oled.analyser.el_analyzer.exceptions;

/**
 * Invalid rig or run configuration (unknown photodiode gain, unsupported angle range,
 * unparsable configuration values). Aborts the whole run.
 */
public class ConfigurationException extends ElAnalysisException {

    public ConfigurationException(String message) {
        super("Configuration error: " + message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("Configuration error: " + message, cause);
    }
}
