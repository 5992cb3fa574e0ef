package de.anton.oled.analyser.el_analyzer.exceptions;

import java.nio.file.Path;
import java.util.List;

public class NoForwardSpectrumException extends IngestionException {

    public NoForwardSpectrumException(Path spectrumDirectory, List<String> acceptedNames) {
        super("No forward (0 degree) spectrum in " + spectrumDirectory + ", tried " + acceptedNames);
    }
}
