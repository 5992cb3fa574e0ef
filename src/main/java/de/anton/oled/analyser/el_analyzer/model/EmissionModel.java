package de.anton.oled.analyser.el_analyzer.model;

/**
 * Angular emission assumption an efficiency series was computed under.
 */
public enum EmissionModel {
    /** Measured angular profile, corrected with the angular factors. */
    ACTUAL("NONLAM"),
    /** Ideal cosine emitter. */
    LAMBERTIAN("LAM");

    private final String fileTag;

    EmissionModel(String fileTag) {
        this.fileTag = fileTag;
    }

    /** Suffix used in output file names. */
    public String getFileTag() { return fileTag; }
}
