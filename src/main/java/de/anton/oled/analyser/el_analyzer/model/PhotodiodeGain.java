package de.anton.oled.analyser.el_analyzer.model;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;

/**
 * Gain settings of the PDA100A2 transimpedance amplifier with the load resistance used to
 * convert the photodiode voltage back into a photocurrent and the voltage below which the
 * reading is considered noise.
 */
public enum PhotodiodeGain {
    DB_0(0, 1.51e3, 1e-6),
    DB_10(10, 4.75e3, 3e-6),
    DB_20(20, 1.5e4, 5e-6),
    DB_30(30, 4.75e4, 1e-5),
    DB_40(40, 1.51e5, 3e-4),
    DB_50(50, 4.75e5, 9e-4),
    DB_60(60, 1.5e6, 4e-3),
    DB_70(70, 4.75e6, 2e-3),
    DB_80(80, 2.2e6, 2e-5);

    private final int decibels;
    private final double resistanceOhm;
    private final double cutoffVolt;

    PhotodiodeGain(int decibels, double resistanceOhm, double cutoffVolt) {
        this.decibels = decibels;
        this.resistanceOhm = resistanceOhm;
        this.cutoffVolt = cutoffVolt;
    }

    public int getDecibels() { return decibels; }
    public double getResistanceOhm() { return resistanceOhm; }
    public double getCutoffVolt() { return cutoffVolt; }

    /**
     * Looks up the gain setting for a value in dB.
     *
     * @throws ConfigurationException if the amplifier has no such setting.
     */
    public static PhotodiodeGain fromDecibels(int decibels) throws ConfigurationException {
        for (PhotodiodeGain gain : values()) {
            if (gain.decibels == decibels) return gain;
        }
        throw new ConfigurationException("Not a valid photodiode gain: " + decibels
            + " dB. Supported: 0, 10, 20, 30, 40, 50, 60, 70, 80 dB.");
    }

    @Override
    public String toString() {
        return decibels + " dB";
    }
}
