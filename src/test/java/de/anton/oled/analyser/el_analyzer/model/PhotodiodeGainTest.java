package de.anton.oled.analyser.el_analyzer.model;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhotodiodeGainTest {

    @Test
    void gain50MapsToResistanceAndCutoff() throws Exception {
        PhotodiodeGain gain = PhotodiodeGain.fromDecibels(50);
        assertEquals(4.75e5, gain.getResistanceOhm());
        assertEquals(9e-4, gain.getCutoffVolt());
    }

    @Test
    void everySettingResolvesToItself() throws Exception {
        for (PhotodiodeGain gain : PhotodiodeGain.values()) {
            assertSame(gain, PhotodiodeGain.fromDecibels(gain.getDecibels()));
        }
        assertEquals(2.2e6, PhotodiodeGain.fromDecibels(80).getResistanceOhm());
    }

    @Test
    void unsupportedGainIsAConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PhotodiodeGain.fromDecibels(55));
        assertTrue(e.getMessage().contains("55"));
        assertThrows(ConfigurationException.class, () -> PhotodiodeGain.fromDecibels(90));
    }
}
