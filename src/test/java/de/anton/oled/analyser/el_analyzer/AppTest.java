package de.anton.oled.analyser.el_analyzer;

import de.anton.oled.analyser.el_analyzer.model.SampleRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static final double[] WAVELENGTHS = TestFixtures.range(400, 800, 10);

    @TempDir
    Path tempDir;

    private Path configFile() throws Exception {
        Path library = TestFixtures.writeLibrary(tempDir.resolve("library"), WAVELENGTHS);
        Path file = tempDir.resolve("el.properties");
        Files.write(file, List.of("library.dir=" + library.toString().replace('\\', '/')));
        return file;
    }

    @Test
    void wrongArgumentsAreFatal() {
        assertEquals(App.EXIT_FATAL, App.run(new String[0]));
        assertEquals(App.EXIT_FATAL, App.run(new String[] {"a", "b", "c"}));
    }

    @Test
    void missingLibraryIsFatal() throws Exception {
        Path file = tempDir.resolve("el.properties");
        Files.write(file, List.of("library.dir=" + tempDir.resolve("nowhere").toString().replace('\\', '/')));
        assertEquals(App.EXIT_FATAL, App.run(new String[] {tempDir.toString(), file.toString()}));
    }

    @Test
    void exitCodeReflectsSampleFailures() throws Exception {
        Path config = configFile();
        Path dataRoot = tempDir.resolve("data");
        SampleRun run = TestFixtures.writeRun(dataRoot, "OLED1", "t1", TestFixtures.range(0, 90, 10), WAVELENGTHS,
            (angle, wavelength) -> Math.cos(Math.toRadians(angle)));

        assertEquals(App.EXIT_OK, App.run(new String[] {dataRoot.toString(), config.toString()}));
        assertTrue(Files.exists(run.outputDirectory().resolve("OLED1_effdata_NONLAM.txt")));

        SampleRun broken = TestFixtures.writeRun(dataRoot, "OLED2", "t1", TestFixtures.range(0, 90, 10), WAVELENGTHS,
            (angle, wavelength) -> Math.cos(Math.toRadians(angle)));
        Files.delete(broken.spectrumDirectory().resolve("Angle0.0.txt"));
        assertEquals(App.EXIT_SAMPLE_FAILURES, App.run(new String[] {dataRoot.toString(), config.toString()}));
    }
}
