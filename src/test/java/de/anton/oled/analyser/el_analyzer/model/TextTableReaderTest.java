package de.anton.oled.analyser.el_analyzer.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextTableReaderTest {

    @TempDir
    Path tempDir;

    private final TextTableReader reader = new TextTableReader();

    @Test
    void skipsHeaderCommentsAndBlankLines() throws IOException {
        Path file = tempDir.resolve("table.txt");
        Files.write(file, List.of(
            "Date: 2019-05-01",
            "Integration time (ms): 100",
            "400.0\t1.5",
            "",
            "# comment",
            "410.0 2.5",
            "420.0,3.5"));

        NumericTable table = reader.read(file, 2);

        assertEquals(2, table.columnCount());
        assertEquals(3, table.rowCount());
        assertArrayEquals(new double[] {400.0, 410.0, 420.0}, table.column(0));
        assertArrayEquals(new double[] {1.5, 2.5, 3.5}, table.column(1));
    }

    @Test
    void columnsAreCopies() throws IOException {
        Path file = tempDir.resolve("table.txt");
        Files.write(file, List.of("1 2", "3 4"));
        NumericTable table = reader.read(file, 0);
        table.column(0)[0] = 99;
        assertEquals(1.0, table.column(0)[0]);
    }

    @Test
    void nonNumericCellIsRejected() throws IOException {
        Path file = tempDir.resolve("bad.txt");
        Files.write(file, List.of("400 1.0", "410 abc"));
        IOException e = assertThrows(IOException.class, () -> reader.read(file, 0));
        assertTrue(e.getMessage().contains("line 2"));
    }

    @Test
    void inconsistentColumnCountIsRejected() throws IOException {
        Path file = tempDir.resolve("ragged.txt");
        Files.write(file, List.of("400 1.0 2.0", "410 1.0"));
        assertThrows(IOException.class, () -> reader.read(file, 0));
    }

    @Test
    void emptyTableIsRejected() throws IOException {
        Path file = tempDir.resolve("empty.txt");
        Files.write(file, List.of("header", "# only a comment"));
        assertThrows(IOException.class, () -> reader.read(file, 1));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(NoSuchFileException.class, () -> reader.read(tempDir.resolve("absent.txt"), 0));
    }
}
