package com.flowmable.avatarcolor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionDriverTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void singleFile_dualMode() throws IOException {
        Path red = dir.resolve("red.png");
        Files.write(red, TestImages.encode(TestImages.solidColor(32, 32, 0xFF0000), "png"));

        int code = ExtractionDriver.run(new String[]{red.toString()}, out);

        assertEquals(0, code);
        assertEquals("red.png\t#FF0000\t#FF0000\tclustering", output().trim());
    }

    @Test
    void directory_singleModeFast() throws IOException {
        Files.write(dir.resolve("a.png"), TestImages.encode(TestImages.solidColor(8, 8, 0xFF0000), "png"));
        Files.write(dir.resolve("b.png"), TestImages.encode(TestImages.fullyTransparent(8, 8), "png"));
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        int code = ExtractionDriver.run(new String[]{"--mode=single", "--fast", dir.toString()}, out);

        assertEquals(0, code);
        String[] lines = output().trim().split("\\R");
        assertEquals(2, lines.length);
        assertEquals("a.png\t#F00000\thistogram", lines[0]);
        assertEquals("b.png\t#5865F2\thistogram", lines[1]);
    }

    @Test
    void corruptFile_reportedAndFails() throws IOException {
        Path bad = dir.resolve("bad.png");
        Files.writeString(bad, "not a png");

        int code = ExtractionDriver.run(new String[]{bad.toString()}, out);

        assertEquals(1, code);
        assertTrue(output().startsWith("bad.png\tERROR\t"));
    }

    @Test
    void unknownOption_usageError() {
        assertEquals(2, ExtractionDriver.run(new String[]{"--colors=3", "x.png"}, out));
        assertTrue(output().contains("Usage"));
    }

    @Test
    void noInputs_usageError() {
        assertEquals(2, ExtractionDriver.run(new String[]{"--mode=dual"}, out));
    }

    @Test
    void parse_defaults() {
        ExtractionDriver.Options options = ExtractionDriver.parse(new String[]{"avatar.webp"});
        assertEquals(ExtractionMode.DUAL, options.mode());
        assertFalse(options.fast());
        assertEquals(1, options.inputs().size());
    }
}
