package com.mindmarker.cli;

import com.mindmarker.markerFile.MarkerDecoder;
import com.mindmarker.testsupport.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MarkerCompilerMainTest
 * -----------------------------------------------------------------------------
 * Exit codes and output of the command line front end.
 */
final class MarkerCompilerMainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @TempDir
    Path dir;

    private int run(String... args) {
        return MarkerCompilerMain.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void compileWritesSiblingMarkerThenInspectReadsIt() throws Exception {
        Path photo = dir.resolve("poster.jpg");
        Files.write(photo, TestImages.texturedJpeg(640, 480, 31));

        assertEquals(MarkerCompilerMain.OK, run("compile", photo.toString()));
        Path marker = dir.resolve("poster.mind");
        assertTrue(Files.exists(marker));
        assertEquals(1, new MarkerDecoder().decode(Files.readAllBytes(marker)).targetCount());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("source EXTRACTED"));

        out.reset();
        assertEquals(MarkerCompilerMain.OK, run("inspect", marker.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("format version 1, 1 target(s)"));
    }

    @Test
    void compileHonoursExplicitOutput() throws Exception {
        Path photo = dir.resolve("flat.png");
        Files.write(photo, TestImages.solidPng(300, 300, 90));
        Path marker = dir.resolve("custom.mind");

        assertEquals(MarkerCompilerMain.OK, run("compile", photo.toString(), marker.toString()));
        assertTrue(Files.exists(marker));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("WARNING: degraded target"));
    }

    @Test
    void tooSmallImageFails() throws Exception {
        Path photo = dir.resolve("tiny.png");
        Files.write(photo, TestImages.texturedPng(120, 90, 32));

        assertEquals(MarkerCompilerMain.FAILED, run("compile", photo.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("DIMENSION:"));
        assertFalse(Files.exists(dir.resolve("tiny.mind")));
    }

    @Test
    void inspectRejectsForeignFile() throws Exception {
        Path bogus = dir.resolve("bogus.mind");
        Files.write(bogus, new byte[]{'G', 'I', 'F', '8', '9', 'a', 0, 0, 1, 0, 0, 0});

        assertEquals(MarkerCompilerMain.FAILED, run("inspect", bogus.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("FORMAT:"));
    }

    @Test
    void missingFileFails() {
        assertEquals(MarkerCompilerMain.FAILED, run("compile", dir.resolve("nope.jpg").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("IO:"));
    }

    @Test
    void usageErrors() {
        assertEquals(MarkerCompilerMain.USAGE, run());
        assertEquals(MarkerCompilerMain.USAGE, run("compile"));
        assertEquals(MarkerCompilerMain.USAGE, run("explode", "x"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage:"));
    }

    @Test
    void defaultOutputSitsNextToInput() {
        assertEquals(dir.resolve("a.mind"), MarkerCompilerMain.defaultOutput(dir.resolve("a.jpeg")));
        assertEquals(dir.resolve("noext.mind"), MarkerCompilerMain.defaultOutput(dir.resolve("noext")));
    }
}
