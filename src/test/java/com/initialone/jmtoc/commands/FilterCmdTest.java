package com.initialone.jmtoc.commands;

import com.initialone.jmtoc.Main;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FilterCmdTest {

    static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures");

    @TempDir
    Path tmp;

    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void translatesToOutputFile() throws Exception {
        Path out = tmp.resolve("Shape.cc");
        int code = run("filter", FIXTURES.resolve("Shape.m").toString(), "-o", out.toString());
        assertEquals(FilterCmd.EXIT_OK, code);
        assertTrue(Files.readString(out).contains("class Shape\n"));
        assertTrue(err.toString().contains("[filter] "));
    }

    @Test
    void configFileAsSecondArgument() throws Exception {
        Path out = tmp.resolve("Tagged.cc");
        int code = run("filter", FIXTURES.resolve("Tagged.m").toString(), FIXTURES.resolve("jmtoc.json").toString(),
                "-o", out.toString());
        assertEquals(FilterCmd.EXIT_OK, code);
        String text = Files.readString(out);
        assertTrue(text.contains("@ingroup shapes"));
        assertTrue(text.contains("@par New in 1.5 (dw, 2011-01-01)"));
    }

    @Test
    void commandLineGroupWins() throws Exception {
        Path out = tmp.resolve("Tagged.cc");
        run("filter", "--group", "other", FIXTURES.resolve("Tagged.m").toString(),
                FIXTURES.resolve("jmtoc.json").toString(), "-o", out.toString());
        String text = Files.readString(out);
        assertTrue(text.contains("@ingroup other"));
        assertFalse(text.contains("@ingroup shapes"));
    }

    @Test
    void parseErrorExitsWithOne() {
        Path out = tmp.resolve("Broken.cc");
        int code = run("filter", FIXTURES.resolve("Broken.m").toString(), "-o", out.toString());
        assertEquals(FilterCmd.EXIT_PARSE, code);
        assertTrue(err.toString().contains("Broken.m:3:13: unbalanced '['"), err.toString());
        assertFalse(Files.exists(out));
    }

    @Test
    void missingFileExitsWithTwo() {
        int code = run("filter", tmp.resolve("Nope.m").toString());
        assertEquals(FilterCmd.EXIT_IO, code);
        assertTrue(err.toString().contains("[filter] no such file: "));
    }

    @Test
    void warningsGoToStandardError() throws Exception {
        Path src = tmp.resolve("W.m");
        Files.writeString(src, "classdef W\n properties (Fancy)\n  x\n end\nend\n");
        int code = run("filter", src.toString(), "-o", tmp.resolve("W.cc").toString());
        assertEquals(FilterCmd.EXIT_OK, code);
        assertTrue(err.toString().contains("W.m:2:"));
        assertTrue(err.toString().contains(": warning: "));
    }
}
