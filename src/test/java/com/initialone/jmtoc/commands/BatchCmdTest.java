package com.initialone.jmtoc.commands;

import com.initialone.jmtoc.Main;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BatchCmdTest {

    @TempDir
    Path tmp;

    Path src;
    Path out;

    private final StringWriter stdout = new StringWriter();
    private final StringWriter stderr = new StringWriter();

    @BeforeEach
    void tree() throws IOException {
        src = tmp.resolve("src");
        out = tmp.resolve("out");
        Files.createDirectories(src.resolve("pkg"));
        Files.copy(FilterCmdTest.FIXTURES.resolve("Shape.m"), src.resolve("pkg").resolve("Shape.m"));
        Files.copy(FilterCmdTest.FIXTURES.resolve("Tagged.m"), src.resolve("Tagged.m"));
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(stdout));
        cmd.setErr(new PrintWriter(stderr));
        return cmd.execute(args);
    }

    @Test
    void cleanTreeExitsWithZero() throws Exception {
        int code = run("batch", src.toString(), "-d", out.toString(), "-j", "2");
        assertEquals(FilterCmd.EXIT_OK, code);
        assertTrue(Files.exists(out.resolve("pkg").resolve("Shape.cc")));
        assertTrue(Files.exists(out.resolve("Tagged.cc")));
        assertTrue(Files.exists(out.resolve("warnings.log")));
        assertTrue(stdout.toString().contains("[batch] files=2, threads="));
        assertTrue(stdout.toString().contains("[batch] DONE. ok=2, failed=0, cancelled=0"));
    }

    @Test
    void failedFileIsLoggedAndExitsWithOne() throws Exception {
        Files.copy(FilterCmdTest.FIXTURES.resolve("Broken.m"), src.resolve("Broken.m"));
        Path report = tmp.resolve("report.json");
        int code = run("batch", src.toString(), "-d", out.toString(), "--report", report.toString());

        assertEquals(FilterCmd.EXIT_PARSE, code);
        assertTrue(stdout.toString().contains("ok=2, failed=1, cancelled=0"));
        assertTrue(stdout.toString().contains("[batch] warnings:"));
        assertTrue(stderr.toString().contains("FAILED"));
        assertTrue(Files.readString(out.resolve("warnings.log")).contains("Broken.m:3:13: unbalanced '['"));
        assertTrue(Files.readString(report).contains("\"failed\" : 1"));
        assertTrue(Files.exists(out.resolve("pkg").resolve("Shape.cc")));
    }

    @Test
    void customWarningsLogLocation() throws Exception {
        Path log = tmp.resolve("logs").resolve("w.log");
        Files.createDirectories(log.getParent());
        int code = run("batch", src.toString(), "-d", out.toString(), "--warnings-log", log.toString());
        assertEquals(FilterCmd.EXIT_OK, code);
        assertTrue(Files.exists(log));
    }

    @Test
    void missingInputExitsWithTwo() {
        int code = run("batch", tmp.resolve("nowhere").toString(), "-d", out.toString());
        assertEquals(FilterCmd.EXIT_IO, code);
        assertTrue(stderr.toString().contains("[batch] no such file or directory"));
    }

    @Test
    void missingConfigExitsWithTwo() {
        int code = run("batch", src.toString(), "-d", out.toString(), "--conf", tmp.resolve("none.json").toString());
        assertEquals(FilterCmd.EXIT_IO, code);
    }
}
