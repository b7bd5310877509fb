package com.initialone.jmtoc.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranslatorConfigTest {

    @TempDir
    Path tmp;

    @Test
    void loadsFixture() throws Exception {
        TranslatorConfig config = TranslatorConfig.load(TranslatorTest.FIXTURES.resolve("jmtoc.json"));
        assertEquals("shapes", config.group());
        assertEquals(StandardCharsets.ISO_8859_1, config.encoding());
        assertEquals("@par Documentation update ($1)", config.macros().templates().get("docupdate"));
    }

    @Test
    void missingEntriesKeepDefaults() throws Exception {
        Path file = tmp.resolve("c.json");
        Files.writeString(file, "{ \"comment\": \"unknown keys are ignored\" }");
        TranslatorConfig config = TranslatorConfig.load(file);
        assertNull(config.group());
        assertEquals(TranslatorConfig.DEFAULT_ENCODING, config.encoding());
        assertTrue(config.macros().isEmpty());
    }

    @Test
    void noFileMeansDefaults() throws Exception {
        TranslatorConfig config = TranslatorConfig.loadOrDefaults(null);
        assertNull(config.group());
        assertEquals(TranslatorConfig.DEFAULT_ENCODING, config.encoding());
        assertTrue(config.macros().isEmpty());
    }

    @Test
    void absentFileIsAnError() {
        IOException e = assertThrows(IOException.class, () -> TranslatorConfig.loadOrDefaults(tmp.resolve("nope.json")));
        assertTrue(e.getMessage().startsWith("configuration file not found"));
    }

    @Test
    void malformedJsonIsAnError() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{ \"group\": ");
        IOException e = assertThrows(IOException.class, () -> TranslatorConfig.load(file));
        assertTrue(e.getMessage().startsWith("invalid configuration"));
    }

    @Test
    void unknownEncodingIsAnError() throws Exception {
        Path file = tmp.resolve("enc.json");
        Files.writeString(file, "{ \"encoding\": \"klingon-8\" }");
        IOException e = assertThrows(IOException.class, () -> TranslatorConfig.load(file));
        assertEquals("unsupported encoding: klingon-8", e.getMessage());
    }

    @Test
    void overridesReturnNewInstances() {
        TranslatorConfig base = TranslatorConfig.defaults();
        TranslatorConfig changed = base.withGroup("g").withEncoding(StandardCharsets.UTF_8);
        assertNull(base.group());
        assertEquals("g", changed.group());
        assertEquals(StandardCharsets.UTF_8, changed.encoding());
    }
}
