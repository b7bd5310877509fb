package com.initialone.jmtoc.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jmtoc.emit.MacroTable;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a translation depends on besides the source text. Passed explicitly into each
 * {@link Translator}; there is no global configuration.
 *
 * @param group    doxygen group added to the class documentation with {@code @ingroup}, or {@code null}
 * @param encoding how source files are decoded and output files encoded
 */
public record TranslatorConfig(String group, Charset encoding, MacroTable macros) {

    public static final Charset DEFAULT_ENCODING = StandardCharsets.ISO_8859_1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** JSON shape of the configuration file. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigFile {
        public String group;
        public String encoding;
        public Map<String, String> macros = new LinkedHashMap<>();
    }

    public static TranslatorConfig defaults() {
        return new TranslatorConfig(null, DEFAULT_ENCODING, MacroTable.empty());
    }

    /** Reads a configuration file; missing entries keep their defaults. */
    public static TranslatorConfig load(Path file) throws IOException {
        ConfigFile raw;
        try {
            raw = MAPPER.readValue(file.toFile(), ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new IOException("invalid configuration " + file + ": " + e.getOriginalMessage(), e);
        }
        Charset encoding = raw.encoding == null ? DEFAULT_ENCODING : charset(raw.encoding);
        Map<String, String> macros = raw.macros == null ? Map.of() : raw.macros;
        return new TranslatorConfig(raw.group, encoding, new MacroTable(macros));
    }

    /** Like {@link #load(Path)}, or the defaults when {@code file} is {@code null}. */
    public static TranslatorConfig loadOrDefaults(Path file) throws IOException {
        if (file == null) {
            return defaults();
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("configuration file not found: " + file);
        }
        return load(file);
    }

    public TranslatorConfig withGroup(String newGroup) {
        return new TranslatorConfig(newGroup, encoding, macros);
    }

    public TranslatorConfig withEncoding(Charset newEncoding) {
        return new TranslatorConfig(group, newEncoding, macros);
    }

    public static Charset charset(String name) throws IOException {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IOException("unsupported encoding: " + name, e);
        }
    }
}
