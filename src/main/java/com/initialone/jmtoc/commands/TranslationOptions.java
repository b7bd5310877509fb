package com.initialone.jmtoc.commands;

import com.initialone.jmtoc.pipeline.TranslatorConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/** Options shared by filter and batch; command line values override the configuration file. */
public class TranslationOptions {

    @CommandLine.Option(names = "--group",
            description = "Doxygen group the class is added to (@ingroup)")
    public String group;

    @CommandLine.Option(names = "--encoding",
            description = "Source and output encoding (default: ISO-8859-1, passes bytes through unchanged)")
    public String encoding;

    /** Loads {@code confFile} (may be {@code null}) and applies the overrides. */
    public TranslatorConfig resolve(Path confFile) throws IOException {
        TranslatorConfig config = TranslatorConfig.loadOrDefaults(confFile);
        if (group != null) {
            config = config.withGroup(group);
        }
        if (encoding != null) {
            config = config.withEncoding(TranslatorConfig.charset(encoding));
        }
        return config;
    }
}
