package com.initialone.jmtoc.commands;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.diagnostics.TranslationException;
import com.initialone.jmtoc.pipeline.Translator;
import com.initialone.jmtoc.pipeline.TranslatorConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Doxygen input filter: one M-file in, pseudo-code out (stdout unless {@code -o}).
 *
 * Used as {@code FILTER_PATTERNS = *.m=jmtoc filter} in a Doxyfile.
 */
@CommandLine.Command(
        name = "filter",
        description = "Translate one MATLAB classdef file into doxygen pseudo-code"
)
public class FilterCmd implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE = 1;
    static final int EXIT_IO = 2;

    @CommandLine.Mixin
    TranslationOptions options;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "MATLAB source file (.m)")
    String file;

    @CommandLine.Parameters(index = "1", arity = "0..1", description = "Optional JSON configuration file")
    String confFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
    String output;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        Path source = Paths.get(file);
        try {
            TranslatorConfig config = options.resolve(confFile == null ? null : Paths.get(confFile));
            Translator translator = new Translator(config);
            Translator.Result result = translator.translateFile(source);
            for (Diagnostic d : result.diagnostics()) {
                err.println(d.format());
            }
            byte[] bytes = translator.encode(result.output());
            if (output == null) {
                System.out.write(bytes);
                System.out.flush();
            } else {
                Path out = Paths.get(output);
                Path parent = out.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(out, bytes);
                err.println("[filter] " + source + " -> " + out);
            }
            err.flush();
            return EXIT_OK;
        } catch (TranslationException e) {
            err.println(e.getMessage());
            err.flush();
            return EXIT_PARSE;
        } catch (IOException e) {
            err.println("[filter] " + (e instanceof NoSuchFileException ? "no such file: " : "") + e.getMessage());
            err.flush();
            return EXIT_IO;
        }
    }
}
