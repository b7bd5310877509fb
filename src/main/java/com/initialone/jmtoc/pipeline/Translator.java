package com.initialone.jmtoc.pipeline;

import com.initialone.jmtoc.ast.AttributeResolver;
import com.initialone.jmtoc.ast.ClassParser;
import com.initialone.jmtoc.ast.DocAssociator;
import com.initialone.jmtoc.ast.ParsedClass;
import com.initialone.jmtoc.ast.TypeSubstitution;
import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.diagnostics.TranslationException;
import com.initialone.jmtoc.emit.PseudoCodeEmitter;
import com.initialone.jmtoc.model.ClassDeclaration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * scan -> parse -> resolve attributes -> associate comments -> check -> emit, for one file.
 *
 * Instances hold only the configuration and can be shared between threads; every call builds
 * its own scanner, parser and emitter.
 */
public final class Translator {

    /** Output text plus the non-fatal diagnostics of one file, in source order. */
    public record Result(String output, List<Diagnostic> diagnostics) {
    }

    private final TranslatorConfig config;

    public Translator(TranslatorConfig config) {
        this.config = config;
    }

    public Result translate(String sourceName, String text) throws TranslationException {
        ParsedClass parsed = ClassParser.parse(sourceName, text);
        ClassDeclaration cls = parsed.declaration();
        cls.setGroup(config.group());

        List<Diagnostic> diagnostics = new ArrayList<>(parsed.diagnostics());
        new AttributeResolver(sourceName, diagnostics).resolve(cls);
        new DocAssociator(sourceName, diagnostics).associate(parsed);
        new TypeSubstitution(cls).checkParameters(sourceName, diagnostics);

        PseudoCodeEmitter emitter = new PseudoCodeEmitter(config.macros().forSourceEncoding(config.encoding()));
        String output = emitter.emit(cls);

        diagnostics.sort((a, b) -> a.line() != b.line()
                ? Integer.compare(a.line(), b.line())
                : Integer.compare(a.column(), b.column()));
        return new Result(output, List.copyOf(diagnostics));
    }

    /** Reads {@code file} in the configured encoding and translates it. */
    public Result translateFile(Path file) throws IOException, TranslationException {
        String text = new String(Files.readAllBytes(file), config.encoding());
        return translate(file.toString(), text);
    }

    /** Output encoded for writing, same charset as the input. */
    public byte[] encode(String output) {
        return output.getBytes(config.encoding());
    }
}
