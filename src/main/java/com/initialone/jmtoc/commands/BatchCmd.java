package com.initialone.jmtoc.commands;

import com.initialone.jmtoc.pipeline.BatchReport;
import com.initialone.jmtoc.pipeline.BatchTranslator;
import com.initialone.jmtoc.pipeline.FileOutcome;
import com.initialone.jmtoc.pipeline.Translator;
import com.initialone.jmtoc.pipeline.TranslatorConfig;
import com.initialone.jmtoc.util.Tools;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translates a whole source tree. One bad file never stops the run; all diagnostics end up in
 * {@code warnings.log}, whose head is echoed at the end.
 *
 * Exit code: 0 when every file translated, 1 when at least one failed, 2 on setup errors.
 */
@CommandLine.Command(
        name = "batch",
        description = "Translate many MATLAB classdef files, mirroring directories under the output dir"
)
public class BatchCmd implements Callable<Integer> {

    static final int PREVIEW_CHARS = 800;

    @CommandLine.Mixin
    TranslationOptions options;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", description = "Source files and/or directories")
    List<String> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-d", "--out-dir"}, required = true, description = "Output directory")
    String outDir;

    @CommandLine.Option(names = "--conf", description = "JSON configuration file")
    String confFile;

    @CommandLine.Option(names = {"-j", "--jobs"}, defaultValue = "4",
            description = "Worker threads, capped at the number of CPUs (default: ${DEFAULT-VALUE})")
    int jobs;

    @CommandLine.Option(names = "--report", description = "Write a JSON report of per-file outcomes")
    String report;

    @CommandLine.Option(names = "--warnings-log",
            description = "Where to write the diagnostics log (default: <out-dir>/warnings.log)")
    String warningsLog;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            TranslatorConfig config = options.resolve(confFile == null ? null : Paths.get(confFile));
            Path outRoot = Paths.get(outDir);
            List<Path> in = new ArrayList<>();
            for (String s : inputs) in.add(Paths.get(s));

            List<BatchTranslator.Job> plan = BatchTranslator.plan(in, outRoot);
            BatchTranslator batch = new BatchTranslator(new Translator(config), jobs);
            out.println("[batch] files=" + plan.size() + ", threads=" + batch.threads() + " -> " + outRoot);
            out.flush();

            AtomicInteger done = new AtomicInteger(0);
            batch.onOutcome(o -> {
                int n = done.incrementAndGet();
                if (o.status() == FileOutcome.Status.FAILED) {
                    synchronized (err) {
                        err.println("[batch] " + n + "/" + plan.size() + " FAILED " + o.error());
                        err.flush();
                    }
                }
            });
            BatchReport result = batch.run(plan);

            Files.createDirectories(outRoot);
            Path log = warningsLog == null ? outRoot.resolve("warnings.log") : Paths.get(warningsLog);
            String logText = result.warningsLog();
            Files.writeString(log, logText, StandardCharsets.UTF_8);
            if (report != null) {
                result.writeJson(Paths.get(report));
            }

            out.printf("[batch] DONE. ok=%d, failed=%d, cancelled=%d, log=%s%n",
                    result.count(FileOutcome.Status.OK),
                    result.count(FileOutcome.Status.FAILED),
                    result.count(FileOutcome.Status.CANCELLED), log);
            if (!logText.isEmpty()) {
                out.println("[batch] warnings:");
                out.println(Tools.preview(logText, PREVIEW_CHARS));
            }
            out.flush();
            return result.hasFailures() ? FilterCmd.EXIT_PARSE : FilterCmd.EXIT_OK;
        } catch (IOException e) {
            err.println("[batch] " + e.getMessage());
            err.flush();
            return FilterCmd.EXIT_IO;
        }
    }
}
