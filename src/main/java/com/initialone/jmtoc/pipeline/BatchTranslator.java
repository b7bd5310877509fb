package com.initialone.jmtoc.pipeline;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.diagnostics.TranslationException;
import com.initialone.jmtoc.util.Tools;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates many files on a fixed pool. A failing file is recorded and the others go on;
 * outcomes come back in submission order whatever the completion order.
 */
public final class BatchTranslator {

    /** One source file and where its output goes. */
    public record Job(Path source, Path target) {
    }

    private final Translator translator;
    private final int threads;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private Consumer<FileOutcome> listener = o -> { };

    public BatchTranslator(Translator translator, int requestedJobs) {
        this.translator = translator;
        this.threads = Math.max(1, Math.min(requestedJobs, Runtime.getRuntime().availableProcessors()));
    }

    public int threads() {
        return threads;
    }

    /** Called from the worker threads as each file finishes. */
    public BatchTranslator onOutcome(Consumer<FileOutcome> listener) {
        this.listener = listener;
        return this;
    }

    /** Files not yet started are reported as cancelled; files in progress finish normally. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public BatchReport run(List<Job> jobs) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(jobs.size());
            for (Job job : jobs) {
                futures.add(pool.submit(() -> {
                    FileOutcome outcome = cancelled.get()
                            ? FileOutcome.cancelled(job.source(), job.target())
                            : translateOne(job);
                    listener.accept(outcome);
                    return outcome;
                }));
            }
            List<FileOutcome> outcomes = new ArrayList<>(jobs.size());
            for (int i = 0; i < futures.size(); i++) {
                Job job = jobs.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    cancel();
                    outcomes.add(FileOutcome.cancelled(job.source(), job.target()));
                } catch (ExecutionException ee) {
                    outcomes.add(unexpected(job, ee.getCause()));
                }
            }
            return new BatchReport(outcomes);
        } finally {
            pool.shutdown();
        }
    }

    private FileOutcome translateOne(Job job) {
        try {
            Translator.Result result = translator.translateFile(job.source());
            writeAtomically(job.target(), translator.encode(result.output()));
            return FileOutcome.ok(job.source(), job.target(), result.diagnostics());
        } catch (TranslationException e) {
            return FileOutcome.failed(job.source(), job.target(), List.of(e.toDiagnostic()), e.getMessage());
        } catch (IOException e) {
            Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Kind.IO_ERROR,
                    job.source().toString(), 0, 0, String.valueOf(e.getMessage()));
            return FileOutcome.failed(job.source(), job.target(), List.of(d), d.format());
        }
    }

    private static FileOutcome unexpected(Job job, Throwable cause) {
        String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Kind.IO_ERROR,
                job.source().toString(), 0, 0, "internal error: " + message);
        return FileOutcome.failed(job.source(), job.target(), List.of(d), message);
    }

    /** Writes a temporary sibling and moves it over {@code target}; readers never see a partial file. */
    static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Jobs for the given files and directories. Directories are searched for {@code .m} files
     * and mirrored under {@code outDir}; plain files land directly in {@code outDir}. Output
     * files get the {@code .cc} extension.
     */
    public static List<Job> plan(List<Path> inputs, Path outDir) throws IOException {
        List<Job> jobs = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                List<Path> sources;
                try (Stream<Path> paths = Files.walk(input)) {
                    sources = paths.filter(BatchTranslator::isMatlabFile).sorted().collect(Collectors.toList());
                }
                for (Path p : sources) {
                    Path rel = input.relativize(p);
                    jobs.add(new Job(p, Tools.withExtension(outDir.resolve(rel.toString()), ".cc")));
                }
            } else if (Files.isRegularFile(input)) {
                jobs.add(new Job(input, Tools.withExtension(outDir.resolve(input.getFileName().toString()), ".cc")));
            } else {
                throw new IOException("no such file or directory: " + input);
            }
        }
        return jobs;
    }

    private static boolean isMatlabFile(Path p) {
        return Files.isRegularFile(p) && p.getFileName().toString().endsWith(".m");
    }
}
