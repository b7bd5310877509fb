package com.initialone.jmtoc.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jmtoc.diagnostics.Diagnostic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Outcomes of a batch run in submission order. */
public final class BatchReport {

    /** One row of the JSON report. */
    public static class Entry {
        public String source;
        public String target;
        public String status;
        public String error;
        public List<String> diagnostics = new ArrayList<>();
    }

    private final List<FileOutcome> outcomes;

    public BatchReport(List<FileOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    public List<FileOutcome> outcomes() {
        return outcomes;
    }

    public long count(FileOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean hasFailures() {
        return count(FileOutcome.Status.FAILED) > 0;
    }

    /** All diagnostics, file by file in submission order. */
    public List<Diagnostic> diagnostics() {
        return outcomes.stream()
                .flatMap(o -> o.diagnostics().stream())
                .collect(Collectors.toList());
    }

    /** Text of {@code warnings.log}: one formatted diagnostic per line. */
    public String warningsLog() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics()) {
            sb.append(d.format()).append('\n');
        }
        return sb.toString();
    }

    public void writeJson(Path file) throws IOException {
        List<Entry> rows = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            Entry e = new Entry();
            e.source = o.source().toString();
            e.target = o.target() == null ? null : o.target().toString();
            e.status = o.status().name();
            e.error = o.error();
            o.diagnostics().forEach(d -> e.diagnostics.add(d.format()));
            rows.add(e);
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("ok", count(FileOutcome.Status.OK));
        doc.put("failed", count(FileOutcome.Status.FAILED));
        doc.put("cancelled", count(FileOutcome.Status.CANCELLED));
        doc.put("files", rows);
        ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        om.writeValue(file.toFile(), doc);
    }
}
