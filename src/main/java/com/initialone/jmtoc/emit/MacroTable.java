package com.initialone.jmtoc.emit;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Documentation macros: {@code @new{1,5,dw,2011-01-01}} with the template
 * {@code @par New in $1.$2 ($3, $4)} becomes {@code @par New in 1.5 (dw, 2011-01-01)}.
 *
 * Only names present in the table are touched, so regular doxygen commands pass through.
 * Expansion is a single pass: text produced by a macro is not expanded again.
 */
public final class MacroTable {

    private static final Pattern USE = Pattern.compile("(?<![\\w@\\\\])[@\\\\]([A-Za-z_]\\w*)(?:\\{([^{}]*)\\})?");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([1-9])");

    private final Map<String, String> templates;

    public MacroTable(Map<String, String> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    public static MacroTable empty() {
        return new MacroTable(Map.of());
    }

    public boolean isEmpty() {
        return templates.isEmpty();
    }

    public Map<String, String> templates() {
        return templates;
    }

    /**
     * Sources read as ISO-8859-1 carry their raw bytes one char each; templates come from a UTF-8
     * config file and are brought into the same representation so the output bytes stay UTF-8.
     */
    public MacroTable forSourceEncoding(Charset encoding) {
        if (!encoding.equals(StandardCharsets.ISO_8859_1)) {
            return this;
        }
        Map<String, String> converted = new LinkedHashMap<>();
        templates.forEach((name, t) ->
                converted.put(name, new String(t.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1)));
        return new MacroTable(converted);
    }

    /** Expands every line, leaving {@code @verbatim ... @endverbatim} regions alone. */
    public List<String> expand(List<String> lines) {
        if (templates.isEmpty()) {
            return lines;
        }
        List<String> out = new ArrayList<>(lines.size());
        boolean verbatim = false;
        for (String line : lines) {
            StringBuilder sb = new StringBuilder();
            int from = 0;
            while (from <= line.length()) {
                String marker = verbatim ? "endverbatim" : "verbatim";
                int at = findCommand(line, marker, from);
                int end = at < 0 ? line.length() : at;
                String piece = line.substring(from, end);
                sb.append(verbatim ? piece : expandText(piece));
                if (at < 0) break;
                sb.append(line, at, at + 1 + marker.length());
                from = at + 1 + marker.length();
                verbatim = !verbatim;
            }
            out.add(sb.toString());
        }
        return out;
    }

    String expandText(String text) {
        Matcher m = USE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String template = templates.get(m.group(1));
            if (template == null) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
                continue;
            }
            String[] args = m.group(2) == null ? new String[0] : m.group(2).split(",", -1);
            m.appendReplacement(sb, Matcher.quoteReplacement(fill(template, args)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String fill(String template, String[] args) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int index = Integer.parseInt(m.group(1)) - 1;
            String arg = index < args.length ? args[index].strip() : "";
            m.appendReplacement(sb, Matcher.quoteReplacement(arg));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Position of {@code @command} or {@code \command} as a whole word, or -1. */
    private static int findCommand(String line, String command, int from) {
        for (int i = from; i < line.length(); i++) {
            char c = line.charAt(i);
            if ((c == '@' || c == '\\') && line.startsWith(command, i + 1)) {
                int after = i + 1 + command.length();
                boolean wordEnd = after >= line.length() || !Character.isLetterOrDigit(line.charAt(after));
                boolean wordStart = i == 0 || !Character.isLetterOrDigit(line.charAt(i - 1));
                if (wordEnd && wordStart) return i;
            }
        }
        return -1;
    }
}
