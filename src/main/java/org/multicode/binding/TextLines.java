package org.multicode.binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line view of a text that remembers its line-ending style and trailing newline.
 */
final class TextLines {

    static final String CRLF = "\r\n";
    static final String LF = "\n";

    private final List<String> lines;
    private final String eol;
    private final boolean trailingNewline;

    private TextLines(List<String> lines, String eol, boolean trailingNewline) {
        this.lines = lines;
        this.eol = eol;
        this.trailingNewline = trailingNewline;
    }

    /**
     * Splits on {@code \r\n} and {@code \n}. A trailing newline does not produce an extra empty line.
     */
    static TextLines of(String text) {
        String eol = text.contains(CRLF) ? CRLF : LF;
        boolean trailing = text.endsWith(LF);
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
        if (trailing || text.isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return new TextLines(lines, eol, trailing);
    }

    /**
     * Normalizes generated code to lines: CRLF becomes LF, trailing whitespace is dropped.
     */
    static List<String> codeLines(String code) {
        String normalized = code.replace(CRLF, LF).stripTrailing();
        return normalized.isEmpty() ? List.of() : List.of(normalized.split(LF, -1));
    }

    List<String> lines() {
        return lines;
    }

    String eol() {
        return eol;
    }

    boolean hasTrailingNewline() {
        return trailingNewline;
    }

    /**
     * Joins lines with this text's line ending, restoring the trailing newline if the original had one.
     */
    String join(List<String> newLines, boolean withTrailingNewline) {
        String joined = String.join(eol, newLines);
        return withTrailingNewline ? joined + eol : joined;
    }
}
