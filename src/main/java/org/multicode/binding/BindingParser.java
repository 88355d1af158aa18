package org.multicode.binding;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds flat blocks delimited by {@code // <tool>:begin [id]} and {@code // <tool>:end [id]}
 * lines. Leading whitespace before the markers is allowed.
 * <p>
 * The parser is stateless and may be shared.
 */
public final class BindingParser {

    /** Tool name written into markers unless configured otherwise. */
    public static final String DEFAULT_TOOL_NAME = "multicode";

    private final Pattern beginPattern;
    private final Pattern endPattern;

    public BindingParser() {
        this(DEFAULT_TOOL_NAME);
    }

    /**
     * @param toolName The tool name used in the markers.
     */
    public BindingParser(String toolName) {
        this.beginPattern = markerPattern(toolName, "begin");
        this.endPattern = markerPattern(toolName, "end");
    }

    /**
     * Scans a text for binding blocks.
     *
     * @param text The file content.
     * @return The blocks found, and the first structural error if any.
     */
    public BindingParseResult parse(String text) {
        List<String> lines = TextLines.of(text).lines();
        List<BindingBlock> blocks = new ArrayList<>();

        String openId = null;
        int openLine = 0;
        String openText = null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            Matcher begin = beginPattern.matcher(line);
            if (begin.matches()) {
                if (openText != null) {
                    return new BindingParseResult(blocks, new BindingParseError(BindingErrorKind.NESTED_BEGIN, lineNumber,
                            "Nested begin marker at line " + lineNumber + "; close the block opened at line " + openLine + " first"));
                }
                openId = markerId(begin.group(1));
                openLine = lineNumber;
                openText = line;
                continue;
            }

            Matcher end = endPattern.matcher(line);
            if (!end.matches()) continue;

            if (openText == null) {
                return new BindingParseResult(blocks, new BindingParseError(BindingErrorKind.ORPHAN_END, lineNumber,
                        "End marker without begin at line " + lineNumber));
            }
            String endId = markerId(end.group(1));
            if (openId != null && endId != null && !openId.equals(endId)) {
                return new BindingParseResult(blocks, new BindingParseError(BindingErrorKind.MISMATCHED_IDS, lineNumber,
                        "Marker ids differ: begin=\"" + openId + "\", end=\"" + endId + "\" (line " + lineNumber + ")"));
            }

            blocks.add(new BindingBlock(
                    openId != null ? openId : endId,
                    openLine,
                    lineNumber,
                    openText,
                    line,
                    preview(lines, openLine, lineNumber)));
            openId = null;
            openText = null;
        }

        if (openText != null) {
            return new BindingParseResult(blocks, new BindingParseError(BindingErrorKind.UNCLOSED_BEGIN, openLine,
                    "Begin marker at line " + openLine + " is not closed"));
        }
        return new BindingParseResult(blocks, null);
    }

    private static Pattern markerPattern(String toolName, String kind) {
        return Pattern.compile("^\\s*//\\s*" + Pattern.quote(toolName) + ":" + kind + "(?:\\s+(.+?))?\\s*$");
    }

    private static String markerId(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String preview(List<String> lines, int beginLine, int endLine) {
        for (int i = beginLine; i < endLine - 1; i++) {
            String trimmed = lines.get(i).trim();
            if (!trimmed.isEmpty()) return trimmed;
        }
        return BindingBlock.EMPTY_PREVIEW;
    }
}
