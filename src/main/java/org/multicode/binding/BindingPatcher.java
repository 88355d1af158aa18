package org.multicode.binding;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated code into binding blocks. Everything outside the replaced interior is kept
 * as is, including the line-ending style of the file.
 */
public final class BindingPatcher {

    private final String toolName;

    public BindingPatcher() {
        this(BindingParser.DEFAULT_TOOL_NAME);
    }

    /**
     * @param toolName The tool name used in appended markers.
     */
    public BindingPatcher(String toolName) {
        this.toolName = toolName;
    }

    /**
     * Replaces the lines strictly between the markers of a block.
     *
     * @param text  The file content the block was parsed from.
     * @param block The block to replace.
     * @param code  The new interior; trailing whitespace is dropped.
     * @return The patched text with the original line endings and trailing-newline presence.
     * @throws IllegalArgumentException if the block does not lie within the text.
     */
    public String patch(String text, BindingBlock block, String code) {
        TextLines source = TextLines.of(text);
        List<String> lines = source.lines();
        if (block.beginLine() < 1 || block.endLine() <= block.beginLine() || block.endLine() > lines.size()) {
            throw new IllegalArgumentException("Block " + block.beginLine() + "-" + block.endLine()
                    + " is outside the text (" + lines.size() + " lines)");
        }

        List<String> patched = new ArrayList<>(lines.subList(0, block.beginLine()));
        patched.addAll(TextLines.codeLines(code));
        patched.addAll(lines.subList(block.endLine() - 1, lines.size()));
        return source.join(patched, source.hasTrailingNewline());
    }

    /**
     * Appends a new block at the end of the text, separated by one blank line when the text
     * has content. The result always ends with a newline.
     *
     * @param text    The file content.
     * @param blockId The id written into both markers; blank writes markers without id.
     * @param code    The block interior.
     * @return The extended text.
     */
    public String append(String text, String blockId, String code) {
        TextLines source = TextLines.of(text);
        String id = blockId.trim();

        List<String> lines = new ArrayList<>(source.lines());
        if (!text.isBlank()) {
            lines.add("");
        }
        String suffix = id.isEmpty() ? "" : " " + id;
        lines.add("// " + toolName + ":begin" + suffix);
        lines.addAll(TextLines.codeLines(code));
        lines.add("// " + toolName + ":end" + suffix);
        return source.join(lines, true);
    }

    /**
     * @param blocks  Parsed blocks.
     * @param blockId The id to look for; blank matches all blocks.
     * @return The blocks whose trimmed id equals the trimmed {@code blockId}.
     */
    public static List<BindingBlock> findBlocksById(List<BindingBlock> blocks, String blockId) {
        if (blockId == null || blockId.isBlank()) return List.copyOf(blocks);
        String id = blockId.trim();
        return blocks.stream()
                .filter(b -> b.optionalId().map(String::trim).orElse("").equals(id))
                .toList();
    }
}
