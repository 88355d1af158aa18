package org.multicode.compiler.api;

/**
 * Maps an inclusive, 1-based line range of the generated code back to a graph node.
 *
 * @param nodeId    The originating node.
 * @param startLine The first line.
 * @param endLine   The last line, never before {@code startLine}.
 */
public record SourceMapEntry(String nodeId, int startLine, int endLine) {

    /**
     * @param offset Number of lines to add.
     * @return This entry moved down by {@code offset} lines.
     */
    public SourceMapEntry shift(int offset) {
        return new SourceMapEntry(nodeId, startLine + offset, endLine + offset);
    }
}
