package org.multicode.binding;

import java.util.Optional;

/**
 * A block of generated code between a begin and an end marker.
 *
 * @param id            The block id from the begin marker, else from the end marker; {@code null} if neither has one.
 * @param beginLine     1-based line of the begin marker.
 * @param endLine       1-based line of the end marker.
 * @param beginLineText The begin marker line as written.
 * @param endLineText   The end marker line as written.
 * @param preview       The first non-blank interior line, trimmed, or {@code (empty block)}.
 */
public record BindingBlock(
        String id,
        int beginLine,
        int endLine,
        String beginLineText,
        String endLineText,
        String preview
) {
    /** Preview of a block without content. */
    public static final String EMPTY_PREVIEW = "(empty block)";

    public Optional<String> optionalId() {
        return Optional.ofNullable(id);
    }

    /**
     * @return Number of lines between the markers.
     */
    public int interiorLineCount() {
        return endLine - beginLine - 1;
    }
}
