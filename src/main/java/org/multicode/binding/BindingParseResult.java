package org.multicode.binding;

import java.util.List;
import java.util.Optional;

/**
 * Result of scanning a text for binding blocks. Parsing stops at the first error; the blocks
 * closed before it are still reported.
 *
 * @param blocks The blocks in file order.
 * @param error  The first structural error, or {@code null}.
 */
public record BindingParseResult(List<BindingBlock> blocks, BindingParseError error) {
    public BindingParseResult {
        blocks = List.copyOf(blocks);
    }

    public boolean success() {
        return error == null;
    }

    public Optional<BindingParseError> optionalError() {
        return Optional.ofNullable(error);
    }
}
