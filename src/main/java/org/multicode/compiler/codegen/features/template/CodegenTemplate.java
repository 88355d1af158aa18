package org.multicode.compiler.codegen.features.template;

import java.util.List;

/**
 * C++ code template of a package node.
 *
 * @param template The main template, may span several lines.
 * @param includes Include targets the template needs, e.g. {@code <cmath>}.
 * @param before   Optional code emitted before the template.
 * @param after    Optional code emitted after the template.
 */
public record CodegenTemplate(String template, List<String> includes, String before, String after) {
    public CodegenTemplate {
        includes = includes != null ? List.copyOf(includes) : List.of();
    }

    public static CodegenTemplate of(String template, String... includes) {
        return new CodegenTemplate(template, List.of(includes), null, null);
    }

    /**
     * @return {@code true} if there is a non-empty main template.
     */
    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }
}
