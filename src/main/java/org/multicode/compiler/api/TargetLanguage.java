package org.multicode.compiler.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Target languages a graph can declare. Only languages with {@link #supportsGenerator()} can be
 * compiled; the others are rejected by {@link CodeGeneratorFactory}.
 */
public enum TargetLanguage {
    CPP("cpp", true),
    RUST("rust", false),
    ASM("asm", false);

    private final String id;
    private final boolean supportsGenerator;

    TargetLanguage(String id, boolean supportsGenerator) {
        this.id = id;
        this.supportsGenerator = supportsGenerator;
    }

    /**
     * @return The lowercase identifier, e.g. {@code "cpp"}.
     */
    public String id() {
        return id;
    }

    /**
     * @return {@code true} if a code generator exists for this language.
     */
    public boolean supportsGenerator() {
        return supportsGenerator;
    }

    /**
     * @param id A language identifier, case-insensitive.
     * @return The matching language.
     */
    public static Optional<TargetLanguage> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (TargetLanguage language : values()) {
            if (language.id.equals(normalized)) return Optional.of(language);
        }
        return Optional.empty();
    }
}
