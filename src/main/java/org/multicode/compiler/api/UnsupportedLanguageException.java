package org.multicode.compiler.api;

/**
 * Thrown when a code generator is requested for a language that has none.
 * <p>
 * It is part of the public API; callers are expected to catch it once and present a message
 * instead of silently falling back to another language.
 */
public class UnsupportedLanguageException extends Exception {

    private final TargetLanguage language;

    /**
     * @param language The requested language.
     */
    public UnsupportedLanguageException(TargetLanguage language) {
        super(String.format("Code generation for language '%s' is not supported yet", language.id()));
        this.language = language;
    }

    /**
     * @return The requested language.
     */
    public TargetLanguage getLanguage() {
        return language;
    }
}
