package org.multicode.compiler.api;

import org.multicode.compiler.CppCodeGenerator;
import org.multicode.compiler.codegen.features.template.NodeDefinitionLookup;

import java.util.List;

/**
 * Creates code generators strictly by target language. An unsupported language is an error,
 * never a fallback to another language.
 */
public final class CodeGeneratorFactory {

    private CodeGeneratorFactory() {}

    /**
     * @param language The target language.
     * @return A generator with the built-in node generators.
     * @throws UnsupportedLanguageException if the language has no generator.
     */
    public static ICodeGenerator create(TargetLanguage language) throws UnsupportedLanguageException {
        requireSupported(language);
        return new CppCodeGenerator();
    }

    /**
     * @param language     The target language.
     * @param lookup       Resolves package node definitions.
     * @param packageTypes The package node-type tags to register.
     * @return A generator with the built-in and package node generators.
     * @throws UnsupportedLanguageException if the language has no generator.
     */
    public static ICodeGenerator createWithPackages(TargetLanguage language,
                                                    NodeDefinitionLookup lookup,
                                                    List<String> packageTypes) throws UnsupportedLanguageException {
        requireSupported(language);
        return CppCodeGenerator.withPackages(lookup, packageTypes);
    }

    private static void requireSupported(TargetLanguage language) throws UnsupportedLanguageException {
        if (!language.supportsGenerator()) {
            throw new UnsupportedLanguageException(language);
        }
    }
}
