package org.multicode.cli.commands;

import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.multicode.binding.BindingBlock;
import org.multicode.binding.BindingParseResult;
import org.multicode.binding.BindingParser;
import org.multicode.binding.BindingPatcher;
import org.multicode.cli.CommandLineInterface;
import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.CodeGeneratorFactory;
import org.multicode.compiler.api.GenerationResult;
import org.multicode.compiler.api.GenerationStats;
import org.multicode.compiler.api.ICodeGenerator;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.api.TargetLanguage;
import org.multicode.compiler.api.UnsupportedLanguageException;
import org.multicode.compiler.diagnostics.Diagnostic;
import org.multicode.graph.Graph;
import org.multicode.graph.io.GraphFormatException;
import org.multicode.graph.io.GraphReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "generate",
    description = "Compiles a graph JSON file to C++ and prints it, writes it, or patches it into a binding block."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Option(names = {"-g", "--graph"}, required = true, description = "The graph JSON file.")
    private Path graphFile;

    @Option(names = {"-o", "--out"}, description = "Write the generated code to this file instead of stdout.")
    private Path outFile;

    @Option(names = {"-b", "--bind-file"}, description = "Patch the generated code into a binding block of this file.")
    private Path bindFile;

    @Option(names = "--block-id", description = "The binding block to replace; appended when absent (default: graph name).")
    private String blockId;

    @Option(names = {"-l", "--language"}, description = "Target language (default: ${DEFAULT-VALUE}).", defaultValue = "cpp")
    private String language;

    @Option(names = "--no-headers", description = "Omit the header comment and include directives.")
    private boolean noHeaders;

    @Option(names = "--no-wrapper", description = "Do not wrap the code in int main().")
    private boolean noWrapper;

    @Option(names = "--no-comments", description = "Omit node label comments.")
    private boolean noComments;

    @Option(names = "--markers", description = "Wrap the code of every node in node-begin/node-end comments.")
    private boolean markers;

    @Option(names = "--json", description = "Print diagnostics, source map and statistics as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Optional<TargetLanguage> target = TargetLanguage.fromId(language);
        if (target.isEmpty()) {
            err.println("Unknown language: " + language);
            return EXIT_BAD_INPUT;
        }

        ICodeGenerator generator;
        try {
            generator = CodeGeneratorFactory.create(target.get());
        } catch (UnsupportedLanguageException e) {
            err.println(e.getMessage());
            return EXIT_BAD_INPUT;
        }

        Graph graph;
        try {
            graph = new GraphReader().read(graphFile);
        } catch (GraphFormatException e) {
            LOG.debug("Graph could not be read", e);
            err.println(e.getMessage());
            return EXIT_BAD_INPUT;
        }

        GenerationResult result = generator.generate(graph, options(config));
        if (json) {
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(new Report(result)));
        } else {
            printDiagnostics(result.errors(), err);
            printDiagnostics(result.warnings(), err);
        }
        if (!result.success()) {
            return EXIT_FAILED;
        }

        try {
            if (bindFile != null) {
                String toolName = config.getString("multicode.binding.tool-name");
                return bind(result.code(), blockId != null ? blockId : graph.name(), toolName, err);
            }
            if (outFile != null) {
                Files.writeString(outFile, result.code(), StandardCharsets.UTF_8);
                LOG.info("Wrote {} line(s) to {}", result.stats().linesOfCode(), outFile);
            } else if (!json) {
                out.print(result.code());
                out.flush();
            }
        } catch (IOException e) {
            err.println("Failed to write output: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
        return EXIT_OK;
    }

    private CodeGenOptions options(Config config) {
        CodeGenOptions options = config.hasPath("multicode.codegen")
                ? CodeGenOptions.fromConfig(config.getConfig("multicode.codegen"))
                : CodeGenOptions.defaults();
        if (noHeaders) options = options.withIncludeHeaders(false);
        if (noWrapper) options = options.withGenerateEntryWrapper(false);
        if (noComments) options = options.withIncludeComments(false);
        if (markers) options = options.withIncludeSourceMarkers(true);
        return options;
    }

    private int bind(String code, String id, String toolName, PrintWriter err) throws IOException {
        String text = Files.exists(bindFile) ? Files.readString(bindFile, StandardCharsets.UTF_8) : "";
        BindingParseResult parsed = new BindingParser(toolName).parse(text);
        if (!parsed.success()) {
            err.println(bindFile + ": " + parsed.error());
            return EXIT_FAILED;
        }

        BindingPatcher patcher = new BindingPatcher(toolName);
        List<BindingBlock> matches = BindingPatcher.findBlocksById(parsed.blocks(), id);
        String patched;
        if (matches.isEmpty()) {
            patched = patcher.append(text, id, code);
            LOG.info("Appended block '{}' to {}", id, bindFile);
        } else {
            if (matches.size() > 1) {
                LOG.warn("{} blocks with id '{}' in {}, patching the first at line {}",
                        matches.size(), id, bindFile, matches.get(0).beginLine());
            }
            patched = patcher.patch(text, matches.get(0), code);
            LOG.info("Patched block '{}' in {}", id, bindFile);
        }
        Files.writeString(bindFile, patched, StandardCharsets.UTF_8);
        return EXIT_OK;
    }

    private static void printDiagnostics(List<Diagnostic> diagnostics, PrintWriter err) {
        for (Diagnostic diagnostic : diagnostics) {
            err.println(diagnostic);
        }
    }

    /**
     * JSON view of a generation result without the code.
     */
    private static final class Report {
        private final boolean success;
        private final List<Diagnostic> errors;
        private final List<Diagnostic> warnings;
        private final List<SourceMapEntry> sourceMap;
        private final GenerationStats stats;

        Report(GenerationResult result) {
            this.success = result.success();
            this.errors = result.errors();
            this.warnings = result.warnings();
            this.sourceMap = result.sourceMap();
            this.stats = result.stats();
        }
    }
}
