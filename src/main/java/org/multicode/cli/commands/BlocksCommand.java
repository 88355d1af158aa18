package org.multicode.cli.commands;

import com.google.gson.GsonBuilder;
import org.multicode.binding.BindingBlock;
import org.multicode.binding.BindingParseResult;
import org.multicode.binding.BindingParser;
import org.multicode.cli.CommandLineInterface;
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
import java.util.concurrent.Callable;

@Command(
    name = "blocks",
    description = "Lists the binding blocks of a source file."
)
public class BlocksCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The source file to scan.")
    private Path file;

    @Option(names = "--json", description = "Print the parse result as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read " + file + ": " + e.getMessage());
            return GenerateCommand.EXIT_BAD_INPUT;
        }

        String toolName = parent.getConfig().getString("multicode.binding.tool-name");
        BindingParseResult result = new BindingParser(toolName).parse(text);
        if (json) {
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(result));
        } else {
            for (BindingBlock block : result.blocks()) {
                out.printf("%s\t%d-%d\t%s%n", block.optionalId().orElse("-"), block.beginLine(), block.endLine(), block.preview());
            }
            result.optionalError().ifPresent(error -> err.println(file + ": " + error));
        }
        return result.success() ? GenerateCommand.EXIT_OK : GenerateCommand.EXIT_FAILED;
    }
}
