package org.multicode.cli;

import org.multicode.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class CommandLineInterfaceTest {

    private static final String HELLO_GRAPH = """
            {
              "id": "hello", "name": "Hello",
              "nodes": [
                {"id": "start", "type": "Start",
                 "outputs": [{"id": "start-exec-out", "dataType": "execution", "direction": "output"}]},
                {"id": "print", "type": "Print",
                 "inputs": [
                   {"id": "print-exec-in", "dataType": "execution", "direction": "input"},
                   {"id": "print-string", "dataType": "string", "direction": "input", "value": "hi"}
                 ]}
              ],
              "edges": [
                {"id": "e1", "sourceNode": "start", "sourcePort": "start-exec-out",
                 "targetNode": "print", "targetPort": "print-exec-in"}
              ]
            }
            """;

    private static final String PRINT_LINE = "std::cout << \"hi\" << std::endl;";

    @TempDir
    Path dir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;
    private Path graphFile;

    @BeforeEach
    void setUp() throws IOException {
        LoggingConfigurator.reset();
        cmd = new CommandLine(new CommandLineInterface());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        graphFile = dir.resolve("hello.json");
        Files.writeString(graphFile, HELLO_GRAPH, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void cliInitialization() {
        assertEquals("multicode", cmd.getCommandName());
        assertThat(cmd.getSubcommands()).containsKeys("generate", "blocks", "help");
    }

    @Test
    void generate_printsCodeToStdout() {
        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "--no-headers", "--no-wrapper");

        assertEquals(0, exitCode, err.toString());
        assertEquals(PRINT_LINE + "\n", out.toString());
    }

    @Test
    void generate_writesOutFile() throws IOException {
        Path target = dir.resolve("hello.cpp");

        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "-o", target.toString());

        assertEquals(0, exitCode, err.toString());
        String code = Files.readString(target);
        assertThat(code).contains("#include <iostream>", "int main() {", "    " + PRINT_LINE, "    return 0;");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void generate_jsonReportsSourceMapAndStats() {
        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "--json");

        assertEquals(0, exitCode, err.toString());
        assertThat(out.toString())
                .contains("\"success\": true")
                .contains("\"sourceMap\"")
                .contains("\"nodeId\": \"print\"")
                .doesNotContain(PRINT_LINE);
    }

    @Test
    void generate_appendsBlockToBindFile() throws IOException {
        Path source = dir.resolve("main.cpp");
        Files.writeString(source, "int x = 0;\n", StandardCharsets.UTF_8);

        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "-b", source.toString(),
                "--no-headers", "--no-wrapper");

        assertEquals(0, exitCode, err.toString());
        assertEquals("int x = 0;\n\n// multicode:begin Hello\n" + PRINT_LINE + "\n// multicode:end Hello\n",
                Files.readString(source));
    }

    @Test
    void generate_patchesExistingBlockKeepingLineEndings() throws IOException {
        Path source = dir.resolve("main.cpp");
        Files.writeString(source, "a\r\n// multicode:begin gen\r\nold();\r\n// multicode:end gen\r\nb\r\n",
                StandardCharsets.UTF_8);

        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "-b", source.toString(),
                "--block-id", "gen", "--no-headers", "--no-wrapper");

        assertEquals(0, exitCode, err.toString());
        assertEquals("a\r\n// multicode:begin gen\r\n" + PRINT_LINE + "\r\n// multicode:end gen\r\nb\r\n",
                Files.readString(source));
    }

    @Test
    void generate_refusesToPatchMalformedBindFile() throws IOException {
        Path source = dir.resolve("main.cpp");
        String broken = "// multicode:begin gen\nold();\n";
        Files.writeString(source, broken, StandardCharsets.UTF_8);

        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "-b", source.toString());

        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("UNCLOSED_BEGIN");
        assertEquals(broken, Files.readString(source));
    }

    @Test
    void generate_reportsCompileErrors() throws IOException {
        Path noStart = dir.resolve("empty.json");
        Files.writeString(noStart, "{\"name\": \"Empty\", \"nodes\": []}", StandardCharsets.UTF_8);

        int exitCode = cmd.execute("generate", "-g", noStart.toString());

        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("NO_START");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void generate_rejectsUnknownLanguageAndBadGraph() throws IOException {
        assertEquals(2, cmd.execute("generate", "-g", graphFile.toString(), "-l", "cobol"));
        assertThat(err.toString()).contains("Unknown language: cobol");

        Path bad = dir.resolve("bad.json");
        Files.writeString(bad, "{ nodes: [", StandardCharsets.UTF_8);
        assertEquals(2, cmd.execute("generate", "-g", bad.toString()));
    }

    @Test
    void generate_unsupportedLanguage() {
        int exitCode = cmd.execute("generate", "-g", graphFile.toString(), "-l", "rust");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("not supported yet");
    }

    @Test
    void blocks_listsBlocks() throws IOException {
        Path source = dir.resolve("main.cpp");
        Files.writeString(source, "// multicode:begin gen\n  foo();\n// multicode:end gen\n// multicode:begin\n// multicode:end\n",
                StandardCharsets.UTF_8);

        int exitCode = cmd.execute("blocks", "-f", source.toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals("gen\t1-3\tfoo();\n-\t4-5\t(empty block)\n", out.toString().replace("\r\n", "\n"));
    }

    @Test
    void blocks_reportsParseError() throws IOException {
        Path source = dir.resolve("main.cpp");
        Files.writeString(source, "// multicode:end x\n", StandardCharsets.UTF_8);

        int exitCode = cmd.execute("blocks", "-f", source.toString());

        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("ORPHAN_END at line 1");
    }
}
