package org.multicode.compiler.codegen;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.codegen.FunctionSynthesizer.FunctionBlock;
import org.multicode.graph.Graph;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assembles the generated file. The body is built first because the header depends on what the
 * body requires; the source map is then moved to final line numbers.
 */
public final class OutputComposer {

	/** Includes every generated file gets. */
	public static final List<String> BASELINE_INCLUDES = List.of("<iostream>", "<string>", "<vector>");

	private final Clock clock;

	public OutputComposer(Clock clock) {
		this.clock = clock;
	}

	/**
	 * The composed file.
	 *
	 * @param code        The complete source text, ending with a single newline.
	 * @param sourceMap   Entries in final 1-based line numbers, sorted by start line.
	 * @param linesOfCode Non-blank lines that are not comments.
	 */
	public record Composition(String code, List<SourceMapEntry> sourceMap, int linesOfCode) {
	}

	/**
	 * @param graph     The compiled graph, named in the header.
	 * @param options   The generation options.
	 * @param functions The function definitions in declaration order.
	 * @param main      The context of the main traversal.
	 * @param headers   The header requirements of the call.
	 * @return The composed file.
	 */
	public Composition compose(Graph graph, CodeGenOptions options, List<FunctionBlock> functions,
							   CodeGenContext main, HeaderRequirements headers) {
		List<String> body = new ArrayList<>();
		List<SourceMapEntry> entries = new ArrayList<>();

		for (FunctionBlock function : functions) {
			append(body, entries, function.lines(), function.sourceMap());
			body.add("");
		}

		if (options.generateEntryWrapper()) {
			body.add("int main() {");
			append(body, entries, main.lines(), main.sourceMap());
			if (!lastLineIsReturn(main.lines())) {
				body.add(" ".repeat(options.indentSize()) + "return 0;");
			}
			body.add("}");
		} else {
			append(body, entries, main.lines(), main.sourceMap());
		}

		List<String> file = new ArrayList<>();
		if (options.includeHeaders()) {
			file.addAll(header(graph, headers));
		}
		int offset = file.size();
		file.addAll(body);

		List<SourceMapEntry> sourceMap = new ArrayList<>();
		for (SourceMapEntry entry : entries) {
			SourceMapEntry shifted = entry.shift(offset);
			int start = Math.max(1, shifted.startLine());
			sourceMap.add(new SourceMapEntry(shifted.nodeId(), start, Math.max(start, shifted.endLine())));
		}
		sourceMap.sort(Comparator.comparingInt(SourceMapEntry::startLine));

		return new Composition(String.join("\n", file) + "\n", sourceMap, countLinesOfCode(file));
	}

	private List<String> header(Graph graph, HeaderRequirements headers) {
		List<String> lines = new ArrayList<>();
		lines.add("// Generated by MultiCode");
		lines.add("// Graph: " + graph.name());
		lines.add("// Date: " + DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
		lines.add("");
		Set<String> includes = new TreeSet<>(BASELINE_INCLUDES);
		if (headers.requiresTupleSupport()) includes.add("<tuple>");
		includes.addAll(headers.includes());
		for (String include : includes) {
			lines.add("#include " + include);
		}
		lines.add("");
		return lines;
	}

	private static void append(List<String> body, List<SourceMapEntry> entries, List<String> lines, List<SourceMapEntry> map) {
		int offset = body.size();
		body.addAll(lines);
		for (SourceMapEntry entry : map) {
			entries.add(entry.shift(offset));
		}
	}

	private static boolean lastLineIsReturn(List<String> lines) {
		return !lines.isEmpty() && lines.get(lines.size() - 1).trim().startsWith("return");
	}

	private static int countLinesOfCode(List<String> lines) {
		int count = 0;
		for (String line : lines) {
			String trimmed = line.trim();
			if (!trimmed.isEmpty() && !trimmed.startsWith("//")) count++;
		}
		return count;
	}
}
