package org.multicode.graph.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.Strictness;
import org.multicode.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads program graphs from JSON documents. Comments are tolerated.
 * <p>
 * Field names follow the graph model: {@code nodes}, {@code edges}, {@code functions}; enum
 * values use their lowercase wire names ({@code "execution"}, {@code "int32"}, ...).
 * Gson reports both syntax errors and rejected record components (a node without id) as
 * runtime exceptions; both become a {@link GraphFormatException}.
 */
public final class GraphReader {

    private static final Logger LOG = LoggerFactory.getLogger(GraphReader.class);

    private static final Gson GSON = new GsonBuilder()
            .setStrictness(Strictness.LENIENT)
            .create();

    /**
     * @param json The graph document.
     * @return The graph.
     * @throws GraphFormatException if the document is not a valid graph.
     */
    public Graph read(String json) throws GraphFormatException {
        return parse(json, "<string>");
    }

    /**
     * @param file A graph file, UTF-8 encoded.
     * @return The graph.
     * @throws GraphFormatException if the file cannot be read or is not a valid graph.
     */
    public Graph read(Path file) throws GraphFormatException {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            throw new GraphFormatException("Failed to read graph file '" + file + "': " + e.getMessage(), e);
        }
    }

    /**
     * @param reader A reader over the graph document.
     * @return The graph.
     * @throws GraphFormatException if the document is not a valid graph.
     */
    public Graph read(Reader reader) throws GraphFormatException {
        try {
            Graph graph = GSON.fromJson(reader, Graph.class);
            return requireGraph(graph, "<reader>");
        } catch (RuntimeException e) {
            throw new GraphFormatException("Invalid graph document: " + e.getMessage(), e);
        }
    }

    private Graph parse(String json, String source) throws GraphFormatException {
        try {
            Graph graph = GSON.fromJson(json, Graph.class);
            return requireGraph(graph, source);
        } catch (RuntimeException e) {
            throw new GraphFormatException("Invalid graph document '" + source + "': " + e.getMessage(), e);
        }
    }

    private static Graph requireGraph(Graph graph, String source) throws GraphFormatException {
        if (graph == null) {
            throw new GraphFormatException("Empty graph document '" + source + "'");
        }
        LOG.debug("Read graph '{}' from {}: {} nodes, {} edges, {} functions",
                graph.name(), source, graph.nodes().size(), graph.edges().size(), graph.functions().size());
        return graph;
    }
}
