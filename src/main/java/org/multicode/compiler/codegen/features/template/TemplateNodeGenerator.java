package org.multicode.compiler.codegen.features.template;

import org.multicode.compiler.api.TargetLanguage;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.INodeGenerator;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates a package node from the C++ template of its {@link NodeDefinition}.
 * <p>
 * Placeholders:
 * <ul>
 *     <li>{@code {{input.<port>}}}: the resolved input expression</li>
 *     <li>{@code {{output.<port>}}}: a variable name derived from port and node id</li>
 *     <li>{@code {{prop.<id>}}}: the node property, else the declared default</li>
 *     <li>{@code {{node.label}}}: the definition label, else the node label</li>
 * </ul>
 * Includes of the template are registered in the header requirements of the current call. The
 * definition is resolved on every use, so packages loaded after registration are picked up.
 */
public class TemplateNodeGenerator implements INodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateNodeGenerator.class);

    private static final Pattern INPUT = Pattern.compile("\\{\\{input\\.(\\w+)}}");
    private static final Pattern OUTPUT = Pattern.compile("\\{\\{output\\.(\\w+)}}");
    private static final Pattern PROP = Pattern.compile("\\{\\{prop\\.(\\w+)}}");
    private static final String NODE_LABEL = "{{node.label}}";

    private final String type;
    private final NodeDefinitionLookup lookup;

    public TemplateNodeGenerator(String type, NodeDefinitionLookup lookup) {
        this.type = type;
        this.lookup = lookup;
    }

    @Override
    public List<String> nodeTypes() {
        return List.of(type);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<NodeDefinition> definition = lookup.find(node.type());
        Optional<CodegenTemplate> template = definition.flatMap(d -> d.template(TargetLanguage.CPP.id()))
                .filter(CodegenTemplate::hasTemplate);
        if (template.isEmpty()) {
            LOG.debug("No C++ template for package node type '{}'", node.type());
            return NodeGenerationResult.follow();
        }

        CodegenTemplate t = template.get();
        t.includes().forEach(ctx.headers()::addInclude);
        if (t.before() != null && !t.before().isEmpty()) {
            emitLines(render(t.before(), node, definition.get(), helpers), ctx);
        }
        emitLines(render(t.template(), node, definition.get(), helpers), ctx);
        if (t.after() != null && !t.after().isEmpty()) {
            emitLines(render(t.after(), node, definition.get(), helpers), ctx);
        }
        return node.hasExecutionOutput() ? NodeGenerationResult.follow() : NodeGenerationResult.stop();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<NodeDefinition> definition = lookup.find(node.type());
        Optional<CodegenTemplate> template = definition.flatMap(d -> d.template(TargetLanguage.CPP.id()))
                .filter(CodegenTemplate::hasTemplate);
        if (template.isEmpty()) return Optional.empty();

        template.get().includes().forEach(ctx.headers()::addInclude);
        String rendered = render(template.get().template(), node, definition.get(), helpers);
        return Optional.of(rendered.replace("\n", "").trim());
    }

    /**
     * Substitutes all placeholders of a template.
     */
    String render(String template, Node node, NodeDefinition definition, GeneratorHelpers helpers) {
        String result = replace(template, INPUT, key -> helpers.input(node, key).orElse("/* missing input */"));
        result = replace(result, OUTPUT, key -> outputVariable(node.id(), key));
        result = replace(result, PROP, key -> node.property(key)
                .or(() -> definition.propertyDefault(key).map(String::valueOf))
                .orElse("/* missing prop */"));
        String label = definition.label() != null ? definition.label() : node.label();
        return result.replace(NODE_LABEL, label);
    }

    /**
     * @return {@code <port>_<last 8 characters of the node id>} with non-alphanumerics replaced by {@code _}.
     */
    static String outputVariable(String nodeId, String portKey) {
        String cleanNode = nodeId.replaceAll("[^a-zA-Z0-9]", "_");
        if (cleanNode.length() > 8) cleanNode = cleanNode.substring(cleanNode.length() - 8);
        return portKey.replaceAll("[^a-zA-Z0-9]", "_") + "_" + cleanNode;
    }

    private static String replace(String text, Pattern pattern, Function<String, String> replacement) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static void emitLines(String rendered, CodeGenContext ctx) {
        for (String line : rendered.split("\n", -1)) {
            ctx.emit(line);
        }
    }
}
