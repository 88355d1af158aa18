package org.multicode.compiler.codegen.features.template;

import org.multicode.graph.NodeTypeDefinition.PortTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node type supplied by a third-party package.
 *
 * @param type        The node-type tag.
 * @param label       The display label, substituted for {@code {{node.label}}}.
 * @param category    The palette category as declared by the package.
 * @param description Optional documentation.
 * @param inputs      Input port templates.
 * @param outputs     Output port templates.
 * @param codegen     Code templates by language id ({@code "cpp"}).
 * @param properties  Configurable properties.
 */
public record NodeDefinition(
        String type,
        String label,
        String category,
        String description,
        List<PortTemplate> inputs,
        List<PortTemplate> outputs,
        Map<String, CodegenTemplate> codegen,
        List<PropertyDefinition> properties
) {
    public NodeDefinition {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        codegen = codegen != null ? Map.copyOf(codegen) : Map.of();
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    /**
     * @param languageId A target language id.
     * @return The template for that language.
     */
    public Optional<CodegenTemplate> template(String languageId) {
        return Optional.ofNullable(codegen.get(languageId));
    }

    /**
     * @param propertyId A property id.
     * @return The declared default of that property.
     */
    public Optional<Object> propertyDefault(String propertyId) {
        return properties.stream()
                .filter(p -> p.id().equals(propertyId))
                .findFirst()
                .map(PropertyDefinition::defaultValue);
    }
}
