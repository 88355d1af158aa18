package org.multicode.compiler.codegen;

import org.multicode.compiler.codegen.features.flow.BranchGenerator;
import org.multicode.compiler.codegen.features.flow.BreakGenerator;
import org.multicode.compiler.codegen.features.flow.ContinueGenerator;
import org.multicode.compiler.codegen.features.flow.DoWhileGenerator;
import org.multicode.compiler.codegen.features.flow.ForEachGenerator;
import org.multicode.compiler.codegen.features.flow.ForLoopGenerator;
import org.multicode.compiler.codegen.features.flow.ReturnGenerator;
import org.multicode.compiler.codegen.features.flow.SequenceGenerator;
import org.multicode.compiler.codegen.features.flow.StartGenerator;
import org.multicode.compiler.codegen.features.flow.SwitchGenerator;
import org.multicode.compiler.codegen.features.flow.WhileLoopGenerator;
import org.multicode.compiler.codegen.features.functions.CallUserFunctionGenerator;
import org.multicode.compiler.codegen.features.functions.FunctionEntryGenerator;
import org.multicode.compiler.codegen.features.functions.FunctionReturnGenerator;
import org.multicode.compiler.codegen.features.io.InputGenerator;
import org.multicode.compiler.codegen.features.io.PrintGenerator;
import org.multicode.compiler.codegen.features.math.BinaryOperatorGenerator;
import org.multicode.compiler.codegen.features.math.NotGenerator;
import org.multicode.compiler.codegen.features.other.CommentGenerator;
import org.multicode.compiler.codegen.features.other.FallbackGenerator;
import org.multicode.compiler.codegen.features.other.RerouteGenerator;
import org.multicode.compiler.codegen.features.template.NodeDefinitionLookup;
import org.multicode.compiler.codegen.features.template.TemplateNodeGenerator;
import org.multicode.compiler.codegen.features.variables.GetVariableGenerator;
import org.multicode.compiler.codegen.features.variables.SetVariableGenerator;
import org.multicode.compiler.codegen.features.variables.VariableGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping node-type tags to generator instances.
 * <p>
 * Registration is last-write-wins per tag: a later generator replaces an earlier one, which
 * lets package templates override built-in nodes.
 */
public final class NodeGeneratorRegistry {

	private static final Logger LOG = LoggerFactory.getLogger(NodeGeneratorRegistry.class);

	private final Map<String, INodeGenerator> byType = new LinkedHashMap<>();

	/**
	 * Registers a generator for every type it declares.
	 *
	 * @param generator The generator.
	 */
	public void register(INodeGenerator generator) {
		for (String type : generator.nodeTypes()) {
			register(type, generator);
		}
	}

	/**
	 * Registers a generator for a single type.
	 *
	 * @param type      The node-type tag.
	 * @param generator The generator.
	 */
	public void register(String type, INodeGenerator generator) {
		INodeGenerator previous = byType.put(type, generator);
		if (previous != null && previous != generator) {
			LOG.debug("Generator for node type '{}' replaced: {} -> {}", type,
					previous.getClass().getSimpleName(), generator.getClass().getSimpleName());
		}
	}

	/**
	 * @param type A node-type tag.
	 * @return The generator registered for the tag.
	 */
	public Optional<INodeGenerator> get(String type) {
		return Optional.ofNullable(byType.get(type));
	}

	/**
	 * @param type A node-type tag.
	 * @return {@code true} if a generator is registered.
	 */
	public boolean has(String type) {
		return byType.containsKey(type);
	}

	/**
	 * @return All registered tags in registration order.
	 */
	public List<String> getSupportedTypes() {
		return new ArrayList<>(byType.keySet());
	}

	/**
	 * Initializes a registry with one generator per built-in node type.
	 *
	 * @return A registry pre-populated with the standard generators.
	 */
	public static NodeGeneratorRegistry initializeWithDefaults() {
		NodeGeneratorRegistry reg = new NodeGeneratorRegistry();
		// flow
		reg.register(new StartGenerator());
		reg.register(new ReturnGenerator());
		reg.register(new BranchGenerator());
		reg.register(new ForLoopGenerator());
		reg.register(new WhileLoopGenerator());
		reg.register(new DoWhileGenerator());
		reg.register(new ForEachGenerator());
		reg.register(new SwitchGenerator());
		reg.register(new BreakGenerator());
		reg.register(new ContinueGenerator());
		reg.register(new SequenceGenerator());
		// math, comparison, logic
		BinaryOperatorGenerator.all().forEach(reg::register);
		reg.register(new NotGenerator());
		// variables
		reg.register(new VariableGenerator());
		reg.register(new GetVariableGenerator());
		reg.register(new SetVariableGenerator());
		// io
		reg.register(new PrintGenerator());
		reg.register(new InputGenerator());
		// other
		reg.register(new CommentGenerator());
		reg.register(new RerouteGenerator());
		reg.register(new FallbackGenerator());
		// functions
		reg.register(new FunctionEntryGenerator());
		reg.register(new FunctionReturnGenerator());
		reg.register(new CallUserFunctionGenerator());
		return reg;
	}

	/**
	 * Initializes a registry with the built-in generators followed by one template generator
	 * per package type. Definitions are resolved lazily at generation time.
	 *
	 * @param lookup       Resolves package node definitions.
	 * @param packageTypes The package node-type tags.
	 * @return The registry.
	 */
	public static NodeGeneratorRegistry initializeWithPackages(NodeDefinitionLookup lookup, List<String> packageTypes) {
		NodeGeneratorRegistry reg = initializeWithDefaults();
		for (String type : packageTypes) {
			reg.register(new TemplateNodeGenerator(type, lookup));
		}
		return reg;
	}
}
