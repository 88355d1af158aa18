package org.multicode.compiler.codegen.features.template;

import java.util.Optional;

/**
 * Resolves package node definitions by node-type tag. Supplied by the package loader.
 */
@FunctionalInterface
public interface NodeDefinitionLookup {

    Optional<NodeDefinition> find(String type);
}
