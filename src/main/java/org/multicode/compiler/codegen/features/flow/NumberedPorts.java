package org.multicode.compiler.codegen.features.flow;

import org.multicode.graph.Node;
import org.multicode.graph.Port;

import java.util.List;
import java.util.TreeSet;

/**
 * Finds numbered execution outputs such as {@code case-0}, {@code case-1} or {@code then-2}.
 */
final class NumberedPorts {

    private NumberedPorts() {}

    /**
     * @param node   The node.
     * @param prefix The key prefix including the dash, e.g. {@code "case-"}.
     * @return The distinct port numbers in ascending order.
     */
    static List<Integer> indices(Node node, String prefix) {
        TreeSet<Integer> indices = new TreeSet<>();
        for (Port port : node.outputs()) {
            if (!port.isExecution()) continue;
            String id = port.id();
            int at = id.lastIndexOf(prefix);
            if (at < 0 || (at > 0 && id.charAt(at - 1) != '-')) continue;
            String digits = id.substring(at + prefix.length());
            if (!digits.isEmpty() && digits.chars().allMatch(Character::isDigit)) {
                indices.add(Integer.parseInt(digits));
            }
        }
        return List.copyOf(indices);
    }
}
