package org.multicode.compiler.codegen.features.functions;

import org.multicode.compiler.codegen.CppTypes;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.graph.FunctionParameter;
import org.multicode.graph.GraphFunction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Names and types derived from a user-defined function: C++ name, return type, the synthesized
 * result type for multiple outputs and the default return statement.
 */
public final class FunctionSignatures {

    private FunctionSignatures() {}

    /**
     * @return The C++ function name (transliterated, case preserved).
     */
    public static String functionName(GraphFunction function) {
        return Identifiers.toTypeName(function.name());
    }

    /**
     * @return The name of the tuple alias used when the function has two or more outputs.
     */
    public static String resultTypeName(GraphFunction function) {
        return functionName(function) + "Result";
    }

    /**
     * @return {@code true} if the function returns a synthesized result type.
     */
    public static boolean hasResultType(GraphFunction function) {
        return function.outputs().size() > 1;
    }

    /**
     * @return {@code void}, the type of the single output, or the result type name.
     */
    public static String returnType(GraphFunction function) {
        List<FunctionParameter> outputs = function.outputs();
        if (outputs.isEmpty()) return "void";
        if (outputs.size() == 1) return CppTypes.cppType(outputs.get(0).dataType());
        return resultTypeName(function);
    }

    /**
     * @return {@code using <Name>Result = std::tuple<T1, T2, ...>;}
     */
    public static String resultTypeDeclaration(GraphFunction function) {
        String types = function.outputs().stream()
                .map(p -> CppTypes.cppType(p.dataType()))
                .collect(Collectors.joining(", "));
        return "using " + resultTypeName(function) + " = std::tuple<" + types + ">;";
    }

    /**
     * @param function The function.
     * @param values   One expression per output parameter.
     * @return The return statement for the given output values.
     */
    public static String returnStatement(GraphFunction function, List<String> values) {
        if (values.isEmpty()) return "return;";
        if (values.size() == 1) return "return " + values.get(0) + ";";
        return "return " + resultTypeName(function) + "{" + String.join(", ", values) + "};";
    }

    /**
     * @return The return statement built from the zero values of all outputs.
     */
    public static String defaultReturn(GraphFunction function) {
        return returnStatement(function, function.outputs().stream()
                .map(p -> CppTypes.zeroValue(p.dataType()))
                .toList());
    }

    /**
     * @param parameter An input parameter.
     * @return The logical variable id under which the parameter is bound in the function body.
     */
    public static String parameterVariableId(FunctionParameter parameter) {
        return "param:" + parameter.id();
    }
}
