package com.flowgraph.analyzer.syntax;

import java.util.List;

/**
 * Function summary decoded by the parser for a function definition node.
 *
 * @param name        bare or {@code Class::name} qualified function name
 * @param returnType  declared return type, null when the parser could not decode one
 * @param parameters  declared parameters in order
 */
public record FunctionInfo(
        String name,
        String returnType,
        List<Parameter> parameters,
        boolean isVirtual,
        boolean isStatic,
        boolean isConst
) {

    public FunctionInfo {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static FunctionInfo of(String name, String returnType, Parameter... parameters) {
        return new FunctionInfo(name, returnType, List.of(parameters), false, false, false);
    }

    public record Parameter(String type, String name) {}
}
