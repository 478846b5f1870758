package com.flowgraph.analyzer.syntax;

import java.util.Set;

/**
 * Node kind tags of the C/C++ grammar dumps the analyzer understands.
 * Anything else inside a function body is treated as an opaque statement.
 */
public final class SyntaxKinds {

    private SyntaxKinds() {}

    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String COMPOUND_STATEMENT  = "compound_statement";
    public static final String IF_STATEMENT        = "if_statement";
    public static final String ELSE_CLAUSE         = "else_clause";
    public static final String FOR_STATEMENT       = "for_statement";
    public static final String FOR_RANGE_LOOP      = "for_range_loop";
    public static final String WHILE_STATEMENT     = "while_statement";
    public static final String RETURN_STATEMENT    = "return_statement";
    public static final String CONDITION_CLAUSE    = "condition_clause";
    public static final String PARENTHESIZED       = "parenthesized_expression";
    public static final String CALL_EXPRESSION     = "call_expression";
    public static final String FIELD_EXPRESSION    = "field_expression";
    public static final String IDENTIFIER          = "identifier";
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String FIELD_IDENTIFIER    = "field_identifier";
    public static final String COMMENT             = "comment";

    public static final Set<String> LOOPS = Set.of(FOR_STATEMENT, FOR_RANGE_LOOP, WHILE_STATEMENT);

    public static final Set<String> CONDITIONS = Set.of(CONDITION_CLAUSE, PARENTHESIZED);
}
