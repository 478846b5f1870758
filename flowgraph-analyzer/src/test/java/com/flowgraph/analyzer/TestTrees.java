package com.flowgraph.analyzer;

import com.flowgraph.analyzer.syntax.FunctionInfo;
import com.flowgraph.analyzer.syntax.Span;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Small builders for C++-shaped syntax trees, mirroring the node kinds a tree-sitter dump has.
 */
final class TestTrees {

    private TestTrees() {}

    static TreeNode token(String text) {
        return TreeNode.builder(text).text(text).build();
    }

    static TreeNode translationUnit(SyntaxNode... items) {
        return TreeNode.builder("translation_unit").children(List.of(items)).build();
    }

    static TreeNode namespace(String name, SyntaxNode... items) {
        return TreeNode.builder("namespace_definition").namespaceName(name)
                .text("namespace " + name)
                .child(TreeNode.builder("declaration_list").children(List.of(items)).build())
                .build();
    }

    static TreeNode classSpec(String name, SyntaxNode... members) {
        return TreeNode.builder("class_specifier").className(name)
                .text("class " + name)
                .child(TreeNode.builder("field_declaration_list").children(List.of(members)).build())
                .build();
    }

    static TreeNode function(String name, SyntaxNode... statements) {
        return function(FunctionInfo.of(name, "void"), 0, statements);
    }

    static TreeNode function(FunctionInfo info, int startRow, SyntaxNode... statements) {
        return TreeNode.builder("function_definition")
                .function(info)
                .text(info.returnType() + " " + info.name() + "() {...}")
                .span(new Span(0, 0, startRow, 0, startRow + statements.length + 1, 1))
                .child(TreeNode.builder("primitive_type").text(String.valueOf(info.returnType())).build())
                .child(TreeNode.builder("function_declarator").text(info.name() + "()").build())
                .child(block(statements))
                .build();
    }

    /** A function definition with no body block at all, e.g. a defaulted special member. */
    static TreeNode bodylessFunction(String name) {
        return TreeNode.builder("function_definition")
                .function(FunctionInfo.of(name, "void"))
                .text(name + "() = default;")
                .build();
    }

    static TreeNode block(SyntaxNode... statements) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(token("{"));
        children.addAll(List.of(statements));
        children.add(token("}"));
        StringBuilder text = new StringBuilder("{ ");
        for (SyntaxNode s : statements) text.append(s.text()).append(' ');
        return TreeNode.builder("compound_statement").text(text.append('}').toString()).children(children).build();
    }

    static TreeNode stmt(String text, SyntaxNode... children) {
        return TreeNode.builder("expression_statement").text(text).children(List.of(children)).build();
    }

    /** {@code name();} */
    static TreeNode callStmt(String name) {
        return stmt(name + "();", callExpr(name));
    }

    static TreeNode callExpr(String name) {
        TreeNode callee = TreeNode.builder(name.contains("::") ? "qualified_identifier" : "identifier")
                .text(name).build();
        return TreeNode.builder("call_expression").text(name + "()")
                .child(callee)
                .child(TreeNode.builder("argument_list").text("()").build())
                .build();
    }

    /** {@code object.method()} */
    static TreeNode methodCallExpr(String object, String method) {
        TreeNode field = TreeNode.builder("field_expression").text(object + "." + method)
                .child(TreeNode.builder("identifier").text(object).build())
                .child(token("."))
                .child(TreeNode.builder("field_identifier").text(method).build())
                .build();
        return TreeNode.builder("call_expression").text(object + "." + method + "()")
                .child(field)
                .child(TreeNode.builder("argument_list").text("()").build())
                .build();
    }

    static TreeNode ret(String value, SyntaxNode... children) {
        List<SyntaxNode> all = new ArrayList<>();
        all.add(token("return"));
        all.addAll(List.of(children));
        all.add(token(";"));
        return TreeNode.builder("return_statement").text("return " + value + ";").children(all).build();
    }

    static TreeNode condition(String text, SyntaxNode... children) {
        return TreeNode.builder("condition_clause").text("(" + text + ")").children(List.of(children)).build();
    }

    static TreeNode ifStmt(SyntaxNode condition, SyntaxNode then) {
        return TreeNode.builder("if_statement").text("if " + condition.text() + " " + then.text())
                .child(token("if")).child(condition).child(then).build();
    }

    static TreeNode ifElse(SyntaxNode condition, SyntaxNode then, SyntaxNode otherwise) {
        TreeNode elseClause = TreeNode.builder("else_clause").text("else " + otherwise.text())
                .child(token("else")).child(otherwise).build();
        return TreeNode.builder("if_statement").text("if " + condition.text() + " " + then.text() + " " + elseClause.text())
                .child(token("if")).child(condition).child(then).child(elseClause).build();
    }

    static TreeNode forLoop(String header, SyntaxNode body) {
        return TreeNode.builder("for_statement").text("for (" + header + ") " + body.text())
                .child(token("for")).child(token("("))
                .child(TreeNode.builder("declaration").text(header).build())
                .child(token(")")).child(body).build();
    }

    static TreeNode whileLoop(SyntaxNode condition, SyntaxNode body) {
        return TreeNode.builder("while_statement").text("while " + condition.text() + " " + body.text())
                .child(token("while")).child(condition).child(body).build();
    }
}
