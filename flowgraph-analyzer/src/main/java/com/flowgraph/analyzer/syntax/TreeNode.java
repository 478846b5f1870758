package com.flowgraph.analyzer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable in-memory {@link SyntaxNode}, built by {@link SyntaxTreeReader} from parser dumps
 * or directly by callers that already hold a tree.
 */
public final class TreeNode implements SyntaxNode {

    private final String kind;
    private final Span span;
    private final String text;
    private final List<SyntaxNode> children;
    private final Boolean named;          // nullable: derive from kind/text
    private final FunctionInfo function;  // nullable
    private final String className;       // nullable
    private final String namespaceName;   // nullable

    private TreeNode(Builder b) {
        this.kind = b.kind;
        this.span = b.span;
        this.text = b.text;
        this.children = List.copyOf(b.children);
        this.named = b.named;
        this.function = b.function;
        this.className = b.className;
        this.namespaceName = b.namespaceName;
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    @Override public String kind()                { return kind; }
    @Override public Span span()                  { return span; }
    @Override public String text()                { return text; }
    @Override public List<SyntaxNode> children()  { return children; }

    @Override
    public boolean isNamed() {
        return named != null ? named : SyntaxNode.super.isNamed();
    }

    @Override public Optional<FunctionInfo> function() { return Optional.ofNullable(function); }
    @Override public Optional<String> className()      { return Optional.ofNullable(className); }
    @Override public Optional<String> namespaceName()  { return Optional.ofNullable(namespaceName); }

    @Override
    public String toString() {
        return kind + "[" + children.size() + "]";
    }

    public static final class Builder {
        private final String kind;
        private Span span = Span.EMPTY;
        private String text = "";
        private final List<SyntaxNode> children = new ArrayList<>();
        private Boolean named;
        private FunctionInfo function;
        private String className;
        private String namespaceName;

        private Builder(String kind) {
            this.kind = kind != null ? kind : "";
        }

        public Builder span(Span span)                 { this.span = span != null ? span : Span.EMPTY; return this; }
        public Builder text(String text)               { this.text = text != null ? text : ""; return this; }
        public Builder child(SyntaxNode child)         { this.children.add(child); return this; }
        public Builder children(List<? extends SyntaxNode> nodes) { this.children.addAll(nodes); return this; }
        public Builder named(Boolean named)            { this.named = named; return this; }
        public Builder function(FunctionInfo function) { this.function = function; return this; }
        public Builder className(String className)     { this.className = className; return this; }
        public Builder namespaceName(String name)      { this.namespaceName = name; return this; }

        public TreeNode build() {
            return new TreeNode(this);
        }
    }
}
