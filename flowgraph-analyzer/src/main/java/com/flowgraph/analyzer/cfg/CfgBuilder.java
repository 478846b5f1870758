package com.flowgraph.analyzer.cfg;

import com.flowgraph.analyzer.call_graph.CallSites;
import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.syntax.SyntaxKinds;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.SyntaxTrees;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the control-flow graph of one function from its syntax subtree.
 *
 * The body's statements are walked depth-first while threading a frontier: the node the next
 * emitted node attaches to, together with the kind of that attaching edge. A {@code return}
 * ends its block's chain. {@code if} and loop statements emit a decision node, recurse into
 * their blocks and leave a synthesized merge or loop-exit node as the new frontier. A closure
 * step finally wires every dangling node to Exit.
 *
 * The builder holds no state between calls and may be shared across threads.
 */
public class CfgBuilder {

    static final int LABEL_LIMIT = 50;

    /**
     * @param function       the function definition subtree
     * @param qualifiedName  {@code namespace::class::name}; prefixes every node id
     * @param file           source file recorded on node locations, may be null
     */
    public ControlFlowGraph build(SyntaxNode function, String qualifiedName, String file) {
        Session session = new Session(qualifiedName, file);
        session.begin(function);

        Optional<SyntaxNode> body = SyntaxTrees.findDescendant(function, SyntaxKinds.COMPOUND_STATEMENT);
        if (body.isEmpty()) {
            session.edge(session.entryId, session.exitId, CfgEdgeKind.NORMAL);
        } else {
            session.process(statementsOf(body.get()), new Frontier(session.entryId, CfgEdgeKind.NORMAL));
        }
        return session.finish();
    }

    /**
     * Locates {@code functionName} under {@code root} and builds its graph.
     *
     * @return empty when no function of that name exists in the tree
     */
    public Optional<ControlFlowGraph> buildForFunction(SyntaxNode root, String functionName,
                                                       String qualifiedName, String file) {
        return SyntaxTrees.findFunction(root, functionName)
                .map(fn -> build(fn, qualifiedName, file));
    }

    /** Statements of a block with nested bare blocks flattened in place. */
    static List<SyntaxNode> statementsOf(SyntaxNode block) {
        List<SyntaxNode> statements = new ArrayList<>();
        for (SyntaxNode child : SyntaxTrees.namedChildren(block)) {
            if (SyntaxKinds.COMPOUND_STATEMENT.equals(child.kind())) {
                statements.addAll(statementsOf(child));
            } else {
                statements.add(child);
            }
        }
        return statements;
    }

    /** A braced branch contributes its statements, a bare one contributes itself. */
    private static List<SyntaxNode> branchStatements(SyntaxNode branch) {
        if (branch == null) return List.of();
        return SyntaxKinds.COMPOUND_STATEMENT.equals(branch.kind()) ? statementsOf(branch) : List.of(branch);
    }

    static String statementLabel(SyntaxNode stmt) {
        String text = collapse(stmt.text());
        if (text.length() > LABEL_LIMIT) {
            return text.substring(0, LABEL_LIMIT - 3) + "...";
        }
        return text.isEmpty() ? "Statement" : text;
    }

    private static String conditionText(SyntaxNode condition) {
        if (condition == null) return "condition";
        String text = collapse(condition.text());
        if (text.isEmpty()) return "condition";
        return text.length() > LABEL_LIMIT ? text.substring(0, LABEL_LIMIT) : text;
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").strip();
    }

    private static SyntaxNode conditionOf(SyntaxNode stmt) {
        for (SyntaxNode c : stmt.children()) {
            if (SyntaxKinds.CONDITIONS.contains(c.kind())) return c;
        }
        return null;
    }

    private static SyntaxNode loopBody(SyntaxNode loop) {
        Optional<SyntaxNode> block = SyntaxTrees.child(loop, SyntaxKinds.COMPOUND_STATEMENT);
        if (block.isPresent()) return block.get();
        List<SyntaxNode> named = SyntaxTrees.namedChildren(loop);
        if (named.isEmpty()) return null;
        SyntaxNode last = named.get(named.size() - 1);
        boolean statementLike = last.kind().endsWith("_statement") || last.kind().equals("declaration")
                || SyntaxKinds.LOOPS.contains(last.kind());
        return statementLike && !SyntaxKinds.CONDITIONS.contains(last.kind()) ? last : null;
    }

    /** Node the next statement attaches to, and the kind of the attaching edge. */
    private record Frontier(String nodeId, CfgEdgeKind edgeKind) {}

    private static final class Session {
        private final String qualifiedName;
        private final String file;
        private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
        private final List<CfgEdge> edges = new ArrayList<>();
        private int counter = 0;
        private String entryId;
        private String exitId;

        Session(String qualifiedName, String file) {
            this.qualifiedName = qualifiedName;
            this.file = file;
        }

        void begin(SyntaxNode function) {
            entryId = qualifiedName + "_entry";
            exitId = qualifiedName + "_exit";
            put(new CfgNode(entryId, CfgNodeKind.ENTRY, "Entry: " + qualifiedName,
                    location(function.span().line()), null));
            put(new CfgNode(exitId, CfgNodeKind.EXIT, "Exit: " + qualifiedName,
                    location(function.span().endRow() + 1), null));
        }

        /** @return the frontier after the statements, or null when the chain was terminated */
        Frontier process(List<SyntaxNode> statements, Frontier frontier) {
            for (SyntaxNode stmt : statements) {
                String kind = stmt.kind();
                if (SyntaxKinds.IF_STATEMENT.equals(kind)) {
                    frontier = processIf(stmt, frontier);
                    if (frontier == null) return null;
                } else if (SyntaxKinds.LOOPS.contains(kind)) {
                    frontier = processLoop(stmt, frontier);
                } else if (SyntaxKinds.RETURN_STATEMENT.equals(kind)) {
                    String ret = add(CfgNodeKind.RETURN, "Return", stmt, calls(List.of(stmt)));
                    attach(frontier, ret);
                    edge(ret, exitId, CfgEdgeKind.RETURN);
                    return null;
                } else {
                    String id = add(CfgNodeKind.STATEMENT, statementLabel(stmt), stmt, calls(List.of(stmt)));
                    attach(frontier, id);
                    frontier = new Frontier(id, CfgEdgeKind.NORMAL);
                }
            }
            return frontier;
        }

        private Frontier processIf(SyntaxNode stmt, Frontier frontier) {
            SyntaxNode condition = conditionOf(stmt);
            JsonObject attrs = calls(condition != null ? List.of(condition) : List.of());
            String conditionText = conditionText(condition);
            attrs.addProperty("condition", conditionText);
            String branch = add(CfgNodeKind.BRANCH, "If: " + conditionText, stmt, attrs);
            attach(frontier, branch);

            SyntaxNode thenNode = null;
            SyntaxNode elseNode = null;
            for (SyntaxNode c : SyntaxTrees.namedChildren(stmt)) {
                if (c == condition) continue;
                if (SyntaxKinds.ELSE_CLAUSE.equals(c.kind())) {
                    List<SyntaxNode> inner = SyntaxTrees.namedChildren(c);
                    elseNode = inner.isEmpty() ? null : inner.get(0);
                } else if (thenNode == null) {
                    thenNode = c;
                } else if (elseNode == null) {
                    elseNode = c;
                }
            }

            Frontier thenEnd = process(branchStatements(thenNode), new Frontier(branch, CfgEdgeKind.TRUE));
            Frontier elseEnd = elseNode != null
                    ? process(branchStatements(elseNode), new Frontier(branch, CfgEdgeKind.FALSE))
                    : new Frontier(branch, CfgEdgeKind.FALSE);
            if (thenEnd == null && elseEnd == null) {
                return null;
            }

            String merge = branch + "_merge";
            put(new CfgNode(merge, CfgNodeKind.STATEMENT, "Merge", location(stmt.span().line()),
                    Attributes.of("synthetic", true)));
            JsonObject branchAttrs = nodes.get(branch).attributes();
            branchAttrs.addProperty("merge", merge);
            CfgNode b = nodes.get(branch);
            put(new CfgNode(b.id(), b.kind(), b.label(), b.location(), branchAttrs));

            if (thenEnd != null) attach(thenEnd, merge);
            if (elseEnd != null) attach(elseEnd, merge);
            return new Frontier(merge, CfgEdgeKind.NORMAL);
        }

        private Frontier processLoop(SyntaxNode stmt, Frontier frontier) {
            boolean isWhile = SyntaxKinds.WHILE_STATEMENT.equals(stmt.kind());
            String prefix = isWhile ? "While" : "For";
            SyntaxNode body = loopBody(stmt);

            List<SyntaxNode> header = new ArrayList<>();
            for (SyntaxNode c : SyntaxTrees.namedChildren(stmt)) {
                if (c != body) header.add(c);
            }
            JsonObject attrs = calls(header);
            SyntaxNode condition = conditionOf(stmt);
            if (condition != null) attrs.addProperty("condition", conditionText(condition));

            String loop = add(CfgNodeKind.LOOP, prefix + " Loop Entry", stmt, attrs);
            attach(frontier, loop);

            Frontier bodyEnd = process(branchStatements(body), new Frontier(loop, CfgEdgeKind.NORMAL));
            if (bodyEnd != null && !bodyEnd.nodeId().equals(loop)) {
                edge(bodyEnd.nodeId(), loop, CfgEdgeKind.BACK_EDGE);
            }

            String exit = loop + "_exit";
            put(new CfgNode(exit, CfgNodeKind.STATEMENT, prefix + " Loop Exit", location(stmt.span().line()),
                    Attributes.of("synthetic", true)));
            edge(loop, exit, CfgEdgeKind.LOOP_EXIT);
            return new Frontier(exit, CfgEdgeKind.NORMAL);
        }

        private JsonObject calls(List<SyntaxNode> roots) {
            JsonObject attrs = new JsonObject();
            Set<String> names = CallSites.names(roots);
            if (!names.isEmpty()) attrs.add("calls", Attributes.stringArray(names));
            return attrs;
        }

        private String add(CfgNodeKind kind, String label, SyntaxNode stmt, JsonObject attrs) {
            String id = qualifiedName + "_" + counter++;
            put(new CfgNode(id, kind, label, location(stmt.span().line()), attrs));
            return id;
        }

        private void put(CfgNode node) {
            nodes.put(node.id(), node);
        }

        private SourceLocation location(int line) {
            return new SourceLocation(file, line);
        }

        private void attach(Frontier frontier, String target) {
            edge(frontier.nodeId(), target, frontier.edgeKind());
        }

        void edge(String source, String target, CfgEdgeKind kind) {
            for (CfgEdge e : edges) {
                if (e.source().equals(source) && e.target().equals(target) && e.kind() == kind) return;
            }
            edges.add(new CfgEdge(source, target, kind));
        }

        ControlFlowGraph finish() {
            for (String id : nodes.keySet()) {
                if (id.equals(exitId)) continue;
                boolean hasOut = false;
                for (CfgEdge e : edges) {
                    if (e.source().equals(id)) {
                        hasOut = true;
                        break;
                    }
                }
                if (!hasOut) edge(id, exitId, CfgEdgeKind.NORMAL);
            }
            return new ControlFlowGraph(qualifiedName, file, nodes, edges, entryId, exitId);
        }
    }
}
