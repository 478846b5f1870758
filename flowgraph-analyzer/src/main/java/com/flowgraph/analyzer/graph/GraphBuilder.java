package com.flowgraph.analyzer.graph;

import com.flowgraph.analyzer.ir.IrModel.BlockType;
import com.flowgraph.analyzer.ir.IrModel.ControlBlock;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives normalized graphs from IR.
 *
 * The per-function graph has one node per control block ({@code <function-id>_<block-id>})
 * between a fresh Entry and Exit. Blocks are wired in nesting order: an if node leads into its
 * then-children with a {@code true} edge and its else-children with a {@code false} edge, and
 * both ends continue to the next sibling; a loop's body ends with a {@code back_edge} to the
 * loop, which continues with a {@code loop_exit} edge. A return block links straight to Exit.
 * Whatever is left dangling is closed onto Exit.
 *
 * Call and module graphs resolve callee and dependency names by plain name, first match.
 */
public class GraphBuilder {

    /** A node waiting for its next edge, and the type that edge will carry. */
    private record Pending(String nodeId, String edgeType) {}

    public Graph buildCfgGraph(FunctionIR function) {
        Graph graph = new Graph();
        String entry = function.id + "_entry";
        String exit = function.id + "_exit";
        graph.addNode(entry, Attributes.of(
                "type", "entry",
                "label", "Entry: " + function.name,
                "function_id", function.id,
                "metadata", new JsonObject()));
        graph.addNode(exit, Attributes.of(
                "type", "exit",
                "label", "Exit: " + function.name,
                "function_id", function.id,
                "metadata", new JsonObject()));

        List<Pending> frontier = addBlocks(graph, function.controlBlocks,
                List.of(new Pending(entry, "normal")), function.id, exit);
        for (Pending p : frontier) {
            graph.addEdge(p.nodeId(), exit, Attributes.of("type", p.edgeType()));
        }
        for (String id : new ArrayList<>(graph.nodeIds())) {
            if (!id.equals(exit) && graph.outDegree(id) == 0) {
                graph.addEdge(id, exit, Attributes.of("type", "normal"));
            }
        }
        return graph;
    }

    /** @return the nodes the next sibling attaches to; empty once every path has returned */
    private List<Pending> addBlocks(Graph graph, List<ControlBlock> blocks, List<Pending> frontier,
                                    String functionId, String exit) {
        if (blocks == null) return frontier;
        for (ControlBlock block : blocks) {
            if (frontier.isEmpty()) break;
            String id = functionId + "_" + block.blockId;
            graph.addNode(id, Attributes.of(
                    "type", block.blockType != null ? block.blockType.wireName() : "sequence",
                    "label", block.label,
                    "function_id", functionId,
                    "condition", block.condition,
                    "metadata", block.metadata != null ? block.metadata.deepCopy() : new JsonObject()));
            for (Pending p : frontier) {
                graph.addEdge(p.nodeId(), id, Attributes.of("type", p.edgeType()));
            }

            if (block.blockType == BlockType.IF) {
                List<Pending> next = new ArrayList<>(addBlocks(graph, block.thenChildren,
                        List.of(new Pending(id, "true")), functionId, exit));
                if (block.elseChildren != null) {
                    next.addAll(addBlocks(graph, block.elseChildren,
                            List.of(new Pending(id, "false")), functionId, exit));
                } else {
                    next.add(new Pending(id, "false"));
                }
                frontier = next;
            } else if (block.blockType == BlockType.LOOP) {
                List<Pending> bodyEnd = addBlocks(graph, block.bodyChildren,
                        List.of(new Pending(id, "normal")), functionId, exit);
                for (Pending p : bodyEnd) {
                    if (!p.nodeId().equals(id)) {
                        graph.addEdge(p.nodeId(), id, Attributes.of("type", "back_edge"));
                    }
                }
                frontier = List.of(new Pending(id, "loop_exit"));
            } else if (isReturn(block)) {
                graph.addEdge(id, exit, Attributes.of("type", "return"));
                frontier = List.of();
            } else {
                frontier = List.of(new Pending(id, "normal"));
            }
        }
        return frontier;
    }

    private static boolean isReturn(ControlBlock block) {
        return "return".equals(Attributes.string(block.metadata, "node_type", null));
    }

    /** One node per function id; a {@code call} edge for each callee name that matches a function. */
    public Graph buildCallGraph(Map<String, FunctionIR> functions) {
        Graph graph = new Graph();
        for (Map.Entry<String, FunctionIR> e : functions.entrySet()) {
            FunctionIR f = e.getValue();
            graph.addNode(e.getKey(), Attributes.of(
                    "name", f.name,
                    "signature", f.signature,
                    "file", f.file,
                    "line", f.line,
                    "metadata", f.metadata != null ? f.metadata.deepCopy() : new JsonObject()));
        }
        for (Map.Entry<String, FunctionIR> e : functions.entrySet()) {
            if (e.getValue().calls == null) continue;
            for (String callee : e.getValue().calls) {
                String calleeId = findFunctionByName(callee, functions);
                if (calleeId != null) {
                    graph.addEdge(e.getKey(), calleeId, Attributes.of("type", "call"));
                }
            }
        }
        return graph;
    }

    /** One node per module id; a {@code depends_on} edge per dependency name, never to itself. */
    public Graph buildModuleGraph(Map<String, ModuleIR> modules) {
        Graph graph = new Graph();
        for (Map.Entry<String, ModuleIR> e : modules.entrySet()) {
            ModuleIR m = e.getValue();
            graph.addNode(e.getKey(), Attributes.of(
                    "name", m.name,
                    "path", m.path,
                    "metadata", m.metadata != null ? m.metadata.deepCopy() : new JsonObject()));
        }
        for (Map.Entry<String, ModuleIR> e : modules.entrySet()) {
            if (e.getValue().dependencies == null) continue;
            for (String dep : e.getValue().dependencies) {
                String depId = findModuleByName(dep, modules);
                if (depId != null && !depId.equals(e.getKey())) {
                    graph.addEdge(e.getKey(), depId, Attributes.of("type", "depends_on"));
                }
            }
        }
        return graph;
    }

    private static String findFunctionByName(String name, Map<String, FunctionIR> functions) {
        for (Map.Entry<String, FunctionIR> e : functions.entrySet()) {
            if (name.equals(e.getValue().name)) return e.getKey();
        }
        return null;
    }

    private static String findModuleByName(String name, Map<String, ModuleIR> modules) {
        for (Map.Entry<String, ModuleIR> e : modules.entrySet()) {
            if (name.equals(e.getValue().name)) return e.getKey();
        }
        return null;
    }
}
