package com.flowgraph.analyzer.ir;

import com.flowgraph.analyzer.cfg.CfgEdge;
import com.flowgraph.analyzer.cfg.CfgEdgeKind;
import com.flowgraph.analyzer.cfg.CfgNode;
import com.flowgraph.analyzer.cfg.CfgNodeKind;
import com.flowgraph.analyzer.cfg.ControlFlowGraph;
import com.flowgraph.analyzer.ir.IrModel.ControlBlock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds nested control blocks from a {@link ControlFlowGraph}, starting at Entry.
 *
 * A branch's then-blocks follow its True successor and its else-blocks its False successor;
 * both stop at the branch's merge node, after which recovery continues from the merge as the
 * branch's next sibling. A loop's body follows its non-LoopExit successors and recovery
 * continues after the loop-exit node. Synthesized merge and loop-exit nodes emit no block of
 * their own. Graphs without merge information degrade to a plain depth-first walk.
 *
 * Every node is emitted at most once; the visited set also bounds the walk on back edges.
 * Instances are single-use.
 */
public class ControlBlockRecovery {

    private final ControlFlowGraph cfg;
    private final String exitId;
    private final Set<String> visited = new HashSet<>();

    public ControlBlockRecovery(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.exitId = cfg.exit().id();
    }

    public static List<ControlBlock> recover(ControlFlowGraph cfg) {
        return new ControlBlockRecovery(cfg).run();
    }

    public List<ControlBlock> run() {
        return chain(cfg.entry().id(), null);
    }

    private List<ControlBlock> chain(String start, String stopAt) {
        List<ControlBlock> blocks = new ArrayList<>();
        String current = start;
        while (current != null && !current.equals(stopAt) && !current.equals(exitId)
                && visited.add(current)) {
            CfgNode node = cfg.node(current).orElse(null);
            if (node == null) break;

            if (node.kind() == CfgNodeKind.BRANCH) {
                String merge = node.attribute("merge");
                blocks.add(branch(node, merge));
                current = merge;
            } else if (node.kind() == CfgNodeKind.LOOP) {
                blocks.add(loop(node));
                current = successor(current, CfgEdgeKind.LOOP_EXIT);
            } else {
                if (node.kind() != CfgNodeKind.ENTRY && !isSynthetic(node)) {
                    blocks.add(sequence(node));
                }
                List<String> next = forwardSuccessors(current);
                if (next.size() == 1) {
                    current = next.get(0);
                } else {
                    for (String s : next) blocks.addAll(chain(s, stopAt));
                    current = null;
                }
            }
        }
        return blocks;
    }

    private ControlBlock branch(CfgNode node, String merge) {
        String condition = node.attribute("condition");
        if (condition == null) {
            condition = node.label().startsWith("If: ") ? node.label().substring(4) : node.label();
        }
        ControlBlock block = ControlBlock.ifBlock(node.id(), node.label(), condition);
        block.metadata.addProperty("node_type", node.kind().wireName());

        String onTrue = successor(node.id(), CfgEdgeKind.TRUE);
        if (onTrue != null) block.thenChildren.addAll(chain(onTrue, merge));

        String onFalse = successor(node.id(), CfgEdgeKind.FALSE);
        if (onFalse != null && !onFalse.equals(node.id()) && !onFalse.equals(merge)) {
            block.elseChildren = chain(onFalse, merge);
        }
        return block;
    }

    private ControlBlock loop(CfgNode node) {
        ControlBlock block = ControlBlock.loop(node.id(), node.label());
        block.metadata.addProperty("node_type", node.kind().wireName());
        String condition = node.attribute("condition");
        if (condition != null) block.metadata.addProperty("condition", condition);
        for (CfgEdge e : cfg.outEdges(node.id())) {
            if (e.kind() != CfgEdgeKind.LOOP_EXIT) {
                block.bodyChildren.addAll(chain(e.target(), node.id()));
            }
        }
        return block;
    }

    private static ControlBlock sequence(CfgNode node) {
        ControlBlock block = ControlBlock.sequence(node.id(), node.label());
        block.metadata.addProperty("node_type", node.kind().wireName());
        if (node.location() != null) block.metadata.addProperty("line", node.location().line());
        return block;
    }

    private String successor(String id, CfgEdgeKind kind) {
        for (CfgEdge e : cfg.outEdges(id)) {
            if (e.kind() == kind) return e.target();
        }
        return null;
    }

    /** Successors other than Exit, skipping back edges. */
    private List<String> forwardSuccessors(String id) {
        List<String> result = new ArrayList<>();
        for (CfgEdge e : cfg.outEdges(id)) {
            if (e.kind() == CfgEdgeKind.BACK_EDGE || e.target().equals(exitId)) continue;
            if (!result.contains(e.target())) result.add(e.target());
        }
        return result;
    }

    private static boolean isSynthetic(CfgNode node) {
        return "true".equals(node.attribute("synthetic"));
    }
}
