package com.flowgraph.analyzer.pipeline;

import com.flowgraph.analyzer.call_graph.CallGraph;
import com.flowgraph.analyzer.cfg.ControlFlowGraph;
import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.ir.IrModel.ProjectIR;
import com.flowgraph.analyzer.modules.ModuleAnalysis;

import java.util.List;
import java.util.Map;

/**
 * Everything one {@link ProjectAnalyzer} run produced. {@code cfgs} is keyed by function IR id.
 */
public record AnalysisResult(
    Map<String, FunctionIR> functions,
    Map<String, ModuleIR> modules,
    ProjectIR project,
    Map<String, ControlFlowGraph> cfgs,
    CallGraph callGraph,
    ModuleAnalysis moduleAnalysis,
    List<Diagnostic> diagnostics
) {}
