package com.flowgraph.analyzer;

import com.flowgraph.analyzer.cfg.CfgBuilder;
import com.flowgraph.analyzer.cfg.CfgNodeKind;
import com.flowgraph.analyzer.cfg.ControlFlowGraph;
import com.flowgraph.analyzer.syntax.DumpDirectoryTreeProvider;
import com.flowgraph.analyzer.syntax.FunctionInfo;
import com.flowgraph.analyzer.syntax.FunctionSite;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.SyntaxTreeReader;
import com.flowgraph.analyzer.syntax.SyntaxTreeReader.SyntaxTreeReadException;
import com.flowgraph.analyzer.syntax.SyntaxTrees;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeReaderTest {

    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    private static Path fixture() throws URISyntaxException {
        return Path.of(SyntaxTreeReaderTest.class.getResource("/trees/engine.cc.json").toURI());
    }

    @Test
    void readsFunctionSummariesWithScope() throws URISyntaxException {
        SyntaxNode root = reader.read(fixture());

        List<FunctionSite> sites = SyntaxTrees.collectFunctions(root);

        assertEquals(1, sites.size());
        FunctionSite run = sites.get(0);
        assertEquals("run", run.name());
        assertEquals("Engine", run.className());
        assertEquals("app", run.namespace());
        assertEquals(3, run.line());
        FunctionInfo info = run.info();
        assertEquals("int", info.returnType());
        assertEquals(List.of(new FunctionInfo.Parameter("int", "steps")), info.parameters());
        assertTrue(info.isVirtual());
        assertFalse(info.isStatic());
    }

    @Test
    void keywordTokensAreUnnamedAndCommentsSkipped() throws URISyntaxException {
        SyntaxNode root = reader.read(fixture());
        SyntaxNode body = SyntaxTrees.findDescendant(root, "compound_statement").orElseThrow();

        List<String> kinds = SyntaxTrees.namedChildren(body).stream().map(SyntaxNode::kind).toList();

        assertEquals(List.of("if_statement", "return_statement"), kinds);
        SyntaxNode ns = root.children().get(0);
        assertFalse(ns.children().get(0).isNamed());
        assertTrue(ns.children().get(1).isNamed());
    }

    @Test
    void dumpedFunctionBuildsExpectedGraph() throws URISyntaxException {
        SyntaxNode root = reader.read(fixture());
        FunctionSite run = SyntaxTrees.collectFunctions(root).get(0);

        ControlFlowGraph cfg = new CfgBuilder().build(run.node(), "app::Engine::run", "engine.cc");

        assertEquals(1, cfg.nodesOfKind(CfgNodeKind.BRANCH).size());
        assertEquals(2, cfg.nodesOfKind(CfgNodeKind.RETURN).size());
        assertEquals("If: (steps > 0)", cfg.nodesOfKind(CfgNodeKind.BRANCH).get(0).label());
        assertEquals(5, cfg.nodesOfKind(CfgNodeKind.STATEMENT).get(0).location().line());
    }

    @Test
    void missingFieldsTakeDefaults() {
        SyntaxNode node = reader.parse(new StringReader("{\"type\": \"translation_unit\", \"children\": [{}]}"));

        assertEquals("translation_unit", node.kind());
        assertEquals("", node.text());
        assertEquals(1, node.span().line());
        assertEquals("", node.children().get(0).kind());
        assertTrue(node.function().isEmpty());
    }

    @Test
    void invalidDumpsAreRejected(@TempDir Path dir) throws IOException {
        assertThrows(SyntaxTreeReadException.class, () -> reader.parse(new StringReader("[1]")));
        assertThrows(SyntaxTreeReadException.class, () -> reader.parse(new StringReader("{\"type\": ")));
        assertThrows(SyntaxTreeReadException.class, () -> reader.read(dir.resolve("none.json")));
    }

    @Test
    void providerMapsSourceFilesToDumps(@TempDir Path dir) throws IOException, URISyntaxException {
        Path project = Files.createDirectories(dir.resolve("proj"));
        Path trees = Files.createDirectories(dir.resolve("trees/core"));
        Files.copy(fixture(), trees.resolve("engine.cc.json"));
        DumpDirectoryTreeProvider provider = new DumpDirectoryTreeProvider(project, dir.resolve("trees"));

        Optional<SyntaxNode> tree = provider.treeFor(project.resolve("core/engine.cc"));

        assertTrue(tree.isPresent());
        assertEquals("translation_unit", tree.get().kind());
        assertTrue(provider.treeFor(project.resolve("core/other.cc")).isEmpty());
    }
}
