package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.aimux.distribution.DependencyGraph;
import org.aimux.distribution.PluginId;
import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.junit.jupiter.api.Test;

public class DependencyGraphTest {

    private static final PluginId APP = PluginId.parse("aimux/app");
    private static final PluginId LIB = PluginId.parse("aimux/lib");
    private static final PluginId CORE = PluginId.parse("aimux/core");

    @Test
    public void testNodesAreIndexedByIdentity() {
        DependencyGraph graph = new DependencyGraph();
        DependencyGraph.GraphNode node = graph.addNode(APP);
        assertSame(node, graph.addNode(APP));
        assertSame(node, graph.getNode(APP));
        assertSame(node, graph.getNode(node.getIndex()));
        assertNull(graph.getNode(LIB));

        graph.addEdge(APP, LIB, VersionConstraint.parse("^1.0.0"), false);
        assertEquals(2, graph.getNodes().size());
        assertEquals(1, graph.getEdgeCount());
        assertEquals(graph.getNode(LIB).getIndex(), node.getOutgoingEdges().get(0).getTargetIndex());
    }

    @Test
    public void testTopologicalOrder() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(APP, LIB, VersionConstraint.LATEST, false);
        graph.addEdge(APP, CORE, VersionConstraint.LATEST, false);
        graph.addEdge(LIB, CORE, VersionConstraint.LATEST, false);
        assertNull(graph.findCycle());
        assertEquals(List.of(CORE, LIB, APP), graph.topologicalOrder());
    }

    @Test
    public void testCycleDetection() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(APP, LIB, VersionConstraint.LATEST, false);
        graph.addEdge(LIB, CORE, VersionConstraint.LATEST, false);
        graph.addEdge(CORE, LIB, VersionConstraint.LATEST, true);

        List<PluginId> cycle = graph.findCycle();
        assertNotNull(cycle);
        assertEquals(List.of(LIB, CORE, LIB), cycle);
        assertThrows(IllegalStateException.class, graph::topologicalOrder);
    }

    @Test
    public void testSelfDependency() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(APP, APP, VersionConstraint.LATEST, false);
        assertEquals(List.of(APP, APP), graph.findCycle());
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        DependencyGraph graph = new DependencyGraph();
        int depth = 50_000;
        for (int i = 0; i < depth; i++) {
            graph.addEdge(PluginId.parse("aimux/p" + i), PluginId.parse("aimux/p" + (i + 1)), VersionConstraint.LATEST, false);
        }
        assertNull(graph.findCycle());
        List<PluginId> order = graph.topologicalOrder();
        assertEquals(depth + 1, order.size());
        assertEquals(PluginId.parse("aimux/p" + depth), order.get(0));

        graph.addEdge(PluginId.parse("aimux/p" + depth), PluginId.parse("aimux/p0"), VersionConstraint.LATEST, false);
        List<PluginId> cycle = graph.findCycle();
        assertNotNull(cycle);
        assertEquals(depth + 2, cycle.size());
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
    }

    @Test
    public void testSelect() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode(APP);
        graph.select(APP, SemanticVersion.parse("1.2.0"));
        assertEquals(SemanticVersion.parse("1.2.0"), graph.getNode(APP).getSelectedVersion());
        assertThrows(IllegalStateException.class, () -> graph.select(LIB, SemanticVersion.parse("1.0.0")));
        assertTrue(graph.getNode(APP).getOutgoingEdges().isEmpty());
    }
}
