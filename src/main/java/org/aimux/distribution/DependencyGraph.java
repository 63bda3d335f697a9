package org.aimux.distribution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The dependency graph of a single resolution call. Nodes are plugin identities, edges are
 * "depends-on" relations carrying the constraint declared by the depending plugin.
 *
 * <p>Nodes and edges are stored in flat lists and reference each other by index rather than by
 * object reference, so cyclic graphs pose no problem for construction and traversals do not recurse.
 * The graph is not thread-safe, it is meant to be built and inspected by one resolution round at a time.
 */
public class DependencyGraph {

    public static class GraphNode {
        private final int index;
        @NotNull
        public final PluginId pluginId;
        @NotNull
        private final List<@NotNull GraphEdge> outgoingEdges = new ArrayList<>();
        @Nullable
        private SemanticVersion selectedVersion;

        private GraphNode(int index, @NotNull PluginId pluginId) {
            this.index = index;
            this.pluginId = pluginId;
        }

        @Contract(pure = true)
        public int getIndex() {
            return this.index;
        }

        @NotNull
        @Contract(pure = true)
        public List<@NotNull GraphEdge> getOutgoingEdges() {
            return Collections.unmodifiableList(this.outgoingEdges);
        }

        @Nullable
        @Contract(pure = true)
        public SemanticVersion getSelectedVersion() {
            return this.selectedVersion;
        }

        @Override
        @NotNull
        public String toString() {
            return "GraphNode[plugin=" + this.pluginId + " version=" + this.selectedVersion + "]";
        }
    }

    public static class GraphEdge {
        private final int declarer;
        private final int target;
        @NotNull
        public final VersionConstraint constraint;
        public final boolean optional;

        private GraphEdge(int declarer, int target, @NotNull VersionConstraint constraint, boolean optional) {
            this.declarer = declarer;
            this.target = target;
            this.constraint = constraint;
            this.optional = optional;
        }

        @Contract(pure = true)
        public int getDeclarerIndex() {
            return this.declarer;
        }

        @Contract(pure = true)
        public int getTargetIndex() {
            return this.target;
        }
    }

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    @NotNull
    private final List<@NotNull GraphNode> nodes = new ArrayList<>();
    @NotNull
    private final Map<@NotNull PluginId, @NotNull GraphNode> index = new HashMap<>();
    private int edgeCount;

    @NotNull
    @Contract(mutates = "this", pure = false)
    public GraphEdge addEdge(@NotNull PluginId declarer, @NotNull PluginId target, @NotNull VersionConstraint constraint, boolean optional) {
        GraphNode from = this.addNode(declarer);
        GraphNode to = this.addNode(target);
        GraphEdge edge = new GraphEdge(from.index, to.index, Objects.requireNonNull(constraint), optional);
        from.outgoingEdges.add(edge);
        this.edgeCount++;
        return edge;
    }

    /**
     * Obtains the node of the given plugin, creating it if it does not exist yet.
     *
     * @param pluginId The plugin identity
     * @return The node representing the plugin
     */
    @NotNull
    @Contract(mutates = "this", pure = false)
    public GraphNode addNode(@NotNull PluginId pluginId) {
        GraphNode node = this.index.get(pluginId);
        if (node == null) {
            node = new GraphNode(this.nodes.size(), pluginId);
            this.nodes.add(node);
            this.index.put(pluginId, node);
        }
        return node;
    }

    /**
     * Searches the graph for a dependency cycle by means of an iterative depth-first traversal
     * that colours nodes as unvisited, in progress or done. Any edge into a node that is in progress
     * closes a cycle. Roots are visited in insertion order, making the reported cycle deterministic
     * as long as the graph was built deterministically.
     *
     * @return The cycle path, starting and ending with the same plugin, or null if the graph is acyclic
     */
    @Nullable
    public List<@NotNull PluginId> findCycle() {
        byte[] colour = new byte[this.nodes.size()];
        int[] parent = new int[this.nodes.size()];
        int[] nextEdge = new int[this.nodes.size()];
        Deque<Integer> stack = new ArrayDeque<>();

        for (GraphNode root : this.nodes) {
            if (colour[root.index] != DependencyGraph.UNVISITED) {
                continue;
            }
            colour[root.index] = DependencyGraph.IN_PROGRESS;
            parent[root.index] = -1;
            stack.push(root.index);

            while (!stack.isEmpty()) {
                int current = stack.peek();
                List<GraphEdge> edges = this.nodes.get(current).outgoingEdges;
                if (nextEdge[current] == edges.size()) {
                    colour[current] = DependencyGraph.DONE;
                    stack.pop();
                    continue;
                }
                int target = edges.get(nextEdge[current]++).target;
                if (colour[target] == DependencyGraph.IN_PROGRESS) {
                    List<PluginId> path = new ArrayList<>();
                    path.add(this.nodes.get(target).pluginId);
                    for (int i = current; i != target; i = parent[i]) {
                        path.add(this.nodes.get(i).pluginId);
                    }
                    path.add(this.nodes.get(target).pluginId);
                    Collections.reverse(path);
                    return path;
                } else if (colour[target] == DependencyGraph.UNVISITED) {
                    colour[target] = DependencyGraph.IN_PROGRESS;
                    parent[target] = current;
                    stack.push(target);
                }
            }
        }
        return null;
    }

    @Nullable
    public GraphNode getNode(@NotNull PluginId pluginId) {
        return this.index.get(pluginId);
    }

    @NotNull
    public GraphNode getNode(int index) {
        return this.nodes.get(index);
    }

    @Contract(pure = true)
    public int getEdgeCount() {
        return this.edgeCount;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull GraphNode> getNodes() {
        return Collections.unmodifiableList(this.nodes);
    }

    @Contract(mutates = "this", pure = false)
    public void select(@NotNull PluginId pluginId, @NotNull SemanticVersion version) {
        GraphNode node = this.index.get(pluginId);
        if (node == null) {
            throw new IllegalStateException("Plugin " + pluginId + " is not part of the dependency graph.");
        }
        node.selectedVersion = version;
    }

    /**
     * Orders all nodes so that every node is preceded by all nodes it depends on.
     * Ties are broken by insertion order.
     *
     * @return The plugins in dependency-first order
     * @throws IllegalStateException If the graph contains a cycle
     */
    @NotNull
    public List<@NotNull PluginId> topologicalOrder() {
        byte[] colour = new byte[this.nodes.size()];
        int[] nextEdge = new int[this.nodes.size()];
        List<PluginId> order = new ArrayList<>(this.nodes.size());
        Deque<Integer> stack = new ArrayDeque<>();

        for (GraphNode root : this.nodes) {
            if (colour[root.index] != DependencyGraph.UNVISITED) {
                continue;
            }
            colour[root.index] = DependencyGraph.IN_PROGRESS;
            stack.push(root.index);
            while (!stack.isEmpty()) {
                int current = stack.peek();
                List<GraphEdge> edges = this.nodes.get(current).outgoingEdges;
                if (nextEdge[current] == edges.size()) {
                    colour[current] = DependencyGraph.DONE;
                    order.add(this.nodes.get(current).pluginId);
                    stack.pop();
                    continue;
                }
                int target = edges.get(nextEdge[current]++).target;
                if (colour[target] == DependencyGraph.IN_PROGRESS) {
                    throw new IllegalStateException("Cannot order a cyclic graph (cycle through " + this.nodes.get(target).pluginId + ")");
                } else if (colour[target] == DependencyGraph.UNVISITED) {
                    colour[target] = DependencyGraph.IN_PROGRESS;
                    stack.push(target);
                }
            }
        }
        return order;
    }
}
