package org.example.formula.model;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Dependency graph of a solved selection.
 * Nodes are selected releases, edges point from a release to the selected packages its formula requires.
 */
public class ResolvedGraph {

    private final PackageVersion root;
    private final Set<PackageVersion> nodes;
    private final List<ResolvedDependency> dependencies;

    public ResolvedGraph(PackageVersion root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.nodes = new LinkedHashSet<>();
        this.dependencies = new ArrayList<>();
        this.nodes.add(root);
    }

    public static Builder builder(PackageVersion root) {
        return new Builder(root);
    }

    // Getters

    public PackageVersion getRoot() {
        return root;
    }

    public Set<PackageVersion> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public List<ResolvedDependency> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    // Modification methods

    public void addNode(PackageVersion node) {
        nodes.add(node);
    }

    /**
     * Adds an edge and both of its endpoints.
     */
    public void addDependency(ResolvedDependency dependency) {
        nodes.add(dependency.getSource());
        nodes.add(dependency.getTarget());
        dependencies.add(dependency);
    }

    // Query methods

    public int getNodeCount() {
        return nodes.size();
    }

    public int getDependencyCount() {
        return dependencies.size();
    }

    /**
     * Returns the edges leaving the root release.
     */
    public List<ResolvedDependency> getDirectDependencies() {
        return dependencies.stream()
                .filter(ResolvedDependency::isDirect)
                .collect(Collectors.toList());
    }

    public List<ResolvedDependency> getDependenciesFrom(PackageVersion source) {
        return dependencies.stream()
                .filter(d -> d.getSource().equals(source))
                .collect(Collectors.toList());
    }

    public List<ResolvedDependency> getDependenciesTo(PackageVersion target) {
        return dependencies.stream()
                .filter(d -> d.getTarget().equals(target))
                .collect(Collectors.toList());
    }

    public Optional<PackageVersion> findNode(String name) {
        return nodes.stream()
                .filter(n -> n.getName().equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return "ResolvedGraph{" +
                "root=" + root +
                ", nodeCount=" + nodes.size() +
                ", dependencyCount=" + dependencies.size() +
                '}';
    }

    /**
     * Returns a multi-line listing of nodes and edges.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ResolvedGraph:\n");
        sb.append("  Root: ").append(root.getCoordinate()).append("\n");
        sb.append("  Nodes (").append(nodes.size()).append("):\n");
        for (PackageVersion node : nodes) {
            sb.append("    - ").append(node.getCoordinate()).append("\n");
        }
        sb.append("  Dependencies (").append(dependencies.size()).append("):\n");
        for (ResolvedDependency dep : dependencies) {
            sb.append("    - ").append(dep.getEdgeDescription()).append("\n");
        }
        return sb.toString();
    }

    /**
     * Builder for ResolvedGraph.
     */
    public static class Builder {
        private final ResolvedGraph graph;

        public Builder(PackageVersion root) {
            this.graph = new ResolvedGraph(root);
        }

        public Builder addNode(PackageVersion node) {
            graph.addNode(node);
            return this;
        }

        public Builder addDependency(ResolvedDependency dependency) {
            graph.addDependency(dependency);
            return this;
        }

        public ResolvedGraph build() {
            return graph;
        }
    }
}
