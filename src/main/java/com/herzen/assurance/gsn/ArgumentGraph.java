package com.herzen.assurance.gsn;

import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.gsn.GsnModels.Relation;

import java.util.*;
import java.util.function.Predicate;

// Flat node arena; edges are resolved to indices once, at build time.
public final class ArgumentGraph {
    private static final int[] NONE = new int[0];
    private static final ArgumentGraph EMPTY = new ArgumentGraph(List.of(), List.of());

    private final List<GsnNode> nodes;
    private final List<GsnEdge> edges;
    private final Map<String, Integer> index;
    private final int[][] supportChildren;
    private final int[][] supportParents;
    private final int[][] contextOf;
    private final int[][] underminedBy;

    private ArgumentGraph(List<GsnNode> nodes, List<GsnEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.index = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            index.put(this.nodes.get(i).id(), i);
        }

        List<List<Integer>> children = buckets();
        List<List<Integer>> parents = buckets();
        List<List<Integer>> context = buckets();
        List<List<Integer>> undermining = buckets();
        for (GsnEdge e : this.edges) {
            int from = index.get(e.from());
            int to = index.get(e.to());
            switch (e.relation()) {
                case SUPPORTED_BY -> {
                    children.get(from).add(to);
                    parents.get(to).add(from);
                }
                case IN_CONTEXT_OF -> context.get(from).add(to);
                case UNDERMINES -> undermining.get(to).add(from);
            }
        }
        this.supportChildren = toArrays(children);
        this.supportParents = toArrays(parents);
        this.contextOf = toArrays(context);
        this.underminedBy = toArrays(undermining);
    }

    public static ArgumentGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        nodes.forEach(b::node);
        edges.forEach(b::edge);
        return b;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<GsnNode> nodes() {
        return nodes;
    }

    public List<GsnEdge> edges() {
        return edges;
    }

    public GsnNode node(int idx) {
        return nodes.get(idx);
    }

    public Optional<GsnNode> find(String id) {
        Integer idx = index.get(id);
        return idx == null ? Optional.empty() : Optional.of(nodes.get(idx));
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    public int indexOf(String id) {
        Integer idx = index.get(id);
        return idx == null ? -1 : idx;
    }

    public int[] supportChildren(int idx) {
        return supportChildren[idx].clone();
    }

    public int[] supportParents(int idx) {
        return supportParents[idx].clone();
    }

    public int[] contextOf(int idx) {
        return contextOf[idx].clone();
    }

    public int[] underminedBy(int idx) {
        return underminedBy[idx].clone();
    }

    public List<GsnNode> supportChildren(String id) {
        int idx = indexOf(id);
        if (idx < 0) return List.of();
        return Arrays.stream(supportChildren[idx]).mapToObj(nodes::get).toList();
    }

    public boolean hasSupport(String id) {
        int idx = indexOf(id);
        return idx >= 0 && supportChildren[idx].length > 0;
    }

    public List<GsnNode> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    public List<GsnNode> roots() {
        List<GsnNode> roots = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).kind().isNumeric() && supportParents[i].length == 0) {
                roots.add(nodes.get(i));
            }
        }
        return roots;
    }

    public List<GsnEdge> edgesTouching(String id) {
        return edges.stream().filter(e -> e.from().equals(id) || e.to().equals(id)).toList();
    }

    public List<GsnEdge> edgesOf(Relation relation) {
        return edges.stream().filter(e -> e.relation() == relation).toList();
    }

    public ArgumentGraph withConfidences(Double[] confidences) {
        if (confidences.length != nodes.size()) {
            throw new IllegalArgumentException("Expected " + nodes.size() + " confidences, got " + confidences.length);
        }
        List<GsnNode> updated = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            updated.add(nodes.get(i).withConfidence(confidences[i]));
        }
        return new ArgumentGraph(updated, edges);
    }

    public ArgumentGraph withoutConfidences() {
        if (nodes.stream().allMatch(n -> n.confidence() == null)) return this;
        return withConfidences(new Double[nodes.size()]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArgumentGraph other)) return false;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "ArgumentGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }

    private List<List<Integer>> buckets() {
        List<List<Integer>> out = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) out.add(new ArrayList<>());
        return out;
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] out = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            List<Integer> l = lists.get(i);
            out[i] = l.isEmpty() ? NONE : l.stream().mapToInt(Integer::intValue).toArray();
        }
        return out;
    }

    public static final class Builder {
        private final LinkedHashMap<String, GsnNode> nodes = new LinkedHashMap<>();
        private final LinkedHashSet<GsnEdge> edges = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder node(GsnNode node) {
            if (nodes.containsKey(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            nodes.put(node.id(), node);
            return this;
        }

        public Builder replaceNode(GsnNode node) {
            if (!nodes.containsKey(node.id())) {
                throw new IllegalArgumentException("Unknown node id: " + node.id());
            }
            nodes.put(node.id(), node);
            return this;
        }

        public Builder removeNode(String id) {
            nodes.remove(id);
            edges.removeIf(e -> e.from().equals(id) || e.to().equals(id));
            return this;
        }

        public Builder edge(GsnEdge edge) {
            edges.add(edge);
            return this;
        }

        public Builder removeEdges(Predicate<GsnEdge> filter) {
            edges.removeIf(filter);
            return this;
        }

        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        public GsnNode getNode(String id) {
            return nodes.get(id);
        }

        public List<GsnEdge> edges() {
            return List.copyOf(edges);
        }

        public ArgumentGraph build() {
            for (GsnEdge e : edges) {
                if (!nodes.containsKey(e.from()) || !nodes.containsKey(e.to())) {
                    throw new IllegalArgumentException("Edge references missing node: " + e.from() + "->" + e.to());
                }
            }
            if (nodes.isEmpty()) return EMPTY;
            return new ArgumentGraph(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
        }
    }
}
