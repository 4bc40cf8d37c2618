package com.herzen.assurance.gsn;

import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.gsn.GsnModels.Violation;
import com.herzen.assurance.gsn.GsnModels.ViolationType;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class GsnValidator {

    public List<Violation> validate(ArgumentGraph graph) {
        return validate(graph, List.of());
    }

    public List<Violation> validate(ArgumentGraph graph, Collection<String> openPorts) {
        List<Violation> violations = new ArrayList<>();
        if (graph.isEmpty()) {
            openPorts.forEach(p -> violations.add(Violation.of(ViolationType.MALFORMED_PORT, p, "Port references missing goal: " + p)));
            return violations;
        }

        List<String> cycle = findCycle(graph);
        if (!cycle.isEmpty()) {
            violations.add(new Violation(ViolationType.CYCLE_DETECTED, cycle.get(0), cycle,
                    "Cycle in support edges: " + String.join(" -> ", cycle)));
        }

        for (int i = 0; i < graph.size(); i++) {
            GsnNode node = graph.node(i);
            if (node.kind() == NodeKind.SOLUTION && node.evidenceRefs().isEmpty()) {
                violations.add(Violation.of(ViolationType.ORPHAN_EVIDENCE, node.id(), "Solution has no evidence reference: " + node.id()));
            }
            if (node.kind() == NodeKind.STRATEGY) {
                boolean supported = Arrays.stream(graph.supportChildren(i))
                        .mapToObj(graph::node)
                        .anyMatch(c -> c.kind() == NodeKind.GOAL || c.kind() == NodeKind.SOLUTION);
                if (!supported) {
                    violations.add(Violation.of(ViolationType.UNSUPPORTED_STRATEGY, node.id(), "Strategy has no supporting goal or solution: " + node.id()));
                }
            }
        }

        List<GsnNode> roots = graph.roots();
        if (roots.size() > 1 || (roots.size() == 1 && roots.get(0).kind() != NodeKind.GOAL) || (roots.isEmpty() && cycle.isEmpty())) {
            String ids = roots.stream().map(GsnNode::id).sorted().reduce((a, b) -> a + "," + b).orElse("");
            violations.add(new Violation(ViolationType.MULTIPLE_ROOTS, roots.isEmpty() ? null : roots.get(0).id(),
                    roots.stream().map(GsnNode::id).toList(),
                    "Expected exactly one root goal, found [" + ids + "]"));
        }

        for (String port : new TreeSet<>(openPorts)) {
            Optional<GsnNode> node = graph.find(port);
            if (node.isEmpty()) {
                violations.add(Violation.of(ViolationType.MALFORMED_PORT, port, "Port references missing goal: " + port));
            } else if (node.get().kind() != NodeKind.GOAL) {
                violations.add(Violation.of(ViolationType.MALFORMED_PORT, port, "Port is not a goal: " + port));
            } else if (graph.hasSupport(port)) {
                violations.add(Violation.of(ViolationType.MALFORMED_PORT, port, "Port goal already has support: " + port));
            }
        }
        return violations;
    }

    // Kahn's sort over support edges: empty when acyclic, otherwise one cycle with its first id repeated.
    public List<String> findCycle(ArgumentGraph graph) {
        int n = graph.size();
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            inDegree[i] = graph.supportParents(i).length;
        }
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        int sorted = 0;
        while (!ready.isEmpty()) {
            int idx = ready.poll();
            sorted++;
            for (int child : graph.supportChildren(idx)) {
                if (--inDegree[child] == 0) ready.add(child);
            }
        }
        if (sorted == n) return List.of();

        // every node left with inDegree > 0 lies on or below a cycle; walk parents until one repeats
        int start = -1;
        for (int i = 0; i < n && start < 0; i++) {
            if (inDegree[i] > 0) start = i;
        }
        Map<Integer, Integer> seenAt = new HashMap<>();
        List<Integer> walk = new ArrayList<>();
        int current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, walk.size());
            walk.add(current);
            int next = -1;
            for (int parent : graph.supportParents(current)) {
                if (inDegree[parent] > 0) {
                    next = parent;
                    break;
                }
            }
            current = next;
        }
        List<Integer> loop = new ArrayList<>(walk.subList(seenAt.get(current), walk.size()));
        Collections.reverse(loop);
        List<String> path = new ArrayList<>();
        loop.forEach(i -> path.add(graph.node(i).id()));
        path.add(path.get(0));
        return path;
    }

    public int[] topologicalOrder(ArgumentGraph graph) {
        int n = graph.size();
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) inDegree[i] = graph.supportParents(i).length;
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) if (inDegree[i] == 0) ready.add(i);
        int[] order = new int[n];
        int pos = 0;
        while (!ready.isEmpty()) {
            int idx = ready.poll();
            order[pos++] = idx;
            for (int child : graph.supportChildren(idx)) {
                if (--inDegree[child] == 0) ready.add(child);
            }
        }
        if (pos != n) throw new IllegalStateException("Support subgraph is cyclic");
        return order;
    }
}
