package com.herzen.assurance.argtl;

import com.herzen.assurance.argtl.ArgTLModels.*;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceCase.Snapshot;
import com.herzen.assurance.error.AssuranceException;
import com.herzen.assurance.error.CompositionErrorCode;
import com.herzen.assurance.error.CompositionException;
import com.herzen.assurance.error.StructuralException;
import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentStore;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.*;
import com.herzen.assurance.gsn.GsnValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

// Every operation validates a candidate snapshot before it commits.
@Service
public class ArgTLInterpreter {
    private static final Logger log = LoggerFactory.getLogger(ArgTLInterpreter.class);

    static final String NAMESPACE_SEPARATOR = "::";

    private final GsnValidator validator;

    public ArgTLInterpreter(GsnValidator validator) {
        this.validator = validator;
    }

    public AssuranceCase compose(AssuranceCase assuranceCase, String portGoalId, Fragment fragment) {
        assuranceCase.requireMutable();
        String fragmentRootId = fragment.rootGoalId();
        GsnNode fragmentRoot = fragmentRootId == null ? null : fragment.graph().find(fragmentRootId).orElse(null);
        if (fragmentRoot == null || fragmentRoot.kind() != NodeKind.GOAL) {
            throw new CompositionException(CompositionErrorCode.PORT_MISMATCH, portGoalId,
                    "Fragment " + fragment.name() + " has no single root goal to attach");
        }

        Snapshot current = assuranceCase.snapshot();
        Snapshot next = current.graph().isEmpty()
                ? seed(portGoalId, fragment, fragmentRootId)
                : attach(current, portGoalId, fragment, fragmentRoot);

        commit(assuranceCase, next, "compose", args("port", String.valueOf(portGoalId), "fragment", fragment.name()));
        log.debug("Composed fragment {} into case {} at {}", fragment.name(), assuranceCase.id(), portGoalId);
        return assuranceCase;
    }

    public AssuranceCase refine(AssuranceCase assuranceCase, String goalId, StrategyTemplate template) {
        assuranceCase.requireMutable();
        Snapshot current = assuranceCase.snapshot();
        ArgumentGraph graph = current.graph();
        GsnNode goal = graph.find(goalId).orElse(null);
        if (goal == null || goal.kind() != NodeKind.GOAL || graph.hasSupport(goalId)) {
            throw new CompositionException(CompositionErrorCode.NOT_A_GOAL, goalId, "Not a leaf goal: " + goalId);
        }

        ArgumentGraph.Builder builder = graph.toBuilder();
        boolean justified = template.justification() != null && !template.justification().isBlank();
        String strategyId = freshStrategyId(builder, goalId, template.subGoalStatements().size(), justified);
        GsnNode strategy = GsnNode.of(strategyId, NodeKind.STRATEGY, template.strategyStatement());
        if (template.aggregator() != null) strategy = strategy.withMetadata("aggregator", template.aggregator());
        builder.node(strategy);
        builder.edge(GsnEdge.supportedBy(goalId, strategyId));

        List<String> ports = new ArrayList<>(current.openPorts());
        ports.remove(goalId);
        for (int i = 0; i < template.subGoalStatements().size(); i++) {
            String childId = strategyId + ".G" + (i + 1);
            builder.node(GsnNode.of(childId, NodeKind.GOAL, template.subGoalStatements().get(i)));
            builder.edge(GsnEdge.supportedBy(strategyId, childId));
            ports.add(childId);
        }
        if (justified) {
            String justificationId = strategyId + ".J";
            builder.node(GsnNode.of(justificationId, NodeKind.JUSTIFICATION, template.justification()));
            builder.edge(GsnEdge.inContextOf(strategyId, justificationId));
        }

        Snapshot next = new Snapshot(builder.build(), current.rootGoalId(), ports, current.provenance());
        commit(assuranceCase, next, "refine", args("goal", goalId, "strategy", template.strategyStatement()));
        return assuranceCase;
    }

    public AssuranceCase abstractSubgraph(AssuranceCase assuranceCase, Collection<String> nodeIds, String newStatement) {
        assuranceCase.requireMutable();
        Snapshot current = assuranceCase.snapshot();
        ArgumentGraph graph = current.graph();
        Set<String> selected = new LinkedHashSet<>(nodeIds);
        if (selected.isEmpty()) {
            throw new CompositionException(CompositionErrorCode.DISCONNECTED_SUBGRAPH, null, "Nothing to abstract");
        }
        for (String id : selected) {
            if (!graph.contains(id)) {
                throw new CompositionException(CompositionErrorCode.DISCONNECTED_SUBGRAPH, id, "Unknown node in subgraph: " + id);
            }
        }
        if (!isConnected(graph, selected)) {
            throw new CompositionException(CompositionErrorCode.DISCONNECTED_SUBGRAPH, null, "Subgraph is not connected: " + selected);
        }
        List<String> subRoots = selected.stream()
                .filter(id -> graph.find(id).orElseThrow().kind().isNumeric())
                .filter(id -> Arrays.stream(graph.supportParents(graph.indexOf(id)))
                        .noneMatch(p -> selected.contains(graph.node(p).id())))
                .toList();
        if (subRoots.size() != 1) {
            throw new CompositionException(CompositionErrorCode.DISCONNECTED_SUBGRAPH, null,
                    "Subgraph must have exactly one sub-root, found " + subRoots);
        }
        String subRootId = subRoots.get(0);

        ArgumentGraph.Builder builder = graph.toBuilder();
        List<GsnEdge> rewired = new ArrayList<>();
        for (GsnEdge e : graph.edges()) {
            boolean fromInside = selected.contains(e.from());
            boolean toInside = selected.contains(e.to());
            if (fromInside == toInside) continue;
            String from = fromInside ? subRootId : e.from();
            String to = toInside ? subRootId : e.to();
            rewired.add(new GsnEdge(from, to, e.relation(), e.defeaterId()));
        }
        selected.stream().filter(id -> !id.equals(subRootId)).forEach(builder::removeNode);

        GsnNode collapsed = new GsnNode(subRootId, NodeKind.GOAL, newStatement, null,
                Map.of("abstracted", "true", "abstractedFrom", selected.stream().sorted().collect(Collectors.joining(","))),
                List.of());
        OptionalDouble display = displayConfidence(graph, subRootId, selected);
        if (display.isPresent()) {
            collapsed = collapsed.withMetadata("displayConfidence", String.format(Locale.ROOT, "%.6f", display.getAsDouble()));
        }
        builder.removeEdges(e -> e.from().equals(subRootId) || e.to().equals(subRootId));
        for (GsnEdge e : graph.edges()) {
            if ((e.from().equals(subRootId) && !selected.contains(e.to())) || (e.to().equals(subRootId) && !selected.contains(e.from()))) {
                builder.edge(e);
            }
        }
        builder.replaceNode(collapsed);
        rewired.forEach(builder::edge);

        List<String> ports = current.openPorts().stream().filter(p -> !selected.contains(p)).toList();
        Snapshot next = new Snapshot(builder.build(), current.rootGoalId(), ports, current.provenance());
        commit(assuranceCase, next, "abstract", args("nodes", String.join(",", selected), "statement", newStatement));
        return assuranceCase;
    }

    public AssuranceCase seal(AssuranceCase assuranceCase) {
        assuranceCase.seal();
        log.info("Sealed case {} at revision {}", assuranceCase.id(), assuranceCase.revision());
        return assuranceCase;
    }

    public ScriptResult run(AssuranceCase assuranceCase, List<ArgTLOperation> script, FragmentStore store) {
        List<ScriptStep> steps = new ArrayList<>();
        for (int i = 0; i < script.size(); i++) {
            ArgTLOperation operation = script.get(i);
            try {
                apply(assuranceCase, operation, store);
                steps.add(new ScriptStep(i, operation.op(), true, null, null));
            } catch (AssuranceException e) {
                log.info("ArgTL step {} ({}) failed on case {}: {}", i, operation.op(), assuranceCase.id(), e.getMessage());
                steps.add(new ScriptStep(i, operation.op(), false, e.code(), e.getMessage()));
                return new ScriptResult(false, steps);
            }
        }
        return new ScriptResult(true, steps);
    }

    public AssuranceCase apply(AssuranceCase assuranceCase, ArgTLOperation operation, FragmentStore store) {
        if (operation instanceof Compose c) {
            return compose(assuranceCase, c.portGoalId(), store.get(c.fragmentName()));
        } else if (operation instanceof Refine r) {
            return refine(assuranceCase, r.goalId(), r.template());
        } else if (operation instanceof Abstract a) {
            return abstractSubgraph(assuranceCase, a.nodeIds(), a.statement());
        } else if (operation instanceof Seal) {
            return seal(assuranceCase);
        }
        throw new CompositionException(CompositionErrorCode.UNKNOWN_OPERATION, null, "Unknown ArgTL operation: " + operation.op());
    }

    private Snapshot seed(String portGoalId, Fragment fragment, String fragmentRootId) {
        if (portGoalId != null) {
            throw new CompositionException(CompositionErrorCode.PORT_MISMATCH, portGoalId, "Empty case has no port " + portGoalId);
        }
        return new Snapshot(fragment.graph(), fragmentRootId, fragment.ports(), List.of(fragment.id()));
    }

    private Snapshot attach(Snapshot current, String portGoalId, Fragment fragment, GsnNode fragmentRoot) {
        ArgumentGraph graph = current.graph();
        GsnNode port = portGoalId == null ? null : graph.find(portGoalId).orElse(null);
        if (port == null || port.kind() != NodeKind.GOAL || !current.openPorts().contains(portGoalId) || graph.hasSupport(portGoalId)) {
            throw new CompositionException(CompositionErrorCode.PORT_MISMATCH, portGoalId, "Not an open goal port: " + portGoalId);
        }

        Map<String, String> rename = renameFragmentNodes(graph, fragment, fragmentRoot.id(), portGoalId);
        ArgumentGraph.Builder builder = graph.toBuilder();

        GsnNode unified = port.withMetadata("composedFrom", fragment.id())
                .withMetadata("fragmentClaim", fragmentRoot.statement());
        for (var entry : fragmentRoot.metadata().entrySet()) {
            if (port.meta(entry.getKey()) == null) unified = unified.withMetadata(entry.getKey(), entry.getValue());
        }
        builder.replaceNode(unified);

        for (GsnNode node : fragment.graph().nodes()) {
            if (node.id().equals(fragmentRoot.id())) continue;
            builder.node(node.withId(rename.get(node.id())));
        }
        for (GsnEdge e : fragment.graph().edges()) {
            builder.edge(new GsnEdge(rename.get(e.from()), rename.get(e.to()), e.relation(), e.defeaterId()));
        }

        List<String> ports = new ArrayList<>(current.openPorts());
        if (!fragment.ports().contains(fragmentRoot.id())) ports.remove(portGoalId);
        fragment.ports().stream()
                .filter(p -> !p.equals(fragmentRoot.id()))
                .map(rename::get)
                .forEach(ports::add);

        List<String> provenance = new ArrayList<>(current.provenance());
        provenance.add(fragment.id());
        return new Snapshot(builder.build(), current.rootGoalId(), ports, provenance);
    }

    // Fragment root maps onto the port. One clash namespaces every other id as <fragmentId>::<id>.
    private Map<String, String> renameFragmentNodes(ArgumentGraph graph, Fragment fragment, String fragmentRootId, String portGoalId) {
        List<String> others = fragment.graph().nodes().stream().map(GsnNode::id).filter(id -> !id.equals(fragmentRootId)).toList();
        boolean collides = others.stream().anyMatch(graph::contains);

        Map<String, String> rename = new HashMap<>();
        rename.put(fragmentRootId, portGoalId);
        for (String id : others) {
            String mapped = collides ? fragment.id() + NAMESPACE_SEPARATOR + id : id;
            if (graph.contains(mapped)) {
                CompositionErrorCode code = fragment.ports().contains(id) ? CompositionErrorCode.DUPLICATE_PORT : CompositionErrorCode.DUPLICATE_NODE;
                throw new CompositionException(code, mapped, "Node id already present in case: " + mapped);
            }
            rename.put(id, mapped);
        }
        return rename;
    }

    private void commit(AssuranceCase assuranceCase, Snapshot next, String operation, Map<String, String> arguments) {
        List<Violation> violations = validator.validate(next.graph(), next.openPorts());
        if (!violations.isEmpty()) {
            log.debug("Rejected {} on case {}: {}", operation, assuranceCase.id(), violations);
            throw new StructuralException(violations);
        }
        assuranceCase.commit(next, operation, arguments);
    }

    private boolean isConnected(ArgumentGraph graph, Set<String> selected) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        String first = selected.iterator().next();
        queue.add(first);
        seen.add(first);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (GsnEdge e : graph.edgesTouching(id)) {
                String other = e.from().equals(id) ? e.to() : e.from();
                if (selected.contains(other) && seen.add(other)) queue.add(other);
            }
        }
        return seen.size() == selected.size();
    }

    private OptionalDouble displayConfidence(ArgumentGraph graph, String subRootId, Set<String> selected) {
        double weighted = 0.0;
        double weights = 0.0;
        boolean any = false;
        for (GsnNode child : graph.supportChildren(subRootId)) {
            if (!selected.contains(child.id()) || child.confidence() == null) continue;
            any = true;
            weighted += child.confidence() * child.confidence();
            weights += child.confidence();
        }
        if (!any) return OptionalDouble.empty();
        return OptionalDouble.of(weights == 0.0 ? 0.0 : weighted / weights);
    }

    // First goalId.S<n> whose derived sub-goal and justification ids are all unused.
    private String freshStrategyId(ArgumentGraph.Builder builder, String goalId, int subGoals, boolean justified) {
        for (int n = 1; ; n++) {
            String candidate = goalId + ".S" + n;
            boolean taken = builder.hasNode(candidate) || (justified && builder.hasNode(candidate + ".J"));
            for (int i = 1; i <= subGoals && !taken; i++) {
                taken = builder.hasNode(candidate + ".G" + i);
            }
            if (!taken) return candidate;
        }
    }

    private Map<String, String> args(String... pairs) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) out.put(pairs[i], pairs[i + 1]);
        return out;
    }
}
