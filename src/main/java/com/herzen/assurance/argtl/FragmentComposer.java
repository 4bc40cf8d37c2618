package com.herzen.assurance.argtl;

import com.herzen.assurance.argtl.ArgTLModels.CompositionStrategy;
import com.herzen.assurance.domain.AssuranceCase;
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

// Source nodes that clash with ones already placed become <fragmentId>::<nodeId>.
@Service
public class FragmentComposer {
    private static final Logger log = LoggerFactory.getLogger(FragmentComposer.class);

    static final String PARALLEL_CLAIM = "All components meet requirements";
    static final String PARALLEL_STRATEGY = "Argue over each component independently";

    private final GsnValidator validator;
    private final ArgTLInterpreter interpreter;

    public FragmentComposer(GsnValidator validator, ArgTLInterpreter interpreter) {
        this.validator = validator;
        this.interpreter = interpreter;
    }

    private record Placed(Fragment fragment, String rootId, List<String> leafGoals) {}

    public Fragment compose(FragmentStore store, List<String> names, String targetId, String strategy) {
        CompositionStrategy parsed = CompositionStrategy.parse(strategy);
        if (parsed == null) {
            throw new CompositionException(CompositionErrorCode.UNKNOWN_STRATEGY, null, "Unknown composition strategy: " + strategy);
        }
        return compose(store, names, targetId, parsed);
    }

    public Fragment compose(FragmentStore store, List<String> names, String targetId, CompositionStrategy strategy) {
        if (names == null || names.isEmpty()) {
            throw new CompositionException(CompositionErrorCode.NOTHING_TO_COMPOSE, null, "No fragments to compose into " + targetId);
        }
        List<Fragment> sources = names.stream().map(store::get).toList();

        ArgumentGraph.Builder builder = ArgumentGraph.builder();
        List<String> ports = new ArrayList<>();
        List<Placed> placed = new ArrayList<>();
        for (Fragment source : sources) {
            placed.add(place(builder, source, ports));
        }

        String rootId = switch (strategy) {
            case PARALLEL -> parallel(builder, placed, targetId);
            case SEQUENTIAL -> sequential(builder, placed, ports);
            case HIERARCHICAL -> hierarchical(builder, placed, ports);
        };

        Set<String> required = new LinkedHashSet<>();
        sources.forEach(f -> required.addAll(FragmentStore.requiredEvidence(f)));
        GsnNode root = builder.getNode(rootId).withMetadata("compositionStrategy", strategy.name().toLowerCase(Locale.ROOT))
                .withMetadata("composedOf", String.join(",", names));
        if (!required.isEmpty()) root = root.withMetadata("requiredEvidence", String.join(",", required));
        builder.replaceNode(root);

        ArgumentGraph graph = builder.build();
        List<Violation> violations = validator.validate(graph, ports);
        if (!violations.isEmpty()) {
            log.debug("Rejected {} composition of {} into {}: {}", strategy, names, targetId, violations);
            throw new StructuralException(violations);
        }
        Fragment composed = new Fragment(targetId, targetId, null, sources.get(0).type(), graph, ports);
        store.register(composed);
        log.info("Composed {} into fragment {} ({}, {} nodes)", names, targetId, strategy, graph.size());
        return composed;
    }

    // Hierarchical composition of the fragments, then a fresh case seeded from the result.
    public AssuranceCase assembleCase(FragmentStore store, List<String> names, String caseId, String title) {
        Fragment composed = compose(store, names, caseId + "_composed", CompositionStrategy.HIERARCHICAL);
        AssuranceCase assuranceCase = AssuranceCase.empty(caseId, title);
        interpreter.compose(assuranceCase, null, composed);
        log.info("Assembled case {} from {} fragments", caseId, names.size());
        return assuranceCase;
    }

    private Placed place(ArgumentGraph.Builder builder, Fragment source, List<String> ports) {
        String sourceRoot = source.rootGoalId();
        if (sourceRoot == null) {
            throw new CompositionException(CompositionErrorCode.PORT_MISMATCH, null,
                    "Fragment " + source.name() + " has no single root goal to compose");
        }
        ArgumentGraph graph = source.graph();
        boolean collides = graph.nodes().stream().anyMatch(n -> builder.hasNode(n.id()));
        Map<String, String> rename = new HashMap<>();
        for (GsnNode node : graph.nodes()) {
            String mapped = collides ? source.id() + ArgTLInterpreter.NAMESPACE_SEPARATOR + node.id() : node.id();
            if (builder.hasNode(mapped)) {
                throw new CompositionException(CompositionErrorCode.DUPLICATE_NODE, mapped, "Node id already composed: " + mapped);
            }
            rename.put(node.id(), mapped);
        }
        graph.nodes().forEach(n -> builder.node(n.withId(rename.get(n.id()))));
        graph.edges().forEach(e -> builder.edge(new GsnEdge(rename.get(e.from()), rename.get(e.to()), e.relation(), e.defeaterId())));
        source.ports().forEach(p -> ports.add(rename.get(p)));

        List<String> leafGoals = graph.nodesOfKind(NodeKind.GOAL).stream()
                .map(GsnNode::id)
                .filter(id -> !graph.hasSupport(id))
                .map(rename::get)
                .toList();
        return new Placed(source, rename.get(sourceRoot), leafGoals);
    }

    private String parallel(ArgumentGraph.Builder builder, List<Placed> placed, String targetId) {
        String rootId = targetId + ".G0";
        String strategyId = targetId + ".S1";
        for (String id : List.of(rootId, strategyId)) {
            if (builder.hasNode(id)) {
                throw new CompositionException(CompositionErrorCode.DUPLICATE_NODE, id, "Node id already composed: " + id);
            }
        }
        builder.node(GsnNode.of(rootId, NodeKind.GOAL, PARALLEL_CLAIM));
        builder.node(GsnNode.of(strategyId, NodeKind.STRATEGY, PARALLEL_STRATEGY));
        builder.edge(GsnEdge.supportedBy(rootId, strategyId));
        placed.forEach(p -> builder.edge(GsnEdge.supportedBy(strategyId, p.rootId())));
        return rootId;
    }

    private String sequential(ArgumentGraph.Builder builder, List<Placed> placed, List<String> ports) {
        for (int i = 1; i < placed.size(); i++) {
            Placed previous = placed.get(i - 1);
            attach(builder, previous, placed.get(i), previous.leafGoals(), ports);
        }
        return placed.get(0).rootId();
    }

    private String hierarchical(ArgumentGraph.Builder builder, List<Placed> placed, List<String> ports) {
        Placed parent = placed.get(0);
        for (int i = 1; i < placed.size(); i++) {
            List<String> leaves = parent.leafGoals();
            List<String> target = leaves.isEmpty() ? List.of() : List.of(leaves.get((i - 1) % leaves.size()));
            attach(builder, parent, placed.get(i), target, ports);
        }
        return parent.rootId();
    }

    private void attach(ArgumentGraph.Builder builder, Placed parent, Placed child, List<String> leaves, List<String> ports) {
        if (leaves.isEmpty()) {
            throw new CompositionException(CompositionErrorCode.PORT_MISMATCH, parent.rootId(),
                    "Fragment " + parent.fragment().name() + " has no leaf goal to attach " + child.fragment().name());
        }
        for (String leaf : leaves) {
            builder.edge(GsnEdge.supportedBy(leaf, child.rootId()));
            ports.remove(leaf);
        }
    }
}
