package com.herzen.assurance;

import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.*;
import com.herzen.assurance.gsn.GsnValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GsnValidatorTest {
    private final GsnValidator validator = new GsnValidator();

    @Test
    void acceptsWellFormedArgument() {
        assertTrue(validator.validate(AssuranceFixtures.exampleGraph().build()).isEmpty());
        assertTrue(validator.validate(ArgumentGraph.empty()).isEmpty());
    }

    @Test
    void reportsSupportCycleWithConcretePath() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .node(GsnNode.of("G0", NodeKind.GOAL, "root"))
                .node(GsnNode.of("G1", NodeKind.GOAL, "a"))
                .node(GsnNode.of("G2", NodeKind.GOAL, "b"))
                .edge(GsnEdge.supportedBy("G0", "G1"))
                .edge(GsnEdge.supportedBy("G1", "G2"))
                .edge(GsnEdge.supportedBy("G2", "G1"))
                .build();

        List<Violation> violations = validator.validate(graph);
        Violation cycle = violations.stream().filter(v -> v.type() == ViolationType.CYCLE_DETECTED).findFirst().orElseThrow();
        assertEquals(3, cycle.path().size());
        assertEquals(cycle.path().get(0), cycle.path().get(2));
        assertTrue(cycle.path().containsAll(List.of("G1", "G2")));
        assertThrows(IllegalStateException.class, () -> validator.topologicalOrder(graph));
    }

    @Test
    void flagsOrphanSolutionAndUnsupportedStrategy() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "root"))
                .node(GsnNode.of("S1", NodeKind.STRATEGY, "empty strategy"))
                .node(GsnNode.of("S2", NodeKind.STRATEGY, "with solution"))
                .node(GsnNode.of("Sol1", NodeKind.SOLUTION, "no evidence"))
                .edge(GsnEdge.supportedBy("G1", "S1"))
                .edge(GsnEdge.supportedBy("G1", "S2"))
                .edge(GsnEdge.supportedBy("S2", "Sol1"))
                .build();

        List<Violation> violations = validator.validate(graph);
        assertTrue(violations.stream().anyMatch(v -> v.type() == ViolationType.ORPHAN_EVIDENCE && v.nodeId().equals("Sol1")));
        assertTrue(violations.stream().anyMatch(v -> v.type() == ViolationType.UNSUPPORTED_STRATEGY && v.nodeId().equals("S1")));
        assertFalse(violations.stream().anyMatch(v -> v.type() == ViolationType.UNSUPPORTED_STRATEGY && v.nodeId().equals("S2")));
    }

    @Test
    void requiresExactlyOneRootGoal() {
        ArgumentGraph twoRoots = ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "one"))
                .node(GsnNode.of("G2", NodeKind.GOAL, "two"))
                .node(GsnNode.of("C1", NodeKind.CONTEXT, "context is not a root"))
                .build();
        assertTrue(validator.validate(twoRoots).stream().anyMatch(v -> v.type() == ViolationType.MULTIPLE_ROOTS));

        ArgumentGraph strategyRoot = ArgumentGraph.builder()
                .node(GsnNode.of("S1", NodeKind.STRATEGY, "root strategy"))
                .node(GsnNode.solution("Sol1", "evidence", "ref"))
                .edge(GsnEdge.supportedBy("S1", "Sol1"))
                .build();
        assertTrue(validator.validate(strategyRoot).stream().anyMatch(v -> v.type() == ViolationType.MULTIPLE_ROOTS));
    }

    @Test
    void checksOpenPortsAreUnsupportedGoals() {
        ArgumentGraph graph = AssuranceFixtures.exampleGraph()
                .node(GsnNode.of("G2", NodeKind.GOAL, "open"))
                .edge(GsnEdge.supportedBy("S1", "G2"))
                .build();

        assertTrue(validator.validate(graph, List.of("G2")).isEmpty());
        List<Violation> violations = validator.validate(graph, List.of("G1", "S1", "missing"));
        assertEquals(3, violations.stream().filter(v -> v.type() == ViolationType.MALFORMED_PORT).count());
    }

    @Test
    void builderRejectsDanglingEdgesAndDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "a"))
                .node(GsnNode.of("G1", NodeKind.GOAL, "b")));
        assertThrows(IllegalArgumentException.class, () -> ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "a"))
                .edge(GsnEdge.supportedBy("G1", "nowhere"))
                .build());
        assertThrows(IllegalArgumentException.class, () -> GsnNode.of("G1", NodeKind.GOAL, "a").withConfidence(1.5));
    }
}
