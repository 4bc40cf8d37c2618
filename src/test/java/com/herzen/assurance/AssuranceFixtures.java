package com.herzen.assurance;

import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.reasoning.InMemoryEvidenceCollector;
import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;

import java.util.List;

final class AssuranceFixtures {
    private AssuranceFixtures() {
    }

    /** G1 supported by S1, which is supported by Sol1 and Sol2. */
    static ArgumentGraph.Builder exampleGraph() {
        return ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "System is acceptably safe"))
                .node(GsnNode.of("S1", NodeKind.STRATEGY, "Argue over test evidence"))
                .node(GsnNode.solution("Sol1", "Unit test results", "unit-report"))
                .node(GsnNode.solution("Sol2", "Integration test results", "it-report"))
                .edge(GsnEdge.supportedBy("G1", "S1"))
                .edge(GsnEdge.supportedBy("S1", "Sol1"))
                .edge(GsnEdge.supportedBy("S1", "Sol2"));
    }

    static Fragment exampleFragment() {
        return new Fragment("example", "example", "testing", exampleGraph().build(), List.of());
    }

    static Fragment fragment(String id, ArgumentGraph graph, String... ports) {
        return new Fragment(id, id, null, graph, List.of(ports));
    }

    static InMemoryEvidenceCollector evidence(double sol1, double sol2) {
        return new InMemoryEvidenceCollector()
                .put("Sol1", EvidenceRecord.fresh(sol1, "ci:unit"))
                .put("Sol2", EvidenceRecord.fresh(sol2, "ci:integration"));
    }

    /** Fragment definition with a goal {@code <id>.G} backed by one solution {@code <id>.Sol}. */
    static String leafDefinition(String id) {
        return """
                {"id": "%1$s", "name": "%1$s", "pattern": "evidence",
                 "nodes": [
                   {"id": "%1$s.G", "kind": "Goal", "statement": "%1$s is satisfied"},
                   {"id": "%1$s.Sol", "kind": "Solution", "statement": "%1$s report", "evidence": ["%1$s-report"]}
                 ],
                 "edges": [{"from": "%1$s.G", "to": "%1$s.Sol", "relation": "SupportedBy"}],
                 "ports": []}
                """.formatted(id);
    }
}
