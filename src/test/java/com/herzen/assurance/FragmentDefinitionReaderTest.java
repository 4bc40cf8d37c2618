package com.herzen.assurance;

import com.herzen.assurance.fragment.FragmentDefinitionReader;
import com.herzen.assurance.fragment.FragmentModels.FragmentType;
import com.herzen.assurance.gsn.GsnModels.Relation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class FragmentDefinitionReaderTest {
    @Autowired
    private FragmentDefinitionReader reader;

    @Test
    void readsFragmentWithPortsMetadataAndUnderminesEdge() {
        String json = """
                {"id": "web", "name": "web-security", "pattern": "security", "type": "security",
                 "nodes": [
                   {"id": "W.G0", "kind": "Goal", "statement": "Web tier is secure"},
                   {"id": "W.S1", "kind": "Strategy", "statement": "Argue per threat", "metadata": {"aggregator": "min"}},
                   {"id": "W.G1", "kind": "goal", "statement": "Injection mitigated"},
                   {"id": "W.Sol1", "kind": "Solution", "statement": "DAST report", "evidence": ["zap-2024"]},
                   {"id": "W.A1", "kind": "Assumption", "statement": "Scanner rules current"}
                 ],
                 "edges": [
                   {"from": "W.G0", "to": "W.S1"},
                   {"from": "W.S1", "to": "W.G1", "relation": "SUPPORTED_BY"},
                   {"from": "W.S1", "to": "W.Sol1", "relation": "SupportedBy"},
                   {"from": "W.A1", "to": "W.Sol1", "relation": "Undermines", "defeaterId": "D-RULES"}
                 ],
                 "ports": ["W.G1"]}
                """;

        var result = reader.read(json);
        assertTrue(result.valid(), () -> result.errors().toString());
        var fragment = result.fragment();
        assertEquals("web-security", fragment.name());
        assertEquals(FragmentType.SECURITY, fragment.type());
        assertEquals("W.G0", fragment.rootGoalId());
        assertEquals("min", fragment.graph().find("W.S1").orElseThrow().meta("aggregator"));
        assertEquals(1, fragment.graph().edgesOf(Relation.UNDERMINES).size());
        assertEquals("D-RULES", fragment.graph().edgesOf(Relation.UNDERMINES).get(0).defeaterId());
    }

    @Test
    void reportsStructuredErrors() {
        String json = """
                {"name": "broken", "type": "hardware",
                 "nodes": [
                   {"id": "G1", "kind": "Claim", "statement": "?"},
                   {"id": "G2", "kind": "Goal"},
                   {"id": "G2", "kind": "Goal"}
                 ],
                 "edges": [{"from": "G2", "to": "G9"}, {"from": "G2", "to": "G2", "relation": "Refutes"}]}
                """;
        var result = reader.read(json);
        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("MISSING_FIELD") && e.path().equals("$.id")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("UNKNOWN_KIND") && e.path().equals("$.nodes[0].kind")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("UNKNOWN_TYPE") && e.path().equals("$.type")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("DUPLICATE_NODE")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("NODE_REF_NOT_FOUND")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("UNKNOWN_RELATION")));

        assertEquals("INVALID_JSON", reader.read("{not json").errors().get(0).code());
    }

    @Test
    void structuralViolationsBecomeDefinitionErrors() {
        String json = """
                {"id": "orphan", "nodes": [{"id": "Sol", "kind": "Solution", "statement": "no refs"}]}
                """;
        var result = reader.read(json);
        assertFalse(result.valid());
        assertEquals("ORPHAN_EVIDENCE", result.errors().get(0).code());
    }
}
