package com.herzen.assurance;

import com.herzen.assurance.argtl.ArgTLModels.CompositionStrategy;
import com.herzen.assurance.argtl.FragmentComposer;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.ConfidenceReport;
import com.herzen.assurance.error.CompositionErrorCode;
import com.herzen.assurance.error.CompositionException;
import com.herzen.assurance.error.DuplicateFragmentException;
import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentModels.FragmentType;
import com.herzen.assurance.fragment.FragmentPatternLibrary;
import com.herzen.assurance.fragment.FragmentStore;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.gsn.GsnValidator;
import com.herzen.assurance.reasoning.ClarissaEngine;
import com.herzen.assurance.reasoning.InMemoryEvidenceCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class FragmentComposerTest {
    @Autowired
    private FragmentComposer composer;

    @Autowired
    private FragmentPatternLibrary library;

    @Autowired
    private GsnValidator validator;

    @Autowired
    private ClarissaEngine engine;

    private FragmentStore store;

    @BeforeEach
    void setUp() {
        store = new FragmentStore(validator);
        store.register(library.instantiate("component_quality", "api", "quality"));
        store.register(library.instantiate("component_security", "api", "security"));
        for (String name : List.of("static", "unit", "review", "fuzz")) {
            store.register(leaf(name));
        }
    }

    private static Fragment leaf(String id) {
        ArgumentGraph graph = ArgumentGraph.builder()
                .node(GsnNode.of(id + ".G", NodeKind.GOAL, id + " is satisfied"))
                .node(GsnNode.solution(id + ".Sol", id + " report", id + "-report"))
                .edge(GsnEdge.supportedBy(id + ".G", id + ".Sol"))
                .build();
        return AssuranceFixtures.fragment(id, graph);
    }

    private List<String> children(Fragment fragment, String id) {
        return fragment.graph().supportChildren(id).stream().map(GsnNode::id).toList();
    }

    @Test
    void parallelArguesOverEverySourceRoot() {
        Fragment release = composer.compose(store, List.of("quality", "security"), "release", CompositionStrategy.PARALLEL);

        assertEquals("release.G0", release.rootGoalId());
        assertEquals(List.of("release.S1"), children(release, "release.G0"));
        assertEquals(List.of("quality.G0", "security.G0"), children(release, "release.S1"));
        assertEquals(6, release.ports().size());
        assertEquals(FragmentType.QUALITY, release.type());

        GsnNode root = release.graph().find("release.G0").orElseThrow();
        assertEquals("parallel", root.meta("compositionStrategy"));
        assertEquals("quality,security", root.meta("composedOf"));
        assertEquals(6, FragmentStore.requiredEvidence(release).size());
        assertSame(release, store.get("release"));
        assertThrows(DuplicateFragmentException.class,
                () -> composer.compose(store, List.of("quality"), "release", CompositionStrategy.PARALLEL));
    }

    @Test
    void sequentialHangsEachRootUnderThePreviousLeaves() {
        Fragment chain = composer.compose(store, List.of("quality", "security", "static"), "chain", "sequential");

        assertEquals("quality.G0", chain.rootGoalId());
        for (String port : List.of("quality.G1", "quality.G2", "quality.G3")) {
            assertEquals(List.of("security.G0"), children(chain, port));
        }
        for (String port : List.of("security.G1", "security.G2", "security.G3")) {
            assertEquals(List.of("static.G"), children(chain, port));
        }
        assertTrue(chain.ports().isEmpty());
        assertTrue(validator.validate(chain.graph(), chain.ports()).isEmpty());
        assertEquals(CompositionErrorCode.PORT_MISMATCH, assertThrows(CompositionException.class,
                () -> composer.compose(store, List.of("static", "unit"), "dead-end", CompositionStrategy.SEQUENTIAL)).errorCode());
    }

    @Test
    void hierarchicalAttachesChildrenRoundRobin() {
        Fragment tree = composer.compose(store, List.of("quality", "static", "unit", "review", "fuzz"), "tree",
                CompositionStrategy.HIERARCHICAL);

        assertEquals("quality.G0", tree.rootGoalId());
        assertEquals(List.of("static.G", "fuzz.G"), children(tree, "quality.G1"));
        assertEquals(List.of("unit.G"), children(tree, "quality.G2"));
        assertEquals(List.of("review.G"), children(tree, "quality.G3"));
        assertTrue(tree.ports().isEmpty());
    }

    @Test
    void clashingNodeIdsAreNamespaced() {
        store.register(AssuranceFixtures.fragment("ex1", AssuranceFixtures.exampleGraph().build()));
        store.register(AssuranceFixtures.fragment("ex2", AssuranceFixtures.exampleGraph().build()));

        Fragment both = composer.compose(store, List.of("ex1", "ex2"), "both", CompositionStrategy.PARALLEL);

        assertEquals(List.of("G1", "ex2::G1"), children(both, "both.S1"));
        assertTrue(both.graph().contains("ex2::Sol2"));
        assertEquals(10, both.graph().size());
    }

    @Test
    void rejectsUnusableRequests() {
        assertEquals(CompositionErrorCode.UNKNOWN_STRATEGY, assertThrows(CompositionException.class,
                () -> composer.compose(store, List.of("quality"), "x", "diagonal")).errorCode());
        assertEquals(CompositionErrorCode.NOTHING_TO_COMPOSE, assertThrows(CompositionException.class,
                () -> composer.compose(store, List.of(), "x", CompositionStrategy.PARALLEL)).errorCode());
        assertEquals(CompositionErrorCode.PORT_MISMATCH, assertThrows(CompositionException.class,
                () -> composer.compose(store, List.of("static", "unit"), "x", CompositionStrategy.HIERARCHICAL)).errorCode());
        assertFalse(store.contains("x"));
    }

    @Test
    void assembledCaseIsSeededFromHierarchicalComposition() {
        AssuranceCase assuranceCase = composer.assembleCase(store, List.of("quality", "static", "unit", "review"),
                "api-release", "API release");

        assertEquals("api-release", assuranceCase.id());
        assertEquals("quality.G0", assuranceCase.rootGoalId());
        assertEquals(List.of("api-release_composed"), assuranceCase.provenance());
        assertTrue(assuranceCase.openPorts().isEmpty());
        assertTrue(store.contains("api-release_composed"));

        InMemoryEvidenceCollector evidence = new InMemoryEvidenceCollector()
                .put("static.Sol", 0.9)
                .put("unit.Sol", 0.8)
                .put("review.Sol", 0.85);
        ConfidenceReport report = engine.analyze(assuranceCase, evidence);
        assertEquals(0.85, report.overallConfidence(), 1e-9);
        assertTrue(report.defeatedNodes().isEmpty());
    }
}
