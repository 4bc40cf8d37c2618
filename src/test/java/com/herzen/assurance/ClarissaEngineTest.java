package com.herzen.assurance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.assurance.argtl.ArgTLInterpreter;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.*;
import com.herzen.assurance.error.CompositionErrorCode;
import com.herzen.assurance.error.CompositionException;
import com.herzen.assurance.error.MissingEvidenceException;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.reasoning.*;
import com.herzen.assurance.reasoning.ReasoningModels.AnalysisOptions;
import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;
import com.herzen.assurance.reasoning.ReasoningModels.Finding;
import com.herzen.assurance.reasoning.ReasoningModels.Judgement;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ClarissaEngineTest {
    @Autowired
    private ClarissaEngine engine;

    @Autowired
    private ArgTLInterpreter interpreter;

    @Autowired
    private AggregatorRegistry aggregators;

    @Autowired
    private ObjectMapper objectMapper;

    private AssuranceCase caseOf(String id, ArgumentGraph graph) {
        AssuranceCase assuranceCase = AssuranceCase.empty(id, id);
        interpreter.compose(assuranceCase, null, AssuranceFixtures.fragment(id, graph));
        return assuranceCase;
    }

    private AssuranceCase exampleCase() {
        return caseOf("example", AssuranceFixtures.exampleGraph().build());
    }

    @Test
    void averagesStrategyAndPassesSingleSupportToGoal() {
        AssuranceCase assuranceCase = exampleCase();
        ConfidenceReport report = engine.analyze(assuranceCase, AssuranceFixtures.evidence(0.9, 0.6));

        assertEquals(0.75, report.confidenceOf("S1"), 1e-9);
        assertEquals(0.75, report.confidenceOf("G1"), 1e-9);
        assertEquals(0.75, report.overallConfidence(), 1e-9);
        assertTrue(report.defeaters().isEmpty());
        assertTrue(report.defeatedNodes().isEmpty());
        assertEquals(RiskLevel.LOW, report.riskLevel());
        assertEquals(CaseState.ANALYZED, assuranceCase.state());
        assertEquals(0.75, assuranceCase.graph().find("G1").orElseThrow().confidence(), 1e-9);
    }

    @Test
    void lowEvidenceDefeatsSolutionButNotRoot() {
        AssuranceCase assuranceCase = exampleCase();
        ConfidenceReport report = engine.analyze(assuranceCase, AssuranceFixtures.evidence(0.9, 0.3));

        assertEquals(0.6, report.confidenceOf("S1"), 1e-9);
        assertEquals(0.6, report.overallConfidence(), 1e-9);
        assertEquals(List.of("Sol2"), report.defeatedNodes());
        assertEquals("DEF-LOW_CONFIDENCE-Sol2", report.defeatersOf("Sol2").get(0).id());
        assertEquals(DefeaterStatus.OPEN, assuranceCase.defeaters().find("DEF-LOW_CONFIDENCE-Sol2").orElseThrow().status());
    }

    @Test
    void reanalysisMatchesFreshAnalysisOfSameEvidence() {
        AssuranceCase rerun = exampleCase();
        engine.analyze(rerun, AssuranceFixtures.evidence(0.9, 0.45));
        ConfidenceReport again = engine.analyze(rerun, AssuranceFixtures.evidence(0.9, 0.0));
        ConfidenceReport fresh = engine.analyze(caseOf("fresh", AssuranceFixtures.exampleGraph().build()),
                AssuranceFixtures.evidence(0.9, 0.0));

        assertEquals(fresh.defeaters(), again.defeaters());
        assertEquals(fresh.riskLevel(), again.riskLevel());
        assertEquals(fresh.recommendations(), again.recommendations());
        Defeater lowSol2 = rerun.defeaters().find("DEF-LOW_CONFIDENCE-Sol2").orElseThrow();
        assertEquals(1.0, lowSol2.impactWeight(), 1e-9);
        assertTrue(lowSol2.description().startsWith("Confidence 0.000"));
    }

    @Test
    void repeatedAnalysisProducesIdenticalReports() throws Exception {
        AssuranceCase assuranceCase = exampleCase();
        var evidence = AssuranceFixtures.evidence(0.9, 0.3);
        String first = objectMapper.writeValueAsString(engine.analyze(assuranceCase, evidence));
        ArgumentGraph analyzed = assuranceCase.graph();
        String second = objectMapper.writeValueAsString(engine.analyze(assuranceCase, evidence));

        assertEquals(first, second);
        assertEquals(analyzed, assuranceCase.graph());
        assertEquals(1, assuranceCase.defeaters().size());
    }

    @Test
    void loweringEvidenceNeverRaisesRootConfidence() {
        AssuranceCase assuranceCase = exampleCase();
        double previous = 1.0;
        for (double sol2 = 1.0; sol2 >= 0.0; sol2 -= 0.1) {
            double value = Math.max(0.0, sol2);
            double root = engine.analyze(assuranceCase, AssuranceFixtures.evidence(0.9, value)).overallConfidence();
            assertTrue(root <= previous + 1e-12, "root rose to " + root + " at " + value);
            previous = root;
        }
    }

    @Test
    void goalWithAlternativeSupportsCombinesByNoisyOr() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "Claim"))
                .node(GsnNode.solution("Sol1", "Test", "r1"))
                .node(GsnNode.solution("Sol2", "Proof", "r2"))
                .edge(GsnEdge.supportedBy("G1", "Sol1"))
                .edge(GsnEdge.supportedBy("G1", "Sol2"))
                .build();
        ConfidenceReport report = engine.analyze(caseOf("noisy-or", graph), AssuranceFixtures.evidence(0.6, 0.5));
        assertEquals(0.8, report.overallConfidence(), 1e-9);
    }

    @Test
    void singleLeggedStrategyIsDiscountedBySoundnessFactor() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .node(GsnNode.of("G1", NodeKind.GOAL, "Claim"))
                .node(GsnNode.of("S1", NodeKind.STRATEGY, "Single leg"))
                .node(GsnNode.solution("Sol1", "Test", "r1"))
                .edge(GsnEdge.supportedBy("G1", "S1"))
                .edge(GsnEdge.supportedBy("S1", "Sol1"))
                .build();
        ConfidenceReport report = engine.analyze(caseOf("single-leg", graph), new InMemoryEvidenceCollector().put("Sol1", 0.8));
        assertEquals(0.72, report.confidenceOf("S1"), 1e-9);
    }

    @Test
    void staleEvidenceIsDiscountedAndWarned() {
        AssuranceCase assuranceCase = exampleCase();
        var evidence = new InMemoryEvidenceCollector()
                .put("Sol1", new EvidenceRecord(0.9, "ci:unit", 45))
                .put("Sol2", EvidenceRecord.fresh(0.6, "ci:integration"));
        ConfidenceReport report = engine.analyze(assuranceCase, evidence);

        assertEquals(0.45, report.confidenceOf("Sol1"), 1e-9);
        assertTrue(report.warnings().stream().anyMatch(w -> w.code().equals("STALE_EVIDENCE") && w.nodeId().equals("Sol1")));
        assertTrue(report.recommendations().contains("Refresh stale evidence for Sol1"));
    }

    @Test
    void missingEvidenceFailsUnlessWorstCase() {
        AssuranceCase assuranceCase = exampleCase();
        var partial = new InMemoryEvidenceCollector().put("Sol1", 0.9);

        var error = assertThrows(MissingEvidenceException.class, () -> engine.analyze(assuranceCase, partial));
        assertEquals(List.of("Sol2"), error.solutionIds());
        assertEquals(CaseState.DRAFT, assuranceCase.state());

        ConfidenceReport report = engine.analyze(assuranceCase, partial, AnalysisOptions.worstCaseMode());
        assertEquals(0.0, report.confidenceOf("Sol2"));
        assertEquals(0.45, report.confidenceOf("S1"), 1e-9);
        assertTrue(report.isDefeated("S1"));
        assertEquals(0.45, report.overallConfidence(), 1e-9);
        assertTrue(report.warnings().stream().anyMatch(w -> w.code().equals("MISSING_EVIDENCE")));
    }

    @Test
    void underminedChildIsCappedUntilDefeaterIsMitigated() {
        ArgumentGraph graph = AssuranceFixtures.exampleGraph()
                .node(GsnNode.of("A1", NodeKind.ASSUMPTION, "Test rig differs from production"))
                .edge(GsnEdge.undermines("A1", "Sol1", "D-RIG"))
                .build();
        AssuranceCase assuranceCase = caseOf("undermined", graph);
        var evidence = AssuranceFixtures.evidence(0.9, 0.6);

        ConfidenceReport report = engine.analyze(assuranceCase, evidence);
        assertTrue(report.isDefeated("Sol1"));
        assertEquals(0.9, report.confidenceOf("Sol1"), 1e-9);
        assertEquals(0.55, report.confidenceOf("S1"), 1e-9);

        assuranceCase.resolveDefeater("D-RIG", DefeaterStatus.MITIGATED);
        ConfidenceReport mitigated = engine.analyze(assuranceCase, evidence);
        assertFalse(mitigated.isDefeated("Sol1"));
        assertEquals(0.75, mitigated.overallConfidence(), 1e-9);
        assertEquals(DefeaterStatus.MITIGATED, mitigated.defeatersOf("Sol1").get(0).status());
        assertThrows(IllegalArgumentException.class, () -> assuranceCase.resolveDefeater("D-RIG", DefeaterStatus.OPEN));
    }

    @Test
    void manualDefeaterDefeatsItsTargetAndRaisesRisk() {
        AssuranceCase assuranceCase = exampleCase();
        var evidence = AssuranceFixtures.evidence(0.9, 0.6);
        assuranceCase.raiseDefeater(Defeater.manual("M1", "G1", "Hazard analysis is out of date", 0.9));

        ConfidenceReport report = engine.analyze(assuranceCase, evidence);
        assertTrue(report.isDefeated("G1"));
        assertEquals("manual", report.defeatersOf("G1").get(0).source());
        assertEquals(RiskLevel.MEDIUM, report.riskLevel());
        assertTrue(report.recommendations().contains("Critical defeater M1: immediate action required"));

        assertThrows(IllegalArgumentException.class,
                () -> assuranceCase.raiseDefeater(Defeater.manual("M1", "S1", "again", 0.1)));
    }

    @Test
    void invalidContextDefeatsContextAndItsClaim() {
        ArgumentGraph graph = AssuranceFixtures.exampleGraph()
                .node(GsnNode.of("C1", NodeKind.CONTEXT, "Operating envelope v1").withMetadata("valid", "false"))
                .edge(GsnEdge.inContextOf("G1", "C1"))
                .build();
        ConfidenceReport report = engine.analyze(caseOf("context", graph), AssuranceFixtures.evidence(0.9, 0.6));

        assertTrue(report.isDefeated("C1"));
        assertTrue(report.isDefeated("G1"));
        assertEquals("DEF-INVALID_CONTEXT-G1", report.defeatersOf("G1").get(0).id());
        assertNull(report.confidenceOf("C1"));
    }

    @Test
    void undevelopedGoalScoresZero() {
        AssuranceCase assuranceCase = AssuranceCase.empty("undeveloped", "Undeveloped");
        interpreter.compose(assuranceCase, null, AssuranceFixtures.fragment("single",
                ArgumentGraph.builder().node(GsnNode.of("G1", NodeKind.GOAL, "Todo")).build(), "G1"));

        ConfidenceReport report = engine.analyze(assuranceCase, new InMemoryEvidenceCollector());
        assertEquals(0.0, report.overallConfidence());
        assertTrue(report.defeatersOf("G1").stream().anyMatch(d -> d.id().equals("DEF-UNDEVELOPED-G1")));
        assertEquals(RiskLevel.HIGH, report.riskLevel());
    }

    /*
     * The aggregation policy for strategies is an assumption: average unless a strategy
     * names another aggregator in its metadata.
     */
    @Test
    void strategyAggregatorIsAverageByDefaultAndSelectablePerNode() {
        AssuranceCase byDefault = exampleCase();
        assertEquals(0.75, engine.analyze(byDefault, AssuranceFixtures.evidence(0.9, 0.6)).confidenceOf("S1"), 1e-9);

        ArgumentGraph.Builder minGraph = AssuranceFixtures.exampleGraph();
        minGraph.replaceNode(minGraph.getNode("S1").withMetadata("aggregator", "min"));
        assertEquals(0.6, engine.analyze(caseOf("min", minGraph.build()), AssuranceFixtures.evidence(0.9, 0.6)).confidenceOf("S1"), 1e-9);

        aggregators.register("max", values -> Arrays.stream(values).max().orElse(0.0));
        ArgumentGraph.Builder customGraph = AssuranceFixtures.exampleGraph();
        customGraph.replaceNode(customGraph.getNode("S1").withMetadata("aggregator", "custom:max"));
        assertEquals(0.9, engine.analyze(caseOf("custom", customGraph.build()), AssuranceFixtures.evidence(0.9, 0.6)).confidenceOf("S1"), 1e-9);

        ArgumentGraph.Builder unknownGraph = AssuranceFixtures.exampleGraph();
        unknownGraph.replaceNode(unknownGraph.getNode("S1").withMetadata("aggregator", "median"));
        ConfidenceReport unknown = engine.analyze(caseOf("unknown", unknownGraph.build()), AssuranceFixtures.evidence(0.9, 0.6));
        assertEquals(0.75, unknown.confidenceOf("S1"), 1e-9);
        assertTrue(unknown.warnings().stream().anyMatch(w -> w.code().equals("UNKNOWN_AGGREGATOR")));
    }

    @Test
    void theoriesCombineByTakingTheLowestConfidence() {
        BehavioralTheory behavioral = new BehavioralTheory(List.of(scope ->
                scope.node().id().equals("Sol1")
                        ? new Judgement(OptionalDouble.of(0.4), List.of(Finding.defeating("FLAKY", "Flaky suite", 0.6)))
                        : Judgement.none()));
        List<Theory> theories = List.of(new StructuralTheory(), behavioral, new ProbabilisticTheory());

        ConfidenceReport report = engine.analyze(exampleCase(), AssuranceFixtures.evidence(0.9, 0.6), AnalysisOptions.defaults(), theories);
        assertEquals(0.4, report.confidenceOf("Sol1"), 1e-9);
        assertTrue(report.defeatersOf("Sol1").stream().anyMatch(d -> d.id().equals("DEF-FLAKY-Sol1") && d.source().equals("behavioral")));
        assertEquals(0.5, report.confidenceOf("S1"), 1e-9);
    }

    @Test
    void taggedEvidenceIsJudgedByItsTheoryAndKnownDefeaters() {
        ArgumentGraph.Builder graph = AssuranceFixtures.exampleGraph();
        graph.replaceNode(graph.getNode("Sol1")
                .withMetadata(EvidenceTheoryRule.EVIDENCE_TYPE, "test_coverage")
                .withMetadata("coverage", "92%")
                .withMetadata("testsPassed", "true")
                .withMetadata("branchCoverage", "75")
                .withMetadata("mutationScore", "60"));
        graph.replaceNode(graph.getNode("Sol2")
                .withMetadata(EvidenceTheoryRule.EVIDENCE_TYPE, "static_analysis")
                .withMetadata("scanComplete", "true")
                .withMetadata("criticalIssues", "0")
                .withMetadata("highIssues", "1")
                .withMetadata("dynamicTesting", "false"));
        ConfidenceReport report = engine.analyze(caseOf("tagged", graph.build()), AssuranceFixtures.evidence(0.9, 0.6));

        assertEquals(0.85, report.confidenceOf("Sol1"), 1e-9);
        assertFalse(report.isDefeated("Sol1"));
        Defeater coverage = report.defeatersOf("Sol1").get(0);
        assertEquals("DEF-COVERAGE_LIMITATION-Sol1", coverage.id());
        assertEquals(BehavioralTheory.NAME, coverage.source());

        assertEquals(0.6, report.confidenceOf("Sol2"), 1e-9);
        assertTrue(report.isDefeated("Sol2"));
        assertTrue(report.defeatersOf("Sol2").stream().anyMatch(d -> d.id().equals("DEF-STATIC_ANALYSIS_LIMITATION-Sol2")));
    }

    @Test
    void unmetTheoryPremiseDefeatsEvidence() {
        ArgumentGraph.Builder graph = AssuranceFixtures.exampleGraph();
        graph.replaceNode(graph.getNode("Sol1")
                .withMetadata(EvidenceTheoryRule.EVIDENCE_TYPE, "code_review")
                .withMetadata("reviewCompleted", "true")
                .withMetadata("reviewerQualified", "true"));
        ConfidenceReport report = engine.analyze(caseOf("review", graph.build()), AssuranceFixtures.evidence(0.9, 0.6));

        assertEquals(0.9, report.confidenceOf("Sol1"), 1e-9);
        assertTrue(report.isDefeated("Sol1"));
        Defeater unmet = report.defeatersOf("Sol1").get(0);
        assertEquals("DEF-UNMET_PREMISE-Sol1", unmet.id());
        assertTrue(unmet.description().endsWith("review issues resolved"));
        assertFalse(report.isDefeated("Sol2"));
    }

    @Test
    void sealedCaseCannotBeReanalyzed() {
        AssuranceCase assuranceCase = exampleCase();
        engine.analyze(assuranceCase, AssuranceFixtures.evidence(0.9, 0.6));
        interpreter.seal(assuranceCase);

        var error = assertThrows(CompositionException.class, () -> engine.analyze(assuranceCase, AssuranceFixtures.evidence(0.9, 0.6)));
        assertEquals(CompositionErrorCode.CASE_SEALED, error.errorCode());
        assertEquals(0.75, assuranceCase.lastReport().orElseThrow().overallConfidence(), 1e-9);
    }
}
