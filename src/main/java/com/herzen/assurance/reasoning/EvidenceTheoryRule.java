package com.herzen.assurance.reasoning;

import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.reasoning.ReasoningModels.Finding;
import com.herzen.assurance.reasoning.ReasoningModels.Judgement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.DoublePredicate;

// Judges Solutions tagged with evidenceType. Metrics come from node metadata, booleans written true/false.
@Component
public class EvidenceTheoryRule implements BehavioralRule {
    private static final Logger log = LoggerFactory.getLogger(EvidenceTheoryRule.class);

    public static final String EVIDENCE_TYPE = "evidenceType";

    record Premise(String metric, DoublePredicate holds, String description) {}

    record EvidenceTheory(String evidenceType, double confidence, List<Premise> premises) {}

    record KnownDefeater(String code, String evidenceType, String metric, DoublePredicate applies,
                         String argument, double impactWeight, boolean defeats) {}

    private static final List<EvidenceTheory> THEORIES = List.of(
            new EvidenceTheory("test_coverage", 0.85, List.of(
                    new Premise("coverage", v -> v >= 80, "coverage >= 80%"),
                    new Premise("testsPassed", v -> v == 1.0, "all tests pass"),
                    new Premise("branchCoverage", v -> v >= 70, "branch coverage >= 70%"))),
            new EvidenceTheory("static_analysis", 0.75, List.of(
                    new Premise("scanComplete", v -> v == 1.0, "scan completed"),
                    new Premise("criticalIssues", v -> v == 0, "no critical issues"),
                    new Premise("highIssues", v -> v <= 2, "at most 2 high issues"))),
            new EvidenceTheory("code_review", 0.80, List.of(
                    new Premise("reviewCompleted", v -> v == 1.0, "review completed"),
                    new Premise("reviewerQualified", v -> v == 1.0, "reviewer qualified"),
                    new Premise("issuesResolved", v -> v == 1.0, "review issues resolved"))));

    // null evidenceType applies to every tagged Solution
    private static final List<KnownDefeater> DEFEATERS = List.of(
            new KnownDefeater("COVERAGE_LIMITATION", "test_coverage", "mutationScore", v -> v < 70,
                    "High coverage does not guarantee test quality", 0.5, false),
            new KnownDefeater("STATIC_ANALYSIS_LIMITATION", "static_analysis", "dynamicTesting", v -> v == 0.0,
                    "Static analysis cannot detect runtime vulnerabilities or logic flaws", 0.8, true),
            new KnownDefeater("VULNERABLE_DEPENDENCIES", null, "vulnerableDependencies", v -> v > 0,
                    "Component uses dependencies with known vulnerabilities", 1.0, true));

    @Override
    public Judgement evaluate(NodeScope scope) {
        GsnNode node = scope.node();
        String evidenceType = node.meta(EVIDENCE_TYPE);
        if (node.kind() != NodeKind.SOLUTION || evidenceType == null) return Judgement.none();

        OptionalDouble cap = OptionalDouble.empty();
        List<Finding> findings = new ArrayList<>();
        EvidenceTheory theory = THEORIES.stream()
                .filter(t -> t.evidenceType().equals(evidenceType))
                .findFirst()
                .orElse(null);
        if (theory != null) {
            List<String> unmet = theory.premises().stream()
                    .filter(p -> !holds(node, p.metric(), p.holds()))
                    .map(Premise::description)
                    .toList();
            if (unmet.isEmpty()) {
                cap = OptionalDouble.of(theory.confidence());
            } else {
                findings.add(Finding.defeating("UNMET_PREMISE",
                        "Evidence " + node.id() + " does not establish " + String.join(", ", unmet), 0.7));
            }
        }
        for (KnownDefeater defeater : DEFEATERS) {
            if (defeater.evidenceType() != null && !defeater.evidenceType().equals(evidenceType)) continue;
            if (node.meta(defeater.metric()) == null || !holds(node, defeater.metric(), defeater.applies())) continue;
            findings.add(new Finding(defeater.code(), defeater.argument(), defeater.impactWeight(), defeater.defeats()));
        }
        if (!findings.isEmpty()) {
            log.debug("Evidence {} ({}) raised {}", node.id(), evidenceType, findings.stream().map(Finding::code).toList());
        }
        return new Judgement(cap, findings);
    }

    // A missing or unreadable metric never holds.
    private boolean holds(GsnNode node, String metric, DoublePredicate predicate) {
        Double value = metric(node.meta(metric));
        return value != null && predicate.test(value);
    }

    private static Double metric(String raw) {
        if (raw == null) return null;
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true")) return 1.0;
        if (value.equals("false")) return 0.0;
        try {
            return Double.parseDouble(value.endsWith("%") ? value.substring(0, value.length() - 1) : value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
