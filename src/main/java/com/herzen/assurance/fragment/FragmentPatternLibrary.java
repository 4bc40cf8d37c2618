package com.herzen.assurance.fragment;

import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentModels.FragmentPattern;
import com.herzen.assurance.fragment.FragmentModels.FragmentType;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class FragmentPatternLibrary {
    private final Map<String, FragmentPattern> patterns = new ConcurrentHashMap<>();

    public FragmentPatternLibrary() {
        registerPattern(new FragmentPattern("component_quality", "Component Quality Assurance", "quality",
                List.of("static_analysis", "unit_tests", "code_review"),
                "Component meets quality standards",
                "Argue through multi-faceted quality assessment",
                List.of("Code quality is acceptable", "Tests are comprehensive", "Review process followed")));
        registerPattern(new FragmentPattern("component_security", "Component Security Assurance", "security",
                List.of("security_scan", "dependency_check", "threat_model"),
                "Component is secure",
                "Argue through security analysis",
                List.of("No known vulnerabilities", "Dependencies are secure", "Threats are mitigated")));
        registerPattern(new FragmentPattern("integration", "Integration Assurance", "integration",
                List.of("integration_tests", "api_tests", "compatibility_tests"),
                "Components integrate correctly",
                "Argue through integration testing",
                List.of("APIs are compatible", "Data flow is correct", "Error handling works")));
    }

    public void registerPattern(FragmentPattern pattern) {
        if (pattern.subGoalStatements().isEmpty()) {
            throw new IllegalArgumentException("Pattern needs at least one sub-goal: " + pattern.name());
        }
        patterns.put(pattern.name(), pattern);
    }

    public Optional<FragmentPattern> pattern(String name) {
        return Optional.ofNullable(patterns.get(name));
    }

    public List<String> patternNames() {
        return patterns.keySet().stream().sorted().toList();
    }

    // <fid>.G0 is the root, .S1 the strategy, .G1..Gn the sub-goals and ports.
    public Fragment instantiate(String patternName, String componentName, String fragmentId) {
        FragmentPattern pattern = pattern(patternName)
                .orElseThrow(() -> new IllegalArgumentException("Pattern not found: " + patternName));
        String fid = fragmentId != null ? fragmentId : patternName + "-" + slug(componentName);

        ArgumentGraph.Builder graph = ArgumentGraph.builder();
        String rootId = fid + ".G0";
        String strategyId = fid + ".S1";
        graph.node(GsnNode.of(rootId, NodeKind.GOAL, pattern.rootStatement() + " (" + componentName + ")")
                .withMetadata("requiredEvidence", String.join(",", pattern.requiredEvidence()))
                .withMetadata("component", componentName));
        graph.node(GsnNode.of(strategyId, NodeKind.STRATEGY, pattern.strategyStatement()));
        graph.edge(GsnEdge.supportedBy(rootId, strategyId));

        List<String> ports = new ArrayList<>();
        for (int i = 0; i < pattern.subGoalStatements().size(); i++) {
            String goalId = fid + ".G" + (i + 1);
            graph.node(GsnNode.of(goalId, NodeKind.GOAL, pattern.subGoalStatements().get(i)));
            graph.edge(GsnEdge.supportedBy(strategyId, goalId));
            ports.add(goalId);
        }
        return new Fragment(fid, pattern.title() + " for " + componentName, pattern.name(),
                FragmentType.parse(pattern.category()), graph.build(), ports);
    }

    private String slug(String value) {
        if (value == null || value.isBlank()) return "component";
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
    }
}
