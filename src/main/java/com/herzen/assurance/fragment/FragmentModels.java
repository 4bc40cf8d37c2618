package com.herzen.assurance.fragment;

import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnNode;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public class FragmentModels {
    public enum FragmentType {
        COMPONENT, SUBSYSTEM, SECURITY, SAFETY, QUALITY, PERFORMANCE, INTEGRATION;

        public static FragmentType parse(String raw) {
            if (raw == null || raw.isBlank()) return null;
            for (FragmentType type : values()) {
                if (type.name().equals(raw.trim().toUpperCase(Locale.ROOT))) return type;
            }
            return null;
        }
    }

    public enum FragmentStatus { DRAFT, COMPLETE, VALIDATED, DEPRECATED }

    // ports are goals left open for later composition
    public record Fragment(String id, String name, String pattern, FragmentType type, ArgumentGraph graph, List<String> ports) {
        public Fragment {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(graph, "graph");
            type = type == null ? FragmentType.COMPONENT : type;
            ports = ports == null ? List.of() : List.copyOf(ports);
        }

        public Fragment(String id, String name, String pattern, ArgumentGraph graph, List<String> ports) {
            this(id, name, pattern, FragmentType.COMPONENT, graph, ports);
        }

        public String rootGoalId() {
            List<GsnNode> roots = graph.roots();
            return roots.size() == 1 ? roots.get(0).id() : null;
        }
    }

    public record FragmentPattern(String name,
                                  String title,
                                  String category,
                                  List<String> requiredEvidence,
                                  String rootStatement,
                                  String strategyStatement,
                                  List<String> subGoalStatements) {
        public FragmentPattern {
            requiredEvidence = List.copyOf(requiredEvidence);
            subGoalStatements = List.copyOf(subGoalStatements);
        }
    }

    public record FragmentLink(String source, String target, String interfacePoint) {}

    public record FragmentAssessment(String name,
                                     double strength,
                                     double completeness,
                                     List<String> weaknesses,
                                     FragmentStatus status,
                                     String evidenceCoverage) {
        public FragmentAssessment {
            weaknesses = List.copyOf(weaknesses);
        }
    }

    public enum RuleOutcome { PASSED, FAILED, UNKNOWN_RULE }

    public record DefinitionError(String code, String message, String path) {}

    public record DefinitionResult(Fragment fragment, List<DefinitionError> errors) {
        public boolean valid() {
            return fragment != null && errors.isEmpty();
        }
    }
}
