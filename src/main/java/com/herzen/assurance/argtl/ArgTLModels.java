package com.herzen.assurance.argtl;

import java.util.List;
import java.util.Locale;

public class ArgTLModels {
    public enum CompositionStrategy {
        PARALLEL, SEQUENTIAL, HIERARCHICAL;

        public static CompositionStrategy parse(String raw) {
            if (raw == null) return null;
            for (CompositionStrategy strategy : values()) {
                if (strategy.name().equals(raw.trim().toUpperCase(Locale.ROOT))) return strategy;
            }
            return null;
        }
    }

    public record StrategyTemplate(String strategyStatement,
                                   String aggregator,
                                   List<String> subGoalStatements,
                                   String justification) {
        public StrategyTemplate {
            subGoalStatements = subGoalStatements == null ? List.of() : List.copyOf(subGoalStatements);
        }

        public static StrategyTemplate of(String strategyStatement, String... subGoals) {
            return new StrategyTemplate(strategyStatement, null, List.of(subGoals), null);
        }
    }

    public interface ArgTLOperation {
        String op();
    }

    public record Compose(String portGoalId, String fragmentName) implements ArgTLOperation {
        public String op() { return "compose"; }
    }

    public record Refine(String goalId, StrategyTemplate template) implements ArgTLOperation {
        public String op() { return "refine"; }
    }

    public record Abstract(List<String> nodeIds, String statement) implements ArgTLOperation {
        public Abstract {
            nodeIds = List.copyOf(nodeIds);
        }

        public String op() { return "abstract"; }
    }

    public record Seal() implements ArgTLOperation {
        public String op() { return "seal"; }
    }

    public record ScriptStep(int index, String op, boolean ok, String errorCode, String message) {}

    public record ScriptResult(boolean completed, List<ScriptStep> steps) {
        public ScriptResult {
            steps = List.copyOf(steps);
        }

        public ScriptStep failure() {
            return steps.stream().filter(s -> !s.ok()).findFirst().orElse(null);
        }
    }

    public record ScriptParseError(int index, String message) {}

    public record ParsedScript(List<ArgTLOperation> operations, List<ScriptParseError> errors) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }
}
