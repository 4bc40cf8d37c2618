package com.herzen.assurance.argtl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.assurance.argtl.ArgTLModels.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class ArgTLScriptReader {
    private final ObjectMapper objectMapper;

    public ArgTLScriptReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedScript read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return new ParsedScript(List.of(), List.of(new ScriptParseError(-1, "Invalid JSON: " + e.getOriginalMessage())));
        }
        if (root == null || !root.isArray()) {
            return new ParsedScript(List.of(), List.of(new ScriptParseError(-1, "Script must be a JSON array")));
        }

        List<ArgTLOperation> operations = new ArrayList<>();
        List<ScriptParseError> errors = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode step = root.get(i);
            JsonNode args = step.has("args") ? step.get("args") : step;
            String op = text(step, "op");
            if (op == null) {
                errors.add(new ScriptParseError(i, "Missing op"));
                continue;
            }
            switch (op.toLowerCase(Locale.ROOT)) {
                case "compose" -> {
                    String fragment = text(args, "fragment");
                    if (fragment == null) errors.add(new ScriptParseError(i, "compose requires fragment"));
                    else operations.add(new Compose(text(args, "port"), fragment));
                }
                case "refine" -> {
                    String goal = text(args, "goal");
                    String strategy = text(args, "strategy");
                    List<String> subGoals = strings(args.path("subGoals"));
                    if (goal == null || strategy == null || subGoals.isEmpty()) {
                        errors.add(new ScriptParseError(i, "refine requires goal, strategy and subGoals"));
                    } else {
                        operations.add(new Refine(goal, new StrategyTemplate(strategy, text(args, "aggregator"), subGoals, text(args, "justification"))));
                    }
                }
                case "abstract" -> {
                    List<String> nodes = strings(args.path("nodes"));
                    String statement = text(args, "statement");
                    if (nodes.isEmpty() || statement == null) errors.add(new ScriptParseError(i, "abstract requires nodes and statement"));
                    else operations.add(new Abstract(nodes, statement));
                }
                case "seal" -> operations.add(new Seal());
                default -> errors.add(new ScriptParseError(i, "Unknown op: " + op));
            }
        }
        return new ParsedScript(List.copyOf(operations), List.copyOf(errors));
    }

    private List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
