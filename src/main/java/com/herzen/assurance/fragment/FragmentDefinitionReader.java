package com.herzen.assurance.fragment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.assurance.fragment.FragmentModels.DefinitionError;
import com.herzen.assurance.fragment.FragmentModels.DefinitionResult;
import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentModels.FragmentType;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.*;
import com.herzen.assurance.gsn.GsnValidator;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class FragmentDefinitionReader {
    private final ObjectMapper objectMapper;
    private final GsnValidator validator;

    public FragmentDefinitionReader(ObjectMapper objectMapper, GsnValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public DefinitionResult read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return new DefinitionResult(null, List.of(new DefinitionError("INVALID_JSON", e.getOriginalMessage(), "$")));
        }
        if (root == null || !root.isObject()) {
            return new DefinitionResult(null, List.of(new DefinitionError("INVALID_JSON", "Fragment definition must be an object", "$")));
        }
        return read(root);
    }

    public DefinitionResult read(JsonNode root) {
        List<DefinitionError> errors = new ArrayList<>();
        String id = text(root, "id");
        String name = text(root, "name");
        String pattern = text(root, "pattern");
        if (id == null) errors.add(new DefinitionError("MISSING_FIELD", "Fragment id required", "$.id"));
        if (name == null) name = id;
        String typeRaw = text(root, "type");
        FragmentType type = FragmentType.parse(typeRaw);
        if (typeRaw != null && type == null) {
            errors.add(new DefinitionError("UNKNOWN_TYPE", "Unsupported fragment type: " + typeRaw, "$.type"));
        }

        ArgumentGraph.Builder graph = ArgumentGraph.builder();
        JsonNode nodes = root.path("nodes");
        for (int i = 0; i < nodes.size(); i++) {
            readNode(nodes.get(i), "$.nodes[" + i + "]", graph, errors);
        }
        JsonNode edges = root.path("edges");
        for (int i = 0; i < edges.size(); i++) {
            readEdge(edges.get(i), "$.edges[" + i + "]", graph, errors);
        }
        List<String> ports = new ArrayList<>();
        root.path("ports").forEach(p -> ports.add(p.asText()));

        if (!errors.isEmpty() || id == null) return new DefinitionResult(null, errors);

        ArgumentGraph built = graph.build();
        for (Violation v : validator.validate(built, ports)) {
            errors.add(new DefinitionError(v.type().name(), v.message(), v.nodeId() == null ? "$" : "$.nodes[id=" + v.nodeId() + "]"));
        }
        if (!errors.isEmpty()) return new DefinitionResult(null, errors);
        return new DefinitionResult(new Fragment(id, name, pattern, type, built, ports), List.of());
    }

    private void readNode(JsonNode node, String path, ArgumentGraph.Builder graph, List<DefinitionError> errors) {
        String id = text(node, "id");
        String kindRaw = text(node, "kind");
        if (id == null || kindRaw == null) {
            errors.add(new DefinitionError("MISSING_FIELD", "Node id/kind required", path));
            return;
        }
        NodeKind kind = NodeKind.parse(kindRaw);
        if (kind == null) {
            errors.add(new DefinitionError("UNKNOWN_KIND", "Unsupported node kind: " + kindRaw, path + ".kind"));
            return;
        }
        if (graph.hasNode(id)) {
            errors.add(new DefinitionError("DUPLICATE_NODE", "Duplicate node id: " + id, path + ".id"));
            return;
        }
        List<String> evidence = new ArrayList<>();
        node.path("evidence").forEach(e -> evidence.add(e.asText()));
        Map<String, String> metadata = new TreeMap<>();
        node.path("metadata").fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));
        graph.node(new GsnNode(id, kind, text(node, "statement"), null, metadata, evidence));
    }

    private void readEdge(JsonNode edge, String path, ArgumentGraph.Builder graph, List<DefinitionError> errors) {
        String from = text(edge, "from");
        String to = text(edge, "to");
        String relationRaw = text(edge, "relation");
        if (from == null || to == null) {
            errors.add(new DefinitionError("MISSING_FIELD", "Edge from/to required", path));
            return;
        }
        Relation relation = parseRelation(relationRaw == null ? "SupportedBy" : relationRaw);
        if (relation == null) {
            errors.add(new DefinitionError("UNKNOWN_RELATION", "Unsupported relation: " + relationRaw, path + ".relation"));
            return;
        }
        if (!graph.hasNode(from) || !graph.hasNode(to)) {
            errors.add(new DefinitionError("NODE_REF_NOT_FOUND", "Edge references missing node: " + from + "->" + to, path));
            return;
        }
        graph.edge(new GsnEdge(from, to, relation, relation == Relation.UNDERMINES ? text(edge, "defeaterId") : null));
    }

    static Relation parseRelation(String raw) {
        String normalized = raw.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (Relation r : Relation.values()) {
            if (r.name().replace("_", "").equals(normalized)) return r;
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
