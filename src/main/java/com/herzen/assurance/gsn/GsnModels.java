package com.herzen.assurance.gsn;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public class GsnModels {
    public enum NodeKind {
        GOAL, STRATEGY, SOLUTION, CONTEXT, ASSUMPTION, JUSTIFICATION;

        public boolean isNumeric() {
            return switch (this) {
                case GOAL, STRATEGY, SOLUTION -> true;
                case CONTEXT, ASSUMPTION, JUSTIFICATION -> false;
            };
        }

        public static NodeKind parse(String raw) {
            if (raw == null) return null;
            for (NodeKind kind : values()) {
                if (kind.name().equalsIgnoreCase(raw.trim())) return kind;
            }
            return null;
        }
    }

    public enum Relation { SUPPORTED_BY, IN_CONTEXT_OF, UNDERMINES }

    public record GsnNode(String id,
                          NodeKind kind,
                          String statement,
                          Double confidence,
                          Map<String, String> metadata,
                          List<String> evidenceRefs) {
        public GsnNode {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            statement = statement == null ? "" : statement;
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
            evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
            if (confidence != null && (confidence < 0.0 || confidence > 1.0 || confidence.isNaN())) {
                throw new IllegalArgumentException("Confidence out of [0,1] for node " + id + ": " + confidence);
            }
        }

        public static GsnNode of(String id, NodeKind kind, String statement) {
            return new GsnNode(id, kind, statement, null, Map.of(), List.of());
        }

        public static GsnNode solution(String id, String statement, String... evidenceRefs) {
            return new GsnNode(id, NodeKind.SOLUTION, statement, null, Map.of(), List.of(evidenceRefs));
        }

        public String meta(String key) {
            return metadata.get(key);
        }

        public GsnNode withId(String newId) {
            return new GsnNode(newId, kind, statement, confidence, metadata, evidenceRefs);
        }

        public GsnNode withConfidence(Double value) {
            return new GsnNode(id, kind, statement, value, metadata, evidenceRefs);
        }

        public GsnNode withStatement(String value) {
            return new GsnNode(id, kind, value, confidence, metadata, evidenceRefs);
        }

        public GsnNode withMetadata(String key, String value) {
            Map<String, String> copy = new TreeMap<>(metadata);
            copy.put(key, value);
            return new GsnNode(id, kind, statement, confidence, copy, evidenceRefs);
        }
    }

    public record GsnEdge(String from, String to, Relation relation, String defeaterId) {
        public GsnEdge {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(relation, "relation");
        }

        public static GsnEdge supportedBy(String from, String to) {
            return new GsnEdge(from, to, Relation.SUPPORTED_BY, null);
        }

        public static GsnEdge inContextOf(String from, String to) {
            return new GsnEdge(from, to, Relation.IN_CONTEXT_OF, null);
        }

        public static GsnEdge undermines(String from, String to, String defeaterId) {
            return new GsnEdge(from, to, Relation.UNDERMINES, defeaterId);
        }

        public boolean isSupport() {
            return relation == Relation.SUPPORTED_BY;
        }
    }

    public enum ViolationType { CYCLE_DETECTED, ORPHAN_EVIDENCE, UNSUPPORTED_STRATEGY, MULTIPLE_ROOTS, MALFORMED_PORT }

    public record Violation(ViolationType type, String nodeId, List<String> path, String message) {
        public Violation {
            path = path == null ? List.of() : List.copyOf(path);
        }

        public static Violation of(ViolationType type, String nodeId, String message) {
            return new Violation(type, nodeId, List.of(), message);
        }
    }
}
