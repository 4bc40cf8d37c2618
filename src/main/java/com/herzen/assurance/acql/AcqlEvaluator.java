package com.herzen.assurance.acql;

import com.herzen.assurance.acql.AcqlModels.*;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.DefeaterLedger;
import com.herzen.assurance.domain.AssuranceModels.ConfidenceReport;
import com.herzen.assurance.domain.AssuranceModels.Defeater;
import com.herzen.assurance.domain.AssuranceModels.DefeaterStatus;
import com.herzen.assurance.error.AcqlEvaluationException;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;

import java.util.*;

public class AcqlEvaluator {
    static final double DEFAULT_COVERAGE = 0.8;

    private static final List<String[]> CONTRADICTIONS = List.of(
            new String[]{"secure", "insecure"},
            new String[]{"safe", "unsafe"},
            new String[]{"reliable", "unreliable"},
            new String[]{"correct", "incorrect"},
            new String[]{"complete", "incomplete"});

    private static final Set<String> NUMERIC_FIELDS = Set.of("confidence", "evidencecount", "defeatercount");
    private static final Set<String> TEXT_FIELDS = Set.of("status", "id", "kind");

    private final AssuranceCase assuranceCase;
    private final ArgumentGraph graph;
    private final ConfidenceReport report;
    private final double threshold;
    private final Map<String, Integer> evidenceCounts = new HashMap<>();

    public AcqlEvaluator(AssuranceCase assuranceCase, ConfidenceReport report, double defaultThreshold) {
        this.assuranceCase = assuranceCase;
        this.graph = assuranceCase.graph();
        this.report = report;
        this.threshold = report != null ? report.defeatThreshold() : defaultThreshold;
    }

    public QueryResult evaluate(Query query) {
        if (query instanceof QuantifiedQuery q) {
            check(q.where());
            check(q.have());
            return quantified(q);
        }
        if (query instanceof BuiltinQuery b) return builtin(b);
        throw new IllegalArgumentException("Unsupported query: " + query);
    }

    private QueryResult quantified(QuantifiedQuery q) {
        List<GsnNode> candidates = new ArrayList<>();
        for (GsnNode node : graph.nodes()) {
            if (q.kind() != null && node.kind() != q.kind()) continue;
            if (q.where() != null && !test(q.where(), node)) continue;
            candidates.add(node);
        }
        List<String> passing = new ArrayList<>();
        List<String> failing = new ArrayList<>();
        for (GsnNode node : candidates) {
            if (q.have() == null || test(q.have(), node)) passing.add(node.id());
            else failing.add(node.id());
        }
        String subject = q.kind() == null ? "Node" : q.kind().name();
        return switch (q.quantifier()) {
            case ALL -> new QueryResult(failing.isEmpty(), failing,
                    failing.isEmpty() ? "All " + candidates.size() + " " + subject + " nodes satisfy the condition"
                            : failing.size() + " of " + candidates.size() + " " + subject + " nodes fail: " + failing,
                    (double) passing.size());
            case EXISTS -> new QueryResult(!passing.isEmpty(), List.of(),
                    passing.isEmpty() ? "No " + subject + " node satisfies the condition" : "Satisfied by " + passing,
                    (double) passing.size());
            case COUNT -> new QueryResult(!passing.isEmpty(), List.of(),
                    passing.size() + " " + subject + " nodes match", (double) passing.size());
        };
    }

    private QueryResult builtin(BuiltinQuery b) {
        return switch (b.builtin()) {
            case CONSISTENCY -> consistency();
            case COMPLETENESS -> completeness();
            case SOUNDNESS -> soundness();
            case COVERAGE -> coverage(b);
            case WEAKEST -> weakest(b);
        };
    }

    // accepted risk above the threshold, or two contradicting goals
    private QueryResult consistency() {
        Set<String> failing = new LinkedHashSet<>();
        for (GsnNode node : graph.nodes()) {
            Double confidence = confidence(node);
            boolean acceptedRisk = defeaters(node).stream().anyMatch(d -> d.status() == DefeaterStatus.ACCEPTED_RISK);
            if (acceptedRisk && confidence != null && confidence > threshold) failing.add(node.id());
        }
        List<GsnNode> goals = graph.nodesOfKind(NodeKind.GOAL);
        List<String> contradictions = new ArrayList<>();
        for (int i = 0; i < goals.size(); i++) {
            for (int j = i + 1; j < goals.size(); j++) {
                if (contradict(goals.get(i).statement(), goals.get(j).statement())) {
                    failing.add(goals.get(i).id());
                    failing.add(goals.get(j).id());
                    contradictions.add(goals.get(i).id() + "/" + goals.get(j).id());
                }
            }
        }
        String message = failing.isEmpty() ? "Case is consistent"
                : "Inconsistent nodes " + failing + (contradictions.isEmpty() ? "" : ", contradicting goals " + contradictions);
        return new QueryResult(failing.isEmpty(), new ArrayList<>(failing), message, (double) failing.size());
    }

    private QueryResult completeness() {
        List<String> open = graph.nodes().stream().filter(this::undeveloped).map(GsnNode::id).toList();
        return new QueryResult(open.isEmpty(), open,
                open.isEmpty() ? "No unresolved goals" : open.size() + " unresolved goals: " + open,
                (double) open.size());
    }

    private QueryResult soundness() {
        List<String> issues = new ArrayList<>();
        Set<String> ports = new HashSet<>(assuranceCase.openPorts());
        for (int i = 0; i < graph.size(); i++) {
            GsnNode node = graph.node(i);
            boolean hasNumericChild = Arrays.stream(graph.supportChildren(i)).anyMatch(c -> graph.node(c).kind().isNumeric());
            switch (node.kind()) {
                case STRATEGY -> {
                    if (!hasNumericChild) issues.add(node.id());
                }
                case SOLUTION -> {
                    if (graph.supportChildren(i).length > 0) issues.add(node.id());
                }
                case GOAL -> {
                    if (undeveloped(node) && !ports.contains(node.id())) issues.add(node.id());
                }
                case CONTEXT, ASSUMPTION, JUSTIFICATION -> {
                }
            }
        }
        return new QueryResult(issues.isEmpty(), issues,
                issues.isEmpty() ? "Argument is sound" : "Unsound nodes: " + issues, (double) issues.size());
    }

    private QueryResult coverage(BuiltinQuery b) {
        List<GsnNode> nodes = b.kind() == null ? graph.nodes() : graph.nodesOfKind(b.kind());
        List<String> uncovered = new ArrayList<>();
        for (GsnNode node : nodes) {
            if (!covered(graph.indexOf(node.id()), new HashSet<>())) uncovered.add(node.id());
        }
        double ratio = nodes.isEmpty() ? 0.0 : (double) (nodes.size() - uncovered.size()) / nodes.size();
        CompareOp op = b.op() == null ? CompareOp.GE : b.op();
        double bound = b.threshold() == null ? DEFAULT_COVERAGE : b.threshold();
        boolean ok = op.test(Double.compare(ratio, bound));
        return new QueryResult(ok, uncovered,
                String.format(Locale.ROOT, "Coverage %.3f (%d of %d), required %s %.3f",
                        ratio, nodes.size() - uncovered.size(), nodes.size(), op.symbol(), bound),
                ratio);
    }

    private QueryResult weakest(BuiltinQuery b) {
        GsnNode weakest = null;
        double lowest = Double.MAX_VALUE;
        for (GsnNode node : graph.nodes()) {
            if (b.kind() != null && node.kind() != b.kind()) continue;
            Double confidence = confidence(node);
            if (confidence != null && confidence < lowest) {
                weakest = node;
                lowest = confidence;
            }
        }
        if (weakest == null) {
            return new QueryResult(false, List.of(), "No analyzed " + (b.kind() == null ? "Node" : b.kind().name()) + " nodes", null);
        }
        boolean ok = b.op() == null || b.op().test(Double.compare(lowest, b.threshold()));
        String message = String.format(Locale.ROOT, "Weakest %s is %s (%.3f)",
                b.kind() == null ? "node" : b.kind().name(), weakest.id(), lowest);
        return new QueryResult(ok, ok ? List.of() : List.of(weakest.id()), message, lowest);
    }

    // Field names and operand types are checked once, before any node is visited.
    private void check(Expr expr) {
        if (expr == null) return;
        if (expr instanceof OrExpr or) {
            check(or.left());
            check(or.right());
        } else if (expr instanceof AndExpr and) {
            check(and.left());
            check(and.right());
        } else if (expr instanceof NotExpr not) {
            check(not.operand());
        } else if (expr instanceof Comparison c) {
            String field = c.field().toLowerCase(Locale.ROOT);
            if (NUMERIC_FIELDS.contains(field)) {
                if (!(c.value() instanceof Double)) {
                    throw new AcqlEvaluationException(c.field(), "Field '" + c.field() + "' is numeric, got '" + c.value() + "'");
                }
            } else if (TEXT_FIELDS.contains(field)) {
                if (c.op() != CompareOp.EQ && c.op() != CompareOp.NE) {
                    throw new AcqlEvaluationException(c.field(), "Field '" + c.field() + "' only supports = and !=");
                }
            } else {
                throw new AcqlEvaluationException(c.field(), "Unknown field '" + c.field() + "' at position " + c.position());
            }
        }
    }

    private boolean test(Expr expr, GsnNode node) {
        if (expr instanceof OrExpr or) return test(or.left(), node) || test(or.right(), node);
        if (expr instanceof AndExpr and) return test(and.left(), node) && test(and.right(), node);
        if (expr instanceof NotExpr not) return !test(not.operand(), node);
        if (expr instanceof Comparison c) return compare(c, node);
        throw new IllegalArgumentException("Unsupported expression: " + expr);
    }

    private boolean compare(Comparison c, GsnNode node) {
        Object actual = field(c.field(), node);
        if (actual == null) return false;
        if (actual instanceof Double number) {
            return c.op().test(Double.compare(number, (Double) c.value()));
        }
        String text = (String) actual;
        String expected = c.value() instanceof Double d ? formatNumber(d) : (String) c.value();
        boolean caseSensitive = c.field().equalsIgnoreCase("id");
        int cmp = caseSensitive ? text.compareTo(expected) : text.compareToIgnoreCase(expected);
        return c.op().test(cmp);
    }

    private Object field(String name, GsnNode node) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "confidence" -> confidence(node);
            case "evidencecount" -> (double) evidenceCount(node);
            case "status" -> status(node);
            case "defeatercount" -> (double) defeaters(node).size();
            case "id" -> node.id();
            case "kind" -> node.kind().name();
            default -> throw new AcqlEvaluationException(node.id(), "Unknown field '" + name + "'");
        };
    }

    private Double confidence(GsnNode node) {
        if (report != null) return report.confidenceOf(node.id());
        return node.confidence();
    }

    // Statuses always come from the ledger; the report may predate a raise or resolve.
    private List<Defeater> defeaters(GsnNode node) {
        DefeaterLedger ledger = assuranceCase.defeaters();
        if (report == null) return ledger.forNode(node.id());
        Map<String, Defeater> current = new LinkedHashMap<>();
        for (Defeater d : report.defeatersOf(node.id())) {
            current.put(d.id(), ledger.find(d.id()).orElse(d));
        }
        for (Defeater d : ledger.forNode(node.id())) {
            if (Defeater.MANUAL_SOURCE.equals(d.source())) current.putIfAbsent(d.id(), d);
        }
        return List.copyOf(current.values());
    }

    private String status(GsnNode node) {
        List<Defeater> defeaters = defeaters(node);
        for (DefeaterStatus status : List.of(DefeaterStatus.OPEN, DefeaterStatus.ACCEPTED_RISK, DefeaterStatus.MITIGATED)) {
            if (defeaters.stream().anyMatch(d -> d.status() == status)) return status.name();
        }
        return "CLEAR";
    }

    private int evidenceCount(GsnNode node) {
        return evidenceCounts.computeIfAbsent(node.id(), id -> {
            Set<String> refs = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            Set<Integer> seen = new HashSet<>();
            stack.push(graph.indexOf(id));
            while (!stack.isEmpty()) {
                int idx = stack.pop();
                if (!seen.add(idx)) continue;
                refs.addAll(graph.node(idx).evidenceRefs());
                for (int child : graph.supportChildren(idx)) stack.push(child);
            }
            return refs.size();
        });
    }

    private boolean covered(int idx, Set<Integer> seen) {
        if (!seen.add(idx)) return false;
        GsnNode node = graph.node(idx);
        if (node.kind() == NodeKind.SOLUTION) {
            return report != null && report.evidenceProvenance().containsKey(node.id());
        }
        for (int child : graph.supportChildren(idx)) {
            if (covered(child, seen)) return true;
        }
        return false;
    }

    private boolean undeveloped(GsnNode node) {
        return node.kind() == NodeKind.GOAL && !graph.hasSupport(node.id()) && !"true".equals(node.meta("abstracted"));
    }

    private boolean contradict(String first, String second) {
        Set<String> a = words(first);
        Set<String> b = words(second);
        for (String[] pair : CONTRADICTIONS) {
            if ((a.contains(pair[0]) && b.contains(pair[1])) || (a.contains(pair[1]) && b.contains(pair[0]))) return true;
        }
        return false;
    }

    private Set<String> words(String text) {
        return new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).split("[^a-z]+")));
    }

    private String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
