package com.herzen.assurance.reasoning;

import com.herzen.assurance.config.AssuranceProperties;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.*;
import com.herzen.assurance.error.MissingEvidenceException;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnEdge;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.gsn.GsnValidator;
import com.herzen.assurance.reasoning.ReasoningModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

// Nodes are evaluated level by level from the support leaves up; a level only reads lower levels.
@Service
public class ClarissaEngine {
    private static final Logger log = LoggerFactory.getLogger(ClarissaEngine.class);

    static final String ENGINE_SOURCE = "clarissa";

    private final AssuranceProperties properties;
    private final AggregatorRegistry aggregators;
    private final GsnValidator validator;
    private final ThreadPoolTaskExecutor executor;
    private final List<Theory> theories;

    public ClarissaEngine(AssuranceProperties properties,
                          AggregatorRegistry aggregators,
                          GsnValidator validator,
                          @Qualifier("reasoningExecutor") ThreadPoolTaskExecutor executor,
                          StructuralTheory structural,
                          BehavioralTheory behavioral,
                          ProbabilisticTheory probabilistic) {
        this.properties = properties;
        this.aggregators = aggregators;
        this.validator = validator;
        this.executor = executor;
        this.theories = List.of(structural, behavioral, probabilistic);
    }

    public ConfidenceReport analyze(AssuranceCase assuranceCase, EvidenceCollector collector) {
        return analyze(assuranceCase, collector, AnalysisOptions.defaults());
    }

    public ConfidenceReport analyze(AssuranceCase assuranceCase, EvidenceCollector collector, AnalysisOptions options) {
        return analyze(assuranceCase, collector, options, theories);
    }

    public ConfidenceReport analyze(AssuranceCase assuranceCase,
                                    EvidenceCollector collector,
                                    AnalysisOptions options,
                                    List<Theory> theoryOrder) {
        assuranceCase.requireMutable();
        ReasoningSettings settings = ReasoningSettings.from(properties);
        ArgumentGraph graph = assuranceCase.graph();
        int n = graph.size();

        List<ReportWarning> warnings = new ArrayList<>();
        Map<String, String> provenance = new LinkedHashMap<>();
        EvidenceRecord[] evidence = resolveEvidence(graph, collector, options, settings, warnings, provenance);

        Map<String, Defeater> known = new HashMap<>();
        assuranceCase.defeaters().all().forEach(d -> known.put(d.id(), d));
        Run run = new Run(graph, evidence, settings, List.copyOf(theoryOrder), known);

        List<List<Integer>> levels = levels(graph);
        boolean parallel = n >= properties.getParallelThreshold();
        for (List<Integer> level : levels) {
            if (parallel && level.size() > 1) {
                evaluateOnPool(run, level);
            } else {
                level.forEach(run::evaluate);
            }
        }

        Double[] confidences = new Double[n];
        Map<String, Double> perNode = new LinkedHashMap<>();
        List<String> defeated = new ArrayList<>();
        List<Defeater> reported = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            NodeResult result = run.results[i];
            confidences[i] = result.confidence();
            if (result.confidence() != null) perNode.put(graph.node(i).id(), result.confidence());
            if (result.defeated()) defeated.add(graph.node(i).id());
            for (Defeater d : result.defeaters()) {
                reported.add(assuranceCase.defeaters().record(d));
            }
            warnings.addAll(result.warnings());
        }
        run.edgeDefeaters().forEach(d -> reported.add(assuranceCase.defeaters().record(d)));

        String rootId = assuranceCase.rootGoalId() != null ? assuranceCase.rootGoalId()
                : graph.roots().stream().map(GsnNode::id).findFirst().orElse(null);
        double overall = rootId == null || perNode.get(rootId) == null ? 0.0 : perNode.get(rootId);
        if (graph.isEmpty()) {
            warnings.add(new ReportWarning("EMPTY_CASE", null, "Case " + assuranceCase.id() + " has no nodes"));
        }

        RiskLevel risk = riskLevel(overall, reported);
        List<String> recommendations = recommendations(overall, settings, reported, warnings);
        ConfidenceReport report = new ConfidenceReport(assuranceCase.id(), rootId, perNode, overall, reported, defeated,
                warnings, risk, recommendations, provenance, settings.defeatThreshold());

        assuranceCase.markAnalyzed(graph.withConfidences(confidences), report);
        log.info("Analyzed case {}: overall={} defeated={} risk={}", assuranceCase.id(), overall, defeated.size(), risk);
        return report;
    }

    private EvidenceRecord[] resolveEvidence(ArgumentGraph graph,
                                             EvidenceCollector collector,
                                             AnalysisOptions options,
                                             ReasoningSettings settings,
                                             List<ReportWarning> warnings,
                                             Map<String, String> provenance) {
        EvidenceRecord[] evidence = new EvidenceRecord[graph.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            GsnNode node = graph.node(i);
            if (node.kind() != NodeKind.SOLUTION) continue;
            Optional<EvidenceRecord> record = collector.getEvidence(node.id());
            if (record.isEmpty()) {
                missing.add(node.id());
                continue;
            }
            evidence[i] = record.get();
            if (record.get().provenance() != null && !record.get().provenance().isBlank()) {
                provenance.put(node.id(), record.get().provenance());
            }
            if (record.get().stalenessDays() >= settings.staleWarningDays()) {
                log.warn("Evidence for {} is {} days old", node.id(), record.get().stalenessDays());
                warnings.add(new ReportWarning("STALE_EVIDENCE", node.id(),
                        "Evidence is " + record.get().stalenessDays() + " days old"));
            }
        }
        if (!missing.isEmpty()) {
            if (!options.worstCase()) throw new MissingEvidenceException(missing);
            log.warn("Missing evidence for {}, assuming confidence 0", missing);
            missing.forEach(id -> warnings.add(new ReportWarning("MISSING_EVIDENCE", id, "No evidence; worst case assumed")));
        }
        return evidence;
    }

    private List<List<Integer>> levels(ArgumentGraph graph) {
        int[] order = validator.topologicalOrder(graph);
        int[] height = new int[graph.size()];
        int max = 0;
        for (int k = order.length - 1; k >= 0; k--) {
            int idx = order[k];
            for (int child : graph.supportChildren(idx)) {
                height[idx] = Math.max(height[idx], height[child] + 1);
            }
            max = Math.max(max, height[idx]);
        }
        List<List<Integer>> levels = new ArrayList<>();
        for (int h = 0; h <= max && graph.size() > 0; h++) levels.add(new ArrayList<>());
        for (int i = 0; i < graph.size(); i++) levels.get(height[i]).add(i);
        return levels;
    }

    private void evaluateOnPool(Run run, List<Integer> level) {
        List<Future<?>> pending = new ArrayList<>(level.size());
        for (int idx : level) {
            pending.add(executor.submit(() -> run.evaluate(idx)));
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Analysis interrupted", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) throw runtime;
                throw new IllegalStateException("Node evaluation failed", e.getCause());
            }
        }
    }

    RiskLevel riskLevel(double overall, List<Defeater> defeaters) {
        double score = 1.0 - overall;
        for (Defeater d : defeaters) {
            if (!d.status().defeats()) continue;
            if (d.impactWeight() >= 0.8) score += 0.3;
            else if (d.impactWeight() >= 0.5) score += 0.15;
        }
        score = Math.min(1.0, score);
        if (score >= 0.7) return RiskLevel.HIGH;
        if (score >= 0.4) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    private List<String> recommendations(double overall,
                                         ReasoningSettings settings,
                                         List<Defeater> defeaters,
                                         List<ReportWarning> warnings) {
        List<String> out = new ArrayList<>();
        if (overall < settings.defeatThreshold()) {
            out.add("Confidence is below the defeat threshold: strengthen evidence or argument structure");
        }
        List<Defeater> active = defeaters.stream().filter(d -> d.status() == DefeaterStatus.OPEN).toList();
        if (!active.isEmpty()) {
            out.add("Open defeaters found: mitigate them or accept the risk explicitly");
        }
        for (Defeater d : active) {
            if (d.impactWeight() >= 0.8) {
                out.add("Critical defeater " + d.id() + ": immediate action required");
            }
        }
        for (ReportWarning w : warnings) {
            if ("MISSING_EVIDENCE".equals(w.code())) out.add("Collect evidence for " + w.nodeId());
            if ("STALE_EVIDENCE".equals(w.code())) out.add("Refresh stale evidence for " + w.nodeId());
        }
        return out;
    }

    private record NodeResult(Double confidence, boolean defeated, List<Defeater> defeaters, List<ReportWarning> warnings) {}

    private final class Run {
        private final ArgumentGraph graph;
        private final EvidenceRecord[] evidence;
        private final ReasoningSettings settings;
        private final List<Theory> theoryOrder;
        private final Map<String, Defeater> known;
        private final Map<String, List<Defeater>> manualByNode = new HashMap<>();
        private final Map<String, List<Defeater>> manualByEdge = new HashMap<>();
        private final NodeResult[] results;

        Run(ArgumentGraph graph, EvidenceRecord[] evidence, ReasoningSettings settings, List<Theory> theoryOrder, Map<String, Defeater> known) {
            this.graph = graph;
            this.evidence = evidence;
            this.settings = settings;
            this.theoryOrder = theoryOrder;
            this.known = known;
            this.results = new NodeResult[graph.size()];
            known.values().stream()
                    .filter(d -> Defeater.MANUAL_SOURCE.equals(d.source()))
                    .sorted(Comparator.comparing(Defeater::id))
                    .forEach(d -> {
                        if (d.targetEdge() != null) manualByEdge.computeIfAbsent(d.targetEdge(), k -> new ArrayList<>()).add(d);
                        else if (d.targetNodeId() != null) manualByNode.computeIfAbsent(d.targetNodeId(), k -> new ArrayList<>()).add(d);
                    });
        }

        void evaluate(int idx) {
            GsnNode node = graph.node(idx);
            int[] children = Arrays.stream(graph.supportChildren(idx))
                    .filter(c -> graph.node(c).kind().isNumeric())
                    .toArray();
            double[] contributions = new double[children.length];
            for (int k = 0; k < children.length; k++) {
                contributions[k] = contribution(idx, children[k]);
            }
            NodeScope scope = new NodeScope(graph, idx, children, contributions, evidence[idx], settings, aggregators);

            Double lowest = null;
            boolean defeated = false;
            Map<String, Defeater> defeaters = new LinkedHashMap<>();
            for (Theory theory : theoryOrder) {
                Judgement judgement = theory.judge(scope);
                if (judgement.confidence().isPresent()) {
                    double value = NodeScope.clamp(judgement.confidence().getAsDouble());
                    lowest = lowest == null ? value : Math.min(lowest, value);
                }
                for (Finding finding : judgement.findings()) {
                    String id = "DEF-" + finding.code() + "-" + node.id();
                    if (defeaters.containsKey(id)) continue;
                    Defeater d = detected(id, node.id(), finding.description(), finding.impactWeight(), theory.name());
                    defeaters.put(id, d);
                    defeated |= finding.defeats() && d.status().defeats();
                }
            }

            Double confidence = null;
            if (node.kind().isNumeric()) {
                confidence = lowest == null ? 0.0 : lowest;
                if (confidence < settings.defeatThreshold()) {
                    double impact = settings.defeatThreshold() <= 0 ? 1.0 : (settings.defeatThreshold() - confidence) / settings.defeatThreshold();
                    String id = "DEF-LOW_CONFIDENCE-" + node.id();
                    defeaters.putIfAbsent(id, detected(id, node.id(),
                            "Confidence " + String.format(Locale.ROOT, "%.3f", confidence) + " is below threshold " + settings.defeatThreshold(),
                            impact, ENGINE_SOURCE));
                    defeated = true;
                }
            }

            for (int underminer : graph.underminedBy(idx)) {
                String from = graph.node(underminer).id();
                String id = graph.edges().stream()
                        .filter(e -> e.from().equals(from) && e.to().equals(node.id()) && e.defeaterId() != null)
                        .map(GsnEdge::defeaterId)
                        .findFirst()
                        .orElse("DEF-UNDERMINED-" + node.id() + "-" + from);
                Defeater d = detected(id, node.id(), "Undermined by " + from, 0.5, "undermines");
                defeaters.putIfAbsent(id, d);
                defeated |= d.status().defeats();
            }
            for (Defeater manual : manualByNode.getOrDefault(node.id(), List.of())) {
                defeaters.putIfAbsent(manual.id(), manual);
                defeated |= manual.status().defeats();
            }

            results[idx] = new NodeResult(confidence, defeated, List.copyOf(defeaters.values()), List.copyOf(scope.warnings()));
        }

        // capped at the threshold when the child or the edge is defeated
        private double contribution(int parent, int child) {
            NodeResult result = results[child];
            double value = result.confidence() == null ? 0.0 : result.confidence();
            String edgeKey = graph.node(parent).id() + "->" + graph.node(child).id();
            boolean edgeDefeated = manualByEdge.getOrDefault(edgeKey, List.of()).stream().anyMatch(d -> d.status().defeats());
            if (result.defeated() || edgeDefeated) {
                value = Math.min(value, settings.defeatThreshold());
            }
            return value;
        }

        List<Defeater> edgeDefeaters() {
            Set<String> edges = new HashSet<>();
            graph.edges().forEach(e -> edges.add(e.from() + "->" + e.to()));
            return manualByEdge.entrySet().stream()
                    .filter(e -> edges.contains(e.getKey()))
                    .flatMap(e -> e.getValue().stream())
                    .sorted(Comparator.comparing(Defeater::id))
                    .toList();
        }

        private Defeater detected(String id, String nodeId, String description, double impact, String source) {
            Defeater existing = known.get(id);
            DefeaterStatus status = existing == null ? DefeaterStatus.OPEN : existing.status();
            return new Defeater(id, nodeId, null, description, status, NodeScope.clamp(impact), source);
        }
    }
}
