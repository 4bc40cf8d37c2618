package com.herzen.assurance.reasoning;

import com.herzen.assurance.domain.AssuranceModels.ReportWarning;
import com.herzen.assurance.gsn.ArgumentGraph;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;
import com.herzen.assurance.reasoning.ReasoningModels.ReasoningSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class NodeScope {
    private final ArgumentGraph graph;
    private final int index;
    private final int[] children;
    private final double[] contributions;
    private final EvidenceRecord evidence;
    private final ReasoningSettings settings;
    private final AggregatorRegistry aggregators;
    private final List<ReportWarning> warnings = new ArrayList<>();
    private Double aggregated;

    NodeScope(ArgumentGraph graph,
              int index,
              int[] children,
              double[] contributions,
              EvidenceRecord evidence,
              ReasoningSettings settings,
              AggregatorRegistry aggregators) {
        this.graph = graph;
        this.index = index;
        this.children = children;
        this.contributions = contributions;
        this.evidence = evidence;
        this.settings = settings;
        this.aggregators = aggregators;
    }

    public GsnNode node() {
        return graph.node(index);
    }

    public ArgumentGraph graph() {
        return graph;
    }

    public int index() {
        return index;
    }

    public List<GsnNode> children() {
        return Arrays.stream(children).mapToObj(graph::node).toList();
    }

    public double[] contributions() {
        return contributions.clone();
    }

    public boolean isLeaf() {
        return children.length == 0;
    }

    public Optional<EvidenceRecord> evidence() {
        return Optional.ofNullable(evidence);
    }

    public ReasoningSettings settings() {
        return settings;
    }

    public List<GsnNode> contextNodes() {
        return Arrays.stream(graph.contextOf(index)).mapToObj(graph::node).toList();
    }

    // Unknown aggregators fall back to the average and are reported.
    public double aggregate() {
        if (aggregated != null) return aggregated;
        if (contributions.length == 0) {
            aggregated = 0.0;
            return aggregated;
        }
        String requested = node().meta("aggregator");
        String aggregatorName = requested != null ? requested : settings.defaultAggregator();
        ConfidenceAggregator aggregator = aggregators.resolve(aggregatorName).orElse(null);
        if (aggregator == null) {
            warnings.add(new ReportWarning("UNKNOWN_AGGREGATOR", node().id(), "Unknown aggregator '" + aggregatorName + "', using average"));
            aggregator = aggregators.resolve("average").orElseThrow();
        }
        aggregated = clamp(aggregator.aggregate(contributions.clone()));
        return aggregated;
    }

    List<ReportWarning> warnings() {
        return warnings;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
