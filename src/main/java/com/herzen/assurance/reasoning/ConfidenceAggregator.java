package com.herzen.assurance.reasoning;

@FunctionalInterface
public interface ConfidenceAggregator {
    double aggregate(double[] contributions);
}
