package com.herzen.assurance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assurance")
public class AssuranceProperties {
    private double defeatThreshold = 0.5;
    private int stalenessThresholdDays = 90;
    private int staleWarningDays = 30;
    private String defaultAggregator = "average";
    private double structuralSoundnessFactor = 0.9;
    private int reasoningPoolSize = 4;
    // graphs with fewer nodes are analyzed on the calling thread
    private int parallelThreshold = 64;
    private int queryCacheSize = 256;

    public double getDefeatThreshold() { return defeatThreshold; }
    public void setDefeatThreshold(double defeatThreshold) { this.defeatThreshold = defeatThreshold; }
    public int getStalenessThresholdDays() { return stalenessThresholdDays; }
    public void setStalenessThresholdDays(int stalenessThresholdDays) { this.stalenessThresholdDays = stalenessThresholdDays; }
    public int getStaleWarningDays() { return staleWarningDays; }
    public void setStaleWarningDays(int staleWarningDays) { this.staleWarningDays = staleWarningDays; }
    public String getDefaultAggregator() { return defaultAggregator; }
    public void setDefaultAggregator(String defaultAggregator) { this.defaultAggregator = defaultAggregator; }
    public double getStructuralSoundnessFactor() { return structuralSoundnessFactor; }
    public void setStructuralSoundnessFactor(double structuralSoundnessFactor) { this.structuralSoundnessFactor = structuralSoundnessFactor; }
    public int getReasoningPoolSize() { return reasoningPoolSize; }
    public void setReasoningPoolSize(int reasoningPoolSize) { this.reasoningPoolSize = reasoningPoolSize; }
    public int getParallelThreshold() { return parallelThreshold; }
    public void setParallelThreshold(int parallelThreshold) { this.parallelThreshold = parallelThreshold; }
    public int getQueryCacheSize() { return queryCacheSize; }
    public void setQueryCacheSize(int queryCacheSize) { this.queryCacheSize = queryCacheSize; }
}
