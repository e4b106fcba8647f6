package com.swarmmind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "swarmmind.swarm")
public class SwarmProperties {

    private int agentCount = 3;
    private int tokenBudgetPerAgent = 50_000;
    private double criticalThreshold = 0.6;
    private double densityScale = 15.0;
    private double selectionTemperature = 0.3;
    /** Ticks between collaboration scans. */
    private int collaborationInterval = 5;
    private long tickIntervalMs = 2000;
    /** 0 means unbounded (serve mode only). */
    private long maxTicks = 0;
    private boolean engineeringEnabled = true;
    private boolean parallel = false;
    private Long seed;
    private List<String> discoveryTopics = new ArrayList<>(List.of("typescript", "rust", "ai"));
    private int historyLimit = 200;

    public int getAgentCount() {
        return agentCount;
    }

    public void setAgentCount(int agentCount) {
        this.agentCount = agentCount;
    }

    public int getTokenBudgetPerAgent() {
        return tokenBudgetPerAgent;
    }

    public void setTokenBudgetPerAgent(int tokenBudgetPerAgent) {
        this.tokenBudgetPerAgent = tokenBudgetPerAgent;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public double getDensityScale() {
        return densityScale;
    }

    public void setDensityScale(double densityScale) {
        this.densityScale = densityScale;
    }

    public double getSelectionTemperature() {
        return selectionTemperature;
    }

    public void setSelectionTemperature(double selectionTemperature) {
        this.selectionTemperature = selectionTemperature;
    }

    public int getCollaborationInterval() {
        return collaborationInterval;
    }

    public void setCollaborationInterval(int collaborationInterval) {
        this.collaborationInterval = collaborationInterval;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public long getMaxTicks() {
        return maxTicks;
    }

    public void setMaxTicks(long maxTicks) {
        this.maxTicks = maxTicks;
    }

    public boolean isEngineeringEnabled() {
        return engineeringEnabled;
    }

    public void setEngineeringEnabled(boolean engineeringEnabled) {
        this.engineeringEnabled = engineeringEnabled;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public List<String> getDiscoveryTopics() {
        return discoveryTopics;
    }

    public void setDiscoveryTopics(List<String> discoveryTopics) {
        this.discoveryTopics = discoveryTopics;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }
}
