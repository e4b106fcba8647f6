package com.swarmmind.core.model;

/**
 * Kinds of engineering action an agent can take, with the fixed cost table
 * and base priority each kind is scored with.
 * <p>
 * {@link #FIX_ISSUE} and {@link #CONTRIBUTE_PR} are kept in the vocabulary so
 * that persisted or externally produced decisions can still be described, but
 * they are never offered as autonomous candidates.
 */
public enum ActionType {
    STUDY_REPO("study_repo", 0.85, 3_000, 15_000, RiskLevel.LOW),
    FIX_ISSUE("fix_issue", 0.05, 8_000, 45_000, RiskLevel.MEDIUM),
    WRITE_CODE("write_code", 0.4, 10_000, 60_000, RiskLevel.MEDIUM),
    REFACTOR("refactor", 0.3, 7_000, 40_000, RiskLevel.MEDIUM),
    DOCUMENT("document", 0.6, 4_000, 20_000, RiskLevel.LOW),
    SHARE_TECHNIQUE("share_technique", 0.9, 1_500, 8_000, RiskLevel.LOW),
    CONTRIBUTE_PR("contribute_pr", 0.05, 12_000, 90_000, RiskLevel.HIGH),
    EXPLORE_TOPIC("explore_topic", 0.75, 800, 5_000, RiskLevel.LOW);

    private final String wireName;
    private final double basePriority;
    private final int estimatedTokens;
    private final long estimatedTimeMs;
    private final RiskLevel riskLevel;

    ActionType(String wireName, double basePriority, int estimatedTokens,
               long estimatedTimeMs, RiskLevel riskLevel) {
        this.wireName = wireName;
        this.basePriority = basePriority;
        this.estimatedTokens = estimatedTokens;
        this.estimatedTimeMs = estimatedTimeMs;
        this.riskLevel = riskLevel;
    }

    public String wireName() { return wireName; }
    public double basePriority() { return basePriority; }
    public int estimatedTokens() { return estimatedTokens; }
    public long estimatedTimeMs() { return estimatedTimeMs; }
    public RiskLevel riskLevel() { return riskLevel; }

    /** Whether agents may pick this kind on their own. */
    public boolean isAutonomous() {
        return this != FIX_ISSUE && this != CONTRIBUTE_PR;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
