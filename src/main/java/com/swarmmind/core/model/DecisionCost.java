package com.swarmmind.core.model;

import java.io.Serializable;

/**
 * Estimated cost of carrying out an action.
 *
 * @param estimatedTokens reasoning tokens the action is expected to spend
 * @param estimatedTimeMs expected wall-clock duration
 * @param riskLevel       risk classification of the action kind
 */
public record DecisionCost(
    int estimatedTokens,
    long estimatedTimeMs,
    RiskLevel riskLevel
) implements Serializable {}
