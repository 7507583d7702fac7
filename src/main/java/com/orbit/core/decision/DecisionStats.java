package com.orbit.core.decision;

/**
 * @param totalDecisions    decisions made
 * @param successRate       share of resolved decisions that succeeded
 * @param averageConfidence mean confidence over all decisions
 * @param riskAccuracy      1 - mean absolute error between expected and actual risk
 */
public record DecisionStats(
    int totalDecisions,
    double successRate,
    double averageConfidence,
    double riskAccuracy
) {}
