package com.loteca.riskengine.domain.model;

public record RiskEvaluation(RiskReport report, double[] returns) {
}
