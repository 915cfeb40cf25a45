package com.loteca.riskengine.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record RiskMeasure(double alpha, double valueAtRisk, double expectedShortfall) {

    public String varLabel() {
        return "VaR" + alphaSuffix();
    }

    public String esLabel() {
        return "ES" + alphaSuffix();
    }

    private String alphaSuffix() {
        return BigDecimal.valueOf(alpha * 100.0)
                .setScale(6, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
