package com.loteca.riskengine.domain.service.risk;

import com.loteca.riskengine.domain.exception.InsufficientDataException;
import com.loteca.riskengine.domain.model.RiskMeasure;
import com.loteca.riskengine.domain.model.RiskReport.ReturnDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Slf4j
@Component
public class RiskMetrics {

    public RiskMeasure varEs(double[] returns, double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("신뢰수준(alpha)은 (0,1) 범위여야 합니다: " + alpha);
        }
        if (returns == null || returns.length == 0) {
            throw new InsufficientDataException("수익 분포가 비어 있어 VaR/ES를 계산할 수 없습니다");
        }

        double[] losses = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            losses[i] = -returns[i];
        }
        Arrays.sort(losses);

        double var = quantile(losses, alpha);

        double tailSum = 0;
        int tailCount = 0;
        for (int i = losses.length - 1; i >= 0 && losses[i] >= var; i--) {
            tailSum += losses[i];
            tailCount++;
        }
        double es = tailCount > 0 ? tailSum / tailCount : var;

        log.debug("[Risk] VaR/ES 계산: n={}, alpha={}, VaR={}, ES={}, tail={}",
                returns.length, alpha, var, es, tailCount);

        return new RiskMeasure(alpha, var, es);
    }

    public ReturnDistribution distribution(double[] returns) {
        if (returns == null || returns.length == 0) {
            throw new InsufficientDataException("수익 분포가 비어 있습니다");
        }
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        double sum = 0;
        for (double r : sorted) sum += r;

        return ReturnDistribution.builder()
                .mean(sum / sorted.length)
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .percentile5(percentile(sorted, 5))
                .percentile25(percentile(sorted, 25))
                .median(percentile(sorted, 50))
                .percentile75(percentile(sorted, 75))
                .percentile95(percentile(sorted, 95))
                .build();
    }

    public static double percentile(double[] sorted, double p) {
        return quantile(sorted, p / 100.0);
    }

    static double quantile(double[] sorted, double q) {
        double index = q * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
