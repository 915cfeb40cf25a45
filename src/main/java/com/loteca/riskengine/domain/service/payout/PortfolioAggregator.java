package com.loteca.riskengine.domain.service.payout;

import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import org.springframework.stereotype.Component;

@Component
public class PortfolioAggregator {

    public double[] aggregate(double[][] payoutMatrix, double[] weights) {
        if (payoutMatrix == null || weights == null) {
            throw new IllegalArgumentException("지급 행렬과 가중치는 필수입니다");
        }
        double[] returns = new double[payoutMatrix.length];
        for (int s = 0; s < payoutMatrix.length; s++) {
            double[] row = payoutMatrix[s];
            if (row.length != weights.length) {
                throw new TicketShapeMismatchException("payout row#" + (s + 1), weights.length, row.length);
            }
            double sum = 0;
            for (int t = 0; t < row.length; t++) {
                sum += weights[t] * row[t];
            }
            returns[s] = sum;
        }
        return returns;
    }
}
