package com.loteca.riskengine.domain.service.risk;

import com.loteca.riskengine.domain.model.Portfolio;
import com.loteca.riskengine.domain.model.Ticket;
import com.loteca.riskengine.domain.model.TicketHitSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TicketHitAnalyzer {

    public List<TicketHitSummary> analyze(int[][] hitMatrix, double[][] payoutMatrix, Portfolio portfolio,
                                          double costPerTicket, double kellyFraction) {
        if (!Double.isFinite(costPerTicket) || costPerTicket <= 0) {
            throw new IllegalArgumentException("티켓 비용(costPerTicket)은 0보다 커야 합니다: " + costPerTicket);
        }
        if (!(kellyFraction >= 0 && kellyFraction <= 1)) {
            throw new IllegalArgumentException("켈리 비율(kellyFraction)은 [0, 1] 범위여야 합니다: " + kellyFraction);
        }

        int tickets = portfolio.ticketCount();
        int matches = portfolio.getMatchCount();
        int sims = hitMatrix.length;

        long[] hitSum = new long[tickets];
        int[] full = new int[tickets];
        int[] oneMiss = new int[tickets];
        double[] payoutSum = new double[tickets];

        for (int s = 0; s < sims; s++) {
            int[] hits = hitMatrix[s];
            double[] payouts = payoutMatrix[s];
            for (int t = 0; t < tickets; t++) {
                int h = hits[t];
                hitSum[t] += h;
                if (h == matches) full[t]++;
                else if (h == matches - 1) oneMiss[t]++;
                payoutSum[t] += payouts[t];
            }
        }

        List<TicketHitSummary> summaries = new ArrayList<>(tickets);
        for (int t = 0; t < tickets; t++) {
            Ticket ticket = portfolio.getTickets().get(t);
            double meanPayout = sims > 0 ? payoutSum[t] / sims : 0.0;
            double ev = meanPayout - costPerTicket;
            summaries.add(TicketHitSummary.builder()
                    .ticketIndex(t + 1)
                    .picks(ticket.describePicks())
                    .weight(portfolio.weight(t))
                    .combinations(ticket.combinations())
                    .fallbackCells(ticket.getFallbackCells())
                    .expectedHits(sims > 0 ? (double) hitSum[t] / sims : 0.0)
                    .fullHitProbability(sims > 0 ? (double) full[t] / sims : 0.0)
                    .oneMissProbability(sims > 0 ? (double) oneMiss[t] / sims : 0.0)
                    .meanPayout(meanPayout)
                    .cost(costPerTicket)
                    .expectedValue(ev)
                    .suggestedStake(suggestedStake(ev, costPerTicket, kellyFraction))
                    .build());
        }
        return summaries;
    }

    static double suggestedStake(double expectedValue, double costPerTicket, double kellyFraction) {
        double edge = expectedValue / costPerTicket;
        return Math.min(1.0, kellyFraction * Math.max(0.0, edge));
    }
}
