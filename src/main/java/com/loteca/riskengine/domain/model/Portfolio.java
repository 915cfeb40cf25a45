package com.loteca.riskengine.domain.model;

import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

public final class Portfolio {

    @Getter
    private final List<Ticket> tickets;
    @Getter
    private final PayTable payTable;
    @Getter
    private final int matchCount;
    @Getter
    private final boolean uniformFallback;

    private final double[] weights;

    private Portfolio(List<Ticket> tickets, double[] weights, PayTable payTable, boolean uniformFallback) {
        this.tickets = tickets;
        this.weights = weights;
        this.payTable = payTable;
        this.matchCount = tickets.get(0).matchCount();
        this.uniformFallback = uniformFallback;
    }

    public static Portfolio of(List<Ticket> tickets, PayTable payTable) {
        if (tickets == null || tickets.isEmpty()) {
            throw new IllegalArgumentException("포트폴리오에 티켓이 없습니다");
        }
        int m = tickets.get(0).matchCount();
        for (int t = 1; t < tickets.size(); t++) {
            if (tickets.get(t).matchCount() != m) {
                throw new TicketShapeMismatchException("ticket#" + (t + 1), m, tickets.get(t).matchCount());
            }
        }

        double[] raw = new double[tickets.size()];
        for (int t = 0; t < raw.length; t++) {
            raw[t] = tickets.get(t).getStakeWeight();
        }
        double[] normalized = normalizeWeights(raw);
        boolean uniform = sanitizedSum(raw) <= 0;

        return new Portfolio(List.copyOf(tickets), normalized,
                payTable != null ? payTable : PayTable.defaultScheme(), uniform);
    }

    public static double[] normalizeWeights(double[] raw) {
        if (raw == null || raw.length == 0) {
            return new double[0];
        }
        double sum = sanitizedSum(raw);
        double[] out = new double[raw.length];
        if (sum <= 0) {
            Arrays.fill(out, 1.0 / raw.length);
            return out;
        }
        for (int i = 0; i < raw.length; i++) {
            out[i] = sanitize(raw[i]) / sum;
        }
        return out;
    }

    public int ticketCount() {
        return tickets.size();
    }

    public double[] weights() {
        return weights.clone();
    }

    public double weight(int ticket) {
        return weights[ticket];
    }

    public int fallbackCells() {
        return tickets.stream().mapToInt(Ticket::getFallbackCells).sum();
    }

    private static double sanitizedSum(double[] raw) {
        double sum = 0;
        for (double w : raw) {
            sum += sanitize(w);
        }
        return sum;
    }

    private static double sanitize(double w) {
        return Double.isFinite(w) && w > 0 ? w : 0.0;
    }
}
