package com.loteca.riskengine.domain.service.payout;

import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import com.loteca.riskengine.domain.model.PayTable;
import com.loteca.riskengine.domain.model.Portfolio;
import com.loteca.riskengine.domain.model.SimulationBatch;
import com.loteca.riskengine.domain.model.Ticket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class PayoutEngine {

    public double payout(Ticket ticket, byte[] simulatedResult, PayTable payTable) {
        int hits = hits(ticket, simulatedResult);
        PayTable table = payTable != null ? payTable : PayTable.defaultScheme();
        return table.payout(hits, simulatedResult.length);
    }

    public int hits(Ticket ticket, byte[] simulatedResult) {
        if (ticket.matchCount() != simulatedResult.length) {
            throw new TicketShapeMismatchException("ticket", simulatedResult.length, ticket.matchCount());
        }
        int hits = 0;
        for (int m = 0; m < simulatedResult.length; m++) {
            if (ticket.covers(m, simulatedResult[m])) hits++;
        }
        return hits;
    }

    public int[][] hitMatrix(SimulationBatch batch, List<Ticket> tickets) {
        int sims = batch.simulationCount();
        int matches = batch.matchCount();
        for (int t = 0; t < tickets.size(); t++) {
            if (tickets.get(t).matchCount() != matches) {
                throw new TicketShapeMismatchException("ticket#" + (t + 1), matches, tickets.get(t).matchCount());
            }
        }

        int[][] hits = new int[sims][tickets.size()];
        for (int s = 0; s < sims; s++) {
            byte[] row = batch.row(s);
            int[] out = hits[s];
            for (int t = 0; t < out.length; t++) {
                Ticket ticket = tickets.get(t);
                int h = 0;
                for (int m = 0; m < matches; m++) {
                    if (ticket.covers(m, row[m])) h++;
                }
                out[t] = h;
            }
        }
        return hits;
    }

    public double[][] payoutMatrix(int[][] hitMatrix, int matchCount, PayTable payTable) {
        PayTable table = payTable != null ? payTable : PayTable.defaultScheme();
        double[] lookup = new double[matchCount + 1];
        for (int h = 0; h <= matchCount; h++) {
            lookup[h] = table.payout(h, matchCount);
        }

        double[][] payouts = new double[hitMatrix.length][];
        for (int s = 0; s < hitMatrix.length; s++) {
            int[] hits = hitMatrix[s];
            double[] row = new double[hits.length];
            for (int t = 0; t < hits.length; t++) {
                row[t] = lookup[hits[t]];
            }
            payouts[s] = row;
        }
        return payouts;
    }

    public double[][] payoutMatrix(SimulationBatch batch, Portfolio portfolio) {
        long startNano = System.nanoTime();
        int[][] hits = hitMatrix(batch, portfolio.getTickets());
        double[][] payouts = payoutMatrix(hits, batch.matchCount(), portfolio.getPayTable());
        log.debug("[Payout] 지급 행렬 계산: sims={}, tickets={}, table={}, elapsed={}μs",
                batch.simulationCount(), portfolio.ticketCount(), portfolio.getPayTable().kind(),
                (System.nanoTime() - startNano) / 1_000);
        return payouts;
    }
}
