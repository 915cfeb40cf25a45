package com.loteca.riskengine.domain.model;

import java.util.Arrays;

public final class SimulationBatch {

    private final byte[][] outcomes;
    private final int matchCount;
    private final long seed;

    public SimulationBatch(byte[][] outcomes, int matchCount, long seed) {
        this.outcomes = outcomes;
        this.matchCount = matchCount;
        this.seed = seed;
    }

    public int simulationCount() {
        return outcomes.length;
    }

    public int matchCount() {
        return matchCount;
    }

    public long seed() {
        return seed;
    }

    public int outcome(int simulation, int match) {
        return outcomes[simulation][match];
    }

    public byte[] row(int simulation) {
        return outcomes[simulation];
    }

    public int[] counts(int match) {
        int[] counts = new int[Outcome.values().length];
        for (byte[] row : outcomes) {
            counts[row[match]]++;
        }
        return counts;
    }

    public boolean sameOutcomes(SimulationBatch other) {
        if (other == null || other.outcomes.length != outcomes.length || other.matchCount != matchCount) {
            return false;
        }
        for (int s = 0; s < outcomes.length; s++) {
            if (!Arrays.equals(outcomes[s], other.outcomes[s])) {
                return false;
            }
        }
        return true;
    }
}
