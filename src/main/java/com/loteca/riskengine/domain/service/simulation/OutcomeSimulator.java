package com.loteca.riskengine.domain.service.simulation;

import com.loteca.riskengine.domain.model.MatchProbability;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.model.SimulationBatch;
import com.loteca.riskengine.domain.service.RiskEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;
import java.util.stream.IntStream;

@Slf4j
@Component
@RequiredArgsConstructor
public class OutcomeSimulator {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final RiskEngineProperties properties;

    public SimulationBatch simulate(ProbabilityMatrix matrix, int numSimulations, Long seed) {
        return simulate(matrix, numSimulations, seed, properties.getChunkSize(), properties.isParallel());
    }

    public SimulationBatch simulate(ProbabilityMatrix matrix, int numSimulations, Long seed,
                                    int chunkSize, boolean parallel) {
        if (matrix == null) {
            throw new IllegalArgumentException("확률 행렬(matrix)은 필수입니다");
        }
        if (numSimulations < 1) {
            throw new IllegalArgumentException("시뮬레이션 수(numSimulations)는 1 이상이어야 합니다");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("청크 크기(chunkSize)는 1 이상이어야 합니다");
        }

        long runSeed = seed != null ? seed : new SplittableRandom().nextLong();
        int matchCount = matrix.matchCount();

        double[] homeCut = new double[matchCount];
        double[] drawCut = new double[matchCount];
        for (int m = 0; m < matchCount; m++) {
            MatchProbability p = matrix.row(m);
            boolean onlyHome = p.pDraw() == 0 && p.pAway() == 0;
            homeCut[m] = onlyHome ? 1.0 : p.pHome();
            drawCut[m] = p.pAway() == 0 ? 1.0 : p.pHome() + p.pDraw();
        }

        byte[][] outcomes = new byte[numSimulations][matchCount];
        int chunks = (numSimulations + chunkSize - 1) / chunkSize;
        long startNano = System.nanoTime();

        IntStream range = IntStream.range(0, chunks);
        if (parallel && chunks > 1) {
            range = range.parallel();
        }
        range.forEach(k -> {
            SplittableRandom rng = new SplittableRandom(chunkSeed(runSeed, k));
            int from = k * chunkSize;
            int to = Math.min(from + chunkSize, numSimulations);
            for (int s = from; s < to; s++) {
                byte[] row = outcomes[s];
                for (int m = 0; m < matchCount; m++) {
                    double u = rng.nextDouble();
                    row[m] = u < homeCut[m] ? (byte) 0 : u < drawCut[m] ? (byte) 1 : (byte) 2;
                }
            }
        });

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.debug("[Sim] 생성 완료: sims={}, matches={}, chunks={}, parallel={}, seed={}, elapsed={}ms",
                numSimulations, matchCount, chunks, parallel, runSeed, elapsedMs);

        return new SimulationBatch(outcomes, matchCount, runSeed);
    }

    static long chunkSeed(long seed, int chunk) {
        long z = seed + GOLDEN_GAMMA * (chunk + 1L);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
