package com.loteca.riskengine.domain.model;

import com.loteca.riskengine.domain.exception.InvalidProbabilityRowException;

public record MatchProbability(String matchId, double pHome, double pDraw, double pAway) {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    public MatchProbability {
        if (matchId == null || matchId.isBlank()) {
            throw new IllegalArgumentException("matchId는 비어 있을 수 없습니다");
        }
        checkComponent(matchId, "p_home", pHome);
        checkComponent(matchId, "p_draw", pDraw);
        checkComponent(matchId, "p_away", pAway);
        double sum = pHome + pDraw + pAway;
        if (Math.abs(sum - 1.0) > DEFAULT_TOLERANCE) {
            throw new InvalidProbabilityRowException(matchId, "합계가 1이 아닙니다: sum=" + sum);
        }
    }

    public static MatchProbability normalized(String matchId, double pHome, double pDraw, double pAway) {
        checkComponent(matchId, "p_home", pHome);
        checkComponent(matchId, "p_draw", pDraw);
        checkComponent(matchId, "p_away", pAway);

        double sum = pHome + pDraw + pAway;
        if (sum <= 0) {
            throw new InvalidProbabilityRowException(matchId, "합계가 0 이하입니다");
        }
        if (sum == 1.0) {
            return new MatchProbability(matchId, pHome, pDraw, pAway);
        }
        return new MatchProbability(matchId, pHome / sum, pDraw / sum, pAway / sum);
    }

    public double probability(Outcome outcome) {
        return switch (outcome) {
            case HOME -> pHome;
            case DRAW -> pDraw;
            case AWAY -> pAway;
        };
    }

    private static void checkComponent(String matchId, String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidProbabilityRowException(matchId, name + " 값이 유한하지 않습니다: " + value);
        }
        if (value < 0) {
            throw new InvalidProbabilityRowException(matchId, name + " 값이 음수입니다: " + value);
        }
    }
}
