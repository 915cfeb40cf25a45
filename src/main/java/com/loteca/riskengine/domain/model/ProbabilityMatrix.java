package com.loteca.riskengine.domain.model;

import java.util.List;

public final class ProbabilityMatrix {

    private final List<MatchProbability> rows;

    private ProbabilityMatrix(List<MatchProbability> rows) {
        this.rows = rows;
    }

    public static ProbabilityMatrix of(List<MatchProbability> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("확률 행렬에 경기가 없습니다");
        }
        for (MatchProbability row : rows) {
            if (row == null) {
                throw new IllegalArgumentException("확률 행렬에 null 행이 있습니다");
            }
        }
        return new ProbabilityMatrix(List.copyOf(rows));
    }

    public int matchCount() {
        return rows.size();
    }

    public MatchProbability row(int match) {
        return rows.get(match);
    }

    public List<String> matchIds() {
        return rows.stream().map(MatchProbability::matchId).toList();
    }
}
