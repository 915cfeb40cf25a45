package com.loteca.riskengine.domain.exception;

import lombok.Getter;

@Getter
public class InvalidProbabilityRowException extends RiskEngineException {

    private final String matchId;

    public InvalidProbabilityRowException(String matchId, String reason) {
        super("잘못된 확률 행: match_id=" + matchId + ", " + reason);
        this.matchId = matchId;
    }
}
