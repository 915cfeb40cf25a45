package com.loteca.riskengine.domain.exception;

public class ProbabilityMatrixLoadException extends RiskEngineException {

    public ProbabilityMatrixLoadException(String message) {
        super(message);
    }

    public ProbabilityMatrixLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
