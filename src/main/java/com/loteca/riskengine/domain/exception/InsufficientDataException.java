package com.loteca.riskengine.domain.exception;

public class InsufficientDataException extends RiskEngineException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
