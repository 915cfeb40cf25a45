package com.loteca.riskengine.domain.exception;

public class PortfolioPlanSchemaException extends RiskEngineException {

    public PortfolioPlanSchemaException(String message) {
        super(message);
    }

    public PortfolioPlanSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
