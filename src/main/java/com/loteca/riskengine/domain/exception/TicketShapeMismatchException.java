package com.loteca.riskengine.domain.exception;

import lombok.Getter;

@Getter
public class TicketShapeMismatchException extends RiskEngineException {

    private final int expected;
    private final int actual;

    public TicketShapeMismatchException(String subject, int expected, int actual) {
        super(subject + " 크기 불일치: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
