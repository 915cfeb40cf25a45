package com.loteca.riskengine.api;

import com.loteca.riskengine.domain.exception.InsufficientDataException;
import com.loteca.riskengine.domain.exception.InvalidProbabilityRowException;
import com.loteca.riskengine.domain.exception.PortfolioPlanSchemaException;
import com.loteca.riskengine.domain.exception.ProbabilityMatrixLoadException;
import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class RiskExceptionHandler {

    @ExceptionHandler({InvalidProbabilityRowException.class, PortfolioPlanSchemaException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ProbabilityMatrixLoadException.class)
    public ResponseEntity<Map<String, Object>> handleMissingInput(ProbabilityMatrixLoadException ex) {
        return build(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({TicketShapeMismatchException.class, InsufficientDataException.class})
    public ResponseEntity<Map<String, Object>> handleUnprocessable(RuntimeException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, RuntimeException ex) {
        log.warn("[Risk API] 요청 실패: status={}, error={}, message={}",
                status.value(), ex.getClass().getSimpleName(), ex.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "error", ex.getClass().getSimpleName(),
                "message", ex.getMessage() != null ? ex.getMessage() : status.getReasonPhrase()));
    }
}
