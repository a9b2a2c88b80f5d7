package com.jay.stfunnel.controller;

import com.jay.stfunnel.exception.LedgerException;
import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.exception.PipelineValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps funnel exceptions onto HTTP status codes. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PipelineValidationException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(PipelineValidationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "error", "Invalid configuration",
            "violations", e.getViolations()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> notFound(LedgerException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MarketDataException.class)
    public ResponseEntity<Map<String, Object>> marketData(MarketDataException e) {
        log.error("Market data failure for {}: {}", e.getTicker(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of(
            "error", e.getMessage(),
            "ticker", e.getTicker()
        ));
    }
}
