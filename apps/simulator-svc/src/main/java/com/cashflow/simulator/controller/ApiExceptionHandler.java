package com.cashflow.simulator.controller;

import com.cashflow.simulator.controller.dto.ErrorResponseDto;
import com.cashflow.simulator.exception.InvalidBalanceException;
import com.cashflow.simulator.exception.InvalidWindowException;
import com.cashflow.simulator.exception.LedgerFormatException;
import com.cashflow.simulator.exception.SimulationInputException;
import com.cashflow.simulator.exception.UserDataNotFoundException;
import com.cashflow.simulator.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidWindowException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidWindow(InvalidWindowException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of("windowDays", ex.getWindowDays()));
    }

    @ExceptionHandler(InvalidBalanceException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBalance(InvalidBalanceException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of("field", ex.getField()));
    }

    @ExceptionHandler(SimulationInputException.class)
    public ResponseEntity<ErrorResponseDto> handleSimulationInput(SimulationInputException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(LedgerFormatException.class)
    public ResponseEntity<ErrorResponseDto> handleLedgerFormat(LedgerFormatException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "LEDGER_FORMAT_ERROR", ex.getMessage(), Map.of("line", ex.getLine()));
    }

    @ExceptionHandler(UserDataNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleUserDataNotFound(UserDataNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "USER_DATA_NOT_FOUND", ex.getMessage(), Map.of("file", ex.getPath().getFileName().toString()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        String reason = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read", reasonDetails(reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", reasonDetails(ex.getMessage()));
    }

    private static Map<String, Object> reasonDetails(String reason) {
        // Map.of rejects null values
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        return details;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        Map<String, Object> body = details;
        String user = RequestContextHolder.get().map(RequestContextHolder.RequestContext::user).orElse(null);
        if (user != null) {
            body = new HashMap<>(details);
            body.put("user", user);
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, body, traceId));
    }
}
