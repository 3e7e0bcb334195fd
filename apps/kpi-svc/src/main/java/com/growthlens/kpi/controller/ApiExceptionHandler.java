package com.growthlens.kpi.controller;

import com.growthlens.kpi.controller.dto.ErrorResponseDto;
import com.growthlens.kpi.error.InconsistentRollupException;
import com.growthlens.kpi.error.RollupNotFoundException;
import com.growthlens.kpi.tracing.TraceContext;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RollupNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(RollupNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "ROLLUP_NOT_FOUND", ex.getMessage(), Map.of("date", ex.date().toString()));
    }

    @ExceptionHandler(InconsistentRollupException.class)
    public ResponseEntity<ErrorResponseDto> handleInconsistent(InconsistentRollupException ex) {
        return build(HttpStatus.CONFLICT, "INCONSISTENT_ROLLUP", ex.getMessage(), Map.of("date", ex.date().toString()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for " + ex.getName(), details("value", ex.getValue()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(BadSqlGrammarException.class)
    public ResponseEntity<ErrorResponseDto> handleBadSql(BadSqlGrammarException ex) {
        var sqlEx = ex.getSQLException();
        log.error("Bad SQL grammar: {}", ex.getSql(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "SQL_GRAMMAR_ERROR", "Bad SQL grammar",
                details("sqlState", sqlEx != null ? sqlEx.getSQLState() : null));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", details("reason", specific));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details("reason", ex.getMessage()));
    }

    // Map.of rejects null values
    private static Map<String, Object> details(String key, Object value) {
        Map<String, Object> details = new HashMap<>();
        details.put(key, value);
        return details;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = TraceContext.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
