package com.georep.lookup.controller;

import com.georep.lookup.geometry.GeometryException;
import com.georep.lookup.service.DatasetNotReadyException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps lookup failures to HTTP responses.
 *
 * "Not found for this location" is not an exception and is answered by the
 * controller; everything here is either a bad request or a data problem.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DatasetNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(DatasetNotReadyException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("detail", ex.getMessage()));
    }

    @ExceptionHandler(GeometryException.class)
    public ResponseEntity<Map<String, Object>> handleGeometry(GeometryException ex) {
        log.error("Boundary data error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of(
                "error", "boundary_data_error",
                "detail", ex.getMessage()
            ));
    }

    @ExceptionHandler({
        HandlerMethodValidationException.class,
        ConstraintViolationException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(Map.of(
                "error", "validation_failed",
                "detail", ex.getMessage()
            ));
    }
}
