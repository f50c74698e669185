package com.example.nfse.retrieval.controller;

import com.example.nfse.retrieval.model.ApiError;
import com.example.nfse.retrieval.support.AlreadyRunningException;
import com.example.nfse.retrieval.support.CompanyNotFoundException;
import com.example.nfse.retrieval.support.InvalidPeriodException;
import com.example.nfse.retrieval.support.JobNotFoundException;
import com.example.nfse.retrieval.support.QueueFullException;
import com.example.nfse.retrieval.support.RetrievalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidPeriodException.class)
    public ResponseEntity<ApiError> handleInvalidPeriod(InvalidPeriodException exception) {
        return reject(HttpStatus.BAD_REQUEST, exception);
    }

    @ExceptionHandler({ CompanyNotFoundException.class, JobNotFoundException.class })
    public ResponseEntity<ApiError> handleNotFound(RetrievalException exception) {
        return reject(HttpStatus.NOT_FOUND, exception);
    }

    @ExceptionHandler(AlreadyRunningException.class)
    public ResponseEntity<ApiError> handleAlreadyRunning(AlreadyRunningException exception) {
        return reject(HttpStatus.CONFLICT, exception);
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<ApiError> handleQueueFull(QueueFullException exception) {
        return reject(HttpStatus.SERVICE_UNAVAILABLE, exception);
    }

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<ApiError> handleRetrieval(RetrievalException exception) {
        log.error("Request failed: {}", exception.getMessage(), exception);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(exception.errorType(), exception.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException exception) {
        log.warn("Request rejected: {}", exception.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("InvalidRequest", exception.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException exception) {
        log.warn("Request rejected: {}", exception.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("InvalidRequest", exception.getMessage()));
    }

    private static ResponseEntity<ApiError> reject(HttpStatus status, RetrievalException exception) {
        log.warn("Request rejected with {}: {}", status.value(), exception.getMessage());
        return ResponseEntity.status(status).body(new ApiError(exception.errorType(), exception.getMessage()));
    }
}
