package com.example.storemap.controller;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.TransactionFailureException;
import com.example.storemap.exception.UnresolvedReferenceException;
import com.example.storemap.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnresolvedReferenceException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnresolved(UnresolvedReferenceException e) {
        logger.debug("Unresolved reference {} in store {}", e.getReference(), e.getStoreId());
        Map<String, Object> body = body("UNSAVED_ELEMENT", e.getMessage());
        // null when the request named no element
        body.put("reference", e.getReference());
        return body;
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException e) {
        return body("NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException e) {
        return body("VALIDATION_ERROR", e.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadInput(ServerWebInputException e) {
        return body("VALIDATION_ERROR", "Malformed request: " + e.getReason());
    }

    @ExceptionHandler(TransactionFailureException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleTransactionFailure(TransactionFailureException e) {
        logger.error("Map transaction failed", e);
        return body("TRANSACTION_FAILURE", "The change was not saved and no partial changes were kept. Please retry.");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception e) {
        logger.error("Unexpected error", e);
        return body("INTERNAL_ERROR", String.valueOf(e.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
