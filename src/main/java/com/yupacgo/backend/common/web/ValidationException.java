package com.yupacgo.backend.common.web;

/**
 * Field level input problem, surfaced as 400 with the message as-is.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
