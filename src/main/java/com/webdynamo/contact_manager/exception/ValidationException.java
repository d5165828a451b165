package com.webdynamo.contact_manager.exception;

import org.springframework.http.HttpStatus;

/**
 * Business-rule violation on otherwise well-formed input (e.g. duplicate username)
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
