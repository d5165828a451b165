package com.webdynamo.contact_manager.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map to a specific HTTP status.
 * The message is shown to the client as-is, so it must not carry internals.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
