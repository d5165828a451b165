package com.webdynamo.contact_manager.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an ownership-scoped lookup finds nothing.
 * Used for both "does not exist" and "belongs to another user".
 */
public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
