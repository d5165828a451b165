package com.webdynamo.contact_manager.dto;

/**
 * Error envelope: {@code {"errors": "description"}}
 * Same shape for validation, auth, not-found, rate-limit and server errors
 */
public record ErrorResponse(String errors) {
}
