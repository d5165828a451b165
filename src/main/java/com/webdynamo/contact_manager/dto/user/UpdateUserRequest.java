package com.webdynamo.contact_manager.dto.user;

import jakarta.validation.constraints.Size;

/**
 * Partial update of the current user.
 * A null field keeps its stored value; an empty one is rejected.
 */
public record UpdateUserRequest(

        @Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters")
        String name,

        @Size(min = 1, max = 100, message = "Password must be between 1 and 100 characters")
        String password
) {
}
