package com.webdynamo.contact_manager.dto.user;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.webdynamo.contact_manager.model.User;

/**
 * Public view of a user. The token is only present in the login response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(

        String username,

        String name,

        String token
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.getUsername(), user.getName(), null);
    }

    public static UserResponse from(User user, String token) {
        return new UserResponse(user.getUsername(), user.getName(), token);
    }
}
