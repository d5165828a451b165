package com.webdynamo.contact_manager.dto.contact;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for creating a contact. Only first_name is required.
 */
public record CreateContactRequest(

        @JsonProperty("first_name")
        @NotBlank(message = "First name is required")
        @Size(max = 100, message = "First name must be at most 100 characters")
        String firstName,

        @JsonProperty("last_name")
        @Size(max = 100, message = "Last name must be at most 100 characters")
        String lastName,

        @Email(message = "Email must be valid")
        @Size(max = 100, message = "Email must be at most 100 characters")
        String email,

        @Size(max = 20, message = "Phone must be at most 20 characters")
        String phone
) {
}
