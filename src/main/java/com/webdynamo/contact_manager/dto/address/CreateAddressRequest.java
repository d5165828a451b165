package com.webdynamo.contact_manager.dto.address;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAddressRequest(

        @Size(max = 255, message = "Street must be at most 255 characters")
        String street,

        @Size(max = 100, message = "City must be at most 100 characters")
        String city,

        @Size(max = 100, message = "Province must be at most 100 characters")
        String province,

        @NotBlank(message = "Country is required")
        @Size(max = 100, message = "Country must be at most 100 characters")
        String country,

        @JsonProperty("postal_code")
        @NotBlank(message = "Postal code is required")
        @Size(max = 10, message = "Postal code must be at most 10 characters")
        String postalCode
) {
}
