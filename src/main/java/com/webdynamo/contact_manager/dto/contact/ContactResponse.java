package com.webdynamo.contact_manager.dto.contact;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.webdynamo.contact_manager.model.Contact;

public record ContactResponse(

        Long id,

        @JsonProperty("first_name")
        String firstName,

        @JsonProperty("last_name")
        String lastName,

        String email,

        String phone
) {
    public static ContactResponse from(Contact contact) {
        return new ContactResponse(
                contact.getId(),
                contact.getFirstName(),
                contact.getLastName(),
                contact.getEmail(),
                contact.getPhone()
        );
    }
}
