package com.webdynamo.contact_manager.dto.address;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.webdynamo.contact_manager.model.Address;

public record AddressResponse(

        Long id,

        String street,

        String city,

        String province,

        String country,

        @JsonProperty("postal_code")
        String postalCode
) {
    public static AddressResponse from(Address address) {
        return new AddressResponse(
                address.getId(),
                address.getStreet(),
                address.getCity(),
                address.getProvince(),
                address.getCountry(),
                address.getPostalCode()
        );
    }
}
