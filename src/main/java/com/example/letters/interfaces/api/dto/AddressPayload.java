package com.example.letters.interfaces.api.dto;

import com.example.letters.domain.model.PostalAddress;

/**
 * JSON shape of a US postal address.
 */
public record AddressPayload(
        String street1,
        String street2,
        String city,
        String state,
        String zip
) {

    public static PostalAddress toDomain(AddressPayload payload) {
        if (payload == null) {
            return PostalAddress.empty();
        }
        return new PostalAddress(payload.street1(), payload.street2(), payload.city(), payload.state(), payload.zip());
    }
}
