package com.example.letters.interfaces.api.dto;

import com.example.letters.domain.model.Sender;

/**
 * JSON shape of the letter author. Email and phone are printed only when their toggles are {@code true}.
 */
public record SenderPayload(
        String name,
        AddressPayload address,
        String email,
        String phone,
        Boolean includeEmail,
        Boolean includePhone
) {

    public Sender toDomain() {
        return new Sender(name, AddressPayload.toDomain(address), email, phone,
                Boolean.TRUE.equals(includeEmail), Boolean.TRUE.equals(includePhone));
    }
}
