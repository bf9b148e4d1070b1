package com.example.letters.interfaces.api.dto;

import com.example.letters.domain.model.Recipient;

public record RecipientPayload(
        String name,
        String title,
        String honorific,
        AddressPayload address
) {

    public Recipient toDomain() {
        return new Recipient(name, title, honorific, AddressPayload.toDomain(address));
    }
}
