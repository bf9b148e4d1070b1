package com.example.letters.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Letter author. Email and phone are printed under the signature only when their toggles are set.
 */
public record Sender(
        String name,
        PostalAddress address,
        String email,
        String phone,
        boolean includeEmail,
        boolean includePhone
) {

    public Sender {
        name = name == null ? "" : name.strip();
        address = address != null ? address : PostalAddress.empty();
        email = email == null ? "" : email.strip();
        phone = phone == null ? "" : phone.strip();
    }

    /**
     * @return name followed by the address lines, for the return-address window
     */
    public List<String> returnAddressLines() {
        List<String> lines = new ArrayList<>();
        if (!name.isEmpty()) {
            lines.add(name);
        }
        lines.addAll(address.lines());
        return lines;
    }

    /**
     * @return contact lines printed below the typed signature
     */
    public List<String> contactLines() {
        List<String> lines = new ArrayList<>();
        if (includeEmail && !email.isEmpty()) {
            lines.add(email);
        }
        if (includePhone && !phone.isEmpty()) {
            lines.add(phone);
        }
        return lines;
    }
}
