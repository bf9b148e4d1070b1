package com.example.letters.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Addressee of a letter, typically an elected official with an honorific such as "The Honorable".
 */
public record Recipient(
        String name,
        String title,
        String honorific,
        PostalAddress address
) {

    public Recipient {
        name = name == null ? "" : name.strip();
        title = title == null ? "" : title.strip();
        honorific = honorific == null ? "" : honorific.strip();
        address = address != null ? address : PostalAddress.empty();
    }

    public String displayName() {
        return honorific.isEmpty() ? name : (honorific + " " + name).strip();
    }

    /**
     * @return lines of the recipient window; absent fields leave no blank line behind
     */
    public List<String> addressLines() {
        List<String> lines = new ArrayList<>();
        if (!displayName().isEmpty()) {
            lines.add(displayName());
        }
        if (!title.isEmpty()) {
            lines.add(title);
        }
        lines.addAll(address.lines());
        return lines;
    }

    public Recipient withDefaultHonorific(String fallback) {
        return honorific.isEmpty() ? new Recipient(name, title, fallback, address) : this;
    }
}
