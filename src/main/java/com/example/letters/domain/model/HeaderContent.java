package com.example.letters.domain.model;

/**
 * Left, centre and right zone templates for one header role.
 * Templates may contain {@code {page}}, {@code {total}} and {@code {formatted_date}}.
 */
public record HeaderContent(
        boolean enabled,
        String left,
        String center,
        String right
) {

    public HeaderContent {
        left = left != null ? left : "";
        center = center != null ? center : "";
        right = right != null ? right : "";
    }

    public static HeaderContent disabled() {
        return new HeaderContent(false, "", "", "");
    }
}
