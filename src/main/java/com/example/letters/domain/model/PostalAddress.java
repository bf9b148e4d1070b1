package com.example.letters.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * US postal address. Any component may be empty; {@code null} is normalized to an empty string.
 */
public record PostalAddress(
        String street1,
        String street2,
        String city,
        String state,
        String zip
) {

    public PostalAddress {
        street1 = clean(street1);
        street2 = clean(street2);
        city = clean(city);
        state = clean(state);
        zip = clean(zip);
    }

    public static PostalAddress empty() {
        return new PostalAddress("", "", "", "", "");
    }

    /**
     * Formats {@code City, ST ZIP}, leaving out blank components and the separators they would need.
     *
     * @return city line or an empty string when every component is blank
     */
    public String cityLine() {
        String stateZip = (state + " " + zip).trim();
        if (city.isEmpty()) {
            return stateZip;
        }
        return stateZip.isEmpty() ? city : city + ", " + stateZip;
    }

    /**
     * @return street lines followed by the city line, without empty entries
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        addIfPresent(lines, street1);
        addIfPresent(lines, street2);
        addIfPresent(lines, cityLine());
        return lines;
    }

    private static void addIfPresent(List<String> lines, String value) {
        if (!value.isEmpty()) {
            lines.add(value);
        }
    }

    private static String clean(String value) {
        return value == null ? "" : value.strip();
    }
}
