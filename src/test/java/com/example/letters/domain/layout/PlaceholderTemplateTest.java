package com.example.letters.domain.layout;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PlaceholderTemplateTest {

    @Test
    void expandsPageTotalAndDate() {
        String expanded = PlaceholderTemplate.expand("Page {page} of {total} - {formatted_date}", 2, 3, "October 5, 2026");

        assertThat(expanded).isEqualTo("Page 2 of 3 - October 5, 2026");
    }

    @Test
    void leavesUnknownPlaceholdersAlone() {
        assertThat(PlaceholderTemplate.expand("{name} p{page}", 1, 1, "")).isEqualTo("{name} p1");
    }

    @Test
    void literalTextIsNotExpanded() {
        String template = PlaceholderTemplate.literal("Jane {page} {{Doe}") + " {formatted_date}";

        assertThat(PlaceholderTemplate.expand(template, 2, 3, "October 5, 2026"))
                .isEqualTo("Jane {page} {{Doe} October 5, 2026");
    }

    @Test
    void substitutedValuesAreNotExpandedAgain() {
        assertThat(PlaceholderTemplate.expand("{formatted_date}", 2, 3, "{page}")).isEqualTo("{page}");
    }

    @Test
    void nullTemplateIsEmpty() {
        assertThat(PlaceholderTemplate.expand(null, 1, 1, "")).isEmpty();
    }

    @Test
    void letterDatesHaveNoLeadingZero() {
        assertThat(LetterDates.format(LocalDate.of(2026, 10, 5))).isEqualTo("October 5, 2026");
        assertThat(LetterDates.format(LocalDate.of(2026, 10, 18))).isEqualTo("October 18, 2026");
    }

    @Test
    void pageCoordinatesFlipTheVerticalAxis() {
        PageCoordinates coordinates = new PageCoordinates(612, 792);

        assertThat(coordinates.toSurfaceY(0)).isEqualTo(792);
        assertThat(coordinates.toSurfaceY(90)).isEqualTo(702);
    }
}
