package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.model.FontFace;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PdfBoxFontsTest {

    @Test
    void keepsWinAnsiText() {
        assertThat(PdfBoxFonts.sanitize("Café – “quoted” €5")).isEqualTo("Café – “quoted” €5");
    }

    @Test
    void replacesUnsupportedCharacters() {
        assertThat(PdfBoxFonts.sanitize("Hello 世界")).isEqualTo("Hello ??");
    }

    @Test
    void turnsControlCharactersIntoSpaces() {
        assertThat(PdfBoxFonts.sanitize("tab\there\u00A0nbsp")).isEqualTo("tab here nbsp");
    }

    @Test
    void nullIsEmpty() {
        assertThat(PdfBoxFonts.sanitize(null)).isEmpty();
    }

    @Test
    void facesMapToStandardFonts() {
        assertThat(PdfBoxFonts.standardName(FontFace.TIMES_BOLD)).isEqualTo(Standard14Fonts.FontName.TIMES_BOLD);
        assertThat(PdfBoxFonts.standardName(FontFace.COURIER)).isEqualTo(Standard14Fonts.FontName.COURIER);
    }

    @Test
    void metricsMatchAfmWidths() {
        PdfBoxTextMetrics metrics = new PdfBoxTextMetrics();

        // Courier glyphs are 600 units wide
        assertThat(metrics.width("abcd", FontFace.COURIER, 10)).isCloseTo(24.0, within(1e-6));
        assertThat(metrics.width("", FontFace.TIMES_ROMAN, 11)).isZero();
    }
}
