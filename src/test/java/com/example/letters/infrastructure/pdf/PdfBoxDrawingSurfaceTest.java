package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.model.DocumentProperties;
import com.example.letters.domain.model.FontFace;
import com.example.letters.domain.model.LineStyle;
import com.example.letters.domain.model.RgbColor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the PDFBox-backed drawing surface.
 */
class PdfBoxDrawingSurfaceTest {

    private static final DocumentProperties PROPERTIES =
            new DocumentProperties("Letter to Jane Doe", "John Smith", "Subject", LocalDate.of(2026, 10, 18));

    private PdfBoxDrawingSurface newSurface() {
        return new PdfBoxDrawingSurface(PDRectangle.LETTER, PROPERTIES, new PdfBoxDocumentPropertiesWriter());
    }

    /**
     * Verifies that pages, text and lines end up in a readable document.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void writesPagesTextAndLines() throws IOException {
        byte[] bytes;
        try (PdfBoxDrawingSurface surface = newSurface()) {
            surface.newPage();
            surface.drawText(72, 700, "First page", FontFace.TIMES_ROMAN, 11, RgbColor.BLACK);
            surface.drawLine(72, 690, 540, 690, RgbColor.RULE_GRAY, 0.5, LineStyle.DASHED);
            surface.newPage();
            surface.drawText(72, 700, "Second page 世界", FontFace.HELVETICA_BOLD, 11, RgbColor.fromHex("#333333"));
            assertThat(surface.pageCount()).isEqualTo(2);
            bytes = surface.finish();
        }

        try (PDDocument document = Loader.loadPDF(bytes)) {
            assertThat(document.getNumberOfPages()).isEqualTo(2);
            assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(612f);
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("First page", "Second page ??");
        }
    }

    @Test
    void drawingBeforeFirstPageFails() {
        try (PdfBoxDrawingSurface surface = newSurface()) {
            assertThrows(IllegalStateException.class,
                    () -> surface.drawText(72, 700, "Too early", FontFace.TIMES_ROMAN, 11, RgbColor.BLACK));
        }
    }

    @Test
    void closeIsIdempotent() {
        PdfBoxDrawingSurface surface = newSurface();
        surface.newPage();

        surface.close();

        assertDoesNotThrow(surface::close);
    }
}
