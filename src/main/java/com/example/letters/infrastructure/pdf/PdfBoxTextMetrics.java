package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.model.FontFace;
import com.example.letters.infrastructure.exception.SurfaceException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Text metrics read from the AFM data PDFBox ships for the standard 14 fonts.
 * Width lookups go through PDFBox caches that are not thread-safe, hence the synchronization.
 */
@Component
public class PdfBoxTextMetrics implements TextMetrics {

    private final PdfBoxFonts fonts = new PdfBoxFonts();

    @Override
    public synchronized double width(String text, FontFace face, double size) {
        try {
            return fonts.font(face).getStringWidth(PdfBoxFonts.sanitize(text)) / 1000.0 * size;
        } catch (IOException e) {
            throw new SurfaceException("Unable to measure text in " + face, e);
        }
    }
}
