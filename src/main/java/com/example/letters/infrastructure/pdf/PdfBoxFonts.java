package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.model.FontFace;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;
import org.apache.pdfbox.pdmodel.font.encoding.WinAnsiEncoding;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps letter font faces onto the standard 14 PDF fonts and keeps text within what they can encode.
 * Instances hold PDFBox font objects and must not be shared between documents or threads.
 */
class PdfBoxFonts {

    static final char REPLACEMENT = '?';

    private final Map<FontFace, PDType1Font> fonts = new EnumMap<>(FontFace.class);

    PDType1Font font(FontFace face) {
        return fonts.computeIfAbsent(face, key -> new PDType1Font(standardName(key)));
    }

    static Standard14Fonts.FontName standardName(FontFace face) {
        return switch (face) {
            case TIMES_ROMAN -> Standard14Fonts.FontName.TIMES_ROMAN;
            case TIMES_BOLD -> Standard14Fonts.FontName.TIMES_BOLD;
            case HELVETICA -> Standard14Fonts.FontName.HELVETICA;
            case HELVETICA_BOLD -> Standard14Fonts.FontName.HELVETICA_BOLD;
            case COURIER -> Standard14Fonts.FontName.COURIER;
            case COURIER_BOLD -> Standard14Fonts.FontName.COURIER_BOLD;
        };
    }

    /**
     * Replaces control characters with spaces and characters outside WinAnsi with {@value #REPLACEMENT}.
     * Measuring and drawing both go through this method so their widths agree.
     *
     * @param text raw text
     * @return text every standard font can show
     */
    static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        GlyphList glyphs = GlyphList.getAdobeGlyphList();
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            if (Character.isISOControl(codePoint) || Character.isSpaceChar(codePoint)) {
                builder.append(' ');
            } else if (WinAnsiEncoding.INSTANCE.contains(glyphs.codePointToName(codePoint))) {
                builder.appendCodePoint(codePoint);
            } else {
                builder.append(REPLACEMENT);
            }
        });
        return builder.toString();
    }
}
