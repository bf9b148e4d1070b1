package com.example.letters.support;

import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.model.FontFace;

/**
 * Every character is half an em wide, which makes wrapping predictable in layout tests.
 * At 11pt a 396pt line holds 72 characters.
 */
public class MonospaceTextMetrics implements TextMetrics {

    @Override
    public double width(String text, FontFace face, double size) {
        return text.length() * size * 0.5;
    }
}
