package com.example.letters.domain.layout;

import com.example.letters.domain.model.FontFace;

/**
 * A line of letter content at its final position.
 * {@code x} is measured from the left edge and {@code baseline} from the top edge, both in points.
 *
 * @param paragraphIndex index of the body paragraph the line belongs to, or {@code -1} outside the body
 */
public record PlacedText(
        TextRole role,
        int paragraphIndex,
        double x,
        double baseline,
        String text,
        FontFace face,
        double size
) {
}
