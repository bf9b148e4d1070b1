package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Complete, validated layout configuration for one render call.
 * Cross-field invariants (boxes inside the page, margins smaller than the page) are checked here,
 * so a constructed instance can always be laid out.
 */
public record LetterConfiguration(
        PageSize pageSize,
        Positioning positioning,
        Formatting formatting,
        FoldLines foldLines,
        Header header,
        Footer footer
) {

    public LetterConfiguration {
        pageSize = pageSize != null ? pageSize : PageSize.US_LETTER;
        positioning = positioning != null ? positioning : Positioning.defaults();
        formatting = formatting != null ? formatting : Formatting.defaults();
        foldLines = foldLines != null ? foldLines : FoldLines.defaults();
        header = header != null ? header : Header.defaults();
        footer = footer != null ? footer : Footer.defaults();
        validate(pageSize, positioning, formatting, foldLines);
    }

    /**
     * @return configuration for a US Letter page and a #10 windowed envelope
     */
    public static LetterConfiguration defaults() {
        return new LetterConfiguration(PageSize.US_LETTER, Positioning.defaults(), Formatting.defaults(),
                FoldLines.defaults(), Header.defaults(), Footer.defaults());
    }

    public LetterConfiguration withPositioning(Positioning value) {
        return new LetterConfiguration(pageSize, value, formatting, foldLines, header, footer);
    }

    public LetterConfiguration withFormatting(Formatting value) {
        return new LetterConfiguration(pageSize, positioning, value, foldLines, header, footer);
    }

    public LetterConfiguration withFoldLines(FoldLines value) {
        return new LetterConfiguration(pageSize, positioning, formatting, value, header, footer);
    }

    public LetterConfiguration withHeader(Header value) {
        return new LetterConfiguration(pageSize, positioning, formatting, foldLines, value, footer);
    }

    public LetterConfiguration withFooter(Footer value) {
        return new LetterConfiguration(pageSize, positioning, formatting, foldLines, header, value);
    }

    private static void validate(PageSize pageSize, Positioning positioning, Formatting formatting, FoldLines foldLines) {
        Margins margins = positioning.margins();
        if (margins.top() + margins.bottom() >= pageSize.height()) {
            throw new ConfigurationException("Top and bottom margins leave no room on a "
                    + pageSize.height() + "in high page.");
        }
        if (margins.left() + margins.right() >= pageSize.width()) {
            throw new ConfigurationException("Left and right margins leave no room on a "
                    + pageSize.width() + "in wide page.");
        }
        requireInsidePage("Return address", positioning.returnAddress(), pageSize);
        requireInsidePage("Recipient address", positioning.recipientAddress(), pageSize);

        DatePosition date = positioning.datePosition();
        if (date.x() > pageSize.width() || date.y() > pageSize.height()) {
            throw new ConfigurationException("Date position lies outside the page.");
        }
        if (positioning.bodyStartY() >= pageSize.height() - margins.bottom()) {
            throw new ConfigurationException("Body start " + positioning.bodyStartY()
                    + "in is below the bottom margin.");
        }
        double contentWidth = pageSize.width() - margins.left() - margins.right();
        if (formatting.indentParagraphs() && formatting.indentSize() >= contentWidth) {
            throw new ConfigurationException("Paragraph indent must be narrower than the "
                    + contentWidth + "in content width.");
        }
        for (Double position : foldLines.positions()) {
            if (position > pageSize.height()) {
                throw new ConfigurationException("Fold line at " + position + "in lies below the page.");
            }
        }
    }

    private static void requireInsidePage(String name, AddressPosition box, PageSize pageSize) {
        if (box.right() > pageSize.width() || box.bottom() > pageSize.height()) {
            throw new ConfigurationException(name + " box extends beyond the page.");
        }
    }
}
