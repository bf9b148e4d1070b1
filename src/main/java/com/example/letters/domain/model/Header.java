package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Running header configuration with separate content for the first and the continuation pages.
 */
public record Header(
        HeaderContent firstPage,
        HeaderContent subsequent,
        double fontSize,
        RgbColor color,
        boolean ruleBelow
) {

    public Header {
        firstPage = firstPage != null ? firstPage : HeaderContent.disabled();
        subsequent = subsequent != null ? subsequent : new HeaderContent(true, "", "", "");
        color = color != null ? color : RgbColor.fromHex("#333333");
        if (!(fontSize > 0)) {
            throw new ConfigurationException("Header font size must be positive but was " + fontSize);
        }
    }

    public static Header defaults() {
        return new Header(HeaderContent.disabled(), new HeaderContent(true, "", "", ""),
                10, RgbColor.fromHex("#333333"), true);
    }

    public HeaderContent contentFor(PageRole role) {
        return switch (role) {
            case FIRST -> firstPage;
            case SUBSEQUENT -> subsequent;
        };
    }

    public Header withSubsequent(HeaderContent content) {
        return new Header(firstPage, content, fontSize, color, ruleBelow);
    }
}
