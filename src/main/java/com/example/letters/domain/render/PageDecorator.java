package com.example.letters.domain.render;

import com.example.letters.domain.layout.PageCoordinates;
import com.example.letters.domain.layout.PlaceholderTemplate;
import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.layout.Units;
import com.example.letters.domain.model.FoldLineStyle;
import com.example.letters.domain.model.FoldLines;
import com.example.letters.domain.model.FontFace;
import com.example.letters.domain.model.Footer;
import com.example.letters.domain.model.Header;
import com.example.letters.domain.model.HeaderContent;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LineStyle;
import com.example.letters.domain.model.PageRole;
import com.example.letters.domain.model.RgbColor;

/**
 * Draws the page furniture that does not take part in body flow: fold ticks, running header and footer.
 */
class PageDecorator {

    private static final double HEADER_BASELINE = Units.inches(0.5);
    private static final double HEADER_RULE_OFFSET = 5;
    private static final double FOOTER_BASELINE = Units.inches(0.5);
    private static final double FOOTER_RULE_OFFSET = 15;
    private static final double RULE_WIDTH = 0.5;

    private final LetterConfiguration configuration;
    private final TextMetrics metrics;
    private final PageCoordinates coordinates;
    private final FontFace face;
    private final double contentLeft;
    private final double contentRight;

    PageDecorator(LetterConfiguration configuration, TextMetrics metrics, PageCoordinates coordinates) {
        this.configuration = configuration;
        this.metrics = metrics;
        this.coordinates = coordinates;
        this.face = configuration.formatting().fontFamily().regular();
        this.contentLeft = Units.inches(configuration.positioning().margins().left());
        this.contentRight = coordinates.pageWidth() - Units.inches(configuration.positioning().margins().right());
    }

    void decorate(DrawingSurface surface, int pageNumber, int totalPages, String formattedDate) {
        drawFoldLines(surface);
        drawHeader(surface, pageNumber, totalPages, formattedDate);
        drawFooter(surface, pageNumber, totalPages, formattedDate);
    }

    private void drawFoldLines(DrawingSurface surface) {
        FoldLines foldLines = configuration.foldLines();
        if (!foldLines.enabled()) {
            return;
        }
        FoldLineStyle style = foldLines.style();
        double leftX = Units.millimeters(style.marginOffsetMm());
        double length = Units.millimeters(style.lineLengthMm());
        double rightX = coordinates.pageWidth() - leftX;
        for (Double position : foldLines.positions()) {
            double y = coordinates.toSurfaceY(Units.inches(position));
            surface.drawLine(leftX, y, leftX + length, y, style.color(), style.lineWidth(), style.lineStyle());
            surface.drawLine(rightX - length, y, rightX, y, style.color(), style.lineWidth(), style.lineStyle());
        }
    }

    private void drawHeader(DrawingSurface surface, int pageNumber, int totalPages, String formattedDate) {
        Header header = configuration.header();
        HeaderContent content = header.contentFor(PageRole.forPage(pageNumber));
        if (!content.enabled()) {
            return;
        }
        drawZones(surface, content.left(), content.center(), content.right(), HEADER_BASELINE,
                header.fontSize(), header.color(), pageNumber, totalPages, formattedDate);
        if (header.ruleBelow()) {
            drawRule(surface, HEADER_BASELINE + HEADER_RULE_OFFSET);
        }
    }

    private void drawFooter(DrawingSurface surface, int pageNumber, int totalPages, String formattedDate) {
        Footer footer = configuration.footer();
        if (!footer.enabled()) {
            return;
        }
        double baseline = coordinates.pageHeight() - FOOTER_BASELINE;
        if (footer.ruleAbove()) {
            drawRule(surface, baseline - FOOTER_RULE_OFFSET);
        }
        drawZones(surface, footer.left(), footer.center(), footer.right(), baseline,
                footer.fontSize(), footer.color(), pageNumber, totalPages, formattedDate);
    }

    private void drawZones(DrawingSurface surface, String left, String center, String right, double baseline,
                           double size, RgbColor color, int pageNumber, int totalPages, String formattedDate) {
        double y = coordinates.toSurfaceY(baseline);
        String leftText = PlaceholderTemplate.expand(left, pageNumber, totalPages, formattedDate);
        if (!leftText.isEmpty()) {
            surface.drawText(contentLeft, y, leftText, face, size, color);
        }
        String centerText = PlaceholderTemplate.expand(center, pageNumber, totalPages, formattedDate);
        if (!centerText.isEmpty()) {
            double width = metrics.width(centerText, face, size);
            surface.drawText(coordinates.pageWidth() / 2 - width / 2, y, centerText, face, size, color);
        }
        String rightText = PlaceholderTemplate.expand(right, pageNumber, totalPages, formattedDate);
        if (!rightText.isEmpty()) {
            double width = metrics.width(rightText, face, size);
            surface.drawText(contentRight - width, y, rightText, face, size, color);
        }
    }

    private void drawRule(DrawingSurface surface, double fromTop) {
        double y = coordinates.toSurfaceY(fromTop);
        surface.drawLine(contentLeft, y, contentRight, y, RgbColor.RULE_GRAY, RULE_WIDTH, LineStyle.SOLID);
    }
}
