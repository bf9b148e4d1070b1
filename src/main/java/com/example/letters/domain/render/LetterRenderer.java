package com.example.letters.domain.render;

import com.example.letters.domain.layout.LayoutListener;
import com.example.letters.domain.layout.LetterDates;
import com.example.letters.domain.layout.LetterLayoutEngine;
import com.example.letters.domain.layout.PageCoordinates;
import com.example.letters.domain.layout.PlacedText;
import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LetterRequest;
import com.example.letters.domain.model.PageRole;
import com.example.letters.domain.model.RenderedLetter;
import com.example.letters.domain.model.RgbColor;

/**
 * Drawing pass: runs the shared layout engine and paints its output onto a {@link DrawingSurface},
 * decorating every page with fold ticks, header and footer.
 */
public class LetterRenderer {

    private final TextMetrics metrics;

    public LetterRenderer(TextMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Renders the letter and finishes the surface.
     *
     * @param configuration layout configuration
     * @param request       letter content
     * @param totalPages    page count from the pagination pass, printed in footers
     * @param surface       surface owned by this call; the caller closes it
     * @return finished bytes and the page count produced
     * @throws IllegalStateException when the drawing pass produced a different page count than simulated
     */
    public RenderedLetter render(LetterConfiguration configuration, LetterRequest request, int totalPages,
                                 DrawingSurface surface) {
        if (totalPages < 1) {
            throw new IllegalArgumentException("Total page count must be at least 1 but was " + totalPages);
        }
        PageCoordinates coordinates = PageCoordinates.of(configuration.pageSize());
        PageDecorator decorator = new PageDecorator(configuration, metrics, coordinates);
        String formattedDate = LetterDates.format(request.date());

        LayoutListener painter = new LayoutListener() {
            @Override
            public void onPageStart(int pageNumber, PageRole role) {
                surface.newPage();
                decorator.decorate(surface, pageNumber, totalPages, formattedDate);
            }

            @Override
            public void onText(PlacedText text) {
                surface.drawText(text.x(), coordinates.toSurfaceY(text.baseline()), text.text(),
                        text.face(), text.size(), RgbColor.BLACK);
            }
        };

        int produced = new LetterLayoutEngine(configuration, metrics).layout(request, painter);
        if (produced != totalPages || surface.pageCount() != produced) {
            throw new IllegalStateException("Pagination diverged: simulated " + totalPages
                    + " page(s) but rendered " + produced);
        }
        return new RenderedLetter(surface.finish(), produced);
    }
}
