package com.example.letters.domain.layout;

import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LetterRequest;

/**
 * Dry-run pass that computes the page count before anything is drawn.
 * Footers print "Page n of total", so the total has to be known up front.
 */
public class PaginationSimulator {

    private final TextMetrics metrics;

    public PaginationSimulator(TextMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @param configuration layout configuration
     * @param request       letter content
     * @return number of pages the rendered letter will have
     */
    public int simulate(LetterConfiguration configuration, LetterRequest request) {
        return new LetterLayoutEngine(configuration, metrics).layout(request, LayoutListener.discarding());
    }
}
