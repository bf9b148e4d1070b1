package com.example.letters.application.service;

import com.example.letters.domain.exception.LetterRequestException;
import com.example.letters.domain.layout.PaginationSimulator;
import com.example.letters.domain.layout.PlaceholderTemplate;
import com.example.letters.domain.model.DocumentProperties;
import com.example.letters.domain.model.HeaderContent;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LetterContent;
import com.example.letters.domain.model.LetterDraft;
import com.example.letters.domain.model.LetterRequest;
import com.example.letters.domain.model.Recipient;
import com.example.letters.domain.model.RenderedLetter;
import com.example.letters.domain.render.DrawingSurface;
import com.example.letters.domain.render.DrawingSurfaceFactory;
import com.example.letters.domain.render.LetterRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Application-layer service that turns letter requests into print-ready PDFs.
 * It runs the pagination pass, then the drawing pass on a surface it owns for the duration of the call.
 * The service keeps no per-call state, so independent letters may be rendered in parallel.
 */
@Service
public class LetterPdfService {

    private static final Logger log = LoggerFactory.getLogger(LetterPdfService.class);

    static final String DEFAULT_HONORIFIC = "The Honorable";
    static final String DEFAULT_SUBJECT = "Important Matter";
    static final String SUBJECT_PREFIX = "RE: ";

    private final LetterConfiguration defaultConfiguration;
    private final PaginationSimulator simulator;
    private final LetterRenderer renderer;
    private final DrawingSurfaceFactory surfaceFactory;
    private final LetterContentParser contentParser;
    private final Clock clock;

    /**
     * Creates the service with its layout passes and infrastructure collaborators.
     *
     * @param defaultConfiguration configuration used when the caller does not supply one
     * @param simulator            pagination pass
     * @param renderer             drawing pass
     * @param surfaceFactory       opens a fresh surface per letter
     * @param contentParser        splits drafted text into letter parts
     * @param clock                source of the default letter date
     */
    public LetterPdfService(LetterConfiguration defaultConfiguration,
                            PaginationSimulator simulator,
                            LetterRenderer renderer,
                            DrawingSurfaceFactory surfaceFactory,
                            LetterContentParser contentParser,
                            Clock clock) {
        this.defaultConfiguration = defaultConfiguration;
        this.simulator = simulator;
        this.renderer = renderer;
        this.surfaceFactory = surfaceFactory;
        this.contentParser = contentParser;
        this.clock = clock;
    }

    public RenderedLetter render(LetterRequest request) {
        return render(defaultConfiguration, request);
    }

    /**
     * Renders a letter with an explicit configuration.
     *
     * @param configuration layout configuration
     * @param request       letter content
     * @return PDF bytes and page count
     * @throws com.example.letters.domain.exception.UnrenderableContentException when a paragraph cannot fit a page
     * @throws com.example.letters.infrastructure.exception.SurfaceException    when the PDF cannot be written
     */
    public RenderedLetter render(LetterConfiguration configuration, LetterRequest request) {
        requireRequest(request);
        int totalPages = simulator.simulate(configuration, request);
        try (DrawingSurface surface = surfaceFactory.open(configuration.pageSize(), DocumentProperties.of(request))) {
            RenderedLetter letter = renderer.render(configuration, request, totalPages, surface);
            log.info("Rendered letter to {} with {} page(s), {} bytes",
                    request.recipient().name(), letter.pageCount(), letter.content().length);
            return letter;
        }
    }

    public int countPages(LetterRequest request) {
        return countPages(defaultConfiguration, request);
    }

    /**
     * Runs only the pagination pass.
     *
     * @param configuration layout configuration
     * @param request       letter content
     * @return number of pages the letter would have
     */
    public int countPages(LetterConfiguration configuration, LetterRequest request) {
        requireRequest(request);
        return simulator.simulate(configuration, request);
    }

    /**
     * Renders a drafted letter for a single recipient. The subject is prefixed with {@code RE: }, the
     * recipient gets the default honorific when none is set, and continuation pages carry a header with
     * the recipient's name on the left and the letter date on the right.
     *
     * @param draft drafted letter text and addressing
     * @return PDF bytes and page count
     */
    public RenderedLetter renderDraft(LetterDraft draft) {
        if (draft == null) {
            throw new LetterRequestException("Letter draft is required.");
        }
        LetterContent content = contentParser.parse(draft.content());
        if (draft.recipient() == null) {
            throw new LetterRequestException("Recipient is required.");
        }
        Recipient recipient = draft.recipient().withDefaultHonorific(DEFAULT_HONORIFIC);
        String subject = draft.subject() == null || draft.subject().isBlank() ? DEFAULT_SUBJECT : draft.subject().strip();
        LocalDate date = draft.date() != null ? draft.date() : today();

        LetterRequest request = new LetterRequest(
                draft.sender(),
                recipient,
                SUBJECT_PREFIX + subject,
                content.salutation(),
                content.paragraphs(),
                content.closing(),
                date
        );
        HeaderContent continuationHeader = new HeaderContent(
                true, PlaceholderTemplate.literal(recipient.name()), "", PlaceholderTemplate.FORMATTED_DATE);
        LetterConfiguration configuration = defaultConfiguration.withHeader(
                defaultConfiguration.header().withSubsequent(continuationHeader));
        return render(configuration, request);
    }

    /**
     * @return the date letters are stamped with when the caller does not choose one
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private void requireRequest(LetterRequest request) {
        if (request == null) {
            throw new LetterRequestException("Letter request is required.");
        }
    }
}
