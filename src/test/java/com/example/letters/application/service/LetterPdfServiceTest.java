package com.example.letters.application.service;

import com.example.letters.domain.exception.LetterRequestException;
import com.example.letters.domain.exception.UnrenderableContentException;
import com.example.letters.domain.layout.PaginationSimulator;
import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LetterDraft;
import com.example.letters.domain.model.LetterRequest;
import com.example.letters.domain.model.Recipient;
import com.example.letters.domain.model.RenderedLetter;
import com.example.letters.domain.render.LetterRenderer;
import com.example.letters.infrastructure.exception.SurfaceException;
import com.example.letters.infrastructure.pdf.PdfBoxDocumentPropertiesWriter;
import com.example.letters.infrastructure.pdf.PdfBoxDrawingSurfaceFactory;
import com.example.letters.infrastructure.pdf.PdfBoxTextMetrics;
import com.example.letters.support.Letters;
import com.example.letters.support.MonospaceTextMetrics;
import com.example.letters.support.RecordingDrawingSurface;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * End-to-end tests of the rendering use case with the real PDFBox adapters.
 */
class LetterPdfServiceTest {

    private final PdfBoxTextMetrics metrics = new PdfBoxTextMetrics();
    private final LetterPdfService service = new LetterPdfService(
            LetterConfiguration.defaults(),
            new PaginationSimulator(metrics),
            new LetterRenderer(metrics),
            new PdfBoxDrawingSurfaceFactory(new PdfBoxDocumentPropertiesWriter()),
            new LetterContentParser(),
            Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC)
    );

    /**
     * Verifies that a one-page letter renders with its footer and addressing.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void renderProducesOnePageLetter() throws IOException {
        RenderedLetter letter = service.render(Letters.letter("Thank you for supporting our public libraries."));

        assertThat(letter.pageCount()).isEqualTo(1);
        try (PDDocument document = Loader.loadPDF(letter.content())) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("Page 1 of 1", "The Honorable Jane Doe", "October 18, 2026",
                    "Support for Local Libraries", "Sincerely,");
        }
    }

    /**
     * Verifies that the counted, reported and actual page counts agree for a multi-page letter.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void pageCountsAgreeForLongLetters() throws IOException {
        LetterRequest request = Letters.letter(withHeading(Letters.paragraphs(12, 5)));

        int counted = service.countPages(request);
        RenderedLetter letter = service.render(request);

        assertThat(counted).isGreaterThanOrEqualTo(2);
        assertThat(letter.pageCount()).isEqualTo(counted);
        try (PDDocument document = Loader.loadPDF(letter.content())) {
            assertThat(document.getNumberOfPages()).isEqualTo(counted);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(counted);
            stripper.setEndPage(counted);
            assertThat(stripper.getText(document)).contains("Page " + counted + " of " + counted);
        }
    }

    /**
     * Verifies that rendering the same letter twice yields identical bytes.
     */
    @Test
    void renderingIsDeterministic() {
        LetterRequest request = Letters.letter(Letters.paragraphs(3, 4));

        byte[] first = service.render(request).content();
        byte[] second = service.render(request).content();

        assertThat(first).isEqualTo(second);
    }

    /**
     * Verifies the document information derived from the letter.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void documentInformationDescribesTheLetter() throws IOException {
        RenderedLetter letter = service.render(Letters.letter("Body."));

        try (PDDocument document = Loader.loadPDF(letter.content())) {
            PDDocumentInformation info = document.getDocumentInformation();
            assertThat(info.getTitle()).isEqualTo("Letter to Jane Doe");
            assertThat(info.getAuthor()).isEqualTo("John Smith");
            assertThat(info.getSubject()).isEqualTo("Support for Local Libraries");
            assertThat(info.getCreationDate().get(Calendar.YEAR)).isEqualTo(2026);
            assertThat(document.getDocumentCatalog().getMetadata()).isNotNull();
        }
    }

    /**
     * Verifies the drafted-letter use case: subject prefix, default honorific and continuation header.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void renderDraftAddsSubjectPrefixHonorificAndHeader() throws IOException {
        Recipient recipient = new Recipient("Jane Doe", "United States Senator", null, Letters.recipient().address());
        LetterDraft draft = new LetterDraft(Letters.sender(), recipient, "Library Funding",
                draftedLetter(Letters.paragraphs(10, 5)), null);

        RenderedLetter letter = service.renderDraft(draft);

        assertThat(letter.pageCount()).isGreaterThanOrEqualTo(2);
        try (PDDocument document = Loader.loadPDF(letter.content())) {
            PDFTextStripper firstPage = new PDFTextStripper();
            firstPage.setEndPage(1);
            assertThat(firstPage.getText(document))
                    .contains("RE: Library Funding", "The Honorable Jane Doe", "October 18, 2026", "Dear Senator Doe,");

            PDFTextStripper secondPage = new PDFTextStripper();
            secondPage.setStartPage(2);
            secondPage.setEndPage(2);
            String continuation = secondPage.getText(document);
            assertThat(continuation).contains("Jane Doe", "October 18, 2026");
            assertThat(continuation).doesNotContain("The Honorable");
        }
    }

    /**
     * Verifies that braces in a recipient's name are drawn as written in the continuation header.
     *
     * @throws IOException when the produced PDF cannot be read back
     */
    @Test
    void recipientNameInHeaderIsNotExpanded() throws IOException {
        Recipient recipient = new Recipient("Jane {total} Doe", "United States Senator", null,
                Letters.recipient().address());
        LetterDraft draft = new LetterDraft(Letters.sender(), recipient, "Library Funding",
                draftedLetter(Letters.paragraphs(10, 5)), Letters.DATE);

        RenderedLetter letter = service.renderDraft(draft);

        assertThat(letter.pageCount()).isGreaterThanOrEqualTo(2);
        try (PDDocument document = Loader.loadPDF(letter.content())) {
            PDFTextStripper secondPage = new PDFTextStripper();
            secondPage.setStartPage(2);
            secondPage.setEndPage(2);
            assertThat(secondPage.getText(document)).contains("Jane {total} Doe", "October 18, 2026");
        }
    }

    @Test
    void draftWithoutSubjectUsesDefault() throws IOException {
        LetterDraft draft = new LetterDraft(Letters.sender(), Letters.recipient(), " ",
                "Dear Senator,\nPlease help.\nSincerely,", Letters.DATE);

        RenderedLetter letter = service.renderDraft(draft);

        try (PDDocument document = Loader.loadPDF(letter.content())) {
            assertThat(new PDFTextStripper().getText(document)).contains("RE: Important Matter");
        }
    }

    /**
     * Verifies that an oversized paragraph is reported before any bytes are produced.
     */
    @Test
    void oversizedParagraphIsRejected() {
        LetterRequest request = Letters.letter(Letters.paragraphOfLines(80));

        assertThrows(UnrenderableContentException.class, () -> service.render(request));
        assertThrows(UnrenderableContentException.class, () -> service.countPages(request));
    }

    /**
     * Verifies that a failing surface reaches the caller and is still closed.
     */
    @Test
    void surfaceIsClosedWhenFinishingFails() {
        RecordingDrawingSurface surface = new RecordingDrawingSurface() {
            @Override
            public byte[] finish() {
                throw new SurfaceException("Could not save letter", new IOException("disk full"));
            }
        };
        MonospaceTextMetrics monospace = new MonospaceTextMetrics();
        LetterPdfService failing = serviceWith(new PaginationSimulator(monospace), monospace, surface);

        SurfaceException thrown = assertThrows(SurfaceException.class, () -> failing.render(Letters.letter("Body.")));

        assertThat(thrown.getCause()).hasMessage("disk full");
        assertThat(surface.isClosed()).isTrue();
    }

    /**
     * Verifies that diverging page counts fail the render without finishing the document.
     */
    @Test
    void surfaceIsClosedWhenPaginationDiverges() {
        RecordingDrawingSurface surface = new RecordingDrawingSurface();
        PaginationSimulator simulator = mock(PaginationSimulator.class);
        given(simulator.simulate(any(), any())).willReturn(5);
        LetterPdfService diverging = serviceWith(simulator, new MonospaceTextMetrics(), surface);

        assertThrows(IllegalStateException.class, () -> diverging.render(Letters.letter("Body.")));

        assertThat(surface.isFinished()).isFalse();
        assertThat(surface.isClosed()).isTrue();
    }

    @Test
    void missingRequestIsRejected() {
        assertThrows(LetterRequestException.class, () -> service.render(null));
        assertThrows(LetterRequestException.class, () -> service.renderDraft(null));
    }

    @Test
    void todayComesFromTheClock() {
        assertThat(service.today()).isEqualTo(Letters.DATE);
    }

    private static LetterPdfService serviceWith(PaginationSimulator simulator, TextMetrics metrics,
                                                RecordingDrawingSurface surface) {
        return new LetterPdfService(LetterConfiguration.defaults(), simulator, new LetterRenderer(metrics),
                (pageSize, properties) -> surface, new LetterContentParser(),
                Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC));
    }

    private static String draftedLetter(List<String> paragraphs) {
        StringBuilder content = new StringBuilder("Dear Senator Doe,\n\n");
        for (String paragraph : paragraphs) {
            content.append(paragraph).append("\n\n");
        }
        return content.append("Respectfully,\nJohn Smith").toString();
    }

    private static List<String> withHeading(List<String> paragraphs) {
        List<String> copy = new ArrayList<>(paragraphs);
        copy.add(6, "WHAT WE ASK");
        return copy;
    }
}
