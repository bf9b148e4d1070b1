package com.example.letters.interfaces.api;

import com.example.letters.application.service.LetterPdfService;
import com.example.letters.domain.model.RenderedLetter;
import com.example.letters.interfaces.api.dto.LetterDraftRequest;
import com.example.letters.interfaces.api.dto.LetterPdfRequest;
import com.example.letters.interfaces.api.dto.PageCountResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Interfaces-layer controller that renders letters to PDF over HTTP.
 */
@Controller
public class LetterPdfController {

    static final String PAGE_COUNT_HEADER = "X-Page-Count";
    private static final String FILE_NAME = "letter.pdf";

    private final LetterPdfService letterPdfService;

    /**
     * Creates the controller with the rendering service.
     *
     * @param letterPdfService service that lays out and renders letters
     */
    public LetterPdfController(LetterPdfService letterPdfService) {
        this.letterPdfService = letterPdfService;
    }

    /**
     * Renders a structured letter.
     *
     * @param request sender, recipient, subject and body paragraphs
     * @return PDF document with the page count in the {@code X-Page-Count} header
     */
    @PostMapping(value = "/api/letters/pdf", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<byte[]> renderLetter(@RequestBody LetterPdfRequest request) {
        RenderedLetter letter = letterPdfService.render(request.toDomain(letterPdfService.today()));
        return pdfResponse(letter);
    }

    /**
     * Renders a drafted letter whose text still contains salutation and closing.
     *
     * @param request addressing plus the drafted text
     * @return PDF document with the page count in the {@code X-Page-Count} header
     */
    @PostMapping(value = "/api/letters/draft/pdf", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<byte[]> renderDraft(@RequestBody LetterDraftRequest request) {
        RenderedLetter letter = letterPdfService.renderDraft(request.toDomain());
        return pdfResponse(letter);
    }

    @PostMapping(value = "/api/letters/page-count",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PageCountResponse> countPages(@RequestBody LetterPdfRequest request) {
        int pageCount = letterPdfService.countPages(request.toDomain(letterPdfService.today()));
        return ResponseEntity.ok(new PageCountResponse(pageCount));
    }

    private ResponseEntity<byte[]> pdfResponse(RenderedLetter letter) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + FILE_NAME + "\"")
                .header(PAGE_COUNT_HEADER, String.valueOf(letter.pageCount()))
                .contentType(MediaType.APPLICATION_PDF)
                .body(letter.content());
    }
}
