package com.example.letters.domain.layout;

import com.example.letters.domain.exception.UnrenderableContentException;
import com.example.letters.domain.model.AddressPosition;
import com.example.letters.domain.model.DatePosition;
import com.example.letters.domain.model.FontFace;
import com.example.letters.domain.model.Formatting;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LetterRequest;
import com.example.letters.domain.model.Margins;
import com.example.letters.domain.model.PageRole;
import com.example.letters.domain.model.ParagraphKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a complete letter: the windowed-envelope letterhead on page 1, the body flowed across as many
 * pages as needed, and the closing block.
 * <p>
 * Paragraphs are atomic: a paragraph that does not fit below the cursor moves to the next page as a whole.
 * A heading additionally needs room for the first lines of the paragraph after it, and is never started
 * in the bottom third of a page. The pagination pass and the drawing pass both run this class, which is
 * what keeps the simulated page count equal to the rendered one.
 * <p>
 * All positions are in points, measured from the top-left corner of the page.
 */
public class LetterLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LetterLayoutEngine.class);

    private static final int MIN_FOLLOWER_LINES = 2;
    private static final int MAX_FOLLOWER_LINES = 4;
    private static final double SUBJECT_SPACING_FACTOR = 1.5;
    private static final double SALUTATION_SPACING_FACTOR = 1.5;
    private static final double CLOSING_GAP_FACTOR = 2.0;
    private static final double CLOSING_TO_SIGNATURE = Units.inches(0.25);
    private static final double SIGNATURE_SPACE = Units.inches(0.6);
    private static final double SIGNATURE_TO_NAME = Units.inches(0.15);

    private final LetterConfiguration configuration;
    private final TextMetrics metrics;
    private final ParagraphClassifier classifier;
    private final TextWrapper wrapper;

    public LetterLayoutEngine(LetterConfiguration configuration, TextMetrics metrics) {
        this(configuration, metrics, new ParagraphClassifier());
    }

    public LetterLayoutEngine(LetterConfiguration configuration, TextMetrics metrics, ParagraphClassifier classifier) {
        this.configuration = configuration;
        this.metrics = metrics;
        this.classifier = classifier;
        this.wrapper = new TextWrapper(metrics);
    }

    /**
     * Lays out the letter and reports every page start and every placed line to the listener.
     *
     * @param request  letter content
     * @param listener receiver of the layout events
     * @return number of pages the letter occupies
     * @throws UnrenderableContentException when a paragraph is taller than an empty page
     */
    public int layout(LetterRequest request, LayoutListener listener) {
        return new Pass(request, listener).run();
    }

    /**
     * State of one layout run. A fresh instance per call keeps the engine itself stateless.
     */
    private final class Pass {

        private final LetterRequest request;
        private final LayoutListener listener;
        private final Formatting formatting = configuration.formatting();
        private final FontFace regular = formatting.fontFamily().regular();
        private final FontFace emphasized = formatting.fontFamily().emphasized();
        private final double pageHeight = Units.inches(configuration.pageSize().height());
        private final double pageWidth = Units.inches(configuration.pageSize().width());
        private final Margins margins = configuration.positioning().margins();
        private final double contentLeft = Units.inches(margins.left());
        private final double contentWidth = pageWidth - Units.inches(margins.left() + margins.right());
        private final double topLimit = Units.inches(margins.top());
        private final double bottomLimit = pageHeight - Units.inches(margins.bottom());
        private final double indent = formatting.indentParagraphs() ? Units.inches(formatting.indentSize()) : 0;

        private int pageNumber;
        private int paragraphsOnPage;
        private double cursor;

        private Pass(LetterRequest request, LayoutListener listener) {
            this.request = request;
            this.listener = listener;
        }

        private int run() {
            startPage();
            placeReturnAddress();
            placeDate();
            placeRecipientAddress();
            placeSubjectAndSalutation();
            flowBody();
            placeClosing();
            return pageNumber;
        }

        private void startPage() {
            pageNumber++;
            paragraphsOnPage = 0;
            cursor = pageNumber == 1 ? Units.inches(configuration.positioning().bodyStartY()) : topLimit;
            listener.onPageStart(pageNumber, PageRole.forPage(pageNumber));
        }

        private double spaceBelow() {
            return bottomLimit - cursor;
        }

        private boolean inBottomThird() {
            return pageHeight - cursor < (pageHeight - topLimit) / 3;
        }

        // An empty continuation page is as good as it gets; breaking again would never terminate.
        private boolean canBreak() {
            return pageNumber == 1 || paragraphsOnPage > 0;
        }

        private void placeReturnAddress() {
            placeBlock(TextRole.RETURN_ADDRESS, configuration.positioning().returnAddress(),
                    request.sender().returnAddressLines());
        }

        private void placeRecipientAddress() {
            placeBlock(TextRole.RECIPIENT_ADDRESS, configuration.positioning().recipientAddress(),
                    request.recipient().addressLines());
        }

        private void placeBlock(TextRole role, AddressPosition box, List<String> lines) {
            double x = Units.inches(box.x());
            double baseline = Units.inches(box.y());
            for (String line : lines) {
                emit(role, -1, x, baseline, line, regular);
                baseline += formatting.addressLineHeight();
            }
        }

        private void placeDate() {
            String formatted = LetterDates.format(request.date());
            DatePosition position = configuration.positioning().datePosition();
            double width = metrics.width(formatted, regular, formatting.fontSize());
            double x = switch (position.alignment()) {
                case RIGHT -> Units.inches(configuration.positioning().recipientAddress().right()) - width;
                case CENTER -> contentLeft + (contentWidth - width) / 2;
                case LEFT -> Units.inches(position.x());
            };
            emit(TextRole.DATE, -1, x, Units.inches(position.y()), formatted, regular);
        }

        private void placeSubjectAndSalutation() {
            cursor += formatting.paragraphSpacing();
            if (!request.subject().isEmpty()) {
                emit(TextRole.SUBJECT, -1, contentLeft, cursor, request.subject(), emphasized);
                cursor += formatting.paragraphSpacing() * SUBJECT_SPACING_FACTOR;
            }
            if (!request.salutation().isEmpty()) {
                emit(TextRole.SALUTATION, -1, contentLeft, cursor, request.salutation() + ",", regular);
            }
            cursor += formatting.lineHeight() * SALUTATION_SPACING_FACTOR;
        }

        private void flowBody() {
            List<String> paragraphs = request.paragraphs();
            double wrapWidth = contentWidth - indent;
            List<List<String>> wrapped = new ArrayList<>(paragraphs.size());
            for (String paragraph : paragraphs) {
                wrapped.add(wrapper.wrap(paragraph, wrapWidth, regular, formatting.fontSize()));
            }

            for (int i = 0; i < paragraphs.size(); i++) {
                ParagraphKind kind = classifier.classify(paragraphs.get(i));
                List<String> lines = wrapped.get(i);
                boolean last = i == paragraphs.size() - 1;
                double needed = lines.size() * formatting.lineHeight() + (last ? 0 : formatting.paragraphSpacing());

                if (kind == ParagraphKind.HEADING && !last && canBreak()) {
                    int followerLines = Math.min(MAX_FOLLOWER_LINES,
                            Math.max(MIN_FOLLOWER_LINES, wrapped.get(i + 1).size() / 2));
                    double withFollower = needed + followerLines * formatting.lineHeight();
                    if (spaceBelow() < withFollower || inBottomThird()) {
                        log.debug("Moving heading {} from page {} to keep it with the next paragraph", i + 1, pageNumber);
                        startPage();
                    }
                }
                if (spaceBelow() < needed) {
                    if (canBreak()) {
                        log.debug("Paragraph {} does not fit on page {}; starting a new page", i + 1, pageNumber);
                        startPage();
                    }
                    if (spaceBelow() < needed) {
                        throw new UnrenderableContentException(i, needed, spaceBelow());
                    }
                }
                placeParagraph(i, kind, lines, last);
            }
        }

        private void placeParagraph(int index, ParagraphKind kind, List<String> lines, boolean last) {
            TextRole role = kind == ParagraphKind.HEADING ? TextRole.HEADING : TextRole.BODY;
            for (int j = 0; j < lines.size(); j++) {
                double x = j == 0 && kind == ParagraphKind.BODY ? contentLeft + indent : contentLeft;
                emit(role, index, x, cursor, lines.get(j), regular);
                cursor += formatting.lineHeight();
            }
            if (!last) {
                cursor += formatting.paragraphSpacing();
            }
            paragraphsOnPage++;
        }

        private void placeClosing() {
            cursor += formatting.paragraphSpacing() * CLOSING_GAP_FACTOR;
            if (spaceBelow() < Units.inches(formatting.closingReserve())) {
                log.debug("Closing block does not fit on page {}; starting a new page", pageNumber);
                startPage();
            }
            emit(TextRole.CLOSING, -1, contentLeft, cursor, request.closing() + ",", regular);
            cursor += CLOSING_TO_SIGNATURE + SIGNATURE_SPACE + SIGNATURE_TO_NAME;

            List<String> signature = new ArrayList<>();
            signature.add(request.sender().name());
            signature.addAll(request.sender().contactLines());
            for (String line : signature) {
                emit(TextRole.SIGNATURE, -1, contentLeft, cursor, line, regular);
                cursor += formatting.addressLineHeight();
            }
        }

        private void emit(TextRole role, int paragraphIndex, double x, double baseline, String text, FontFace face) {
            if (text.isEmpty()) {
                return;
            }
            listener.onText(new PlacedText(role, paragraphIndex, x, baseline, text, face, formatting.fontSize()));
        }
    }
}
