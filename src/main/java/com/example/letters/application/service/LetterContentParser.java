package com.example.letters.application.service;

import com.example.letters.application.exception.LetterDraftValidationException;
import com.example.letters.domain.layout.ParagraphClassifier;
import com.example.letters.domain.model.LetterContent;
import com.example.letters.domain.model.ParagraphKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits drafted letter text into salutation, body paragraphs and closing.
 * <p>
 * The salutation is the first line starting with "Dear"; the closing is the last line after it that
 * contains a customary sign-off. Blank lines separate paragraphs, and short upper-case lines become
 * headings of their own.
 */
@Component
public class LetterContentParser {

    static final String DEFAULT_SALUTATION = "Dear Senator";
    static final String DEFAULT_CLOSING = "Respectfully";
    private static final List<String> CLOSING_KEYWORDS =
            List.of("Sincerely", "Respectfully", "Best regards", "Thank you", "Yours truly");

    private final ParagraphClassifier classifier;

    public LetterContentParser() {
        this(new ParagraphClassifier());
    }

    LetterContentParser(ParagraphClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param letterText drafted letter text, one paragraph per block of lines
     * @return parsed letter parts
     * @throws LetterDraftValidationException when the text is blank or has no body
     */
    public LetterContent parse(String letterText) {
        if (letterText == null || letterText.isBlank()) {
            throw new LetterDraftValidationException("Letter text is required.");
        }
        List<String> lines = letterText.strip().lines().toList();

        String salutation = DEFAULT_SALUTATION;
        int salutationIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.startsWith("Dear")) {
                salutation = stripTrailing(line, ':', ',');
                salutationIndex = i;
                break;
            }
        }

        String closing = DEFAULT_CLOSING;
        int closingIndex = lines.size();
        for (int i = lines.size() - 1; i > salutationIndex; i--) {
            String line = stripTrailing(lines.get(i).strip(), ',');
            if (containsClosingKeyword(line)) {
                closing = line;
                closingIndex = i;
                break;
            }
        }

        List<String> paragraphs = collectParagraphs(lines.subList(salutationIndex + 1, closingIndex));
        if (paragraphs.isEmpty()) {
            throw new LetterDraftValidationException("Letter text has no body between the salutation and the closing.");
        }
        return new LetterContent(salutation, paragraphs, closing);
    }

    private List<String> collectParagraphs(List<String> bodyLines) {
        List<String> paragraphs = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String rawLine : bodyLines) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                flush(paragraphs, current);
            } else if (classifier.classify(line) == ParagraphKind.HEADING) {
                flush(paragraphs, current);
                paragraphs.add(line);
            } else {
                current.add(line);
            }
        }
        flush(paragraphs, current);
        return paragraphs;
    }

    private void flush(List<String> paragraphs, List<String> current) {
        if (!current.isEmpty()) {
            paragraphs.add(String.join(" ", current));
            current.clear();
        }
    }

    private boolean containsClosingKeyword(String line) {
        for (String keyword : CLOSING_KEYWORDS) {
            if (line.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String stripTrailing(String value, char... characters) {
        String result = value;
        for (char character : characters) {
            while (!result.isEmpty() && result.charAt(result.length() - 1) == character) {
                result = result.substring(0, result.length() - 1);
            }
        }
        return result.strip();
    }
}
