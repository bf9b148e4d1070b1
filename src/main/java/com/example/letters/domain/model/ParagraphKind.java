package com.example.letters.domain.model;

/**
 * Classification of a body paragraph. Headings are kept together with the paragraph that follows them.
 */
public enum ParagraphKind {
    HEADING,
    BODY
}
