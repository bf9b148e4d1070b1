package com.example.letters.domain.model;

/**
 * Role of a page for header selection: the letterhead page or a continuation page.
 */
public enum PageRole {
    FIRST,
    SUBSEQUENT;

    public static PageRole forPage(int pageNumber) {
        return pageNumber == 1 ? FIRST : SUBSEQUENT;
    }
}
