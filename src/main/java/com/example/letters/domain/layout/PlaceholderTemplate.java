package com.example.letters.domain.layout;

/**
 * Expands the header and footer placeholders. Unknown braces are left untouched and <code>{{</code>
 * stands for a literal brace. Expansion is a single left-to-right pass, so substituted values are
 * never expanded again.
 */
public final class PlaceholderTemplate {

    public static final String PAGE = "{page}";
    public static final String TOTAL = "{total}";
    public static final String FORMATTED_DATE = "{formatted_date}";

    private static final String ESCAPED_BRACE = "{{";

    private PlaceholderTemplate() {
    }

    public static String expand(String template, int page, int total, String formattedDate) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        StringBuilder expanded = new StringBuilder(template.length());
        int i = 0;
        while (i < template.length()) {
            if (template.charAt(i) != '{') {
                expanded.append(template.charAt(i++));
            } else if (template.startsWith(ESCAPED_BRACE, i)) {
                expanded.append('{');
                i += ESCAPED_BRACE.length();
            } else if (template.startsWith(PAGE, i)) {
                expanded.append(page);
                i += PAGE.length();
            } else if (template.startsWith(TOTAL, i)) {
                expanded.append(total);
                i += TOTAL.length();
            } else if (template.startsWith(FORMATTED_DATE, i)) {
                expanded.append(formattedDate);
                i += FORMATTED_DATE.length();
            } else {
                expanded.append('{');
                i++;
            }
        }
        return expanded.toString();
    }

    /**
     * Protects caller-supplied text, such as a recipient name, so it is drawn exactly as given.
     *
     * @param text literal text, may be {@code null}
     * @return a template that expands back to {@code text}
     */
    public static String literal(String text) {
        return text == null ? "" : text.replace("{", ESCAPED_BRACE);
    }
}
