package org.qcircuit.frontend.real;

/**
 * Reads whitespace separated words and rest-of-line strings from a text, tracking line numbers.
 */
final class TextCursor {

    private final String text;
    private int position;
    private int line = 1;

    TextCursor(String text) {
        this.text = text;
    }

    /**
     * @return The next whitespace delimited word, or null at the end of the text.
     */
    String nextWord() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            if (text.charAt(position) == '\n') {
                line++;
            }
            position++;
        }
        if (position >= text.length()) {
            return null;
        }
        int start = position;
        while (position < text.length() && !Character.isWhitespace(text.charAt(position))) {
            position++;
        }
        return text.substring(start, position);
    }

    /**
     * Consumes the remainder of the current line including its line break.
     * @return The consumed text without the line break.
     */
    String restOfLine() {
        int start = position;
        while (position < text.length() && text.charAt(position) != '\n') {
            position++;
        }
        String rest = text.substring(start, position);
        if (position < text.length()) {
            position++;
            line++;
        }
        return rest;
    }

    int line() {
        return line;
    }
}
