package dumb.le;

import static java.util.Objects.requireNonNull;

/**
 * One lexical unit of a document. Spaces and tabs are kept one per token so that
 * indentation can be measured; {@link Kind#NEWLINE} tokens carry the line counter
 * value assigned during normalization.
 */
public record Token(Kind kind, String text, int line) {

    public static final String NEWLINE_TEXT = "\n";

    public Token {
        requireNonNull(kind);
        requireNonNull(text);
    }

    public static Token word(String text) {
        return new Token(Kind.WORD, text, -1);
    }

    public static Token number(String text) {
        return new Token(Kind.NUMBER, text, -1);
    }

    public static Token punct(String text) {
        return new Token(Kind.PUNCT, text, -1);
    }

    public static Token space(String text) {
        return new Token(Kind.SPACE, text, -1);
    }

    public static Token string(String text) {
        return new Token(Kind.STRING, text, -1);
    }

    public static Token cntrl(String text) {
        return new Token(Kind.CNTRL, text, -1);
    }

    public static Token newline(int line) {
        return new Token(Kind.NEWLINE, NEWLINE_TEXT, line);
    }

    public boolean isNewline() {
        return kind == Kind.NEWLINE;
    }

    public boolean isSpace() {
        return kind == Kind.SPACE;
    }

    /** True for any token that reads as {@code text}; newlines and spaces never match. */
    public boolean is(String text) {
        return kind != Kind.NEWLINE && kind != Kind.SPACE && this.text.equals(text);
    }

    /** Columns occupied by a space token. */
    public int width(int tabWidth) {
        return text.equals("\t") ? tabWidth : 1;
    }

    @Override
    public String toString() {
        return kind == Kind.NEWLINE ? "\\n" : text;
    }

    public enum Kind {
        WORD, NUMBER, PUNCT, SPACE, STRING, CNTRL, NEWLINE
    }
}
