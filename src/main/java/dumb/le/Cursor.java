package dumb.le;

import java.util.Collection;
import java.util.List;

/**
 * A read position over a normalized token list. Parsers mark a position before an
 * alternative and reset to it when the alternative fails.
 */
public class Cursor {
    private final List<Token> tokens;
    private final int tabWidth;
    private int pos;

    public Cursor(List<Token> tokens, int tabWidth) {
        this.tokens = List.copyOf(tokens);
        this.tabWidth = tabWidth;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int mark() {
        return pos;
    }

    public void reset(int mark) {
        pos = mark;
    }

    public boolean atEnd() {
        return pos >= tokens.size();
    }

    public Token peek() {
        return peek(0);
    }

    /** The token {@code k} positions ahead, or a newline sentinel past the end. */
    public Token peek(int k) {
        var i = pos + k;
        return i < tokens.size() ? tokens.get(i) : Token.newline(Integer.MAX_VALUE);
    }

    public Token next() {
        return tokens.get(pos++);
    }

    /** Consumes spaces and tabs, returning the columns they occupy. */
    public int spaces() {
        var width = 0;
        while (!atEnd() && tokens.get(pos).isSpace()) width += tokens.get(pos++).width(tabWidth);
        return width;
    }

    public void spacesOrNewlines() {
        while (!atEnd() && (tokens.get(pos).isSpace() || tokens.get(pos).isNewline())) pos++;
    }

    public boolean newline() {
        if (!atEnd() && tokens.get(pos).isNewline()) {
            pos++;
            return true;
        }
        return false;
    }

    /** Consumes one token reading as any of {@code words}, then trailing spaces. */
    public boolean word(Collection<String> words) {
        if (!atEnd() && words.stream().anyMatch(tokens.get(pos)::is)) {
            pos++;
            spaces();
            return true;
        }
        return false;
    }

    public boolean word(String word) {
        return word(List.of(word));
    }

    /** Consumes the words in order, each optionally preceded by spaces, then trailing spaces. */
    public boolean phrase(List<String> words) {
        var start = pos;
        for (var w : words) {
            spaces();
            if (atEnd() || !tokens.get(pos).is(w)) {
                pos = start;
                return false;
            }
            pos++;
        }
        spaces();
        return true;
    }

    /** The first alternative phrase that matches, consumed. */
    public boolean anyPhrase(List<List<String>> alternatives) {
        for (var words : alternatives)
            if (phrase(words)) return true;
        return false;
    }

    /** True when {@code words} follow, without consuming them. */
    public boolean lookingAt(List<String> words) {
        var start = pos;
        var found = phrase(words);
        pos = start;
        return found;
    }

    /**
     * The 0-based line of the current position: the number of the next line break,
     * less two.
     */
    public int line() {
        for (var i = pos; i < tokens.size(); i++)
            if (tokens.get(i).isNewline()) return tokens.get(i).line() - 2;
        for (var i = tokens.size() - 1; i >= 0; i--)
            if (tokens.get(i).isNewline()) return tokens.get(i).line() - 1;
        return 0;
    }
}
