package dumb.le;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Character-level scanner producing the raw token stream: word and number runs,
 * one token per space or tab, control characters, quoted strings and single
 * punctuation characters.
 */
public class Tokenizer {
    private final Reader reader;
    private int currentChar = -2;

    private Tokenizer(Reader reader) {
        this.reader = reader;
    }

    public static List<Token> tokenize(String text) {
        try (var reader = new StringReader(text)) {
            var tokenizer = new Tokenizer(reader);
            var tokens = new ArrayList<Token>();
            while (tokenizer.peek() != -1) tokens.add(tokenizer.next());
            return tokens;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The next code point; a surrogate pair is read as one. */
    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (currentChar != -1 && Character.isHighSurrogate((char) currentChar)) {
                reader.mark(1);
                var low = reader.read();
                if (low != -1 && Character.isLowSurrogate((char) low))
                    currentChar = Character.toCodePoint((char) currentChar, (char) low);
                else
                    reader.reset();
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) currentChar = -2;
        return c;
    }

    private static boolean isWordChar(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Token next() throws IOException {
        var c = consumeChar();
        if (c == ' ' || c == '\t') return Token.space(String.valueOf((char) c));
        if (c == '\r') {
            if (peek() == '\n') consumeChar();
            return Token.cntrl("\n");
        }
        if (c == '\n') return Token.cntrl("\n");
        if (Character.isISOControl(c)) return Token.cntrl(String.valueOf((char) c));
        if (c == '"') return string();
        if (isWordChar(c)) {
            var sb = new StringBuilder().appendCodePoint(c);
            var digits = Character.isDigit(c);
            while (peek() != -1 && isWordChar(peek())) {
                var d = consumeChar();
                digits &= Character.isDigit(d);
                sb.appendCodePoint(d);
            }
            return digits ? Token.number(sb.toString()) : Token.word(sb.toString());
        }
        return Token.punct(Character.toString(c));
    }

    /** An unterminated string runs to the end of input. */
    private Token string() throws IOException {
        var sb = new StringBuilder();
        while (peek() != -1 && peek() != '"') {
            var c = consumeChar();
            if (c == '\\' && (peek() == '"' || peek() == '\\')) c = consumeChar();
            sb.appendCodePoint(c);
        }
        if (peek() == '"') consumeChar();
        return Token.string(sb.toString());
    }
}
