package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads one literal: a phrase that a template matches, optionally placed in time
 * with {@code at <time>,} before it or {@code , at <time>} after it. Declared events
 * come out as {@code happens(G, T)}, declared fluents as {@code holds(G, T)}; every
 * other goal, built-ins included, is timeless.
 */
public class LiteralParser {

    static final String NO_LITERAL = "LE error found in a literal: no literal matched";

    private final Context ctx;

    public LiteralParser(Context ctx) {
        this.ctx = ctx;
    }

    public record Parsed(Term literal, VariableMap map) {
    }

    public @Nullable Parsed literal(Cursor c, VariableMap map) {
        var start = c.mark();

        c.spacesOrNewlines();
        ctx.reading(c.line());
        if (c.word(Lexicon.AT)) {
            var time = time(c, map);
            if (time != null && c.peek().is(",")) {
                c.next();
                var words = phrase(c);
                var m = words == null ? null : ctx.matcher().match(words, time.map());
                if (m != null) return new Parsed(placed(m.goal(), time.term(), m.map()), m.map());
            }
        }
        c.reset(start);

        c.spacesOrNewlines();
        var phraseStart = c.mark();
        var words = phrase(c);
        if (words == null || words.isEmpty()) {
            ctx.error(NO_LITERAL, c.tokens(), phraseStart);
            c.reset(start);
            return null;
        }

        var afterPhrase = c.mark();
        if (c.peek().is(",")) {
            c.next();
            c.spacesOrNewlines();
            if (c.word(Lexicon.AT)) {
                var time = time(c, map);
                if (time != null) {
                    var m = ctx.matcher().match(words, time.map());
                    if (m != null) return new Parsed(placed(m.goal(), time.term(), m.map()), m.map());
                }
            }
            c.reset(afterPhrase);
        }

        var m = ctx.matcher().match(words, map);
        if (m == null) {
            ctx.error(NO_LITERAL, c.tokens(), phraseStart);
            c.reset(start);
            return null;
        }
        return new Parsed(placed(m.goal(), null, m.map()), m.map());
    }

    /**
     * Wraps an event or fluent goal with its time: the one written, else the change
     * time of the enclosing statement, else a fresh variable.
     */
    Term placed(Term goal, @Nullable Term time, VariableMap map) {
        var event = ctx.declarations.isEvent(goal);
        if (!event && !ctx.declarations.isFluent(goal)) return goal;
        var t = time != null ? time : map.changeTime().orElseGet(ctx::freshTime);
        return Term.goal(event ? Logic.HAPPENS : Logic.HOLDS, goal, t);
    }

    private Expressions.@Nullable Parsed time(Cursor c, VariableMap map) {
        var words = new ArrayList<Token>();
        while (!c.atEnd()) {
            var t = c.peek();
            if (t.isNewline() || t.is(",") || t.is("(") || Lexicon.IF.contains(t.text())) break;
            if (t.is(".") && !decimalPoint(c, words)) break;
            c.next();
            if (!t.isSpace()) words.add(t);
        }
        if (words.isEmpty()) return null;
        return ctx.matcher().expressions().parseAll(words, map);
    }

    /**
     * The words of a phrase, up to an {@code if}, a comma, a period or a line break.
     * Bracketed lists are copied whole, line breaks included, and a literal continues on
     * the next line when that line starts with {@code that}.
     */
    public @Nullable List<Token> phrase(Cursor c) {
        var words = new ArrayList<Token>();
        while (!c.atEnd()) {
            var t = c.peek();
            if (t.isSpace()) {
                c.next();
                continue;
            }
            if (t.isNewline()) {
                var m = c.mark();
                c.spacesOrNewlines();
                if (!c.atEnd() && Lexicon.THAT.contains(c.peek().text())) continue;
                c.reset(m);
                break;
            }
            if (t.is("[")) {
                if (!bracketed(c, words)) return null;
                continue;
            }
            if (Lexicon.IF.contains(t.text()) || t.is(",")) break;
            if (t.is(".") && !decimalPoint(c, words)) break;
            words.add(c.next());
            if (Lexicon.THAT.contains(t.text())) c.spacesOrNewlines();
        }
        return words;
    }

    private static boolean bracketed(Cursor c, List<Token> words) {
        var depth = 0;
        while (!c.atEnd()) {
            var t = c.next();
            if (t.isSpace() || t.isNewline()) continue;
            words.add(t);
            if (t.is("[")) depth++;
            else if (t.is("]") && --depth == 0) return true;
        }
        return false;
    }

    /** A period between two numbers is part of a decimal. */
    private static boolean decimalPoint(Cursor c, List<Token> words) {
        return !words.isEmpty() && words.get(words.size() - 1).kind() == Token.Kind.NUMBER
                && c.peek(1).kind() == Token.Kind.NUMBER;
    }
}
