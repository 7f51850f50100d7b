package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Collects the failures of parse alternatives for one translation, most recent first.
 * The entry on the greatest line marks the furthest point the parser reached and is
 * the one shown to the user.
 */
public class ErrorReporter {

    private final Deque<ErrorNotice> notices = new ArrayDeque<>();

    /**
     * Records a failure at {@code pos}. The line is the one holding {@code pos}; the
     * context runs from {@code pos} to the end of that line.
     */
    public ErrorNotice record(String message, List<Token> tokens, int pos) {
        var end = pos;
        while (end < tokens.size() && !tokens.get(end).isNewline()) end++;
        int line;
        if (end < tokens.size()) {
            line = tokens.get(end).line() - 2;
        } else {
            var before = Math.min(pos, tokens.size()) - 1;
            while (before >= 0 && !tokens.get(before).isNewline()) before--;
            line = before >= 0 ? tokens.get(before).line() - 1 : 0;
        }
        var context = new StringBuilder();
        for (var i = Math.min(pos, tokens.size()); i < end; i++) context.append(tokens.get(i).text());
        return record(message, line, context.toString());
    }

    /** Records a failure whose line is already known. */
    public ErrorNotice record(String message, int line, String context) {
        var notice = new ErrorNotice(message, line, context);
        notices.addFirst(notice);
        return notice;
    }

    public List<ErrorNotice> notices() {
        return List.copyOf(notices);
    }

    public boolean isEmpty() {
        return notices.isEmpty();
    }

    public void clear() {
        notices.clear();
    }

    /** The entry with the greatest line; among equal lines the most recent one. */
    public @Nullable ErrorNotice deepest() {
        ErrorNotice best = null;
        for (var n : notices)
            if (best == null || n.line() > best.line()) best = n;
        return best;
    }

    public ParseException failure(int baseline) {
        var deepest = deepest();
        if (deepest == null) deepest = new ErrorNotice("LE error: translation failed", 0, "");
        return new ParseException(deepest, notices(), baseline);
    }

    public record ErrorNotice(String message, int line, String context) {
        public ErrorNotice {
            requireNonNull(message);
            requireNonNull(context);
        }
    }
}
