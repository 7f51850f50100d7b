package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static dumb.le.Phrases.skipSpaces;

/**
 * Values written in argument positions: dates, numbers, binary operations, lists,
 * variable references and constants.
 */
class Expressions {

    static final String BAD_EXPRESSION = "LE error found in an expression";

    /** Operators in the order they are tried: longer token sequences first. */
    static final List<List<String>> OPERATORS;

    /** Words that end a constant or variable name inside an expression. */
    static final Set<String> OP_STOP = Set.of(
            "on", "because", "is_not_before", "not", "before", "and", "or", "at", "after", "in", "else", "then",
            "must", "if", "xor", "rem", "rdiv", "as", "is", "div", "mod",
            "+", "$", "\\", "=", ":", "'", "/", ">", ";", "@", "<", "*", "-", "?", "^");

    private static final Set<String> FUNCTORS;

    static {
        var ops = new ArrayList<List<String>>();
        for (var w : List.of("is_not_before", "of", "then", "must", "on", "because", "and", "in", "or", "at",
                "before", "after", "else", "with", "rem", "is", "xor", "as", "rdiv", "div", "mod"))
            ops.add(List.of(w));
        for (var s : List.of("=..", "\\=@=", "=@=", "=:=", "=\\=", "@=<", "@>=", ">:<", "*->", "-->", "\\==", "==",
                "\\=", ">=", "=<", "@<", "@>", ":=", "->", "/\\", "\\/", ">>", "<<", ":<", "=>", "//", "**", "::",
                "=", ">", "<", "+", "-", "*", "/", "^", ":"))
            ops.add(Arrays.stream(s.split("")).toList());
        ops.sort(Comparator.<List<String>>comparingInt(List::size).reversed());
        OPERATORS = List.copyOf(ops);
        FUNCTORS = ops.stream().map(op -> String.join("", op)).collect(Collectors.toUnmodifiableSet());
    }

    /** True when {@code functor} names a binary operator written between its operands. */
    static boolean isOperator(String functor) {
        return FUNCTORS.contains(functor);
    }

    private final Dictionary dictionary;
    private final @Nullable Context ctx;

    Expressions(Dictionary dictionary) {
        this(dictionary, null);
    }

    /** Failures of operands are recorded in {@code ctx} when one is given. */
    Expressions(Dictionary dictionary, @Nullable Context ctx) {
        this.dictionary = dictionary;
        this.ctx = ctx;
    }

    /** A parsed value, the map after any variable it introduced, and the next token index. */
    record Parsed(Term term, VariableMap map, int next) {
    }

    /** Parses the whole of {@code words}, or returns null. */
    @Nullable Parsed parseAll(List<Token> words, VariableMap map) {
        var p = parse(words, 0, map);
        return p != null && skipSpaces(words, p.next()) == words.size() ? p : null;
    }

    @Nullable Parsed parse(List<Token> w, int i, VariableMap map) {
        return parse(w, i, map, false);
    }

    /**
     * An {@code operand} is the right side of a binary operator; when it is missing the
     * failure is recorded once, here, and the enclosing operations just fail.
     */
    private @Nullable Parsed parse(List<Token> w, int i, VariableMap map, boolean operand) {
        i = skipSpaces(w, i);
        if (i >= w.size()) return missing(w, operand);

        var date = date(w, i);
        if (date != null) return new Parsed(date.term(), map, date.next());

        Term n = null;
        var after = i + 1;
        if (i + 2 < w.size() && w.get(i).kind() == Token.Kind.NUMBER && w.get(i + 1).is(".")
                && w.get(i + 2).kind() == Token.Kind.NUMBER) {
            n = Term.Num.of(Double.parseDouble(w.get(i).text() + "." + w.get(i + 2).text()));
            after = i + 3;
        } else if (w.get(i).kind() == Token.Kind.NUMBER) {
            n = number(w.get(i).text());
        }

        var left = n != null ? new Parsed(n, map, after) : term(w, i, map, OP_STOP);
        if (left != null) {
            var j = skipSpaces(w, left.next());
            var op = operatorAt(w, j);
            if (op != null) {
                var right = parse(w, j + op.size(), left.map(), true);
                if (right == null) return null;
                return new Parsed(Term.goal(String.join("", op), left.term(), right.term()), right.map(), right.next());
            }
        }

        return left != null ? left : missing(w, operand);
    }

    private @Nullable Parsed missing(List<Token> w, boolean operand) {
        if (operand && ctx != null) ctx.expressionError(w);
        return null;
    }

    private static @Nullable Term number(String digits) {
        try {
            return Term.Num.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** {@code YYYY-MM-DDTHH:MM:SS} or {@code YYYY-MM-DD} as epoch seconds. */
    private static @Nullable Parsed date(List<Token> w, int i) {
        if (i + 8 < w.size() && w.get(i + 1).is("-") && w.get(i + 3).is("-") && w.get(i + 5).is(":") && w.get(i + 7).is(":")) {
            var text = new StringBuilder();
            for (var k = i; k <= i + 8; k++) text.append(w.get(k).text());
            try {
                var seconds = LocalDateTime.parse(text).toEpochSecond(ZoneOffset.UTC);
                return new Parsed(Term.Num.of(seconds), VariableMap.empty(), i + 9);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        if (i + 4 < w.size() && w.get(i).kind() == Token.Kind.NUMBER && w.get(i + 1).is("-")
                && w.get(i + 2).kind() == Token.Kind.NUMBER && w.get(i + 3).is("-") && w.get(i + 4).kind() == Token.Kind.NUMBER) {
            var text = w.get(i).text() + "-" + w.get(i + 2).text() + "-" + w.get(i + 4).text();
            try {
                var seconds = LocalDate.parse(text).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
                return new Parsed(Term.Num.of(seconds), VariableMap.empty(), i + 5);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static @Nullable List<String> operatorAt(List<Token> w, int i) {
        for (var op : OPERATORS) {
            if (i + op.size() > w.size()) continue;
            var found = true;
            for (var k = 0; k < op.size() && found; k++) found = w.get(i + k).is(op.get(k));
            if (found) return op;
        }
        return null;
    }

    /** A variable, a constant or a bracketed list. */
    @Nullable Parsed term(List<Token> w, int i, VariableMap map, Set<String> stops) {
        var v = variable(w, i, map, stops);
        if (v != null) return v;
        var c = constant(w, i, map, stops);
        if (c != null) return c;
        return list(w, i, map, Set.of());
    }

    /**
     * A variable written with an indefinite determiner (introduced), a definite one
     * (looked up) or by its bare name (looked up).
     */
    @Nullable Parsed variable(List<Token> w, int i, VariableMap map, Set<String> stops) {
        i = skipSpaces(w, i);
        if (Phrases.indefiniteAt(w, i)) {
            var run = Phrases.variableWords(w, i + 1, stops);
            if (run.isEmpty()) return null;
            var name = Phrases.variableName(run.texts(), dictionary);
            var introduced = map.introduce(name);
            return introduced == null ? null
                    : new Parsed(introduced.lookup(name).orElseThrow(), introduced, run.next());
        }
        var det = Phrases.definiteAt(w, i);
        if (det > 0) {
            var run = Phrases.variableWords(w, i + det, stops);
            if (run.isEmpty()) return null;
            var name = Phrases.variableName(run.texts(), dictionary);
            return map.lookup(name).map(v -> new Parsed(v, map, run.next())).orElse(null);
        }
        var run = Phrases.variableWords(w, i, stops);
        if (run.isEmpty()) return null;
        var name = Phrases.variableName(run.texts(), dictionary);
        return map.lookup(name).map(v -> new Parsed(v, map, run.next())).orElse(null);
    }

    @Nullable Parsed constant(List<Token> w, int i, VariableMap map, Set<String> stops) {
        var run = Phrases.until(w, i, Phrases.nameStop(stops));
        if (run.isEmpty()) return null;
        return new Parsed(Term.Atom.of(Phrases.joinedTokens(run.words())), map, run.next());
    }

    /** {@code [ e1, e2 | tail ]} starting at the opening bracket. */
    @Nullable Parsed list(List<Token> w, int i, VariableMap map, Set<String> stops) {
        i = skipSpaces(w, i);
        if (i >= w.size() || !w.get(i).is("[")) return null;
        var closing = new HashSet<>(stops);
        closing.add("]");
        var elements = new ArrayList<Term>();
        Term tail = null;
        var bar = false;
        i++;
        while (true) {
            i = skipSpaces(w, i);
            while (i < w.size() && (w.get(i).is(",") || w.get(i).is("|"))) {
                bar |= w.get(i).is("|");
                i = skipSpaces(w, i + 1);
            }
            if (i >= w.size()) return null;
            if (w.get(i).is("]") || closing.contains(w.get(i).text())) break;
            var e = listElement(w, i, map, closing);
            if (e == null) return null;
            if (bar) tail = e.term();
            else elements.add(e.term());
            map = e.map();
            i = skipSpaces(w, e.next());
            if (i < w.size() && w.get(i).is("]")) break;
        }
        if (i >= w.size() || !w.get(i).is("]")) return null;
        Term result = tail == null ? Term.list(elements) : tail;
        if (tail != null)
            for (var k = elements.size() - 1; k >= 0; k--)
                result = Term.goal(Logic.CONS, elements.get(k), result);
        return new Parsed(result, map, i + 1);
    }

    private @Nullable Parsed listElement(List<Token> w, int i, VariableMap map, Set<String> closing) {
        var stops = new HashSet<>(closing);
        stops.add("|");
        if (Phrases.indefiniteAt(w, i) || Phrases.definiteAt(w, i) > 0) return variable(w, i, map, stops);
        var symbolic = variable(w, i, map, stops);
        if (symbolic != null) return symbolic;
        var exprStops = new HashSet<>(stops);
        exprStops.add(",");
        var run = Phrases.until(w, i, Phrases.expressionStop(exprStops));
        if (run.isEmpty()) return null;
        var parsed = parseAll(run.words(), map);
        if (parsed != null) return new Parsed(parsed.term(), parsed.map(), run.next());
        return new Parsed(Term.Atom.of(Phrases.joinedTokens(run.words())), map, run.next());
    }
}
