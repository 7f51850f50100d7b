package dumb.le;

import dumb.le.Indentation.Item;
import dumb.le.Indentation.Operator;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Set;

/**
 * Reads rule bodies and query conditions. Every condition after the first starts a
 * new line with {@code and} or {@code or}; the indentation of those lines decides how
 * the conditions nest (see {@link Indentation}).
 */
public class ConditionBuilder {

    static final String BAD_CONDITION = "LE error found at a condition";
    static final String BAD_INDENTATION = "LE indentation error";

    private static final Set<String> IS_STOP = Set.of("is", "es", "est", "è");
    private static final Set<String> SUCH_STOP = Set.of("such", "tale", "tel", "tal");

    private final Context ctx;
    private final LiteralParser literals;

    public ConditionBuilder(Context ctx) {
        this.ctx = ctx;
        this.literals = new LiteralParser(ctx);
    }

    public LiteralParser literals() {
        return literals;
    }

    /** A condition, or none for an empty body, and the variables bound while reading it. */
    public record Parsed(@Nullable Condition condition, VariableMap map) {
    }

    /** Marks a form that was recognised and then failed, so no other form is tried. */
    private static final Parsed ABANDONED = new Parsed(null, VariableMap.empty());

    /**
     * The body after a head: nothing before the closing period, or {@code if} followed
     * by conditions, on the head's line or at the start of a line of its own. Null when
     * neither follows.
     */
    public @Nullable Parsed body(Cursor c, VariableMap map) {
        var start = c.mark();
        c.spacesOrNewlines();
        if (c.atEnd() || c.peek().is(".")) return new Parsed(null, map);
        c.reset(start);

        if (c.newline()) {
            var ind = c.spaces();
            if (c.word(Lexicon.IF)) {
                c.spacesOrNewlines();
                return closeBody(c, conditions(c, ind, map));
            }
        }
        c.reset(start);

        c.spaces();
        if (c.word(Lexicon.IF)) {
            c.spacesOrNewlines();
            return closeBody(c, conditions(c, 0, map));
        }
        c.reset(start);
        return null;
    }

    private static @Nullable Parsed closeBody(Cursor c, @Nullable Parsed body) {
        if (body != null) c.spacesOrNewlines();
        return body;
    }

    /**
     * A first condition followed by operator lines indented at least {@code ind0}, folded
     * into one tree.
     */
    public @Nullable Parsed conditions(Cursor c, int ind0, VariableMap map) {
        var start = c.mark();
        var first = condition(c, map);
        if (first == null) return null;

        var items = new ArrayList<Item>();
        items.add(new Item(ind0, Operator.NONE, first.condition()));
        map = first.map();
        while (true) {
            var m = c.mark();
            if (!c.newline()) break;
            var ind = c.spaces();
            if (ind < ind0) {
                c.reset(m);
                break;
            }
            Operator op = c.word(Lexicon.AND) ? Operator.AND : c.word(Lexicon.OR) ? Operator.OR : null;
            if (op == null) {
                c.reset(m);
                break;
            }
            var next = condition(c, map);
            if (next == null) return null;
            items.add(new Item(ind, op, next.condition()));
            map = next.map();
        }

        try {
            return new Parsed(Indentation.rebuild(items), map);
        } catch (Indentation.InconsistentIndentation e) {
            ctx.error(BAD_INDENTATION, c.tokens(), start);
            return null;
        }
    }

    /** One condition: a set, a universal, a sum, a negation or a literal, tried in that order. */
    public @Nullable Parsed condition(Cursor c, VariableMap map) {
        var start = c.mark();
        for (var form = 0; form < 4; form++) {
            c.reset(start);
            var p = switch (form) {
                case 0 -> setOf(c, map);
                case 1 -> forAll(c, map);
                case 2 -> sum(c, map);
                default -> not(c, map);
            };
            if (p == ABANDONED) return failed(c, start);
            if (p != null) return p;
        }
        c.reset(start);
        var literal = literals.literal(c, map);
        if (literal == null) return failed(c, start);
        return new Parsed(new Condition.Literal(literal.literal()), literal.map());
    }

    private @Nullable Parsed failed(Cursor c, int start) {
        c.reset(start);
        ctx.error(BAD_CONDITION, c.tokens(), start);
        return null;
    }

    /** {@code a record is a set of <term>} then a line {@code where <conditions>}. */
    private @Nullable Parsed setOf(Cursor c, VariableMap map) {
        var set = expressions().variable(c.tokens(), c.mark(), map, IS_STOP);
        if (set == null) return null;
        c.reset(set.next());
        c.spaces();
        if (!c.anyPhrase(Lexicon.IS_A_SET_OF)) return null;
        var term = expressions().term(c.tokens(), c.mark(), set.map(), Set.of());
        if (term == null) return null;
        c.reset(term.next());
        c.spaces();

        if (!c.newline()) return ABANDONED;
        var ind = c.spaces();
        if (!c.anyPhrase(Lexicon.WHERE)) return ABANDONED;
        var goals = conditions(c, ind, term.map());
        if (goals == null) return ABANDONED;
        return modifiers(c, new Condition.SetOf(term.term(), goals.condition(), set.term()), goals.map());
    }

    /** {@code for all cases in which} conditions, then {@code it is the case that} conditions. */
    private @Nullable Parsed forAll(Cursor c, VariableMap map) {
        c.spacesOrNewlines();
        if (!c.anyPhrase(Lexicon.FOR_ALL_CASES_IN_WHICH) || !c.newline()) return null;

        var cases = conditions(c, c.spaces(), map);
        if (cases == null) return ABANDONED;
        c.spacesOrNewlines();
        if (!c.anyPhrase(Lexicon.IT_IS_THE_CASE_THAT) || !c.newline()) return ABANDONED;
        var goals = conditions(c, c.spaces(), cases.map());
        if (goals == null) return ABANDONED;
        return modifiers(c, new Condition.ForAll(cases.condition(), goals.condition()), goals.map());
    }

    /** {@code the total is the sum of each amount such that} then conditions on the next lines. */
    private @Nullable Parsed sum(Cursor c, VariableMap map) {
        var value = expressions().variable(c.tokens(), c.mark(), map, IS_STOP);
        if (value == null) return null;
        c.reset(value.next());
        c.spaces();
        if (!c.anyPhrase(Lexicon.IS_THE_SUM_OF_EACH)) return null;
        var run = Phrases.variableWords(c.tokens(), c.mark(), SUCH_STOP);
        if (run.isEmpty()) return null;
        c.reset(run.next());
        if (!c.anyPhrase(Lexicon.SUCH_THAT)) return null;

        var name = Phrases.variableName(run.texts(), ctx.dictionary());
        var bound = value.map().introduce(name);
        if (bound == null) bound = value.map();
        Term each = bound.lookup(name).orElseThrow();

        if (!c.newline()) return ABANDONED;
        var goals = conditions(c, c.spaces(), bound);
        if (goals == null) return ABANDONED;
        return modifiers(c, new Condition.Aggregate(Logic.SUM, each, goals.condition(), value.term()), goals.map());
    }

    /** {@code it is not the case that} and a line break, then the negated conditions. */
    private @Nullable Parsed not(Cursor c, VariableMap map) {
        c.spaces();
        if (!c.anyPhrase(Lexicon.NOT) || !c.newline()) return null;
        var negated = conditions(c, c.spaces(), map);
        if (negated == null) return ABANDONED;
        return modifiers(c, new Condition.Not(negated.condition()), negated.map());
    }

    /** An optional next line {@code at <variable>} placing the condition in time. */
    private Parsed modifiers(Cursor c, Condition condition, VariableMap map) {
        var m = c.mark();
        if (c.newline()) {
            c.spaces();
            if (c.word(Lexicon.AT)) {
                var time = expressions().variable(c.tokens(), c.mark(), map, Set.of());
                if (time != null) {
                    c.reset(time.next());
                    return new Parsed(new Condition.At(condition, time.term()), time.map());
                }
            }
        }
        c.reset(m);
        return new Parsed(condition, map);
    }

    private Expressions expressions() {
        return ctx.matcher().expressions();
    }
}
