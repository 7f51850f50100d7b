package dumb.le;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A fact or rule. {@code line} is the 0-based line of its head, or -1 for clauses that
 * carry no line, such as the initiates/terminates rules and scenario assumptions.
 */
public record Clause(int line, Term head, @Nullable Condition body) {
    public Clause {
        requireNonNull(head);
    }

    public static Clause of(Term head, @Nullable Condition body) {
        return new Clause(-1, head, body);
    }

    public boolean isFact() {
        return body == null;
    }

    public Term bodyTerm() {
        return body == null ? Term.Atom.of(Logic.TRUE) : body.toTerm();
    }

    /** {@code if(Line, Head, Body)}, or {@code if(Head, Body)} when there is no line. */
    public Term toTerm() {
        return line < 0
                ? Term.goal(Logic.IF, head, bodyTerm())
                : Term.goal(Logic.IF, Term.Num.of(line), head, bodyTerm());
    }

    /** The clause as a scenario assumption: {@code Head :- Body}. */
    public Term toAssumption() {
        return Term.goal(Logic.NECK, head, bodyTerm());
    }
}
