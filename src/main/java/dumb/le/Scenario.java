package dumb.le;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** A named set of assumptions under which queries may be run. */
public record Scenario(Term name, List<Clause> assumptions) {
    public Scenario {
        requireNonNull(name);
        assumptions = List.copyOf(assumptions);
    }

    /** {@code example(Name, [scenario([Assumption, ...], true)])}. */
    public Term toTerm() {
        var facts = Term.list(assumptions.stream().map(Clause::toAssumption).toList());
        var scenario = Term.goal(Logic.SCENARIO, facts, Term.Atom.of(Logic.TRUE));
        return Term.goal(Logic.EXAMPLE, name, Term.list(List.of(scenario)));
    }
}
