package dumb.le;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** One knowledge base block: its name and its clauses in the order written. */
public record KnowledgeBase(String name, List<Clause> clauses) {
    public static final String DEFAULT = "default";

    public KnowledgeBase {
        requireNonNull(name);
        clauses = List.copyOf(clauses);
    }

    /** {@code kbname(Name)} followed by the clause terms. */
    public List<Term> toTerms() {
        var terms = new ArrayList<Term>(clauses.size() + 1);
        terms.add(Term.goal(Logic.KBNAME, Term.Atom.of(name)));
        clauses.forEach(c -> terms.add(c.toTerm()));
        return terms;
    }
}
