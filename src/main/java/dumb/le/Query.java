package dumb.le;

import static java.util.Objects.requireNonNull;

public record Query(Term name, Condition condition) {
    public Query {
        requireNonNull(name);
        requireNonNull(condition);
    }

    public Term toTerm() {
        return Term.goal(Logic.QUERY, name, condition.toTerm());
    }
}
