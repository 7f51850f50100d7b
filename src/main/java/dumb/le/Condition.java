package dumb.le;

import static java.util.Objects.requireNonNull;

/** The boolean structure of a rule body or query. */
sealed public interface Condition permits Condition.Literal, Condition.Not, Condition.And, Condition.Or,
        Condition.ForAll, Condition.SetOf, Condition.Aggregate, Condition.At {

    /** The condition as the goal term handed to the inference engine. */
    Term toTerm();

    record Literal(Term goal) implements Condition {
        public Literal {
            requireNonNull(goal);
        }

        @Override
        public Term toTerm() {
            return goal;
        }
    }

    record Not(Condition condition) implements Condition {
        public Not {
            requireNonNull(condition);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.NOT, condition.toTerm());
        }
    }

    record And(Condition left, Condition right) implements Condition {
        public And {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.AND, left.toTerm(), right.toTerm());
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        public Or {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.OR, left.toTerm(), right.toTerm());
        }
    }

    /** Every case satisfying {@code cases} also satisfies {@code goals}. */
    record ForAll(Condition cases, Condition goals) implements Condition {
        public ForAll {
            requireNonNull(cases);
            requireNonNull(goals);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.FORALL, cases.toTerm(), goals.toTerm());
        }
    }

    /** {@code set} is the set of every {@code term} satisfying {@code goals}. */
    record SetOf(Term term, Condition goals, Term set) implements Condition {
        public SetOf {
            requireNonNull(term);
            requireNonNull(goals);
            requireNonNull(set);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.SETOF, term, goals.toTerm(), set);
        }
    }

    /** {@code value} aggregates {@code term} over the solutions of {@code goals}; only {@code sum} is written. */
    record Aggregate(String kind, Term term, Condition goals, Term value) implements Condition {
        public Aggregate {
            requireNonNull(kind);
            requireNonNull(term);
            requireNonNull(goals);
            requireNonNull(value);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.AGGREGATE_ALL, Term.goal(kind, term), goals.toTerm(), value);
        }
    }

    /** A condition reified at a time: {@code ... at <time>}. */
    record At(Condition condition, Term time) implements Condition {
        public At {
            requireNonNull(condition);
            requireNonNull(time);
        }

        @Override
        public Term toTerm() {
            return Term.goal(Logic.ON, condition.toTerm(), time);
        }
    }
}
