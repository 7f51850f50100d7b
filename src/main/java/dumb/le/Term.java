package dumb.le;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

sealed public interface Term permits Term.Atom, Term.Var, Term.Num, Term.Lst {

    /** A goal term: an atom for a zero-argument relation, else a list headed by the functor. */
    static Term goal(String functor, List<Term> args) {
        if (args.isEmpty()) return Atom.of(functor);
        var terms = new ArrayList<Term>(args.size() + 1);
        terms.add(Atom.of(functor));
        terms.addAll(args);
        return new Lst(terms);
    }

    static Term goal(String functor, Term... args) {
        return goal(functor, List.of(args));
    }

    static Lst list(List<Term> elements) {
        var terms = new ArrayList<Term>(elements.size() + 1);
        terms.add(Atom.of(Logic.LIST));
        terms.addAll(elements);
        return new Lst(terms);
    }

    String toProlog();

    /** Functor of a goal term; empty for variables and numbers. */
    default String functor() {
        if (this instanceof Atom a) return a.value();
        if (this instanceof Lst l) return l.op().orElse("");
        return "";
    }

    default int arity() {
        return this instanceof Lst l ? l.size() - 1 : 0;
    }

    /** {@code functor/arity}, the key of declaration sets and template lookup. */
    default String signature() {
        return functor() + "/" + arity();
    }

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Variable name must start with '?' and have length > 1: " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        /** The name without its {@code ?} prefix. */
        public String label() {
            return name.substring(1);
        }

        @Override
        public String toProlog() {
            var sb = new StringBuilder();
            var label = label();
            for (var i = 0; i < label.length(); i++) {
                var c = label.charAt(i);
                sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
            }
            if (Character.isLetter(sb.charAt(0)))
                sb.setCharAt(0, Character.toUpperCase(sb.charAt(0)));
            else if (sb.charAt(0) != '_')
                sb.insert(0, '_');
            return sb.toString();
        }

        @Override
        public String toString() {
            return "Var[" + name + ']';
        }
    }

    record Num(Number value) implements Term {

        public Num {
            requireNonNull(value);
            if (!(value instanceof Long) && !(value instanceof Double))
                throw new IllegalArgumentException("Number must be a Long or a Double: " + value.getClass());
        }

        public static Num of(long value) {
            return new Num(value);
        }

        public static Num of(double value) {
            return new Num(value);
        }

        @Override
        public String toProlog() {
            return value.toString();
        }

        @Override
        public String toString() {
            return "Num[" + value + ']';
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        /** The terms after the functor. */
        public List<Term> args() {
            return terms.isEmpty() ? List.of() : terms.subList(1, terms.size());
        }

        public Optional<String> op() {
            return terms.isEmpty() || !(terms.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        @Override
        public String toProlog() {
            var op = op().orElse(null);
            if (op == null)
                return terms.stream().map(Term::toProlog).collect(Collectors.joining(", ", "(", ")"));
            var args = args();
            if (op.equals(Logic.LIST))
                return args.stream().map(Term::toProlog).collect(Collectors.joining(", ", "[", "]"));
            if (op.equals(Logic.CONS) && args.size() == 2) {
                var heads = new ArrayList<String>();
                Term tail = this;
                while (tail instanceof Lst c && c.op().filter(Logic.CONS::equals).isPresent() && c.size() == 3) {
                    heads.add(c.get(1).toProlog());
                    tail = c.get(2);
                }
                return "[" + String.join(", ", heads) + "|" + tail.toProlog() + "]";
            }
            if (args.size() == 2) {
                if (op.equals(Logic.AND)) return "(" + args.get(0).toProlog() + ", " + args.get(1).toProlog() + ")";
                if (op.equals(Logic.OR)) return "(" + args.get(0).toProlog() + "; " + args.get(1).toProlog() + ")";
                if (Logic.INFIX.contains(op))
                    return "(" + args.get(0).toProlog() + " " + op + " " + args.get(1).toProlog() + ")";
            }
            return get(0).toProlog() + args.stream().map(Term::toProlog).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "Lst" + terms;
        }
    }

    record Atom(String value) implements Term {
        private static final Pattern PLAIN_PROLOG_ATOM = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return internCache.computeIfAbsent(value, Atom::new);
        }

        @Override
        public String toProlog() {
            if (PLAIN_PROLOG_ATOM.matcher(value).matches() || Logic.INFIX.contains(value) || value.equals("[]"))
                return value;
            return '\'' + value.replace("\\", "\\\\").replace("'", "\\'") + '\'';
        }

        @Override
        public String toString() {
            return "Atom[" + value + ']';
        }
    }
}
