package dumb.le;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * The result of translating one document: the clause terms handed to the inference
 * engine, in order, and the model they were built from.
 */
public record Translation(String target, String sourceLanguage, Declarations declarations, Dictionary dictionary,
                          List<KnowledgeBase> knowledgeBases, List<Scenario> scenarios, List<Query> queries,
                          List<Term> content) {

    public Translation {
        requireNonNull(target);
        requireNonNull(sourceLanguage);
        declarations = declarations.frozen();
        requireNonNull(dictionary);
        knowledgeBases = List.copyOf(knowledgeBases);
        scenarios = List.copyOf(scenarios);
        queries = List.copyOf(queries);
        content = List.copyOf(content);
    }

    /**
     * Every output term: the empty query and example guards, the target, the declaration
     * lists, the declared types, then the content in document order.
     */
    public List<Term> terms() {
        var terms = new ArrayList<Term>();
        var none = Term.Atom.of(Logic.NULL);
        terms.add(Term.goal(Logic.QUERY, none, Term.Atom.of(Logic.TRUE)));
        terms.add(Term.goal(Logic.EXAMPLE, none, Term.list(List.of())));
        terms.add(Term.goal(Logic.TARGET, Term.Atom.of(target)));
        declarations.blocks().forEach(b -> terms.add(b.toTerm()));
        dictionary.types().forEach(t -> terms.add(Term.goal(Logic.IS_TYPE, Term.Atom.of(t))));
        terms.addAll(content);
        return terms;
    }

    /** One term per line, each closed by a period. */
    public String toProlog() {
        return terms().stream().map(t -> t.toProlog() + ".").collect(Collectors.joining("\n", "", "\n"));
    }

    public List<Clause> clauses() {
        return knowledgeBases.stream().flatMap(kb -> kb.clauses().stream()).toList();
    }

    public Optional<Query> query(String name) {
        return queries.stream().filter(q -> named(q.name(), name)).findFirst();
    }

    public Optional<Scenario> scenario(String name) {
        return scenarios.stream().filter(s -> named(s.name(), name)).findFirst();
    }

    private static boolean named(Term term, String name) {
        if (term instanceof Term.Atom a) return a.value().equals(name);
        if (term instanceof Term.Num n) return n.value().toString().equals(name);
        return false;
    }
}
