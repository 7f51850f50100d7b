package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static dumb.le.Log.debug;

/**
 * The top-level structure of a document: a header of target and declaration sections,
 * then knowledge bases, scenarios and queries in any order. Once a section's introducer
 * has been read, a failure inside the section fails the whole document.
 */
public class SectionParser {

    static final String BAD_HEADER = "LE error in the header";
    static final String BAD_CONTENT = "LE error in the content";
    static final String BAD_STATEMENT = "LE error found around this statement";
    static final String BAD_ASSUMPTION = "LE error found in an assumption";
    static final String BAD_SCENARIO = "LE error found around this scenario expression";
    static final String BAD_QUERY = "LE error found around this query";

    private static final List<List<List<String>>> DECLARATION_INTRODUCERS = List.of(
            Lexicon.METAPREDICATES, Lexicon.PREDICATES, Lexicon.EVENTS, Lexicon.FLUENTS,
            Lexicon.TARGET_EN, Lexicon.TARGET_FR, Lexicon.TARGET_IT);

    private final Context ctx;
    private final DeclarationProcessor declarations;
    private final ConditionBuilder conditions;

    private final List<KnowledgeBase> knowledgeBases = new ArrayList<>();
    private final List<Scenario> scenarios = new ArrayList<>();
    private final List<Query> queries = new ArrayList<>();
    private final List<Term> content = new ArrayList<>();

    public SectionParser(Context ctx) {
        this.ctx = ctx;
        this.declarations = new DeclarationProcessor(ctx.errors, this::atSectionStart);
        this.conditions = new ConditionBuilder(ctx);
    }

    /** Reads the header and installs the dictionary it declares. */
    public boolean header(Cursor c) {
        while (true) {
            c.spacesOrNewlines();
            if (c.atEnd()) break;
            if (target(c)) continue;
            var kind = declarationIntroducer(c);
            if (kind != null) {
                var block = declarations.block(c, kind);
                if (block == null) return false;
                ctx.declarations.add(block);
                continue;
            }
            if (lookingAtContent(c)) break;
            ctx.error(BAD_HEADER, c);
            return false;
        }
        ctx.dictionary(Dictionary.of(ctx.declarations.entries(), ctx.config.predefinedTemplates()));
        debug("Dictionary holds " + ctx.dictionary().size() + " templates");
        return true;
    }

    /** Reads knowledge bases, scenarios and queries up to the end of input. */
    public boolean content(Cursor c) {
        while (true) {
            c.spacesOrNewlines();
            if (c.atEnd()) return true;
            var start = c.mark();
            var kb = knowledgeBaseIntroducer(c);
            if (kb != null) {
                if (!knowledgeBase(c, kb)) return false;
                continue;
            }
            c.reset(start);
            if (lookingAtScenario(c)) {
                if (!scenario(c)) return false;
                continue;
            }
            if (lookingAtQuery(c)) {
                if (!query(c)) return false;
                continue;
            }
            ctx.error(BAD_CONTENT, c);
            return false;
        }
    }

    public List<KnowledgeBase> knowledgeBases() {
        return List.copyOf(knowledgeBases);
    }

    public List<Scenario> scenarios() {
        return List.copyOf(scenarios);
    }

    public List<Query> queries() {
        return List.copyOf(queries);
    }

    /** Content terms in document order. */
    public List<Term> content() {
        return List.copyOf(content);
    }

    /** {@code the target language is: prolog.} and its French and Italian forms. */
    private boolean target(Cursor c) {
        var start = c.mark();
        String language;
        if (c.anyPhrase(Lexicon.TARGET_EN)) language = "en";
        else if (c.anyPhrase(Lexicon.TARGET_FR)) language = "fr";
        else if (c.anyPhrase(Lexicon.TARGET_IT)) language = "it";
        else return false;

        c.word(":");
        var name = c.peek();
        if (name.isNewline() || name.kind() != Token.Kind.WORD) {
            c.reset(start);
            return false;
        }
        c.next();
        c.spaces();
        if (!c.peek().is(".")) {
            c.reset(start);
            return false;
        }
        c.next();
        ctx.target = name.text();
        ctx.sourceLanguage = language;
        return true;
    }

    private Declarations.@Nullable Kind declarationIntroducer(Cursor c) {
        if (c.anyPhrase(Lexicon.METAPREDICATES)) return Declarations.Kind.METAPREDICATES;
        if (c.anyPhrase(Lexicon.PREDICATES)) return Declarations.Kind.PREDICATES;
        if (c.anyPhrase(Lexicon.EVENTS)) return Declarations.Kind.EVENTS;
        if (c.anyPhrase(Lexicon.FLUENTS)) return Declarations.Kind.FLUENTS;
        return null;
    }

    /** True, without consuming anything, when a header or content section starts here. */
    boolean atSectionStart(Cursor c) {
        var start = c.mark();
        c.spacesOrNewlines();
        var found = DECLARATION_INTRODUCERS.stream().anyMatch(c::anyPhrase);
        c.reset(start);
        return found || lookingAtContent(c);
    }

    private boolean lookingAtContent(Cursor c) {
        var start = c.mark();
        var kb = knowledgeBaseIntroducer(c);
        c.reset(start);
        return kb != null || lookingAtScenario(c) || lookingAtQuery(c);
    }

    /** A whole {@code scenario <name> is:} line; a statement may start with the bare word. */
    private boolean lookingAtScenario(Cursor c) {
        var start = c.mark();
        c.spacesOrNewlines();
        var found = blockName(c, Lexicon.SCENARIO) != null;
        c.reset(start);
        return found;
    }

    private boolean lookingAtQuery(Cursor c) {
        var start = c.mark();
        c.spacesOrNewlines();
        var found = c.anyPhrase(Lexicon.QUERY) && blockName(c, null) != null;
        c.reset(start);
        return found;
    }

    /** Consumes a knowledge base introducer and returns the base's name, or null. */
    private @Nullable String knowledgeBaseIntroducer(Cursor c) {
        var start = c.mark();
        c.spacesOrNewlines();
        String name = null;
        if (c.phrase(Lexicon.RULES_ARE)) name = KnowledgeBase.DEFAULT;
        else if (c.phrase(Lexicon.KNOWLEDGE_BASE))
            name = c.phrase(Lexicon.INCLUDES) ? KnowledgeBase.DEFAULT : named(c, Lexicon.INCLUDES);
        else if (c.phrase(Lexicon.KNOWLEDGE_BASE_IT)) name = named(c, Lexicon.INCLUDES_IT);
        else if (c.phrase(Lexicon.KNOWLEDGE_BASE_FR)) name = named(c, Lexicon.INCLUDES_FR);

        if (name == null) c.reset(start);
        else c.spacesOrNewlines();
        return name;
    }

    /** A name running up to {@code closing}, which is consumed too. */
    private static @Nullable String named(Cursor c, List<String> closing) {
        var run = Phrases.until(c.tokens(), c.mark(), Phrases.nameStop(Set.of(closing.get(0))));
        if (run.isEmpty()) return null;
        c.reset(run.next());
        return c.phrase(closing) ? Phrases.joinedTokens(run.words()) : null;
    }

    private boolean knowledgeBase(Cursor c, String name) {
        var clauses = new ArrayList<Clause>();
        while (true) {
            c.spacesOrNewlines();
            if (c.atEnd() || atSectionStart(c)) break;
            var clause = statement(c);
            if (clause == null) return false;
            clauses.add(clause);
        }
        var kb = new KnowledgeBase(name, clauses);
        knowledgeBases.add(kb);
        content.addAll(kb.toTerms());
        debug("Knowledge base " + name + ": " + clauses.size() + " clauses");
        return true;
    }

    /** One statement, closed by a period. */
    @Nullable Clause statement(Cursor c) {
        var start = c.mark();
        Clause clause;
        if (itThen(c, List.of(Lexicon.BECOMES_THE_CASE))) clause = change(c, Logic.INITIATES);
        else if (itThen(c, Lexicon.BECOMES_NOT_THE_CASE)) clause = change(c, Logic.TERMINATES);
        else if (itThen(c, List.of(Lexicon.IS_ILLEGAL))) clause = illegal(c);
        else clause = rule(c, true);
        if (clause == null) {
            ctx.error(BAD_STATEMENT, c.tokens(), start);
            c.reset(start);
        }
        return clause;
    }

    /** {@code it} or {@code It} followed by one of {@code phrases}, consumed together or not at all. */
    private static boolean itThen(Cursor c, List<List<String>> phrases) {
        var start = c.mark();
        if (c.word(Lexicon.IT) && c.anyPhrase(phrases)) return true;
        c.reset(start);
        return false;
    }

    /** {@code it becomes [not] the case that <fluent> when <event> [if ...].} */
    private @Nullable Clause change(Cursor c, String functor) {
        c.spacesOrNewlines();
        var fluent = conditions.literals().literal(c, VariableMap.empty());
        if (fluent == null || !isTimed(fluent.literal(), Logic.HOLDS)) return null;
        c.spacesOrNewlines();
        if (!c.word(Lexicon.WHEN)) return null;
        c.spacesOrNewlines();
        var event = conditions.literals().literal(c, fluent.map());
        if (event == null || !isTimed(event.literal(), Logic.HAPPENS)) return null;
        c.spacesOrNewlines();

        var e = (Term.Lst) event.literal();
        var time = e.get(2);
        var body = conditions.body(c, event.map().withChangeTime(time));
        if (body == null || !period(c)) return null;
        var f = (Term.Lst) fluent.literal();
        return Clause.of(Term.goal(functor, e.get(1), f.get(1), time), body.condition());
    }

    /** {@code it is illegal that <event> [if ...].} */
    private @Nullable Clause illegal(Cursor c) {
        c.spacesOrNewlines();
        var event = conditions.literals().literal(c, VariableMap.empty());
        if (event == null || !isTimed(event.literal(), Logic.HAPPENS)) return null;
        var body = conditions.body(c, event.map());
        if (body == null || !period(c)) return null;
        var e = (Term.Lst) event.literal();
        return Clause.of(Term.goal(Logic.IT_IS_ILLEGAL, e.get(1), e.get(2)), body.condition());
    }

    /** A head literal and an optional body; {@code numbered} records the head's line. */
    private @Nullable Clause rule(Cursor c, boolean numbered) {
        c.spacesOrNewlines();
        var line = c.line();
        var head = conditions.literals().literal(c, VariableMap.empty());
        if (head == null) return null;
        var body = conditions.body(c, head.map());
        if (body == null || !period(c)) return null;
        return new Clause(numbered ? line : -1, head.literal(), body.condition());
    }

    private static boolean isTimed(Term literal, String functor) {
        return literal instanceof Term.Lst l && l.size() == 3 && l.op().filter(functor::equals).isPresent();
    }

    private static boolean period(Cursor c) {
        c.spaces();
        if (!c.peek().is(".")) return false;
        c.next();
        return true;
    }

    /** {@code scenario <name> is:} and one assumption per period on the lines that follow. */
    private boolean scenario(Cursor c) {
        c.spacesOrNewlines();
        var start = c.mark();
        var name = blockName(c, Lexicon.SCENARIO);
        if (name == null || !c.newline()) {
            ctx.error(BAD_SCENARIO, c.tokens(), start);
            return false;
        }
        var assumptions = new ArrayList<Clause>();
        while (true) {
            c.spacesOrNewlines();
            if (c.atEnd() || atSectionStart(c)) break;
            var at = c.mark();
            var assumption = rule(c, false);
            if (assumption == null) {
                ctx.error(BAD_ASSUMPTION, c.tokens(), at);
                return false;
            }
            assumptions.add(assumption);
        }
        var scenario = new Scenario(name, assumptions);
        scenarios.add(scenario);
        content.add(scenario.toTerm());
        return true;
    }

    /** {@code query <name> is:} then an optional {@code for which} list and conditions, closed by a period. */
    private boolean query(Cursor c) {
        c.spacesOrNewlines();
        var start = c.mark();
        var name = c.anyPhrase(Lexicon.QUERY) ? blockName(c, null) : null;
        if (name == null) {
            ctx.error(BAD_QUERY, c.tokens(), start);
            return false;
        }
        c.spacesOrNewlines();

        var map = VariableMap.empty();
        var ind = 0;
        var beforeHeader = c.mark();
        var headerInd = c.spaces();
        if (c.anyPhrase(Lexicon.FOR_WHICH)) {
            map = variableList(c);
            if (map == null || !c.word(":")) {
                ctx.error(BAD_QUERY, c.tokens(), start);
                return false;
            }
            c.spacesOrNewlines();
            ind = headerInd;
        } else {
            c.reset(beforeHeader);
        }

        var body = conditions.conditions(c, ind, map);
        if (body == null || !period(c)) {
            ctx.error(BAD_QUERY, c.tokens(), start);
            return false;
        }
        var query = new Query(name, body.condition());
        queries.add(query);
        content.add(query.toTerm());
        return true;
    }

    /** The variables named after {@code for which}, separated by commas or {@code and}. */
    private @Nullable VariableMap variableList(Cursor c) {
        var map = VariableMap.empty();
        do {
            var run = Phrases.until(c.tokens(), c.mark(), Phrases.nameStop(Lexicon.VARIABLE_LIST_STOPS));
            var words = run.texts();
            if (!words.isEmpty() && Lexicon.isDeterminer(words.get(0))) words = words.subList(1, words.size());
            if (words.isEmpty()) return null;
            var name = Phrases.variableName(words, ctx.dictionary());
            var bound = map.introduce(name);
            if (bound != null) map = bound;
            c.reset(run.next());
            c.spaces();
        } while (c.word(",") || c.word(Lexicon.AND));
        return map;
    }

    /**
     * The name of a scenario or query, written between its introducer and {@code is:}.
     * A name that is a single number stays a number.
     */
    private static @Nullable Term blockName(Cursor c, @Nullable Set<String> introducer) {
        if (introducer != null && !c.word(introducer)) return null;
        var run = Phrases.until(c.tokens(), c.mark(), Phrases.nameStop(Lexicon.IS));
        if (run.isEmpty()) return null;
        c.reset(run.next());
        if (!c.word(Lexicon.IS) || !c.word(":")) return null;
        var words = run.words();
        if (words.size() == 1 && words.get(0).kind() == Token.Kind.NUMBER && words.get(0).text().length() < 19)
            return Term.Num.of(Long.parseLong(words.get(0).text()));
        return Term.Atom.of(Phrases.joinedTokens(words));
    }
}
