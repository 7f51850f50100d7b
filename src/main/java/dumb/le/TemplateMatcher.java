package dumb.le;

import dumb.le.TemplateEntry.Placeholder;
import dumb.le.TemplateEntry.Word;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Matches a phrase against the dictionary, word by word, binding each slot to a
 * variable, a list, an expression or a constant. The first template that consumes
 * the whole phrase wins.
 * <p>
 * A meta template may take a whole literal in a slot, either written after the
 * reserved word {@code that} or embedded directly; the embedded literal is matched
 * against plain templates only and cannot nest any further.
 */
public class TemplateMatcher {

    private final Dictionary dictionary;
    private final Expressions expressions;

    public TemplateMatcher(Dictionary dictionary) {
        this(dictionary, null);
    }

    TemplateMatcher(Dictionary dictionary, @Nullable Context ctx) {
        this.dictionary = dictionary;
        this.expressions = new Expressions(dictionary, ctx);
    }

    Expressions expressions() {
        return expressions;
    }

    public Dictionary dictionary() {
        return dictionary;
    }

    public record Match(Term goal, VariableMap map, TemplateEntry entry) {
    }

    /** Matches {@code words}, which hold no space tokens, against meta then plain templates. */
    public @Nullable Match match(List<Token> words, VariableMap map) {
        return match(words, map, 0, true);
    }

    private @Nullable Match match(List<Token> words, VariableMap map, int depth, boolean withMeta) {
        if (words.isEmpty()) return null;
        if (withMeta)
            for (var e : dictionary.metaCandidates()) {
                var m = matchEntry(e, words, map, depth);
                if (m != null) return m;
            }
        for (var e : dictionary.plainCandidates()) {
            var m = matchEntry(e, words, map, depth);
            if (m != null) return m;
        }
        return null;
    }

    @Nullable Match matchEntry(TemplateEntry entry, List<Token> words, VariableMap map, int depth) {
        var args = new Term[entry.arity()];
        var end = walk(entry, 0, words, 0, map, args, depth);
        return end == null ? null : new Match(Term.goal(entry.predicate(), List.of(args)), end, entry);
    }

    private @Nullable VariableMap walk(TemplateEntry entry, int k, List<Token> words, int p, VariableMap map, Term[] args, int depth) {
        var elements = entry.elements();
        if (k == elements.size()) return p == words.size() ? map : null;
        var element = elements.get(k);

        if (element instanceof Word w) {
            if (p >= words.size() || !words.get(p).is(w.text())) return null;
            if (depth == 0 && Lexicon.THAT.contains(w.text()) && k + 2 == elements.size()
                    && elements.get(k + 1) instanceof Placeholder last) {
                var inner = match(words.subList(p + 1, words.size()), map, depth + 1, true);
                if (inner != null) {
                    args[last.index()] = inner.goal();
                    return inner.map();
                }
            }
            return walk(entry, k + 1, words, p + 1, map, args, depth);
        }

        var slot = ((Placeholder) element).index();
        var stops = k + 1 < elements.size() && elements.get(k + 1) instanceof Word next ? Set.of(next.text()) : Set.<String>of();

        if (entry.isMeta() && depth == 0)
            for (var end : literalEnds(words, p, stops)) {
                var inner = match(words.subList(p, end), map, depth + 1, false);
                if (inner == null) continue;
                args[slot] = inner.goal();
                var rest = walk(entry, k + 1, words, end, inner.map(), args, depth);
                if (rest != null) return rest;
            }

        if (p < words.size() && Lexicon.isIndefinite(words.get(p).text())) {
            var run = Phrases.variableWords(words, p + 1, stops);
            if (!run.isEmpty()) {
                var name = Phrases.variableName(run.texts(), dictionary);
                var introduced = map.introduce(name);
                if (introduced == null) return null;
                args[slot] = introduced.lookup(name).orElseThrow();
                return walk(entry, k + 1, words, run.next(), introduced, args, depth);
            }
        }

        var det = Phrases.definiteAt(words, p);
        if (det > 0) {
            var run = Phrases.variableWords(words, p + det, stops);
            if (!run.isEmpty()) {
                var found = map.lookup(Phrases.variableName(run.texts(), dictionary));
                if (found.isEmpty()) return null;
                args[slot] = found.get();
                return walk(entry, k + 1, words, run.next(), map, args, depth);
            }
        }

        var symbolic = Phrases.variableWords(words, p, stops);
        if (!symbolic.isEmpty()) {
            var found = map.lookup(Phrases.variableName(symbolic.texts(), dictionary));
            if (found.isPresent()) {
                args[slot] = found.get();
                return walk(entry, k + 1, words, symbolic.next(), map, args, depth);
            }
        }

        if (p < words.size() && words.get(p).is("[")) {
            var list = expressions.list(words, p, map, stops);
            if (list != null) {
                args[slot] = list.term();
                var end = walk(entry, k + 1, words, list.next(), list.map(), args, depth);
                if (end != null) return end;
            }
        }

        var exprStops = new HashSet<>(stops);
        exprStops.add(",");
        var run = Phrases.until(words, p, Phrases.expressionStop(exprStops));
        if (run.isEmpty()) return null;
        var parsed = expressions.parseAll(run.words(), map);
        args[slot] = parsed != null ? parsed.term() : Term.Atom.of(Phrases.joinedTokens(run.words()));
        return walk(entry, k + 1, words, run.next(), map, args, depth);
    }

    /**
     * Where a literal embedded at {@code p} may end, shortest first: before each later
     * occurrence of the template's next word, or at the end of the phrase for a last
     * slot. An embedded literal never runs over {@code that}.
     */
    private static List<Integer> literalEnds(List<Token> words, int p, Set<String> stops) {
        var ends = new ArrayList<Integer>();
        for (var q = p + 1; q <= words.size(); q++) {
            if (q == words.size()) {
                if (stops.isEmpty()) ends.add(q);
                break;
            }
            var t = words.get(q);
            if (t.isNewline() || Lexicon.THAT.contains(t.text())) break;
            if (stops.contains(t.text())) ends.add(q);
        }
        return ends;
    }
}
