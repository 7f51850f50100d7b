package dumb.le;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Word-run extraction shared by template matching, expressions and declarations.
 * Every extractor skips space tokens and stops, without consuming it, at the first
 * token its stop rule accepts.
 */
final class Phrases {

    static final Set<String> LIST_SYMBOLS = Set.of("[", "]");

    private Phrases() {
    }

    /** Words read from {@code tokens} and the index of the first token not read. */
    record Run(List<Token> words, int next) {
        boolean isEmpty() {
            return words.isEmpty();
        }

        List<String> texts() {
            return words.stream().map(Token::text).toList();
        }
    }

    static Run until(List<Token> tokens, int from, Predicate<Token> stop) {
        var words = new ArrayList<Token>();
        var i = from;
        for (; i < tokens.size(); i++) {
            var t = tokens.get(i);
            if (t.isSpace()) continue;
            if (stop.test(t)) break;
            words.add(t);
        }
        return new Run(words, i);
    }

    private static boolean in(Token t, Collection<String> words) {
        return !t.isNewline() && !t.isSpace() && words.contains(t.text());
    }

    /** Variable names and constants stop at punctuation, brackets, {@code that} and line breaks. */
    static Predicate<Token> nameStop(Collection<String> stops) {
        return t -> t.isNewline() || in(t, stops) || in(t, Lexicon.THAT) || in(t, LIST_SYMBOLS) || in(t, Lexicon.PUNCTUATION);
    }

    /** Expressions run over punctuation but not over brackets, {@code that} or line breaks. */
    static Predicate<Token> expressionStop(Collection<String> stops) {
        return t -> t.isNewline() || in(t, stops) || in(t, Lexicon.THAT) || in(t, LIST_SYMBOLS);
    }

    /** Words of a variable reference, before the name rule is applied. */
    static Run variableWords(List<Token> tokens, int from, Collection<String> stops) {
        return until(tokens, from, nameStop(stops));
    }

    /**
     * The variable name written by {@code words}. Ordinals are kept aside and appended
     * last; a type word is left out of the name when other words follow it.
     */
    static String variableName(List<String> words, Dictionary dictionary) {
        var ordinals = new ArrayList<String>();
        var rest = new ArrayList<String>();
        for (var w : words) {
            if (Lexicon.isOrdinal(w)) ordinals.add(w);
            else rest.add(w);
        }
        var name = nameOf(rest, ordinals, dictionary);
        return String.join("_", name);
    }

    private static List<String> nameOf(List<String> words, List<String> base, Dictionary dictionary) {
        if (words.isEmpty()) return base;
        var head = words.get(0);
        var tail = nameOf(words.subList(1, words.size()), base, dictionary);
        if (dictionary.isType(head)) return tail.isEmpty() ? List.of(head) : tail;
        var out = new ArrayList<String>(tail.size() + 1);
        out.add(head);
        out.addAll(tail);
        return out;
    }

    /** Words joined with underscores, as predicate names and constants are written. */
    static String joined(List<String> words) {
        return String.join("_", words);
    }

    static String joinedTokens(List<Token> words) {
        return words.stream().map(Token::text).collect(Collectors.joining("_"));
    }

    /** A determiner at {@code i}: its length in tokens (the elided {@code l'} takes two), or 0. */
    static int definiteAt(List<Token> tokens, int i) {
        i = skipSpaces(tokens, i);
        if (i >= tokens.size()) return 0;
        var t = tokens.get(i);
        if (t.kind() == Token.Kind.NEWLINE || t.isSpace()) return 0;
        if (Lexicon.isDefinite(t.text())) return 1;
        if (Lexicon.ELIDED_DEFINITE.contains(t.text()) && i + 1 < tokens.size() && tokens.get(i + 1).is("'")) return 2;
        return 0;
    }

    static boolean indefiniteAt(List<Token> tokens, int i) {
        i = skipSpaces(tokens, i);
        return i < tokens.size() && !tokens.get(i).isNewline() && Lexicon.isIndefinite(tokens.get(i).text());
    }

    static int skipSpaces(List<Token> tokens, int i) {
        while (i < tokens.size() && tokens.get(i).isSpace()) i++;
        return i;
    }
}
