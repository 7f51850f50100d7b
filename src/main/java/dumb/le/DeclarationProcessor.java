package dumb.le;

import dumb.le.TemplateEntry.Element;
import dumb.le.TemplateEntry.Placeholder;
import dumb.le.TemplateEntry.Slot;
import dumb.le.TemplateEntry.Word;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static dumb.le.Log.debug;

/**
 * Reads the template declarations of one declaration block. A declaration runs up
 * to a comma or period on a single line; its slots are written between asterisks,
 * as {@code *a payer*}, {@code a *payer*} or {@code *payer*}. A plain declaration
 * with no asterisks marks each slot by an indefinite determiner instead.
 */
public class DeclarationProcessor {

    static final String MISPLACED_NEWLINE = "LE error: misplaced new line found in a template declaration";
    static final String UNPAIRED_ASTERISKS = "LE error: unpaired asterisks in a template declaration";
    static final String BAD_TEMPLATE = "LE error found in a template declaration";
    static final String BAD_DECLARATION = "LE error in a declaration";

    private final ErrorReporter errors;
    private final Predicate<Cursor> sectionStart;

    /**
     * @param sectionStart recognises, without consuming, the introducer that ends a block
     */
    public DeclarationProcessor(ErrorReporter errors, Predicate<Cursor> sectionStart) {
        this.errors = errors;
        this.sectionStart = sectionStart;
    }

    /** Reads declarations up to the next section introducer or the end of input. */
    public Declarations.@Nullable Block block(Cursor c, Declarations.Kind kind) {
        var entries = new ArrayList<TemplateEntry>();
        while (true) {
            c.spacesOrNewlines();
            if (c.atEnd() || sectionStart.test(c)) break;
            var start = c.mark();
            var entry = declaration(c, kind.templateKind);
            if (entry == null) {
                errors.record(BAD_DECLARATION, c.tokens(), start);
                return null;
            }
            entries.add(entry);
        }
        debug("Declared " + entries.size() + " " + kind.functor);
        return new Declarations.Block(kind, entries);
    }

    private @Nullable TemplateEntry declaration(Cursor c, TemplateEntry.Kind kind) {
        var start = c.mark();
        var words = new ArrayList<Token>();
        while (!c.atEnd() && !c.peek().is(".") && !c.peek().is(",")) {
            var t = c.next();
            if (t.isNewline()) {
                errors.record(MISPLACED_NEWLINE, c.tokens(), start);
                return null;
            }
            if (!t.isSpace()) words.add(t);
        }
        if (c.atEnd() || words.isEmpty()) {
            errors.record(BAD_TEMPLATE, c.tokens(), start);
            return null;
        }
        c.next();
        try {
            return build(words.stream().map(Token::text).toList(), kind);
        } catch (BadTemplate e) {
            errors.record(e.getMessage(), c.tokens(), start);
            return null;
        }
    }

    /** Builds a template from the words of one declaration. */
    public static TemplateEntry build(List<String> words, TemplateEntry.Kind kind) throws BadTemplate {
        var stars = words.stream().filter("*"::equals).count();
        if (stars % 2 != 0) throw new BadTemplate(UNPAIRED_ASTERISKS);

        var elements = new ArrayList<Element>();
        var slots = new ArrayList<Slot>();
        var fixed = new ArrayList<String>();

        if (stars > 0) {
            var detOutside = !innerDeterminer(words);
            for (var i = 0; i < words.size(); i++) {
                var w = words.get(i);
                if (detOutside && Lexicon.isDeterminer(w) && i + 1 < words.size() && words.get(i + 1).equals("*"))
                    continue;
                if (w.equals("*")) {
                    var close = words.subList(i + 1, words.size()).indexOf("*") + i + 1;
                    var inner = new ArrayList<>(words.subList(i + 1, close));
                    dropDeterminer(inner);
                    elements.add(new Placeholder(slots.size()));
                    slots.add(slot(inner));
                    i = close;
                } else {
                    elements.add(new Word(w));
                    fixed.add(w);
                }
            }
        } else if (kind == TemplateEntry.Kind.PLAIN) {
            for (var i = 0; i < words.size(); i++) {
                var w = words.get(i);
                if (Lexicon.isIndefinite(w) && (i == 0 || !words.get(i - 1).equals("is"))) {
                    var j = i + 1;
                    while (j < words.size() && !endsDeterminerSlot(words.get(j))) j++;
                    if (j > i + 1) {
                        elements.add(new Placeholder(slots.size()));
                        slots.add(slot(words.subList(i + 1, j)));
                        i = j - 1;
                        continue;
                    }
                }
                elements.add(new Word(w));
                fixed.add(w);
            }
        } else {
            for (var w : words) {
                elements.add(new Word(w));
                fixed.add(w);
            }
        }

        if (fixed.isEmpty()) throw new BadTemplate(BAD_TEMPLATE);
        return new TemplateEntry(kind, Phrases.joined(fixed), slots, elements);
    }

    private static boolean innerDeterminer(List<String> words) {
        for (var i = 0; i + 1 < words.size(); i++)
            if (words.get(i).equals("*") && Lexicon.isDeterminer(words.get(i + 1))) return true;
        return false;
    }

    private static void dropDeterminer(List<String> inner) {
        if (inner.isEmpty()) return;
        if (Lexicon.isDeterminer(inner.get(0))) inner.remove(0);
        else if (inner.size() > 1 && Lexicon.ELIDED_DEFINITE.contains(inner.get(0)) && inner.get(1).equals("'"))
            inner.subList(0, 2).clear();
    }

    private static boolean endsDeterminerSlot(String w) {
        return Lexicon.RESERVED.contains(w) || Lexicon.VERBS.contains(w) || Lexicon.PREPOSITIONS.contains(w)
                || Lexicon.isDeterminer(w) || Lexicon.THAT.contains(w);
    }

    /** Ordinals name a slot without typing it; the other words do both. */
    private static Slot slot(List<String> words) throws BadTemplate {
        var ordinals = new ArrayList<String>();
        var typeWords = new ArrayList<String>();
        for (var w : words) {
            if (Lexicon.isOrdinal(w)) ordinals.add(w);
            else typeWords.add(w);
        }
        if (ordinals.isEmpty() && typeWords.isEmpty()) throw new BadTemplate(BAD_TEMPLATE);
        var name = new ArrayList<>(typeWords);
        name.addAll(ordinals);
        return new Slot(Phrases.joined(name), Phrases.joined(typeWords));
    }

    public static class BadTemplate extends Exception {
        public BadTemplate(String message) {
            super(message);
        }
    }
}
