package dumb.le;

import dumb.le.TemplateEntry.Placeholder;
import dumb.le.TemplateEntry.Word;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static dumb.le.Log.debug;

/**
 * Writes goals back as Logical English, through the template that reads them. Used to
 * explain answers and to list a dictionary.
 */
public class Renderer {

    public static final String NEWLINE = "\n";
    public static final String TAB = "\t";

    private static final Set<String> TIME_TYPES = Set.of("date", "day");
    private static final Set<String> CLOSING = Set.of(",", ".", "]");
    private static final Set<Character> VOWELS = Set.of('a', 'e', 'i', 'o', 'u');

    private final Dictionary dictionary;

    public Renderer(Dictionary dictionary) {
        this.dictionary = dictionary;
    }

    public List<String> render(Condition condition) {
        return render(condition.toTerm());
    }

    public List<String> render(Term goal) {
        var words = new ArrayList<String>();
        render(goal, words);
        return words;
    }

    private void render(Term goal, List<String> out) {
        var f = goal.functor();
        var args = goal instanceof Term.Lst l ? l.args() : List.<Term>of();

        if ((f.equals(Logic.AND) || f.equals(Logic.OR)) && args.size() == 2) {
            render(args.get(0), out);
            out.addAll(List.of(NEWLINE, TAB, f));
            render(args.get(1), out);
            return;
        }
        if (f.equals(Logic.NOT) && args.size() == 1) {
            out.addAll(List.of("it", "is", "not", "the", "case", "that", NEWLINE, TAB));
            render(args.get(0), out);
            return;
        }

        var template = dictionary.lookup(f, args.size());
        if (template.isPresent()) {
            fill(template.get(), args, out);
            return;
        }

        if ((f.equals(Logic.HAPPENS) || f.equals(Logic.HOLDS)) && args.size() == 2) {
            out.add("At");
            out.addAll(time(args.get(1)));
            out.addAll(List.of("it", f.equals(Logic.HAPPENS) ? "occurs" : "holds", "that"));
            render(args.get(0), out);
            return;
        }

        if (args.size() == 2 && Expressions.isOperator(f)) {
            out.addAll(value(args.get(0), ""));
            out.add(f);
            out.addAll(value(args.get(1), ""));
            return;
        }

        debug("No template renders " + goal.signature());
        out.addAll(words(f));
        for (var a : args) out.addAll(value(a, ""));
    }

    private void fill(TemplateEntry entry, List<Term> args, List<String> out) {
        for (var e : entry.elements()) {
            if (e instanceof Word w) {
                out.add(w.text());
            } else {
                var index = ((Placeholder) e).index();
                var slot = entry.slots().get(index);
                var arg = args.get(index);
                if (arg instanceof Term.Var) out.addAll(determined(slot.name()));
                else if (arg instanceof Term.Lst l && !l.functor().equals(Logic.LIST) && !l.functor().equals(Logic.CONS))
                    render(arg, out);
                else out.addAll(value(arg, slot.type()));
            }
        }
    }

    private List<String> value(Term t, String type) {
        if (t instanceof Term.Atom a) return words(a.value());
        if (t instanceof Term.Var v) return determined(v.label());
        if (t instanceof Term.Num n) {
            if (TIME_TYPES.contains(type) && n.value() instanceof Long seconds) return List.of(date(seconds));
            return List.of(n.value().toString());
        }
        var l = (Term.Lst) t;
        if (l.functor().equals(Logic.LIST)) {
            var out = new ArrayList<String>();
            out.add("[");
            var elements = l.args();
            for (var i = 0; i < elements.size(); i++) {
                if (i > 0) out.add(",");
                out.addAll(value(elements.get(i), ""));
            }
            out.add("]");
            return out;
        }
        if (l.functor().equals(Logic.CONS)) return List.of(l.toProlog());
        return render(l);
    }

    /** {@code a time} for a variable, a date for an epoch, the number for small values. */
    private static List<String> time(Term t) {
        if (t instanceof Term.Var) return List.of("a", "time");
        if (t instanceof Term.Num n && n.value() instanceof Long seconds && seconds > 100) return List.of(date(seconds));
        if (t instanceof Term.Num n) return List.of(n.value().toString());
        if (t instanceof Term.Atom a) return words(a.value());
        return List.of(t.toProlog());
    }

    private static String date(long epochSeconds) {
        return LocalDateTime.ofEpochSecond(epochSeconds, 0, ZoneOffset.UTC).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private static List<String> determined(String name) {
        var words = words(name);
        if (words.isEmpty()) return List.of("a", "thing");
        var out = new ArrayList<String>(words.size() + 1);
        out.add(VOWELS.contains(Character.toLowerCase(words.get(0).charAt(0))) ? "an" : "a");
        out.addAll(words);
        return out;
    }

    private static List<String> words(String atom) {
        return Arrays.stream(atom.split("_")).filter(w -> !w.isEmpty()).toList();
    }

    /** A template as it is declared: {@code *a payer* pays *an amount* to *a payee*}. */
    public static List<String> renderTemplate(TemplateEntry entry) {
        var out = new ArrayList<String>();
        for (var e : entry.elements()) {
            if (e instanceof Word w) {
                out.add(w.text());
            } else {
                var slot = entry.slots().get(((Placeholder) e).index());
                var named = determined(slot.name());
                out.add("*" + named.get(0));
                out.addAll(named.subList(1, named.size() - 1));
                out.add(named.get(named.size() - 1) + "*");
            }
        }
        return out;
    }

    /** Words joined for display; line breaks and tabs are kept and open no space. */
    public static String toText(List<String> words) {
        var sb = new StringBuilder();
        var fresh = true;
        for (var w : words) {
            if (w.equals(NEWLINE) || w.equals(TAB)) {
                sb.append(w);
                fresh = true;
                continue;
            }
            if (!fresh && !CLOSING.contains(w)) sb.append(' ');
            sb.append(w);
            fresh = w.equals("[");
        }
        return sb.toString();
    }
}
