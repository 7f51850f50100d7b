package dumb.le;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.le.TemplateEntry.Element;
import dumb.le.TemplateEntry.Word;
import dumb.le.util.Json;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * The ordered templates known to one document. Declared entries are consulted before
 * the built-in ones; within each group meta entries come first, then longer
 * templates, then templates whose fixed words sort first.
 */
public class Dictionary {

    /**
     * Meta before plain, longer before shorter, then element by element: a fixed word
     * before a slot, and of two different fixed words the one later in standard order.
     * Entries comparing equal have the same shape and are kept once.
     */
    public static final Comparator<TemplateEntry> ORDER = (a, b) -> {
        if (a.kind() != b.kind()) return a.kind() == TemplateEntry.Kind.META ? -1 : 1;
        var sizeA = a.elements().size();
        var sizeB = b.elements().size();
        if (sizeA != sizeB) return sizeA > sizeB ? -1 : 1;
        for (var i = 0; i < sizeA; i++) {
            var c = compareElements(a.elements().get(i), b.elements().get(i));
            if (c != 0) return c;
        }
        return 0;
    };

    private static final TypeReference<List<TemplateEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final List<TemplateEntry> entries;
    private final List<TemplateEntry> builtins;
    private final SortedSet<String> types;

    private Dictionary(List<TemplateEntry> entries, List<TemplateEntry> builtins) {
        this.entries = entries;
        this.builtins = builtins;
        var t = new TreeSet<String>();
        for (var e : entries)
            for (var s : e.slots())
                if (!s.type().isEmpty()) t.add(s.type());
        this.types = Collections.unmodifiableSortedSet(t);
    }

    public static Dictionary of(Collection<TemplateEntry> declared, boolean withBuiltins) {
        var builtins = withBuiltins
                ? sorted(Stream.concat(Builtins.META.stream(), Builtins.PLAIN.stream()).toList())
                : List.<TemplateEntry>of();
        return new Dictionary(sorted(declared), builtins);
    }

    public static Dictionary of(Collection<TemplateEntry> declared) {
        return of(declared, true);
    }

    public static Dictionary fromJson(String json, boolean withBuiltins) throws JsonProcessingException {
        return of(Json.obj(json, ENTRY_LIST), withBuiltins);
    }

    static List<TemplateEntry> sorted(Collection<TemplateEntry> entries) {
        var set = new TreeSet<>(ORDER);
        set.addAll(entries);
        return List.copyOf(set);
    }

    private static int compareElements(Element x, Element y) {
        if (x instanceof Word wx) {
            if (y instanceof Word wy) return wy.text().compareTo(wx.text());
            return -1;
        }
        return y instanceof Word ? 1 : 0;
    }

    /** Declared entries in dictionary order. */
    public List<TemplateEntry> entries() {
        return entries;
    }

    public List<TemplateEntry> builtins() {
        return builtins;
    }

    /** Meta templates in matching order: declared, then built-in. */
    public List<TemplateEntry> metaCandidates() {
        return candidates(TemplateEntry.Kind.META);
    }

    /** Plain templates in matching order: declared, then built-in. */
    public List<TemplateEntry> plainCandidates() {
        return candidates(TemplateEntry.Kind.PLAIN);
    }

    private List<TemplateEntry> candidates(TemplateEntry.Kind kind) {
        var out = new ArrayList<TemplateEntry>();
        for (var e : entries) if (e.kind() == kind) out.add(e);
        for (var e : builtins) if (e.kind() == kind) out.add(e);
        return out;
    }

    /** Type atoms taken from the slots of the declared templates, sorted. */
    public SortedSet<String> types() {
        return types;
    }

    /** True for declared type atoms and the predefined type words. */
    public boolean isType(String word) {
        return types.contains(word) || Lexicon.PREDEFINED_TYPES.contains(word);
    }

    /** The template that renders goals of {@code functor/arity}; meta entries first. */
    public Optional<TemplateEntry> lookup(String functor, int arity) {
        return Stream.concat(metaCandidates().stream(), plainCandidates().stream())
                .filter(e -> e.predicate().equals(functor) && e.arity() == arity)
                .findFirst();
    }

    /** The declared entries as JSON; built-ins are not written. */
    public String toJson() {
        return Json.str(entries);
    }

    public int size() {
        return entries.size();
    }
}
