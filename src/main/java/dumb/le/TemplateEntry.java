package dumb.le;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A declared word pattern: fixed words interleaved with argument slots. The
 * {@code predicate} is the fixed words joined with underscores; slot {@code i} of
 * {@code slots} is filled by the {@code i}-th {@link Placeholder} of {@code elements}.
 */
public record TemplateEntry(@JsonProperty("kind") Kind kind,
                            @JsonProperty("predicate") String predicate,
                            @JsonProperty("slots") List<Slot> slots,
                            @JsonProperty("elements") List<Element> elements) {

    @JsonCreator
    public TemplateEntry {
        requireNonNull(kind);
        requireNonNull(predicate);
        slots = List.copyOf(slots);
        elements = List.copyOf(elements);
        var placeholders = elements.stream().filter(Placeholder.class::isInstance).count();
        if (placeholders != slots.size())
            throw new IllegalArgumentException("Template " + predicate + " has " + placeholders + " placeholders for " + slots.size() + " slots");
    }

    @JsonIgnore
    public boolean isMeta() {
        return kind == Kind.META;
    }

    @JsonIgnore
    public int arity() {
        return slots.size();
    }

    @JsonIgnore
    public String signature() {
        return predicate + "/" + slots.size();
    }

    /** The goal shape {@code predicate(?slot1, ...)} listed in a declaration term. */
    @JsonIgnore
    public Term shape() {
        var args = new ArrayList<Term>(slots.size());
        var seen = new ArrayList<String>();
        for (var s : slots) {
            var name = s.name().isEmpty() ? "thing" : s.name();
            var unique = name;
            for (var n = 2; seen.contains(unique); n++) unique = name + "_" + n;
            seen.add(unique);
            args.add(Term.Var.of("?" + unique));
        }
        return Term.goal(predicate, args);
    }

    public enum Kind {
        META, PLAIN
    }

    /** An argument position: the variable name an author uses and its type atom. */
    public record Slot(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        @JsonCreator
        public Slot {
            requireNonNull(name);
            requireNonNull(type);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "element")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Word.class, name = "word"),
            @JsonSubTypes.Type(value = Placeholder.class, name = "slot")
    })
    public sealed interface Element permits Word, Placeholder {
    }

    public record Word(@JsonProperty("text") String text) implements Element {
        @JsonCreator
        public Word {
            requireNonNull(text);
        }
    }

    public record Placeholder(@JsonProperty("index") int index) implements Element {
        @JsonCreator
        public Placeholder {
        }
    }
}
