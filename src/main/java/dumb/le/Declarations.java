package dumb.le;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The declaration blocks of one document, in the order they were written, and the
 * signatures they classify: a matched goal whose signature was declared as an event
 * happens at a time, a fluent holds at a time, anything else is timeless.
 */
public class Declarations {

    private final List<Block> blocks = new ArrayList<>();
    private final Set<String> events = new HashSet<>();
    private final Set<String> fluents = new HashSet<>();
    private final boolean frozen;

    public Declarations() {
        this(false);
    }

    private Declarations(boolean frozen) {
        this.frozen = frozen;
    }

    public enum Kind {
        METAPREDICATES("metapredicates", TemplateEntry.Kind.META),
        PREDICATES("predicates", TemplateEntry.Kind.PLAIN),
        EVENTS("events", TemplateEntry.Kind.PLAIN),
        FLUENTS("fluents", TemplateEntry.Kind.PLAIN);

        public final String functor;
        public final TemplateEntry.Kind templateKind;

        Kind(String functor, TemplateEntry.Kind templateKind) {
            this.functor = functor;
            this.templateKind = templateKind;
        }
    }

    public record Block(Kind kind, List<TemplateEntry> entries) {
        public Block {
            requireNonNull(kind);
            entries = List.copyOf(entries);
        }

        /** {@code predicates([shape, ...])} and the like. */
        public Term toTerm() {
            return Term.goal(kind.functor, Term.list(entries.stream().map(TemplateEntry::shape).toList()));
        }
    }

    public void add(Block block) {
        if (frozen) throw new UnsupportedOperationException("declarations of a finished translation are read-only");
        register(block);
    }

    /** A copy holding the same blocks that refuses any further one. */
    public Declarations frozen() {
        if (frozen) return this;
        var copy = new Declarations(true);
        blocks.forEach(copy::register);
        return copy;
    }

    private void register(Block block) {
        blocks.add(block);
        for (var e : block.entries()) {
            if (block.kind() == Kind.EVENTS) events.add(e.signature());
            else if (block.kind() == Kind.FLUENTS) fluents.add(e.signature());
        }
    }

    public List<Block> blocks() {
        return List.copyOf(blocks);
    }

    /** Every declared template, in document order. */
    public List<TemplateEntry> entries() {
        return blocks.stream().flatMap(b -> b.entries().stream()).toList();
    }

    /** Signatures declared as events, {@code functor/arity}. */
    public Set<String> events() {
        return Collections.unmodifiableSet(events);
    }

    public Set<String> fluents() {
        return Collections.unmodifiableSet(fluents);
    }

    public boolean isEvent(Term goal) {
        return events.contains(goal.signature());
    }

    public boolean isFluent(Term goal) {
        return fluents.contains(goal.signature());
    }
}
