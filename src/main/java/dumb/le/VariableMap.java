package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names an author has given to variables within one rule, scenario assumption or
 * query. Instances are immutable: every binding returns a new map, so a failed match
 * alternative simply drops its copy.
 */
public final class VariableMap {

    /** Name under which a statement's change time is kept for the literals of its body. */
    public static final String CHANGE_TIME = "_change_time";

    private static final VariableMap EMPTY = new VariableMap(Map.of());

    private final Map<String, Term> names;

    private VariableMap(Map<String, Term> names) {
        this.names = names;
    }

    public static VariableMap empty() {
        return EMPTY;
    }

    /**
     * Binds a new name. Returns null when the name is empty or already bound, which
     * makes the alternative that tried it fail.
     */
    public @Nullable VariableMap introduce(String name) {
        if (name.isEmpty() || names.containsKey(name)) return null;
        return with(name, Term.Var.of("?" + name));
    }

    public Optional<Term> lookup(String name) {
        return Optional.ofNullable(names.get(name));
    }

    public VariableMap withChangeTime(Term time) {
        return with(CHANGE_TIME, time);
    }

    public Optional<Term> changeTime() {
        return lookup(CHANGE_TIME);
    }

    private VariableMap with(String name, Term v) {
        var copy = new LinkedHashMap<>(names);
        copy.put(name, v);
        return new VariableMap(Collections.unmodifiableMap(copy));
    }

    public Map<String, Term> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return "VariableMap" + names;
    }
}
