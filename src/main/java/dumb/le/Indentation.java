package dumb.le;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Rebuilds the and/or tree of a body from its flat list of indented conditions.
 * The operator written at the smallest indentation is the outermost connective; the
 * items between two such operators form its operands, each rebuilt the same way, so
 * deeper indentation always binds tighter. Operands of one level fold to the left.
 */
public final class Indentation {

    private Indentation() {
    }

    public enum Operator {
        NONE, AND, OR
    }

    /** One condition of a body, with the indentation and operator of its line. */
    public record Item(int indent, Operator operator, Condition condition) {
        public Item {
            requireNonNull(operator);
            requireNonNull(condition);
        }
    }

    /** Raised when one level of a body mixes {@code and} and {@code or}. */
    public static class InconsistentIndentation extends Exception {
        private final int indent;

        public InconsistentIndentation(int indent) {
            super("and/or mixed at indentation " + indent);
            this.indent = indent;
        }

        public int indent() {
            return indent;
        }
    }

    public static Condition rebuild(List<Item> items) throws InconsistentIndentation {
        if (items.isEmpty()) throw new IllegalArgumentException("empty body");
        return group(items);
    }

    private static Condition group(List<Item> items) throws InconsistentIndentation {
        if (items.size() == 1) return items.get(0).condition();

        var min = Integer.MAX_VALUE;
        for (var i = 1; i < items.size(); i++) min = Math.min(min, items.get(i).indent());

        Operator op = null;
        var splits = new ArrayList<Integer>();
        for (var i = 1; i < items.size(); i++) {
            var item = items.get(i);
            if (item.indent() != min) continue;
            if (op == null) op = item.operator();
            else if (op != item.operator()) throw new InconsistentIndentation(min);
            splits.add(i);
        }

        var result = group(items.subList(0, splits.get(0)));
        for (var s = 0; s < splits.size(); s++) {
            var from = splits.get(s);
            var to = s + 1 < splits.size() ? splits.get(s + 1) : items.size();
            var operand = group(items.subList(from, to));
            result = op == Operator.OR ? new Condition.Or(result, operand) : new Condition.And(result, operand);
        }
        return result;
    }
}
