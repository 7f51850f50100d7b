package dumb.le;

import dumb.le.Indentation.InconsistentIndentation;
import dumb.le.Indentation.Item;
import dumb.le.Indentation.Operator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IndentationTest {

    private static Condition c(String name) {
        return new Condition.Literal(Term.Atom.of(name));
    }

    private static Item item(int indent, Operator op, String name) {
        return new Item(indent, op, c(name));
    }

    @Test
    void singleCondition() throws InconsistentIndentation {
        assertEquals(c("a"), Indentation.rebuild(List.of(item(0, Operator.NONE, "a"))));
    }

    @Test
    void flatRunFoldsLeft() throws InconsistentIndentation {
        var items = new ArrayList<Item>();
        items.add(item(4, Operator.NONE, "a"));
        for (var name : List.of("b", "c", "d")) items.add(item(4, Operator.AND, name));
        var expected = new Condition.And(new Condition.And(new Condition.And(c("a"), c("b")), c("c")), c("d"));
        assertEquals(expected, Indentation.rebuild(items));
    }

    @Test
    void deeperOrNestsInsideAnd() throws InconsistentIndentation {
        var result = Indentation.rebuild(List.of(
                item(4, Operator.NONE, "a"),
                item(4, Operator.AND, "b"),
                item(8, Operator.OR, "c"),
                item(4, Operator.AND, "d")));
        var expected = new Condition.And(new Condition.And(c("a"), new Condition.Or(c("b"), c("c"))), c("d"));
        assertEquals(expected, result);
    }

    @Test
    void deeperAndNestsInsideOr() throws InconsistentIndentation {
        var result = Indentation.rebuild(List.of(
                item(2, Operator.NONE, "a"),
                item(6, Operator.AND, "b"),
                item(2, Operator.OR, "c"),
                item(6, Operator.AND, "d")));
        var expected = new Condition.Or(new Condition.And(c("a"), c("b")), new Condition.And(c("c"), c("d")));
        assertEquals(expected, result);
    }

    @Test
    void shallowestOperatorIsOutermost() throws InconsistentIndentation {
        var result = Indentation.rebuild(List.of(
                item(4, Operator.NONE, "a"),
                item(8, Operator.OR, "b"),
                item(4, Operator.AND, "c")));
        assertEquals(new Condition.And(new Condition.Or(c("a"), c("b")), c("c")), result);
    }

    @Test
    void mixedOperatorsAtOneLevel() {
        var e = assertThrows(InconsistentIndentation.class, () -> Indentation.rebuild(List.of(
                item(4, Operator.NONE, "a"),
                item(4, Operator.AND, "b"),
                item(4, Operator.OR, "c"))));
        assertEquals(4, e.indent());
    }

    @Test
    void emptyBody() {
        assertThrows(IllegalArgumentException.class, () -> Indentation.rebuild(List.of()));
    }
}
