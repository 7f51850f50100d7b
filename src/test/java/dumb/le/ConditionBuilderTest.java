package dumb.le;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionBuilderTest extends AbstractTest {

    private Context ctx;
    private ConditionBuilder builder;

    @BeforeEach
    void setUpBuilder() {
        ctx = context("*a borrower* pays *an amount* to *a lender*", "*a loan* is secured");
        builder = new ConditionBuilder(ctx);
    }

    private Condition conditions(String text, VariableMap map) {
        var parsed = builder.conditions(cursor(text), 0, map);
        assertNotNull(parsed, "no conditions in:\n" + text + "\n" + ctx.errors.notices());
        return parsed.condition();
    }

    private Condition conditions(String text) {
        return conditions(text, VariableMap.empty());
    }

    private static VariableMap bound(String name) {
        return VariableMap.empty().introduce(name);
    }

    @Test
    void negationBlock() {
        var c = conditions("""
                it is not the case that
                    a borrower pays an amount to a lender.
                """);
        var not = assertInstanceOf(Condition.Not.class, c);
        assertEquals("pays_to(Borrower, Amount, Lender)", not.condition().toTerm().toProlog());
    }

    @Test
    void deeperOrBindsTighter() {
        var c = conditions("""
                a borrower pays an amount to a lender
                and the amount > 100
                    or the amount < 10.
                """);
        assertEquals("(pays_to(Borrower, Amount, Lender), ((Amount > 100); (Amount < 10)))", c.toTerm().toProlog());
    }

    @Test
    void laterLiteralsSeeEarlierVariables() {
        var parsed = builder.conditions(cursor("""
                a borrower pays an amount to a lender
                and the amount > 100.
                """), 0, VariableMap.empty());
        assertNotNull(parsed);
        assertEquals(3, parsed.map().size());
    }

    @Test
    void mixedOperatorsAtOneIndentation() {
        var parsed = builder.conditions(cursor("""
                a borrower pays an amount to a lender
                    and the amount > 100
                    or the amount < 10.
                """), 0, VariableMap.empty());
        assertNull(parsed);
        assertTrue(ctx.errors.notices().stream().anyMatch(n -> n.message().equals(ConditionBuilder.BAD_INDENTATION)));
    }

    @Test
    void setOf() {
        var c = conditions("""
                a record is a set of a payment
                    where a borrower pays the payment to a lender.
                """);
        assertInstanceOf(Condition.SetOf.class, c);
        assertEquals("setof(Payment, pays_to(Borrower, Payment, Lender), Record)", c.toTerm().toProlog());
    }

    @Test
    void sum() {
        var c = conditions("""
                a total is the sum of each amount such that
                    a borrower pays the amount to a lender.
                """);
        assertInstanceOf(Condition.Aggregate.class, c);
        assertEquals("aggregate_all(sum(Amount), pays_to(Borrower, Amount, Lender), Total)", c.toTerm().toProlog());
    }

    @Test
    void forAll() {
        var c = conditions("""
                for all cases in which
                    a borrower pays an amount to a lender
                it is the case that
                    the amount > 100.
                """);
        assertEquals("forall(pays_to(Borrower, Amount, Lender), (Amount > 100))", c.toTerm().toProlog());
    }

    @Test
    void timeModifierAfterABlock() {
        var c = conditions("""
                it is not the case that
                    the loan is secured
                at a time.
                """, bound("loan"));
        assertInstanceOf(Condition.At.class, c);
        assertEquals("on(not(is_secured(Loan)), Time)", c.toTerm().toProlog());
    }

    @Test
    void bodyOnTheHeadLine() {
        var c = cursor(" if the amount > 100.");
        var body = builder.body(c, bound("amount"));
        assertNotNull(body);
        assertEquals("(Amount > 100)", body.condition().toTerm().toProlog());
        assertTrue(c.peek().is("."));
    }

    @Test
    void bodyOnItsOwnLines() {
        var c = cursor("""

                    if the amount > 100
                    and the amount < 200.
                """);
        var body = builder.body(c, bound("amount"));
        assertNotNull(body);
        assertEquals("((Amount > 100), (Amount < 200))", body.condition().toTerm().toProlog());
    }

    @Test
    void emptyBody() {
        var body = builder.body(cursor("."), VariableMap.empty());
        assertNotNull(body);
        assertNull(body.condition());
    }

    @Test
    void noBody() {
        assertNull(builder.body(cursor(" because it is so."), VariableMap.empty()));
    }

    @Test
    void unboundReferenceFails() {
        assertNull(builder.conditions(cursor("the loan is secured."), 0, VariableMap.empty()));
        var messages = ctx.errors.notices().stream().map(ErrorReporter.ErrorNotice::message).toList();
        assertTrue(messages.contains(ConditionBuilder.BAD_CONDITION));
        assertTrue(messages.contains(LiteralParser.NO_LITERAL));
    }
}
