package dumb.le;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiteralParserTest extends AbstractTest {

    private Context ctx;
    private LiteralParser literals;

    @BeforeEach
    void setUpContext() {
        ctx = new Context(new Translator.Configuration());
        ctx.declarations.add(new Declarations.Block(Declarations.Kind.EVENTS,
                List.of(template("*a borrower* pays *an amount* to *a lender*"))));
        ctx.declarations.add(new Declarations.Block(Declarations.Kind.FLUENTS,
                List.of(template("*a loan* is in default"))));
        ctx.declarations.add(new Declarations.Block(Declarations.Kind.PREDICATES,
                List.of(template("*a loan* is secured"))));
        ctx.declarations.add(new Declarations.Block(Declarations.Kind.METAPREDICATES,
                List.of(template("*a person* believes that *a thing*", TemplateEntry.Kind.META))));
        ctx.dictionary(Dictionary.of(ctx.declarations.entries()));
        literals = new LiteralParser(ctx);
    }

    private Term literal(String text, VariableMap map) {
        var parsed = literals.literal(cursor(text), map);
        assertNotNull(parsed, "no literal in '" + text + "': " + ctx.errors.notices());
        return parsed.literal();
    }

    @Test
    void eventsHappenAtAFreshTime() {
        assertEquals("happens(pays_to(Borrower, Amount, Lender), _T1)",
                literal("a borrower pays an amount to a lender.", VariableMap.empty()).toProlog());
        assertEquals("happens(pays_to(Borrower, Amount, Lender), _T2)",
                literal("a borrower pays an amount to a lender.", VariableMap.empty()).toProlog());
    }

    @Test
    void leadingTime() {
        assertEquals("happens(pays_to(Borrower, Amount, Lender), 1433116800)",
                literal("at 2015-06-01, a borrower pays an amount to a lender.", VariableMap.empty()).toProlog());
    }

    @Test
    void trailingTime() {
        assertEquals("happens(pays_to(Borrower, Amount, Lender), 1433116800)",
                literal("a borrower pays an amount to a lender, at 2015-06-01.", VariableMap.empty()).toProlog());
    }

    @Test
    void fluentsHoldAtTheChangeTime() {
        var map = VariableMap.empty().withChangeTime(Term.Var.of("?when"));
        assertEquals("holds(is_in_default(Loan), When)", literal("a loan is in default.", map).toProlog());
    }

    @Test
    void timelessPredicatesAreNotWrapped() {
        assertEquals("is_secured(Loan)", literal("a loan is secured.", VariableMap.empty()).toProlog());
    }

    @Test
    void literalContinuesOnALineStartingWithThat() {
        var c = cursor("""
                a person believes
                    that a loan is secured.
                """);
        var parsed = literals.literal(c, VariableMap.empty());
        assertNotNull(parsed);
        assertEquals("believes(Person, is_secured(Loan))", parsed.literal().toProlog());
        assertTrue(c.peek().is("."));
    }

    @Test
    void phraseStopsAtIf() {
        var words = literals.phrase(cursor("a loan is secured if it is."));
        assertNotNull(words);
        assertEquals(List.of("a", "loan", "is", "secured"), words.stream().map(Token::text).toList());
    }

    @Test
    void phraseKeepsDecimals() {
        var words = literals.phrase(cursor("the rate is 3.5."));
        assertNotNull(words);
        assertEquals(List.of("the", "rate", "is", "3", ".", "5"), words.stream().map(Token::text).toList());
    }

    @Test
    void phraseCopiesBracketsAcrossLines() {
        var words = literals.phrase(cursor("a list is [1,\n 2]."));
        assertNotNull(words);
        assertEquals(List.of("a", "list", "is", "[", "1", ",", "2", "]"), words.stream().map(Token::text).toList());
    }

    @Test
    void nothingMatches() {
        assertNull(literals.literal(cursor("the moon is made of cheese and more."), VariableMap.empty()));
        assertTrue(ctx.errors.notices().stream().anyMatch(n -> n.message().equals(LiteralParser.NO_LITERAL)));
    }

    @Test
    void brokenExpressionsAreReportedOnTheirLine() {
        var map = VariableMap.empty().introduce("amount");
        literals.literal(cursor("\n\nthe amount is 3 + ."), map);
        assertTrue(ctx.errors.notices().stream().anyMatch(n -> n.message().equals(Expressions.BAD_EXPRESSION)
                && n.line() == 2 && n.context().equals("3 +")), ctx.errors.notices().toString());
    }
}
