package dumb.le;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.le.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranslatorTest extends AbstractTest {

    @Test
    void loanDocument() {
        var t = translate(resource("/loan.le"));
        assertEquals(List.of(
                "query(null, true)",
                "example(null, [])",
                "target(taxlog)",
                "predicates([pays_to_on(Borrower, Amount, Lender, Date), defaults_on(Borrower, Loan), is_secured(Loan)])",
                "is_type(amount)",
                "is_type(borrower)",
                "is_type(date)",
                "is_type(lender)",
                "is_type(loan)",
                "kbname(loan)",
                "if(9, defaults_on(Borrower, Loan), (pays_to_on(Borrower, Amount, Lender, Date), not(is_secured(Loan))))",
                "example(one, [scenario([(pays_to_on(borrower, 1000, lender, 1433116800) :- true)], true)])",
                "query(one, defaults_on(Borrower, Loan))"), prolog(t));
        assertEquals("en", t.sourceLanguage());
        assertEquals(1, t.clauses().size());
        assertEquals("loan", t.knowledgeBases().get(0).name());
    }

    @Test
    void translationIsDeterministic() {
        var doc = resource("/loan.le");
        assertEquals(prolog(translate(doc)), prolog(translate(doc)));
        assertEquals(translate(doc).toProlog(), translate(doc).toProlog());
    }

    @Test
    void scenarioDateBecomesEpochSeconds() {
        var t = translate("""
                the templates are:
                a * payer * pays a * amount * to a * payee *.

                scenario test is:
                borrower pays an amount to lender on 2015-06-01T00:00:00.
                """);
        var scenario = t.scenario("test").orElseThrow();
        assertEquals(1, scenario.assumptions().size());
        assertEquals("pays_to(borrower, Amount, on(lender, 1433116800))",
                scenario.assumptions().get(0).head().toProlog());
        assertTrue(scenario.assumptions().get(0).isFact());
    }

    @Test
    void queryWithForWhich() {
        var t = translate("""
                the templates are:
                the small business restructure rollover applies to *an event*.

                query one is:
                for which event:
                the small business restructure rollover applies to the event.
                """);
        var query = t.query("one").orElseThrow();
        assertEquals(Term.Atom.of("one"), query.name());
        var literal = assertInstanceOf(Condition.Literal.class, query.condition());
        assertEquals("the_small_business_restructure_rollover_applies_to(Event)", literal.goal().toProlog());
    }

    @Test
    void numberedQueryAndScenarioNames() {
        var t = translate("""
                the predicates are:
                *a loan* is secured.

                query 1 is:
                a loan is secured.

                scenario 2 is:
                mortgage is secured.
                """);
        assertEquals(Term.Num.of(1L), t.query("1").orElseThrow().name());
        assertEquals(Term.Num.of(2L), t.scenario("2").orElseThrow().name());
    }

    @Test
    void negationInARule() {
        var t = translate("""
                the templates are:
                *a borrower* pays *an amount* to *a lender*,
                *a borrower* is trusted.

                the rules are:
                a borrower is trusted if
                    it is not the case that
                        the borrower pays an amount to a lender.
                """);
        var body = t.clauses().get(0).body();
        var not = assertInstanceOf(Condition.Not.class, body);
        assertEquals("pays_to(Borrower, Amount, Lender)", not.condition().toTerm().toProlog());
        assertEquals("default", t.knowledgeBases().get(0).name());
    }

    @Test
    void initiatesWithChangeTime() {
        var t = translate("""
                the event predicates are:
                *a borrower* pays *an amount* to *a lender*.
                the fluents are:
                *a loan* is repaid.
                the predicates are:
                *a loan* is from *a lender*.

                the rules are:
                it becomes the case that
                    a loan is repaid
                when a borrower pays an amount to a lender
                if the loan is from the lender.
                """);
        var terms = prolog(t);
        assertTrue(terms.contains("events([pays_to(Borrower, Amount, Lender)])"), terms::toString);
        assertTrue(terms.contains("fluents([is_repaid(Loan)])"), terms::toString);
        assertTrue(terms.contains("if(initiates(pays_to(Borrower, Amount, Lender), is_repaid(Loan), _T2), is_from(Loan, Lender))"),
                terms::toString);
    }

    @Test
    void terminatesWithoutBody() {
        var t = translate("""
                the event predicates are:
                *a borrower* defaults on *a loan*.
                the fluents are:
                *a loan* is performing.

                the rules are:
                it becomes not the case that
                    a loan is performing
                when a borrower defaults on the loan.
                """);
        assertEquals("if(terminates(defaults_on(Borrower, Loan), is_performing(Loan), _T2), true)",
                t.clauses().get(0).toTerm().toProlog());
    }

    @Test
    void illegalEvent() {
        var t = translate("""
                the event predicates are:
                *a borrower* defaults on *a loan*.

                the rules are:
                it is illegal that a borrower defaults on a loan.
                """);
        assertEquals("if(it_is_illegal(defaults_on(Borrower, Loan), _T1), true)", t.clauses().get(0).toTerm().toProlog());
    }

    @Test
    void eventsInBodiesGetTimes() {
        var t = translate("""
                the event predicates are:
                *a borrower* pays *an amount* to *a lender*.
                the predicates are:
                *a borrower* is trusted.

                the rules are:
                a borrower is trusted
                    if at 2015-06-01, the borrower pays an amount to a lender.
                """);
        assertEquals("if(6, is_trusted(Borrower), happens(pays_to(Borrower, Amount, Lender), 1433116800))",
                t.clauses().get(0).toTerm().toProlog());
    }

    @Test
    void statementsMayStartWithSectionWords() {
        var t = translate("""
                the predicates are:
                *a thing* is pending,
                *a thing* is open.

                the rules are:
                query one is pending.
                scenario two is open.

                scenario three is:
                query one is pending.

                query four is:
                scenario two is open.
                """);
        var terms = prolog(t);
        assertTrue(terms.contains("if(5, is_pending(query_one), true)"), terms.toString());
        assertTrue(terms.contains("if(6, is_open(scenario_two), true)"), terms.toString());
        assertEquals(2, t.knowledgeBases().get(0).clauses().size());
        assertEquals("example(three, [scenario([(is_pending(query_one) :- true)], true)])",
                t.scenario("three").orElseThrow().toTerm().toProlog());
        assertEquals("query(four, is_open(scenario_two))", t.query("four").orElseThrow().toTerm().toProlog());
    }

    @Test
    void finishedTranslationsAreReadOnly() {
        var t = translate("""
                the event predicates are:
                *a borrower* pays *an amount* to *a lender*.

                the fluents are:
                *a loan* is repaid.

                the rules are:
                mortgage is repaid.
                """);
        var declarations = t.declarations();
        assertEquals(Set.of("pays_to/3"), declarations.events());
        assertEquals(Set.of("is_repaid/1"), declarations.fluents());
        assertThrows(UnsupportedOperationException.class, () -> declarations.events().add("is_repaid/1"));
        assertThrows(UnsupportedOperationException.class, () -> declarations.fluents().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> declarations.add(new Declarations.Block(Declarations.Kind.EVENTS, List.of())));
        assertEquals(2, declarations.blocks().size());
    }

    @Test
    void targetPragmas() {
        var en = translate("the target language is: prolog.\n");
        assertEquals("prolog", en.target());
        assertEquals("en", en.sourceLanguage());

        var fr = translate("la langue cible est : scasp.\n");
        assertEquals("scasp", fr.target());
        assertEquals("fr", fr.sourceLanguage());

        assertEquals(Translator.DEFAULT_TARGET, translate("the predicates are:\n*a loan* is secured.\n").target());
    }

    @Test
    void namedKnowledgeBases() {
        var t = translate("""
                the predicates are:
                *a loan* is secured.

                the knowledge base first includes:
                mortgage is secured.

                the knowledge base second includes:
                pledge is secured.
                """);
        assertEquals(List.of("first", "second"), t.knowledgeBases().stream().map(KnowledgeBase::name).toList());
        var terms = prolog(t);
        assertTrue(terms.indexOf("kbname(first)") < terms.indexOf("if(4, is_secured(mortgage), true)"), terms::toString);
        assertTrue(terms.indexOf("if(4, is_secured(mortgage), true)") < terms.indexOf("kbname(second)"), terms::toString);
    }

    @Test
    void headerWithoutIntroducer() {
        var e = failure("""
                *a borrower* pays *an amount* to *a lender*.

                the rules are:
                a borrower pays an amount to a lender.
                """);
        assertEquals(SectionParser.BAD_HEADER, e.notice().message());
        assertEquals(0, e.line());
        assertEquals(1, e.displayLine());
        assertTrue(e.getMessage().startsWith("LE error in the header at line 1"), e.getMessage());
    }

    @Test
    void unknownStatement() {
        var e = failure("""
                the rules are:
                the moon is cheese.
                """);
        assertEquals(SectionParser.BAD_STATEMENT, e.notice().message());
        assertEquals(2, e.displayLine());
        assertEquals("the moon is cheese.", e.context());
        assertTrue(e.errors().size() > 1);
    }

    @Test
    void unpairedAsterisksInHeader() {
        var e = failure("""
                the predicates are:
                *a loan is secured.
                """);
        assertTrue(e.errors().stream().anyMatch(n -> n.message().equals(DeclarationProcessor.UNPAIRED_ASTERISKS)));
        assertEquals(2, e.displayLine());
    }

    @Test
    void missingPeriod() {
        failure("""
                the predicates are:
                *a loan* is secured.

                the rules are:
                mortgage is secured
                """);
    }

    @Test
    void conditionsAgainstAnEarlierTranslation() throws ParseException {
        var t = translate(resource("/loan.le"));
        var c = translator.parseConditions(t, "a borrower defaults on a loan\n    and it is not the case that\n        the loan is secured");
        assertEquals("(defaults_on(Borrower, Loan), not(is_secured(Loan)))", c.toTerm().toProlog());
        assertThrows(ParseException.class, () -> translator.parseConditions(t, "the moon is cheese"));
    }

    @Test
    void configurationDefaults() throws JsonProcessingException {
        var c = Json.obj("{\"tabWidth\": 8}", Translator.Configuration.class);
        assertEquals(8, c.tabWidth());
        assertEquals(Translator.DEFAULT_TARGET, c.defaultTarget());
        assertEquals(Translator.DEFAULT_BASELINE_LINE, c.baselineLine());
        assertTrue(c.predefinedTemplates());
        assertEquals(new Translator.Configuration(), Translator.Configuration.load());
    }

    @Test
    void baselineShiftsDisplayedLines() {
        var zero = new Translator(new Translator.Configuration(null, null, 0, null));
        var e = assertThrows(ParseException.class, () -> zero.translate("*a loan* is secured.\n"));
        assertEquals(0, e.displayLine());
    }

    @Test
    void withoutBuiltinTemplates() {
        var plain = new Translator(new Translator.Configuration(null, null, null, false));
        var doc = """
                the predicates are:
                *a loan* is secured.

                query one is:
                a loan is secured
                and 1 < 2.
                """;
        assertThrows(ParseException.class, () -> plain.translate(doc));
        translate(doc);
    }
}
