package dumb.le;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DictionaryTest extends AbstractTest {

    private final TemplateEntry pays = template("*a borrower* pays *an amount* to *a lender*");
    private final TemplateEntry secured = template("*a loan* is secured");
    private final TemplateEntry believes = template("*a person* believes that *a thing*", TemplateEntry.Kind.META);

    @Test
    void metaFirstThenLongerFirst() {
        var d = Dictionary.of(List.of(secured, pays, believes));
        assertEquals(List.of(believes, pays, secured), d.entries());
    }

    @Test
    void sortingIsIdempotent() {
        var once = Dictionary.of(List.of(secured, believes, pays)).entries();
        var twice = Dictionary.of(new ArrayList<>(once)).entries();
        assertEquals(once, twice);
    }

    @Test
    void orderIsStrictAndTotal() {
        var entries = List.of(pays, secured, believes, template("*a loan* is void"), template("*a loan* is open"));
        for (var a : entries)
            for (var b : entries) {
                var ab = Integer.signum(Dictionary.ORDER.compare(a, b));
                var ba = Integer.signum(Dictionary.ORDER.compare(b, a));
                assertEquals(-ab, ba, a.predicate() + " / " + b.predicate());
                assertEquals(a.equals(b), ab == 0, a.predicate() + " / " + b.predicate());
            }
    }

    @Test
    void duplicatesAreKeptOnce() {
        assertEquals(1, Dictionary.of(List.of(pays, template("*a borrower* pays *an amount* to *a lender*"))).size());
    }

    @Test
    void declaredBeforeBuiltins() {
        var d = Dictionary.of(List.of(pays, secured, believes));
        var plain = d.plainCandidates();
        assertEquals(List.of(pays, secured), plain.subList(0, 2));
        assertTrue(plain.size() > 2);
        assertEquals(believes, d.metaCandidates().get(0));
        assertTrue(d.metaCandidates().stream().skip(1).noneMatch(e -> d.entries().contains(e)));
    }

    @Test
    void builtinsCanBeLeftOut() {
        var d = Dictionary.of(List.of(pays), false);
        assertTrue(d.builtins().isEmpty());
        assertTrue(d.lookup("isbefore", 2).isEmpty());
        assertTrue(Dictionary.of(List.of(pays)).lookup("isbefore", 2).isPresent());
    }

    @Test
    void typesComeFromSlots() {
        var d = Dictionary.of(List.of(pays, secured, believes));
        assertEquals(List.of("amount", "borrower", "lender", "loan", "person", "thing"), List.copyOf(d.types()));
        assertTrue(d.isType("loan"));
        assertTrue(d.isType("date"));
        assertFalse(d.isType("pays"));
    }

    @Test
    void lookupPrefersMeta() {
        var d = Dictionary.of(List.of());
        assertEquals(TemplateEntry.Kind.META, d.lookup("=", 2).orElseThrow().kind());
        assertEquals("pays_to", Dictionary.of(List.of(pays)).lookup("pays_to", 3).orElseThrow().predicate());
        assertTrue(Dictionary.of(List.of(pays)).lookup("pays_to", 2).isEmpty());
    }

    @Test
    void jsonRoundTrip() throws JsonProcessingException {
        var d = Dictionary.of(List.of(pays, secured, believes));
        var json = d.toJson();
        assertTrue(json.contains("\"predicate\" : \"pays_to\""), json);
        var back = Dictionary.fromJson(json, true);
        assertEquals(d.entries(), back.entries());
        assertEquals(d.types(), back.types());
    }
}
