package dumb.le;

import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    protected Translator translator;

    @BeforeEach
    void setUp() {
        translator = new Translator(new Translator.Configuration());
    }

    protected Translation translate(String document) {
        try {
            return translator.translate(document);
        } catch (ParseException e) {
            fail("Failed to translate document:\n" + e.getMessage() + "\n" + e.errors() + "\n" + document);
            return null;
        }
    }

    protected ParseException failure(String document) {
        return assertThrows(ParseException.class, () -> translator.translate(document));
    }

    protected static String resource(String name) {
        try (InputStream in = AbstractTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            fail("Cannot read " + name + ": " + e.getMessage());
            return "";
        }
    }

    /** Prolog text of every output term, one string per term. */
    protected static List<String> prolog(Translation t) {
        return t.terms().stream().map(Term::toProlog).toList();
    }

    protected static List<Token> tokens(String text) {
        return new TokenNormalizer().normalize(Tokenizer.tokenize(text));
    }

    /** The tokens of {@code text} without spaces, as template matching reads a phrase. */
    protected static List<Token> words(String text) {
        return tokens(text).stream().filter(t -> !t.isSpace()).toList();
    }

    protected static Cursor cursor(String text) {
        return new Cursor(tokens(text), Translator.DEFAULT_TAB_WIDTH);
    }

    protected static TemplateEntry template(String declaration) {
        return template(declaration, TemplateEntry.Kind.PLAIN);
    }

    protected static TemplateEntry template(String declaration, TemplateEntry.Kind kind) {
        var texts = words(declaration).stream().map(Token::text).toList();
        try {
            return DeclarationProcessor.build(texts, kind);
        } catch (DeclarationProcessor.BadTemplate e) {
            fail("Bad template '" + declaration + "': " + e.getMessage());
            return null;
        }
    }

    protected static Dictionary dictionary(String... declarations) {
        var entries = new ArrayList<TemplateEntry>();
        Arrays.stream(declarations).forEach(d -> entries.add(template(d)));
        return Dictionary.of(entries);
    }

    /** A context whose dictionary holds {@code declarations}, as after reading a header. */
    protected static Context context(String... declarations) {
        var ctx = new Context(new Translator.Configuration());
        ctx.dictionary(dictionary(declarations));
        return ctx;
    }
}
