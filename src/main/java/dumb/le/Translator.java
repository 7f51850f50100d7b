package dumb.le;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.le.util.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.le.Log.error;
import static dumb.le.Log.message;

/**
 * Translates Logical English documents into logic-program clauses. Each call works on
 * a fresh {@link Context}, so one translator may serve many documents.
 */
public class Translator {

    public static final String CONFIG_RESOURCE = "/logical-english.json";
    public static final String DEFAULT_TARGET = "taxlog";
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_BASELINE_LINE = 1;
    public static final boolean DEFAULT_PREDEFINED_TEMPLATES = true;

    static final String BAD_CONDITIONS = "LE error found in the conditions";

    private final Configuration config;

    public Translator() {
        this(Configuration.load());
    }

    public Translator(Configuration config) {
        this.config = config;
    }

    public static void main(String[] args) {
        String file = null;
        var json = false;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-f", "--file" -> file = args[++i];
                    case "--json" -> json = true;
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing argument for " + args[i - 1]);
                printUsageAndExit();
            }
        }
        if (file == null) printUsageAndExit();

        try {
            var t = new Translator().translate(Files.readString(Path.of(file), StandardCharsets.UTF_8));
            System.out.print(json ? t.dictionary().toJson() + "\n" : t.toProlog());
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            error("Cannot read " + file + ": " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.println("Usage: java dumb.le.Translator -f <file.le> [--json]");
        System.exit(1);
    }

    public Configuration config() {
        return config;
    }

    public Translation translate(String document) throws ParseException {
        var text = document.endsWith("\n") ? document : document + "\n";
        var ctx = new Context(config);
        var c = cursor(text);

        var sections = new SectionParser(ctx);
        if (!sections.header(c) || !sections.content(c)) throw ctx.errors.failure(config.baselineLine());

        var t = new Translation(ctx.target, ctx.sourceLanguage, ctx.declarations, ctx.dictionary(),
                sections.knowledgeBases(), sections.scenarios(), sections.queries(), sections.content());
        message(String.format("Translated %d clauses, %d scenarios, %d queries (target %s)",
                t.clauses().size(), t.scenarios().size(), t.queries().size(), t.target()));
        return t;
    }

    /**
     * Reads conditions written apart from any document, such as a question put to the
     * knowledge base of {@code translation}, with that document's templates and
     * declarations. A closing period is optional.
     */
    public Condition parseConditions(Translation translation, String english) throws ParseException {
        var ctx = new Context(config, translation.declarations());
        ctx.dictionary(translation.dictionary());
        var c = cursor(english.endsWith("\n") ? english : english + "\n");

        c.spacesOrNewlines();
        var start = c.mark();
        var parsed = new ConditionBuilder(ctx).conditions(c, c.spaces(), VariableMap.empty());
        if (parsed != null) {
            c.spaces();
            if (c.peek().is(".")) c.next();
            c.spacesOrNewlines();
            if (c.atEnd()) return parsed.condition();
            ctx.error(BAD_CONDITIONS, c);
        } else {
            ctx.error(BAD_CONDITIONS, c.tokens(), start);
        }
        throw ctx.errors.failure(config.baselineLine());
    }

    private Cursor cursor(String text) {
        var tokens = new TokenNormalizer().normalize(Tokenizer.tokenize(text));
        return new Cursor(tokens, config.tabWidth());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("defaultTarget") String defaultTarget,
            @JsonProperty("tabWidth") int tabWidth,
            @JsonProperty("baselineLine") int baselineLine,
            @JsonProperty("predefinedTemplates") boolean predefinedTemplates
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("defaultTarget") String defaultTarget,
                @JsonProperty("tabWidth") Integer tabWidth,
                @JsonProperty("baselineLine") Integer baselineLine,
                @JsonProperty("predefinedTemplates") Boolean predefinedTemplates
        ) {
            this(
                    defaultTarget != null ? defaultTarget : DEFAULT_TARGET,
                    tabWidth != null ? tabWidth : DEFAULT_TAB_WIDTH,
                    baselineLine != null ? baselineLine : DEFAULT_BASELINE_LINE,
                    predefinedTemplates != null ? predefinedTemplates : DEFAULT_PREDEFINED_TEMPLATES
            );
        }

        public Configuration() {
            this(DEFAULT_TARGET, DEFAULT_TAB_WIDTH, DEFAULT_BASELINE_LINE, DEFAULT_PREDEFINED_TEMPLATES);
        }

        /** The class-path configuration, or the defaults when it is missing or unreadable. */
        public static Configuration load() {
            try (var in = Translator.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in == null) return new Configuration();
                return Json.obj(in, Configuration.class);
            } catch (IOException e) {
                error("Cannot read " + CONFIG_RESOURCE + ", using defaults: " + e.getMessage());
                return new Configuration();
            }
        }

        public String toJson() {
            return Json.str(this);
        }
    }
}
