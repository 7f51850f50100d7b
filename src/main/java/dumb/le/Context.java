package dumb.le;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The state of one document translation: errors recorded so far, the declarations and
 * dictionary read from the header, and the counters that number lines and fresh time
 * variables. A context is never shared between translations.
 */
public class Context {

    public final Translator.Configuration config;
    public final ErrorReporter errors = new ErrorReporter();
    public final Declarations declarations;

    String target;
    String sourceLanguage = "en";

    private @Nullable TemplateMatcher matcher;
    private int times;
    private int line;

    public Context(Translator.Configuration config) {
        this(config, new Declarations());
    }

    Context(Translator.Configuration config, Declarations declarations) {
        this.config = config;
        this.declarations = declarations;
        this.target = config.defaultTarget();
    }

    /** Installs the dictionary once the header has been read. */
    void dictionary(Dictionary dictionary) {
        this.matcher = new TemplateMatcher(dictionary, this);
    }

    public TemplateMatcher matcher() {
        if (matcher == null) throw new IllegalStateException("dictionary not built yet");
        return matcher;
    }

    public Dictionary dictionary() {
        return matcher().dictionary();
    }

    /** A time variable no author wrote, unique within this translation. */
    public Term.Var freshTime() {
        return Term.Var.of("?_T" + (++times));
    }

    /** Records a failure at the cursor's current position. */
    void error(String message, Cursor c) {
        errors.record(message, c.tokens(), c.mark());
    }

    void error(String message, List<Token> tokens, int pos) {
        errors.record(message, tokens, pos);
    }

    /** Notes the line of the phrase being read; failures inside the phrase are reported on it. */
    void reading(int line) {
        this.line = line;
    }

    /** Records an expression of the current phrase that stops short of an operand. */
    void expressionError(List<Token> words) {
        errors.record(Expressions.BAD_EXPRESSION, line,
                words.stream().map(Token::text).collect(Collectors.joining(" ")));
    }
}
