package dumb.le;

import dumb.le.ErrorReporter.ErrorNotice;

import java.util.List;

/** Raised when a document cannot be translated; carries every recorded failure. */
public class ParseException extends Exception {
    private final ErrorNotice notice;
    private final List<ErrorNotice> errors;
    private final int baseline;

    public ParseException(ErrorNotice notice, List<ErrorNotice> errors, int baseline) {
        super(notice.message());
        this.notice = notice;
        this.errors = List.copyOf(errors);
        this.baseline = baseline;
    }

    /** 0-based line of the representative failure. */
    public int line() {
        return notice.line();
    }

    /** Line number as shown to an author. */
    public int displayLine() {
        return notice.line() + baseline;
    }

    public String context() {
        return notice.context();
    }

    public ErrorNotice notice() {
        return notice;
    }

    /** All recorded failures, most recent first. */
    public List<ErrorNotice> errors() {
        return errors;
    }

    @Override
    public String getMessage() {
        var context = notice.context().replace("\n", "\\n");
        var contextSnippet = context.isEmpty() ? "" : " near '" + context + "'";
        return super.getMessage() + " at line " + displayLine() + contextSnippet;
    }
}
