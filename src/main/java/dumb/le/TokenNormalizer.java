package dumb.le;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns line-break control characters into numbered {@link Token.Kind#NEWLINE} tokens,
 * drops other control characters and strips {@code %} comments up to the line break.
 * The counter starts at 1 and is bumped before numbering, so the first line break is 2.
 */
public class TokenNormalizer {

    private int line = 1;

    public void reset() {
        line = 1;
    }

    public int line() {
        return line;
    }

    public List<Token> normalize(List<Token> raw) {
        var out = new ArrayList<Token>(raw.size());
        var inComment = false;
        for (var t : raw) {
            if (t.kind() == Token.Kind.CNTRL) {
                if (t.text().equals("\n") || t.text().equals("\r")) {
                    inComment = false;
                    out.add(Token.newline(++line));
                }
            } else if (!inComment) {
                if (t.kind() == Token.Kind.PUNCT && t.text().equals("%")) inComment = true;
                else out.add(t);
            }
        }
        return out;
    }
}
