package dumb.le;

import java.util.Set;

/** Functor names of the clause vocabulary shared with the inference engine. */
public final class Logic {

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String FORALL = "forall";
    public static final String SETOF = "setof";
    public static final String AGGREGATE_ALL = "aggregate_all";
    public static final String SUM = "sum";
    public static final String ON = "on";
    public static final String TRUE = "true";

    public static final String HAPPENS = "happens";
    public static final String HOLDS = "holds";
    public static final String INITIATES = "initiates";
    public static final String TERMINATES = "terminates";
    public static final String IT_IS_ILLEGAL = "it_is_illegal";

    public static final String IF = "if";
    public static final String NECK = ":-";
    public static final String KBNAME = "kbname";
    public static final String EXAMPLE = "example";
    public static final String SCENARIO = "scenario";
    public static final String QUERY = "query";
    public static final String TARGET = "target";
    public static final String IS_TYPE = "is_type";
    public static final String NULL = "null";

    public static final String LIST = "list";
    public static final String CONS = "cons";

    /** Functors printed infix by {@link Term#toProlog()}. */
    public static final Set<String> INFIX = Set.of(
            "=", "\\=", "==", "\\==", "=:=", "=\\=", "=@=", "\\=@=", "<", ">", "=<", ">=",
            "+", "-", "*", "/", "//", "**", "^", "is", "mod", "rem", "div", "xor", ":-");

    private Logic() {
    }
}
