package dumb.le;

import java.util.List;
import java.util.Set;

/**
 * Fixed surface words of the notation in English, French, Italian and Spanish.
 * Multi-word phrases are token sequences as the tokenizer produces them, so
 * {@code n'est} is {@code n ' est}.
 */
public final class Lexicon {

    public static final Set<String> INDEFINITE = Set.of(
            "a", "an", "another", "which", "each", "un", "una", "une", "qui", "quoi", "che", "quale", "uno",
            "A", "An", "Un", "Una", "Une", "Qui", "Quoi", "Uno", "Che", "Quale", "Each", "Which");

    public static final Set<String> DEFINITE = Set.of(
            "the", "el", "la", "le", "il", "lo",
            "The", "El", "La", "Le", "Il", "Lo");

    /** {@code l'} and {@code L'} arrive as a word followed by an apostrophe. */
    public static final Set<String> ELIDED_DEFINITE = Set.of("l", "L");

    public static final List<String> ORDINALS = List.of(
            "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth", "ninth", "tenth",
            "premier", "seconde", "troisième", "quatrième", "cinquième", "sixième", "septième", "huitième",
            "neuvième", "dixième");

    public static final Set<String> PREDEFINED_TYPES = Set.of(
            "thing", "time", "type", "object", "date", "day", "person", "list", "number");

    public static final Set<String> PUNCTUATION = Set.of(".", ",", ";", "'");

    public static final Set<String> THAT = Set.of("that", "That");

    public static final Set<String> AND = Set.of("and", "e", "et", "y");
    public static final Set<String> OR = Set.of("or", "o", "ou");
    public static final Set<String> IF = Set.of("if", "se", "si");
    public static final Set<String> AT = Set.of("at", "a");
    public static final Set<String> WHEN = Set.of("when");
    public static final Set<String> IT = Set.of("it", "It");

    public static final List<List<String>> NOT = List.of(
            List.of("it", "is", "not", "the", "case", "that"),
            List.of("It", "is", "not", "the", "case", "that"),
            List.of("non", "è", "provato", "che"),
            List.of("ce", "n", "'", "est", "pas", "le", "cas", "que"),
            List.of("no", "es", "el", "caso", "que"));

    public static final List<List<String>> IS_A_SET_OF = List.of(
            List.of("is", "a", "set", "of"),
            List.of("es", "un", "conjunto", "de"),
            List.of("est", "un", "ensemble", "de"),
            List.of("è", "un", "insieme", "di"));

    public static final List<List<String>> WHERE = List.of(
            List.of("where"), List.of("en", "donde"), List.of("où"), List.of("dove"), List.of("quando"));

    public static final List<List<String>> FOR_ALL_CASES_IN_WHICH = List.of(
            List.of("for", "all", "cases", "in", "which"),
            List.of("For", "all", "cases", "in", "which"),
            List.of("pour", "tous", "les", "cas", "où"),
            List.of("per", "tutti", "i", "casi", "in", "cui"),
            List.of("para", "todos", "los", "casos", "en", "que"));

    public static final List<List<String>> IT_IS_THE_CASE_THAT = List.of(
            List.of("it", "is", "the", "case", "that"),
            List.of("es", "el", "caso", "que"),
            List.of("c", "'", "est", "le", "cas", "que"),
            List.of("è", "provato", "che"));

    public static final List<List<String>> IS_THE_SUM_OF_EACH = List.of(
            List.of("is", "the", "sum", "of", "each"),
            List.of("è", "la", "somma", "di", "ogni"),
            List.of("es", "la", "suma", "de", "cada"),
            List.of("est", "la", "somme", "de", "chaque"));

    public static final List<List<String>> SUCH_THAT = List.of(
            List.of("such", "that"), List.of("tale", "che"), List.of("tel", "que"), List.of("tal", "que"));

    public static final Set<String> SCENARIO = Set.of("Scenario", "scenario", "scénario", "escenario");

    public static final List<List<String>> QUERY = List.of(
            List.of("Query"), List.of("query"), List.of("question"), List.of("la", "pregunta"), List.of("domanda"));

    public static final List<List<String>> FOR_WHICH = List.of(
            List.of("for", "which"), List.of("para", "el", "cual"), List.of("pour", "qui"), List.of("per", "cui"));

    /** Verbs closing a named block header: {@code scenario one is:}. */
    public static final Set<String> IS = Set.of("is", "es", "est", "è");

    /** Separators of a {@code for which} variable list. */
    public static final Set<String> VARIABLE_LIST_STOPS = Set.of(",", "and", "el", "et", "y", ":");

    public static final List<String> BECOMES_THE_CASE = List.of("becomes", "the", "case", "that");
    public static final List<List<String>> BECOMES_NOT_THE_CASE = List.of(
            List.of("becomes", "not", "the", "case", "that"),
            List.of("becomes", "no", "longer", "the", "case", "that"));
    public static final List<String> IS_ILLEGAL = List.of("is", "illegal", "that");

    public static final List<List<String>> TARGET_EN = List.of(List.of("the", "target", "language", "is"));
    public static final List<List<String>> TARGET_FR = List.of(List.of("la", "langue", "cible", "est"));
    public static final List<List<String>> TARGET_IT = List.of(List.of("il", "linguaggio", "destinazione", "è"));

    public static final List<List<String>> METAPREDICATES = List.of(
            List.of("the", "metapredicates", "are", ":"),
            List.of("the", "meta", "predicates", "are", ":"),
            List.of("the", "meta", "-", "predicates", "are", ":"));

    public static final List<List<String>> PREDICATES = List.of(
            List.of("the", "predicates", "are", ":"),
            List.of("the", "templates", "are", ":"),
            List.of("the", "timeless", "predicates", "are", ":"),
            List.of("les", "modèles", "sont", ":"),
            List.of("i", "modelli", "sono", ":"));

    public static final List<List<String>> EVENTS = List.of(
            List.of("the", "event", "predicates", "are", ":"));

    public static final List<List<String>> FLUENTS = List.of(
            List.of("the", "fluents", "are", ":"),
            List.of("the", "time", "-", "varying", "predicates", "are", ":"));

    public static final List<String> RULES_ARE = List.of("the", "rules", "are", ":");
    public static final List<String> KNOWLEDGE_BASE = List.of("the", "knowledge", "base");
    public static final List<String> INCLUDES = List.of("includes", ":");
    public static final List<String> KNOWLEDGE_BASE_IT = List.of("la", "base", "di", "conoscenza");
    public static final List<String> INCLUDES_IT = List.of("include", ":");
    public static final List<String> KNOWLEDGE_BASE_FR = List.of("la", "base", "de", "connaissances", "dont", "le", "nom", "est");
    public static final List<String> INCLUDES_FR = List.of("comprend", ":");

    /** Words that end a determiner-led slot in a declaration written without asterisks. */
    public static final Set<String> RESERVED = Set.of(
            "is", "not", "if", "If", "then", "where", "&", "at", "from", "to", "half", "else", "otherwise", "such",
            "<", "=", ">", "+", "-", "/", "*", "{", "}", "(", ")", "[", "]", ":", ",", ";", ".", "'");

    public static final Set<String> VERBS = Set.of(
            "is", "complies", "does", "occurs", "meets", "relates", "can", "qualifies", "has", "satisfies", "owns",
            "belongs", "applies", "must", "acts", "falls", "corresponds", "likes",
            "according", "beginning", "ending",
            "spent", "looked", "could", "had", "tried", "explained", "ocurred");

    public static final Set<String> PREPOSITIONS = Set.of(
            "of", "from", "to", "at", "in", "with", "plus", "as", "by");

    private Lexicon() {
    }

    public static boolean isIndefinite(String word) {
        return INDEFINITE.contains(word);
    }

    public static boolean isDefinite(String word) {
        return DEFINITE.contains(word);
    }

    public static boolean isDeterminer(String word) {
        return INDEFINITE.contains(word) || DEFINITE.contains(word);
    }

    public static boolean isOrdinal(String word) {
        return ORDINALS.contains(word);
    }
}
