package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Part-of-speech classification shared by all detectors. Covers both
 * universal POS values and STTS tags, since parsers deliver either.
 *
 * <p>Scanning methods take and return list positions in
 * {@link Sentence#tokens()}, with -1 for "not found".</p>
 */
public final class TokenClassifier {

    public static final List<String> SEPARABLE_PREFIXES = List.of(
        "zurück", "weiter", "statt", "durch", "fort", "nach", "weg",
        "ab", "an", "auf", "aus", "bei", "ein", "her", "hin", "los", "mit", "vor", "zu");

    public static final Set<String> MODAL_VERBS = Set.of(
        "können", "müssen", "sollen", "wollen", "dürfen", "mögen", "möchten",
        "kann", "muss", "soll", "will", "darf", "mag");

    /** Verbs whose perfect uses sein; "ist gegangen" is not a statal passive. */
    public static final Set<String> SEIN_PERFECT_VERBS = Set.of(
        "gehen", "kommen", "fahren", "fliegen", "laufen", "rennen", "reisen", "wandern", "schwimmen",
        "springen", "fallen", "steigen", "sinken", "bleiben", "sein", "werden", "sterben", "wachsen",
        "passieren", "geschehen", "gelingen", "begegnen", "folgen", "aufstehen", "ankommen", "abfahren",
        "einschlafen", "aufwachen", "umziehen", "einsteigen", "aussteigen", "zurückkommen",
        "verschwinden", "entstehen", "erscheinen", "wegfahren", "losgehen", "mitkommen");

    /** Contracted preposition+article forms mapped to the base preposition. */
    public static final Map<String, String> CONTRACTED_PREPOSITIONS = Map.ofEntries(
        Map.entry("zur", "zu"), Map.entry("zum", "zu"),
        Map.entry("am", "an"), Map.entry("ans", "an"),
        Map.entry("im", "in"), Map.entry("ins", "in"),
        Map.entry("vom", "von"), Map.entry("beim", "bei"),
        Map.entry("aufs", "auf"), Map.entry("durchs", "durch"),
        Map.entry("fürs", "für"), Map.entry("übers", "über"), Map.entry("überm", "über"),
        Map.entry("ums", "um"), Map.entry("unterm", "unter"),
        Map.entry("hinterm", "hinter"), Map.entry("vors", "vor"));

    private static final Set<String> REFLEXIVE_FORMS = Set.of(
        "mich", "dich", "sich", "uns", "euch", "mir", "dir", "ihm", "ihr", "ihnen");
    private static final Set<String> NAMED_ENTITY_TYPES = Set.of("LOC", "PER", "ORG");
    private static final Set<String> CLAUSE_PUNCTUATION = Set.of(",", ".", "!", "?", ";", ":");
    private static final Set<String> SKIPPABLE_BEFORE_PARTICIPLE = Set.of(
        "DET", "NOUN", "PROPN", "ADJ", "ADP", "PRON", "PREP", "ART", "ADV");
    private static final Pattern INFINITIVE_ENDING = Pattern.compile("(?i)[a-zäöüß]+(en|eln|ern)$");
    private static final Pattern PRESENT_PARTICIPLE_ENDING = Pattern.compile("(?i)end(e|er|es|en|em)?$");

    private TokenClassifier() {
    }

    public static boolean isVerbOrAux(Token token) {
        return "VERB".equals(token.pos()) || "AUX".equals(token.pos());
    }

    public static boolean isAuxiliary(Token token) {
        return "AUX".equals(token.pos()) || token.tag().startsWith("VA") || token.tag().startsWith("VM")
            || "aux".equals(token.dep()) || "aux:pass".equals(token.dep());
    }

    public static boolean isFiniteVerb(Token token) {
        if (!isVerbOrAux(token)) {
            return false;
        }
        return Morphology.has(token, "VerbForm", "Fin") || token.tag().endsWith("FIN");
    }

    /**
     * Morphology first, then the tag, then the -en/-eln/-ern ending.
     */
    public static boolean isInfinitive(Token token) {
        if (!isVerbOrAux(token)) {
            return false;
        }
        String verbForm = token.feature("VerbForm");
        if ("Inf".equals(verbForm) || "Inf,Part".equals(verbForm)) {
            return true;
        }
        if (token.tag().contains("INF")) {
            return true;
        }
        if ("Fin".equals(verbForm) || "Part".equals(verbForm) || token.tag().endsWith("FIN")
            || token.tag().endsWith("PP")) {
            return false;
        }
        return hasInfinitiveEnding(token.text());
    }

    private static boolean hasInfinitiveEnding(String text) {
        return INFINITIVE_ENDING.matcher(text).find();
    }

    /**
     * Partizip II. Present participles and finite forms are excluded.
     */
    public static boolean isPastParticiple(Token token) {
        if (token.tag().endsWith("PP")) {
            return true;
        }
        if ("VVPPR".equals(token.tag()) || Morphology.has(token, "Tense", "Pres")) {
            return false;
        }
        if (Morphology.has(token, "VerbForm", "Fin")) {
            return false;
        }
        if (Morphology.has(token, "VerbForm", "Part")) {
            return true;
        }
        return Morphology.has(token, "Tense", "Perf") || Morphology.has(token, "Aspect", "Perf");
    }

    public static boolean isPresentParticiple(Token token) {
        if ("VVPPR".equals(token.tag())) {
            return true;
        }
        if (Morphology.has(token, "VerbForm", "Part") && Morphology.has(token, "Tense", "Pres")) {
            return true;
        }
        return PRESENT_PARTICIPLE_ENDING.matcher(token.text()).find()
            && ("ADJ".equals(token.pos()) || isVerbOrAux(token));
    }

    public static boolean isPreposition(Token token) {
        String pos = token.pos();
        return "ADP".equals(pos) || "APPRART".equals(pos) || "PREP".equals(pos)
            || token.tag().startsWith("APPR") || "APPO".equals(token.tag()) || "APZR".equals(token.tag());
    }

    public static boolean isContractedPreposition(Token token) {
        return "APPRART".equals(token.pos()) || "APPRART".equals(token.tag())
            || (isPreposition(token) && CONTRACTED_PREPOSITIONS.containsKey(token.lowerText()));
    }

    /**
     * Base preposition of a token: contracted forms map to their preposition,
     * everything else to its lower-cased lemma.
     */
    public static String prepositionLemma(Token token) {
        String contracted = CONTRACTED_PREPOSITIONS.get(token.lowerText());
        return contracted != null ? contracted : token.lowerLemma();
    }

    public static boolean matchesPreposition(Token token, String expected) {
        return isPreposition(token) && prepositionLemma(token).equalsIgnoreCase(expected);
    }

    public static boolean isPassiveAuxiliary(Token token, String lemma) {
        return isVerbOrAux(token) && lemma.equals(token.lemma());
    }

    public static boolean isModalVerb(Token token) {
        return MODAL_VERBS.contains(token.lowerLemma()) || token.tag().startsWith("VM");
    }

    public static boolean isSubordinatingConjunction(Token token) {
        return "SCONJ".equals(token.pos()) || "KOUS".equals(token.tag());
    }

    public static boolean isCoordinatingConjunction(Token token) {
        return "CCONJ".equals(token.pos()) || "KON".equals(token.tag());
    }

    public static boolean isComma(Token token) {
        return ",".equals(token.text());
    }

    public static boolean isClausePunctuation(Token token) {
        return CLAUSE_PUNCTUATION.contains(token.text())
            && ("PUNCT".equals(token.pos()) || token.tag().startsWith("$") || token.pos().isEmpty());
    }

    /**
     * A pronoun that can fill a reflexive slot. Object forms like "mich" count
     * unless morphology says otherwise, so callers needing certainty should
     * also check {@link Morphology#isReflexive}.
     */
    public static boolean isReflexivePronoun(Token token) {
        boolean pronoun = "PRON".equals(token.pos()) || "PRF".equals(token.tag());
        return pronoun && (Morphology.isReflexive(token)
            || "sich".equalsIgnoreCase(token.lemma())
            || REFLEXIVE_FORMS.contains(token.lowerText()));
    }

    public static boolean isNoun(Token token) {
        return "NOUN".equals(token.pos()) || "PROPN".equals(token.pos());
    }

    /**
     * A detached verb particle ("vor" in "bereitet sich vor").
     */
    public static boolean isSeparableParticle(Token token) {
        return "PTKVZ".equals(token.tag()) || "svp".equals(token.dep()) || "compound:prt".equals(token.dep());
    }

    /**
     * Separable prefix the lemma starts with, longest first.
     */
    public static Optional<String> separablePrefix(String lemma) {
        String lower = lemma.toLowerCase();
        for (String prefix : SEPARABLE_PREFIXES) {
            if (lower.startsWith(prefix) && lower.length() > prefix.length() + 2) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }

    public static boolean isNamedEntity(Token token) {
        return token.entity() != null && NAMED_ENTITY_TYPES.contains(token.entity().type());
    }

    public static boolean isPartOfEntity(Token token) {
        return token.entity() != null;
    }

    /**
     * All tokens of the entity {@code token} belongs to, or just the token itself.
     */
    public static List<Token> entityTokens(Sentence sentence, Token token) {
        if (token.entity() == null) {
            return List.of(token);
        }
        List<Token> result = new ArrayList<>();
        for (Token t : sentence.tokens()) {
            if (t.entity() != null && t.entity().id() == token.entity().id()) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Last position of the clause starting after {@code position}: stops before
     * clause punctuation and subordinating or coordinating conjunctions.
     */
    public static int findClauseEnd(Sentence sentence, int position) {
        for (int p = position + 1; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (isClausePunctuation(token) || isSubordinatingConjunction(token) || isCoordinatingConjunction(token)) {
                return p - 1;
            }
        }
        return sentence.tokenCount() - 1;
    }

    /**
     * First position of the clause containing {@code position}.
     */
    public static int findClauseStart(Sentence sentence, int position) {
        for (int p = position - 1; p >= 0; p--) {
            Token token = sentence.getToken(p);
            if (isSubordinatingConjunction(token) || isComma(token)) {
                return p + 1;
            }
        }
        return 0;
    }

    /**
     * Next past participle after {@code position}. With {@code allowSkip}, noun
     * phrase material between auxiliary and participle is skipped.
     */
    public static int findNextParticiple(Sentence sentence, int position, int maxDistance, boolean allowSkip) {
        int limit = Math.min(sentence.tokenCount(), position + 1 + maxDistance);
        for (int p = position + 1; p < limit; p++) {
            Token token = sentence.getToken(p);
            if (isVerbOrAux(token) && isPastParticiple(token)) {
                return p;
            }
            if (!allowSkip || !SKIPPABLE_BEFORE_PARTICIPLE.contains(token.pos())) {
                return -1;
            }
        }
        return -1;
    }

    public static int findNext(Sentence sentence, int position, TokenPredicate predicate, int maxDistance) {
        int limit = Math.min(sentence.tokenCount(), position + 1 + maxDistance);
        for (int p = position + 1; p < limit; p++) {
            if (predicate.test(sentence.getToken(p))) {
                return p;
            }
        }
        return -1;
    }

    public static int findPrevious(Sentence sentence, int position, TokenPredicate predicate, int maxDistance) {
        int limit = Math.max(0, position - maxDistance);
        for (int p = position - 1; p >= limit; p--) {
            if (predicate.test(sentence.getToken(p))) {
                return p;
            }
        }
        return -1;
    }
}
