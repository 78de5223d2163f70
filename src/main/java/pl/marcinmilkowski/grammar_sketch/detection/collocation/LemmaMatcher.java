package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lenient lemma comparison that absorbs inflection and lemmatizer noise:
 * exact match, prefix match in either direction, or equality after
 * stripping a trailing -en/-ern/-n.
 */
public final class LemmaMatcher {

    private static final Pattern VERB_ENDING = Pattern.compile("(en|ern|n)$");
    private static final int MIN_PREFIX_LENGTH = 4;

    private LemmaMatcher() {
    }

    public static boolean matches(String tokenLemma, String patternLemma) {
        if (tokenLemma == null || patternLemma == null || tokenLemma.isEmpty() || patternLemma.isEmpty()) {
            return false;
        }
        String a = tokenLemma.toLowerCase(Locale.ROOT);
        String b = patternLemma.toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return true;
        }
        if (Math.min(a.length(), b.length()) >= MIN_PREFIX_LENGTH && (a.startsWith(b) || b.startsWith(a))) {
            return true;
        }
        String strippedA = strip(a);
        return !strippedA.isEmpty() && strippedA.equals(strip(b));
    }

    static String strip(String lemma) {
        return VERB_ENDING.matcher(lemma).replaceFirst("");
    }
}
