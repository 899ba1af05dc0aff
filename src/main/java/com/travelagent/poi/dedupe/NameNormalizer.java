package com.travelagent.poi.dedupe;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reduces a place name to a canonical token so that the same place spelled with or without diacritics, in another
 * case, or with different punctuation compares equal. "Mỹ Khê Beach", "MY KHE BEACH" and "My-Khe beach!" all become
 * "my khe beach". Parenthesized asides are dropped: "Temple of Literature (Văn Miếu)" becomes
 * "temple of literature".
 *
 * Normalizing an already normalized name returns it unchanged.
 */
public abstract class NameNormalizer {

    /**
     * Letters that canonical decomposition leaves alone because the stroke or ligature is part of the base letter.
     * Keys are lower case since lookup happens after lowercasing and removal of combining marks.
     */
    private static final Map<Character, String> FALLBACK_LETTERS = ImmutableMap.<Character, String>builder()
            .put('đ', "d")
            .put('ð', "d")
            .put('ħ', "h")
            .put('ı', "i")
            .put('ł', "l")
            .put('ø', "o")
            .put('æ', "ae")
            .put('œ', "oe")
            .put('ß', "ss")
            .put('þ', "th")
            .build();

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");

    private static final CharMatcher NOT_LETTER_OR_DIGIT = CharMatcher.forPredicate(Character::isLetterOrDigit).negate();

    public static String normalize (String name) {
        if (name == null) return "";
        String normalized = Normalizer.normalize(name.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        normalized = COMBINING_MARKS.matcher(normalized).replaceAll("");
        // After stripping marks, so that a precomposed letter such as ǿ is reduced to ø and then to o.
        normalized = replaceFallbackLetters(normalized);
        normalized = PARENTHESIZED.matcher(normalized).replaceAll(" ");
        normalized = NOT_LETTER_OR_DIGIT.replaceFrom(normalized, ' ');
        return CharMatcher.whitespace().trimAndCollapseFrom(normalized, ' ');
    }

    /** The normalized name without spaces, as used in dedupe keys: "Mỹ Khê Beach" becomes "mykhebeach". */
    public static String compact (String name) {
        return CharMatcher.is(' ').removeFrom(normalize(name));
    }

    private static String replaceFallbackLetters (String name) {
        StringBuilder builder = null;
        for (int i = 0; i < name.length(); i++) {
            String replacement = FALLBACK_LETTERS.get(name.charAt(i));
            if (replacement != null && builder == null) {
                builder = new StringBuilder(name.length() + 4);
                builder.append(name, 0, i);
            }
            if (builder != null) {
                builder.append(replacement != null ? replacement : String.valueOf(name.charAt(i)));
            }
        }
        return builder == null ? name : builder.toString();
    }

}
