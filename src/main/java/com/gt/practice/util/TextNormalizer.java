package com.gt.practice.util;

import java.text.Normalizer;
import java.util.Locale;

// Normalizes free text before comparison. Internal whitespace is left alone.
public class TextNormalizer {

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }

        // upper then lower folds characters like the German sharp s and Greek final sigma the same way
        return Normalizer.normalize(text, Normalizer.Form.NFKC)
                .toUpperCase(Locale.ROOT)
                .toLowerCase(Locale.ROOT)
                .strip();
    }

    public static String normalizeCaseSensitive(String text) {
        if (text == null) {
            return "";
        }

        return Normalizer.normalize(text, Normalizer.Form.NFKC).strip();
    }

    public static boolean matches(String submitted, String expected, boolean caseSensitive) {
        return caseSensitive
                ? normalizeCaseSensitive(submitted).equals(normalizeCaseSensitive(expected))
                : normalize(submitted).equals(normalize(expected));
    }
}
