package com.williamcallahan.webingest.support;

import java.util.HashSet;
import java.util.Set;

/**
 * Single-pass word and character statistics for body text.
 *
 * <p>A word is a maximal run of letters or digits. Distinct words are compared after
 * ASCII lowercasing so the result does not depend on the default locale.</p>
 *
 * @param wordCount number of words
 * @param distinctWordCount number of distinct words
 * @param alphaCount number of letters
 * @param nonWhitespaceCount number of non-whitespace characters
 */
public record TextStatistics(int wordCount, int distinctWordCount, int alphaCount, int nonWhitespaceCount) {

    private static final int CASE_OFFSET = 'a' - 'A';

    /**
     * Scans the text once; null is treated as empty.
     */
    public static TextStatistics of(String text) {
        if (text == null || text.isEmpty()) {
            return new TextStatistics(0, 0, 0, 0);
        }

        int wordCount = 0;
        int alphaCount = 0;
        int nonWhitespaceCount = 0;
        Set<String> distinctWords = new HashSet<>();
        StringBuilder currentWord = new StringBuilder();

        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (!Character.isWhitespace(ch)) {
                nonWhitespaceCount++;
            }
            if (Character.isLetter(ch)) {
                alphaCount++;
            }
            if (Character.isLetterOrDigit(ch)) {
                if (currentWord.length() == 0) {
                    wordCount++;
                }
                currentWord.append(ch);
            } else if (currentWord.length() > 0) {
                distinctWords.add(toLowerAscii(currentWord.toString()));
                currentWord.setLength(0);
            }
        }
        if (currentWord.length() > 0) {
            distinctWords.add(toLowerAscii(currentWord.toString()));
        }

        return new TextStatistics(wordCount, distinctWords.size(), alphaCount, nonWhitespaceCount);
    }

    /**
     * Letters over non-whitespace characters, 0 for whitespace-only text.
     */
    public double alphaRatio() {
        return nonWhitespaceCount == 0 ? 0.0 : (double) alphaCount / nonWhitespaceCount;
    }

    /**
     * Distinct words over total words, 1 for text without words.
     */
    public double distinctWordRatio() {
        return wordCount == 0 ? 1.0 : (double) distinctWordCount / wordCount;
    }

    /**
     * Lowercases ASCII letters only, leaving every other character untouched.
     *
     * @param text input, null treated as empty
     * @return lowercased text
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            normalized.append(current >= 'A' && current <= 'Z' ? (char) (current + CASE_OFFSET) : current);
        }
        return normalized.toString();
    }

    /**
     * Trims the value and maps blank input to null.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
