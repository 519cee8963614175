package net.seitter.sqlshell.completion;

/**
 * Extracts the word currently being typed from the text before the cursor.
 */
public final class WordExtractor {
    private static final String DELIMITERS = " ,\n);(.";

    private WordExtractor() {
    }

    /**
     * Returns the trailing run of characters after the rightmost delimiter.
     * If the text contains no delimiter the whole text is returned.
     *
     * @param textBeforeCursor The input text up to the cursor
     * @return The word being typed, or an empty string if there is none
     */
    public static String extractLastWord(String textBeforeCursor) {
        if (textBeforeCursor == null || textBeforeCursor.isEmpty()) {
            return "";
        }

        int lastPosition = -1;
        for (int i = 0; i < DELIMITERS.length(); i++) {
            lastPosition = Math.max(lastPosition, textBeforeCursor.lastIndexOf(DELIMITERS.charAt(i)));
        }

        return textBeforeCursor.substring(lastPosition + 1);
    }

    /**
     * Checks if a character separates words.
     *
     * @param c The character to check
     * @return true if the character is a word delimiter
     */
    public static boolean isDelimiter(char c) {
        return DELIMITERS.indexOf(c) >= 0;
    }
}
