package net.seitter.sqlshell.completion;

/**
 * Provenance of a completion suggestion.
 */
public enum SuggestionKind {
    KEYWORD,
    FUNCTION,
    TABLE,
    COLUMN
}
