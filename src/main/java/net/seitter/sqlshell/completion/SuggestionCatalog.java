package net.seitter.sqlshell.completion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed list of keyword and function suggestions, keywords first.
 */
public final class SuggestionCatalog {
    private final List<Suggestion> suggestions;

    /**
     * Creates a catalog from keyword and function names.
     *
     * @param keywords The keyword names
     * @param functions The built-in function names
     */
    public SuggestionCatalog(List<String> keywords, List<String> functions) {
        List<Suggestion> all = new ArrayList<>(keywords.size() + functions.size());
        keywords.forEach(keyword -> all.add(new Suggestion(keyword, SuggestionKind.KEYWORD)));
        functions.forEach(function -> all.add(new Suggestion(function, SuggestionKind.FUNCTION)));
        this.suggestions = Collections.unmodifiableList(all);
    }

    /**
     * Gets the catalog built from the shell's SQL dialect.
     *
     * @return The default catalog
     */
    public static SuggestionCatalog getDefault() {
        return new SuggestionCatalog(SqlKeywords.KEYWORDS, SqlKeywords.FUNCTIONS);
    }

    public List<Suggestion> getSuggestions() {
        return suggestions;
    }
}
