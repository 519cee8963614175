package net.seitter.sqlshell.completion;

import net.seitter.sqlshell.schema.SchemaIndex;
import net.seitter.sqlshell.schema.SchemaLoader;
import net.seitter.sqlshell.schema.SchemaSnapshot;
import net.seitter.sqlshell.sql.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Suggests keywords, functions, tables and columns for the word being typed.
 * <p>
 * Creating an engine starts the background schema load. Until it has finished,
 * or if it fails, only keywords and functions are offered. Completion never
 * waits for the load.
 */
public class CompletionEngine {
    private static final Logger logger = LoggerFactory.getLogger(CompletionEngine.class);

    private final SuggestionCatalog catalog;
    private final SchemaIndex schemaIndex;
    private final SchemaLoader schemaLoader;
    private final CompletionRenderer renderer;

    /**
     * Creates an engine with the default catalog and metadata query.
     *
     * @param executor The executor used to load table and column names
     */
    public CompletionEngine(QueryExecutor executor) {
        this(executor, SuggestionCatalog.getDefault(), SchemaLoader.DEFAULT_METADATA_QUERY);
    }

    /**
     * Creates an engine and starts loading the schema in the background.
     *
     * @param executor The executor used to load table and column names
     * @param catalog The keyword and function suggestions
     * @param metadataQuery The query returning (table_name, column_name, data_type) rows
     */
    public CompletionEngine(QueryExecutor executor, SuggestionCatalog catalog, String metadataQuery) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.schemaIndex = new SchemaIndex();
        this.schemaLoader = new SchemaLoader(executor, schemaIndex, metadataQuery);
        this.renderer = new CompletionRenderer();

        schemaLoader.start();
        logger.debug("Completion engine created with {} static suggestions", catalog.getSuggestions().size());
    }

    /**
     * Computes the completions for the word before the cursor.
     * The returned stream is lazy and can be consumed once.
     *
     * @param fullText The complete input text
     * @param cursorOffset The zero-based cursor position in the text
     * @return The matching completions in catalog order
     */
    public Stream<RenderedCompletion> complete(String fullText, int cursorOffset) {
        String text = fullText == null ? "" : fullText;
        int cursor = Math.min(Math.max(cursorOffset, 0), text.length());

        String currentWord = WordExtractor.extractLastWord(text.substring(0, cursor));
        if (currentWord.isEmpty()) {
            return Stream.empty();
        }

        String prefix = currentWord.toUpperCase(Locale.ROOT);
        int wordLength = currentWord.length();

        return candidates(text, schemaIndex.snapshot())
                .filter(suggestion -> suggestion.getLabel().toUpperCase(Locale.ROOT).startsWith(prefix))
                .map(suggestion -> renderer.render(suggestion, wordLength));
    }

    /**
     * Builds the candidate universe: static suggestions, then table names, then the
     * columns of every table whose name occurs anywhere in the text.
     */
    private Stream<Suggestion> candidates(String text, SchemaSnapshot snapshot) {
        Stream<Suggestion> tables = snapshot.getTableNames().stream()
                .map(table -> new Suggestion(table, SuggestionKind.TABLE));

        Stream<Suggestion> columns = snapshot.getRows().stream()
                .filter(row -> text.contains(row.getTable()))
                .map(row -> Suggestion.column(row.getColumn(), row.getDeclaredType(), row.getTable()));

        return Stream.concat(catalog.getSuggestions().stream(), Stream.concat(tables, columns));
    }

    public SchemaIndex getSchemaIndex() {
        return schemaIndex;
    }

    public SchemaLoader getSchemaLoader() {
        return schemaLoader;
    }
}
