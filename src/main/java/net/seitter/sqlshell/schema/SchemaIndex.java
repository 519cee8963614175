package net.seitter.sqlshell.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table and column metadata used for dynamic completions.
 * <p>
 * The index starts empty and can be populated exactly once. Readers always see
 * either the empty snapshot or the complete published one, never a partial list.
 */
public class SchemaIndex {
    private static final Logger logger = LoggerFactory.getLogger(SchemaIndex.class);

    private final AtomicReference<SchemaSnapshot> snapshot =
            new AtomicReference<>(SchemaSnapshot.empty());

    /**
     * Gets the current snapshot.
     *
     * @return The snapshot, empty until rows have been published
     */
    public SchemaSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Publishes the loaded rows as a single immutable snapshot.
     *
     * @param rows The rows returned by the metadata query
     * @throws IllegalStateException If rows have already been published
     */
    public void publish(List<SchemaRow> rows) {
        SchemaSnapshot loaded = new SchemaSnapshot(rows);
        if (!snapshot.compareAndSet(SchemaSnapshot.empty(), loaded)) {
            throw new IllegalStateException("Schema index has already been populated");
        }
        logger.debug("Published {} columns across {} tables", loaded.getRows().size(),
                loaded.getTableNames().size());
    }
}
