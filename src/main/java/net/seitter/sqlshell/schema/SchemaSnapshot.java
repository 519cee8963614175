package net.seitter.sqlshell.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of the schema index contents.
 * Once obtained it can be read from any thread without synchronization.
 */
public final class SchemaSnapshot {
    private static final SchemaSnapshot EMPTY =
            new SchemaSnapshot(Collections.emptyList());

    private final List<SchemaRow> rows;
    private final Set<String> tableNames;

    /**
     * Creates a snapshot from rows in metadata query order.
     * Table names are kept in order of first appearance.
     *
     * @param rows The schema rows
     */
    public SchemaSnapshot(List<SchemaRow> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));

        Set<String> names = new LinkedHashSet<>();
        for (SchemaRow row : this.rows) {
            names.add(row.getTable());
        }
        this.tableNames = Collections.unmodifiableSet(names);
    }

    public static SchemaSnapshot empty() {
        return EMPTY;
    }

    public List<SchemaRow> getRows() {
        return rows;
    }

    public Set<String> getTableNames() {
        return tableNames;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
