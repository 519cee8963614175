package net.seitter.sqlshell.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column labels and rows returned by a statement.
 */
public class QueryResult {
    private final List<String> columnNames;
    private final List<List<Object>> rows;

    /**
     * Creates a new query result.
     *
     * @param columnNames The column labels in select order
     * @param rows The rows, each holding one value per column
     */
    public QueryResult(List<String> columnNames, List<List<Object>> rows) {
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Gets an empty result, as returned by statements that produce no rows.
     *
     * @return The empty result
     */
    public static QueryResult empty() {
        return new QueryResult(Collections.emptyList(), Collections.emptyList());
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public boolean hasColumns() {
        return !columnNames.isEmpty();
    }
}
