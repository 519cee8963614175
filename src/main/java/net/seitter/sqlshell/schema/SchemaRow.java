package net.seitter.sqlshell.schema;

import java.util.List;
import java.util.Objects;

/**
 * One column discovered through metadata introspection.
 */
public final class SchemaRow {
    private final String table;
    private final String column;
    private final String declaredType;

    /**
     * Creates a new schema row.
     *
     * @param table The name of the table owning the column
     * @param column The column name
     * @param declaredType The declared data type of the column
     */
    public SchemaRow(String table, String column, String declaredType) {
        this.table = Objects.requireNonNull(table, "table");
        this.column = Objects.requireNonNull(column, "column");
        this.declaredType = Objects.requireNonNull(declaredType, "declaredType");
    }

    /**
     * Builds a schema row from a (table_name, column_name, data_type) result row.
     * Cell values are converted with {@link String#valueOf(Object)}.
     *
     * @param values The result row
     * @return The schema row
     * @throws IllegalArgumentException If the row has fewer than three values
     */
    public static SchemaRow fromResultRow(List<Object> values) {
        if (values.size() < 3) {
            throw new IllegalArgumentException(
                    "Expected (table_name, column_name, data_type) but got " + values.size() + " values");
        }
        return new SchemaRow(String.valueOf(values.get(0)), String.valueOf(values.get(1)),
                String.valueOf(values.get(2)));
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaRow)) {
            return false;
        }
        SchemaRow other = (SchemaRow) o;
        return table.equals(other.table) && column.equals(other.column)
                && declaredType.equals(other.declaredType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column, declaredType);
    }

    @Override
    public String toString() {
        return table + "." + column + " " + declaredType;
    }
}
