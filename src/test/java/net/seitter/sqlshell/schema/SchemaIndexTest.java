package net.seitter.sqlshell.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for the SchemaIndex and SchemaSnapshot classes.
 */
public class SchemaIndexTest {

    @Test
    public void testStartsEmpty() {
        SchemaIndex index = new SchemaIndex();

        assertTrue(index.snapshot().isEmpty());
        assertTrue(index.snapshot().getTableNames().isEmpty());
    }

    @Test
    public void testPublishKeepsRowOrderAndDistinctTables() {
        SchemaIndex index = new SchemaIndex();
        List<SchemaRow> rows = Arrays.asList(
                new SchemaRow("users", "id", "int"),
                new SchemaRow("orders", "id", "bigint"),
                new SchemaRow("users", "name", "text"),
                new SchemaRow("users", "name", "text"));

        index.publish(rows);

        SchemaSnapshot snapshot = index.snapshot();
        assertEquals(rows, snapshot.getRows(), "Rows keep query order including duplicates");
        assertEquals(Arrays.asList("users", "orders"), new ArrayList<>(snapshot.getTableNames()));
    }

    @Test
    public void testPublishCopiesRows() {
        SchemaIndex index = new SchemaIndex();
        List<SchemaRow> rows = new ArrayList<>();
        rows.add(new SchemaRow("users", "id", "int"));

        index.publish(rows);
        rows.add(new SchemaRow("users", "name", "text"));

        assertEquals(1, index.snapshot().getRows().size(), "Snapshot must not see later changes");
        assertThrows(UnsupportedOperationException.class,
                () -> index.snapshot().getRows().add(new SchemaRow("a", "b", "c")));
    }

    @Test
    public void testSecondPublishIsRejected() {
        SchemaIndex index = new SchemaIndex();
        index.publish(Collections.singletonList(new SchemaRow("users", "id", "int")));

        assertThrows(IllegalStateException.class,
                () -> index.publish(Collections.singletonList(new SchemaRow("orders", "id", "int"))));
        assertEquals(Collections.singleton("users"), index.snapshot().getTableNames());
    }

    @Test
    public void testSchemaRowFromResultRow() {
        SchemaRow row = SchemaRow.fromResultRow(Arrays.asList("users", "id", 4));
        assertEquals(new SchemaRow("users", "id", "4"), row);

        SchemaRow nullType = SchemaRow.fromResultRow(Arrays.asList("users", "id", null));
        assertEquals("null", nullType.getDeclaredType());

        assertThrows(IllegalArgumentException.class,
                () -> SchemaRow.fromResultRow(Arrays.asList("users", "id")));
    }
}
