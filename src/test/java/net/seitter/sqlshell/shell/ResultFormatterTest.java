package net.seitter.sqlshell.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Timestamp;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import net.seitter.sqlshell.sql.QueryResult;

/**
 * Tests for the ResultFormatter class.
 */
public class ResultFormatterTest {

    private static final QueryResult USERS = new QueryResult(
            Arrays.asList("id", "name"),
            Arrays.asList(
                    Arrays.asList(1, "alice"),
                    Arrays.asList(22, null)));

    @Test
    public void testTableFormat() {
        String expected = String.join("\n",
                "id | name ",
                "---+------",
                "1  | alice",
                "22 | null ",
                "(2 rows)");

        assertEquals(expected, new ResultFormatter(OutputFormat.TABLE).format(USERS));
    }

    @Test
    public void testSingleRowTable() {
        QueryResult result = new QueryResult(Collections.singletonList("n"),
                Collections.singletonList(Collections.singletonList(7)));

        assertTrue(new ResultFormatter(OutputFormat.TABLE).format(result).endsWith("(1 row)"));
    }

    @Test
    public void testJsonFormat() {
        String expected = "{\"id\":1,\"name\":\"alice\"}\n{\"id\":22,\"name\":null}";

        assertEquals(expected, new ResultFormatter(OutputFormat.JSON).format(USERS));
    }

    @Test
    public void testJsonWritesTimestampsAsText() {
        QueryResult result = new QueryResult(Collections.singletonList("created"),
                Collections.singletonList(Collections.singletonList(Timestamp.valueOf("2024-01-02 03:04:05"))));

        String json = new ResultFormatter(OutputFormat.JSON).format(result);

        assertTrue(json.startsWith("{\"created\":\"2024-01-0"), "Unexpected JSON: " + json);
    }

    @Test
    public void testJsonWritesUnserializableValuesAsText() {
        Object opaque = new Object() {
            @Override
            public String toString() {
                return "BLOB@1";
            }
        };
        QueryResult result = new QueryResult(Arrays.asList("id", "data"),
                Collections.singletonList(Arrays.asList(5, opaque)));

        String json = new ResultFormatter(OutputFormat.JSON).format(result);

        assertEquals("{\"id\":5,\"data\":\"BLOB@1\"}", json);
    }

    @Test
    public void testStatementWithoutColumns() {
        assertEquals("OK", new ResultFormatter(OutputFormat.TABLE).format(QueryResult.empty()));
        assertEquals("OK", new ResultFormatter(OutputFormat.JSON).format(QueryResult.empty()));
    }
}
