package net.seitter.sqlshell.completion;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import net.seitter.sqlshell.schema.LoadState;
import net.seitter.sqlshell.schema.SchemaLoader;
import net.seitter.sqlshell.testsupport.BlockingQueryExecutor;

/**
 * Tests completion while the schema is loaded in the background.
 */
public class CompletionEngineConcurrencyTest {

    private static final int COLUMNS = 500;

    @Test
    public void testCompletionsDuringLoadSeeAllOrNothing() throws Exception {
        String[][] rows = new String[COLUMNS][];
        for (int i = 0; i < COLUMNS; i++) {
            rows[i] = new String[] {"metrics", "col_" + i, "int"};
        }
        BlockingQueryExecutor executor = BlockingQueryExecutor.returningColumns(rows);
        CompletionEngine engine = new CompletionEngine(executor, SuggestionCatalog.getDefault(),
                SchemaLoader.DEFAULT_METADATA_QUERY);
        assertTrue(executor.awaitEntered());

        String text = "SELECT * FROM metrics WHERE col_";
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                Callable<Integer> call = () -> engine.complete(text, text.length())
                        .collect(Collectors.toList())
                        .size();
                results.add(pool.submit(call));
                if (i == 50) {
                    executor.release();
                }
            }

            for (Future<Integer> result : results) {
                int count = result.get(5, TimeUnit.SECONDS);
                assertTrue(count == 0 || count == COLUMNS,
                        "Completion must see either no columns or all of them, saw " + count);
            }
        } finally {
            executor.release();
            pool.shutdownNow();
        }

        assertTrue(engine.getSchemaLoader().awaitCompletion(5, TimeUnit.SECONDS));
        assertEquals(LoadState.LOADED, engine.getSchemaLoader().getState());
        assertEquals(COLUMNS, engine.complete(text, text.length()).count());
    }

    @Test
    public void testCompletionDoesNotWaitForLoad() throws Exception {
        BlockingQueryExecutor executor = BlockingQueryExecutor.returningColumns(
                new String[] {"users", "id", "int"});
        try {
            CompletionEngine engine = new CompletionEngine(executor);
            assertTrue(executor.awaitEntered());

            long start = System.nanoTime();
            for (int i = 0; i < 100; i++) {
                engine.complete("SELECT id FROM users WHERE i", 28).collect(Collectors.toList());
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(LoadState.RUNNING, engine.getSchemaLoader().getState());
            assertTrue(elapsedMs < 5000, "Completion should not block on the schema load");
        } finally {
            executor.release();
        }
    }
}
