package net.seitter.sqlshell.testsupport;

import net.seitter.sqlshell.sql.QueryExecutionException;
import net.seitter.sqlshell.sql.QueryExecutor;
import net.seitter.sqlshell.sql.QueryResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Query executor for tests that holds every statement until {@link #release()} is called,
 * then returns a fixed result or throws a fixed exception.
 */
public class BlockingQueryExecutor implements QueryExecutor {
    private final CountDownLatch gate = new CountDownLatch(1);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();
    private final QueryResult result;
    private final QueryExecutionException failure;
    private final RuntimeException crash;

    private BlockingQueryExecutor(QueryResult result, QueryExecutionException failure, RuntimeException crash) {
        this.result = result;
        this.failure = failure;
        this.crash = crash;
    }

    /**
     * Creates an executor returning (table_name, column_name, data_type) rows.
     *
     * @param rows Triples of table, column and type
     * @return The executor
     */
    public static BlockingQueryExecutor returningColumns(String[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (String[] row : rows) {
            data.add(new ArrayList<>(Arrays.asList((Object[]) row)));
        }
        return new BlockingQueryExecutor(
                new QueryResult(Arrays.asList("table_name", "column_name", "data_type"), data), null, null);
    }

    public static BlockingQueryExecutor failingWith(QueryExecutionException failure) {
        return new BlockingQueryExecutor(null, failure, null);
    }

    public static BlockingQueryExecutor crashingWith(RuntimeException crash) {
        return new BlockingQueryExecutor(null, null, crash);
    }

    /**
     * Creates an executor that does not block.
     *
     * @param rows Triples of table, column and type
     * @return The executor, already released
     */
    public static BlockingQueryExecutor released(String[]... rows) {
        BlockingQueryExecutor executor = returningColumns(rows);
        executor.release();
        return executor;
    }

    @Override
    public QueryResult execute(String statement) throws QueryExecutionException {
        calls.incrementAndGet();
        entered.countDown();
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Executor was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while blocked", e);
        }
        if (failure != null) {
            throw failure;
        }
        if (crash != null) {
            throw crash;
        }
        return result;
    }

    public void release() {
        gate.countDown();
    }

    /**
     * Waits until a statement has been submitted.
     *
     * @return true if a statement arrived within five seconds
     * @throws InterruptedException If interrupted while waiting
     */
    public boolean awaitEntered() throws InterruptedException {
        return entered.await(5, TimeUnit.SECONDS);
    }

    public int getCalls() {
        return calls.get();
    }
}
