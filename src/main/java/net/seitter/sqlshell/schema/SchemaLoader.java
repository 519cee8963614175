package net.seitter.sqlshell.schema;

import net.seitter.sqlshell.sql.QueryExecutionException;
import net.seitter.sqlshell.sql.QueryExecutor;
import net.seitter.sqlshell.sql.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background thread that runs the metadata query once and publishes the
 * discovered columns into a {@link SchemaIndex}.
 * <p>
 * A failed query leaves the index empty for the rest of the session; completion
 * then only offers keywords and functions. Any other error is not handled here.
 */
public class SchemaLoader implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(SchemaLoader.class);

    public static final String DEFAULT_METADATA_QUERY =
            "SELECT table_name, column_name, data_type FROM information_schema.columns";

    private final QueryExecutor executor;
    private final SchemaIndex index;
    private final String metadataQuery;
    private final Thread loaderThread;
    private final AtomicReference<LoadState> state;
    private final CountDownLatch done;

    /**
     * Creates a new schema loader.
     *
     * @param executor The executor used to run the metadata query
     * @param index The index to publish into
     * @param metadataQuery The query returning (table_name, column_name, data_type) rows
     */
    public SchemaLoader(QueryExecutor executor, SchemaIndex index, String metadataQuery) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.index = Objects.requireNonNull(index, "index");
        this.metadataQuery = Objects.requireNonNull(metadataQuery, "metadataQuery");
        this.loaderThread = new Thread(this, "SchemaLoader");
        this.loaderThread.setDaemon(true);
        this.state = new AtomicReference<>(LoadState.PENDING);
        this.done = new CountDownLatch(1);
    }

    public SchemaLoader(QueryExecutor executor, SchemaIndex index) {
        this(executor, index, DEFAULT_METADATA_QUERY);
    }

    /**
     * Starts the loader thread. Subsequent calls have no effect.
     */
    public void start() {
        if (state.compareAndSet(LoadState.PENDING, LoadState.RUNNING)) {
            loaderThread.start();
            logger.debug("Started schema loader");
        }
    }

    @Override
    public void run() {
        LoadState outcome = LoadState.CRASHED;
        try {
            QueryResult result = executor.execute(metadataQuery);

            List<SchemaRow> rows = new ArrayList<>(result.getRows().size());
            for (List<Object> row : result.getRows()) {
                rows.add(SchemaRow.fromResultRow(row));
            }

            index.publish(rows);
            outcome = LoadState.LOADED;
            logger.info("Loaded {} columns for completion", rows.size());
        } catch (QueryExecutionException e) {
            // Completion degrades to keywords and functions only
            outcome = LoadState.FAILED;
            logger.debug("Schema metadata query failed: {}", e.getMessage());
        } catch (RuntimeException | Error e) {
            logger.error("Schema loader terminated unexpectedly", e);
            throw e;
        } finally {
            state.set(outcome);
            done.countDown();
        }
    }

    /**
     * Waits for the load to reach a terminal state.
     *
     * @param timeout The maximum time to wait
     * @param unit The unit of the timeout
     * @return true if the load finished within the timeout
     * @throws InterruptedException If the current thread was interrupted while waiting
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    public LoadState getState() {
        return state.get();
    }
}
