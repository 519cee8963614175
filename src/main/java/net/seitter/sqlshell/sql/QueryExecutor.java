package net.seitter.sqlshell.sql;

/**
 * Runs SQL statements against a data source.
 */
public interface QueryExecutor {

    /**
     * Executes a statement and collects its rows.
     *
     * @param statement The SQL statement text
     * @return The result of the statement
     * @throws QueryExecutionException If the data source rejected or failed the statement
     */
    QueryResult execute(String statement) throws QueryExecutionException;
}
