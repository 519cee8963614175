package net.seitter.sqlshell.sql;

/**
 * Thrown when a statement could not be executed by the data source,
 * e.g. lost connectivity, missing privileges or an unknown relation.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
