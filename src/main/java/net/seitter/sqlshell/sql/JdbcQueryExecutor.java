package net.seitter.sqlshell.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes statements over a JDBC connection.
 * Statements are serialized on the connection, since the schema loader and the
 * interactive shell share it.
 */
public class JdbcQueryExecutor implements QueryExecutor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final Connection connection;

    /**
     * Creates an executor on top of an open connection.
     *
     * @param connection The JDBC connection, owned by this executor from now on
     */
    public JdbcQueryExecutor(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * Opens a connection through the JDBC driver manager.
     *
     * @param url The JDBC URL
     * @param user The user name, or null
     * @param password The password, or null
     * @return An executor for the new connection
     * @throws QueryExecutionException If the connection could not be established
     */
    public static JdbcQueryExecutor connect(String url, String user, String password)
            throws QueryExecutionException {
        try {
            Connection connection = user == null
                    ? DriverManager.getConnection(url)
                    : DriverManager.getConnection(url, user, password);
            logger.info("Connected to {}", url);
            return new JdbcQueryExecutor(connection);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to connect to " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public QueryResult execute(String statement) throws QueryExecutionException {
        logger.debug("Executing statement: {}", statement);

        synchronized (connection) {
            try (Statement jdbcStatement = connection.createStatement()) {
                boolean hasResultSet = jdbcStatement.execute(statement);
                if (!hasResultSet) {
                    logger.debug("Statement updated {} rows", jdbcStatement.getUpdateCount());
                    return QueryResult.empty();
                }

                try (ResultSet resultSet = jdbcStatement.getResultSet()) {
                    return readResult(resultSet);
                }
            } catch (SQLException e) {
                throw new QueryExecutionException(e.getMessage(), e);
            }
        }
    }

    private static QueryResult readResult(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> columnNames = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columnNames.add(metaData.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(resultSet.getObject(i));
            }
            rows.add(row);
        }

        return new QueryResult(columnNames, rows);
    }

    @Override
    public void close() throws QueryExecutionException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to close connection: " + e.getMessage(), e);
        }
    }
}
