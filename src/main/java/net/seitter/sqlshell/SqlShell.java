package net.seitter.sqlshell;

import net.seitter.sqlshell.completion.CompletionEngine;
import net.seitter.sqlshell.completion.SuggestionCatalog;
import net.seitter.sqlshell.shell.ResultFormatter;
import net.seitter.sqlshell.shell.ShellConfig;
import net.seitter.sqlshell.shell.SqlCompleter;
import net.seitter.sqlshell.shell.SqlLineParser;
import net.seitter.sqlshell.sql.JdbcQueryExecutor;
import net.seitter.sqlshell.sql.QueryExecutionException;
import net.seitter.sqlshell.sql.QueryExecutor;
import net.seitter.sqlshell.sql.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

// JLine imports
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

/**
 * Main class for SqlShell - an interactive SQL client with autocompletion.
 */
public class SqlShell {
    private static final Logger logger = LoggerFactory.getLogger(SqlShell.class);

    private final ShellConfig config;
    private final QueryExecutor executor;
    private final CompletionEngine completionEngine;
    private final ResultFormatter formatter;

    public SqlShell(ShellConfig config, QueryExecutor executor) {
        this.config = config;
        this.executor = executor;
        // Starts loading table and column names in the background
        this.completionEngine = new CompletionEngine(executor, SuggestionCatalog.getDefault(),
                config.getSchemaQuery());
        this.formatter = new ResultFormatter(config.getOutputFormat());
    }

    public void start() {
        logger.info("Starting SqlShell...");

        try (Terminal terminal = TerminalBuilder.builder()
                .name("SqlShell Terminal")
                .system(true)
                .build()) {

            History history = new DefaultHistory();

            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(history)
                    .variable(LineReader.HISTORY_FILE, config.getHistoryFile())
                    .parser(new SqlLineParser())
                    .completer(new SqlCompleter(completionEngine))
                    .option(LineReader.Option.CASE_INSENSITIVE, true)
                    .option(LineReader.Option.AUTO_MENU, true)
                    .option(LineReader.Option.AUTO_LIST, true)
                    .build();

            PrintWriter out = terminal.writer();
            out.println("SqlShell");
            out.println("Type SQL statements terminated by ';', 'help' for assistance, or 'exit' to quit");
            out.println("Use TAB for autocompletion");
            out.flush();

            runLoop(lineReader, out);

            try {
                history.save();
            } catch (IOException e) {
                logger.warn("Failed to save command history: {}", e.getMessage());
            }
        } catch (IOException e) {
            logger.error("Error in SQL shell", e);
        }

        logger.info("SqlShell stopped");
    }

    private void runLoop(LineReader lineReader, PrintWriter out) {
        StringBuilder statement = new StringBuilder();

        while (true) {
            String prompt = statement.length() == 0 ? "sql> " : "  -> ";
            String line;
            try {
                line = lineReader.readLine(prompt).trim();
            } catch (UserInterruptException e) {
                // Ctrl-C
                statement.setLength(0);
                out.println("Statement cancelled.");
                out.flush();
                continue;
            } catch (EndOfFileException e) {
                // Ctrl-D
                return;
            }

            if (statement.length() == 0) {
                String command = shellCommand(line);
                if (command.equals("exit") || command.equals("quit")) {
                    return;
                }
                if (command.equals("help")) {
                    displayHelp(out);
                    continue;
                }
                if (line.isEmpty()) {
                    continue;
                }
            }

            statement.append(line);
            if (!line.endsWith(";")) {
                statement.append('\n');
                continue;
            }

            out.println(execute(statement.toString()));
            out.flush();
            statement.setLength(0);
        }
    }

    /**
     * Normalizes a line for comparison with the shell's own commands, so that
     * "EXIT;" and "help ;" are recognized as well.
     */
    static String shellCommand(String line) {
        String command = line.trim();
        if (command.endsWith(";")) {
            command = command.substring(0, command.length() - 1).trim();
        }
        return command.toLowerCase(Locale.ROOT);
    }

    /**
     * Executes a statement and formats its result or error for display.
     *
     * @param statement The statement text, possibly ending with a semicolon
     * @return The text to print
     */
    String execute(String statement) {
        String sql = statement.trim();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        try {
            QueryResult result = executor.execute(sql);
            return formatter.format(result);
        } catch (QueryExecutionException e) {
            logger.error("Query execution error", e);
            return "Error: " + e.getMessage();
        }
    }

    private void displayHelp(PrintWriter out) {
        out.println("\n=== SqlShell Help ===");
        out.println("help                           Display this help message");
        out.println("exit, quit                     Exit the shell (or press Ctrl-D)");
        out.println();
        out.println("Statements may span several lines and are executed when a line ends with ';'.");
        out.println("Ctrl-C discards the statement being typed.");
        out.println("TAB completes keywords, functions, table names and the columns of tables");
        out.println("mentioned in the statement.");
        out.println();
        out.println("Output format: " + config.getOutputFormat().name().toLowerCase()
                + " (set " + ShellConfig.OUTPUT_FORMAT + "=table|json)");
        out.println("History file:  " + config.getHistoryFile());
        out.println("=====================\n");
        out.flush();
    }

    CompletionEngine getCompletionEngine() {
        return completionEngine;
    }

    public static void main(String[] args) {
        if (args.length > 0) {
            System.setProperty(ShellConfig.JDBC_URL, args[0]);
        }

        ShellConfig config = ShellConfig.load();
        if (!config.hasConnection()) {
            System.err.println("Usage: sqlshell <jdbc-url>  (or set " + ShellConfig.JDBC_URL + ")");
            System.exit(1);
        }

        try (JdbcQueryExecutor executor = JdbcQueryExecutor.connect(config.getJdbcUrl(),
                config.getJdbcUser(), config.getJdbcPassword())) {
            new SqlShell(config, executor).start();
        } catch (QueryExecutionException e) {
            logger.error("Failed to start SqlShell", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
