package net.seitter.sqlshell.shell;

import net.seitter.sqlshell.schema.SchemaLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for the interactive shell.
 * <p>
 * Values are read from {@code ~/.sqlshell/sqlshell.properties} if it exists and can be
 * overridden with system properties of the same name.
 */
public class ShellConfig {
    private static final Logger logger = LoggerFactory.getLogger(ShellConfig.class);

    public static final String JDBC_URL = "sqlshell.jdbc.url";
    public static final String JDBC_USER = "sqlshell.jdbc.user";
    public static final String JDBC_PASSWORD = "sqlshell.jdbc.password";
    public static final String OUTPUT_FORMAT = "sqlshell.output.format";
    public static final String HISTORY_FILE = "sqlshell.history.file";
    public static final String SCHEMA_QUERY = "sqlshell.schema.query";

    private static final String CONFIG_DIR = ".sqlshell";
    private static final String CONFIG_FILE = "sqlshell.properties";
    private static final String DEFAULT_HISTORY_FILE = ".sqlshell_history";

    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final OutputFormat outputFormat;
    private final Path historyFile;
    private final String schemaQuery;

    /**
     * Creates a new shell configuration.
     *
     * @param jdbcUrl The JDBC URL to connect to, or null if not configured
     * @param jdbcUser The user name, or null
     * @param jdbcPassword The password, or null
     * @param outputFormat The format used to print results
     * @param historyFile The file command history is saved to
     * @param schemaQuery The metadata query used to load table and column names
     */
    public ShellConfig(String jdbcUrl, String jdbcUser, String jdbcPassword, OutputFormat outputFormat,
                       Path historyFile, String schemaQuery) {
        this.jdbcUrl = jdbcUrl;
        this.jdbcUser = jdbcUser;
        this.jdbcPassword = jdbcPassword;
        this.outputFormat = outputFormat;
        this.historyFile = historyFile;
        this.schemaQuery = schemaQuery;
    }

    /**
     * Gets the default configuration, which has no connection configured.
     *
     * @return The default configuration
     */
    public static ShellConfig getDefault() {
        return new ShellConfig(null, null, null, OutputFormat.TABLE,
                Paths.get(System.getProperty("user.home"), DEFAULT_HISTORY_FILE),
                SchemaLoader.DEFAULT_METADATA_QUERY);
    }

    /**
     * Loads the configuration from the user's config file and system properties.
     *
     * @return The loaded configuration
     */
    public static ShellConfig load() {
        return load(Paths.get(System.getProperty("user.home"), CONFIG_DIR, CONFIG_FILE));
    }

    /**
     * Loads the configuration from a properties file, overlaid with system properties.
     *
     * @param configFile The properties file; a missing file is ignored
     * @return The loaded configuration
     */
    public static ShellConfig load(Path configFile) {
        Properties properties = new Properties();

        if (Files.isRegularFile(configFile)) {
            try (InputStream in = Files.newInputStream(configFile)) {
                properties.load(in);
                logger.info("Loaded configuration from {}", configFile);
            } catch (IOException e) {
                logger.warn("Failed to read configuration file {}: {}", configFile, e.getMessage());
            }
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("sqlshell.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }

        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties, using defaults for missing keys.
     *
     * @param properties The configuration properties
     * @return The configuration
     * @throws IllegalArgumentException If the output format is unknown
     */
    public static ShellConfig fromProperties(Properties properties) {
        ShellConfig defaults = getDefault();

        String format = properties.getProperty(OUTPUT_FORMAT);
        String history = properties.getProperty(HISTORY_FILE);

        return new ShellConfig(
                properties.getProperty(JDBC_URL),
                properties.getProperty(JDBC_USER),
                properties.getProperty(JDBC_PASSWORD),
                format != null ? OutputFormat.fromName(format) : defaults.getOutputFormat(),
                history != null ? Paths.get(history) : defaults.getHistoryFile(),
                properties.getProperty(SCHEMA_QUERY, defaults.getSchemaQuery()));
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    public String getSchemaQuery() {
        return schemaQuery;
    }

    public boolean hasConnection() {
        return jdbcUrl != null && !jdbcUrl.isEmpty();
    }
}
