package net.seitter.sqlshell.shell;

import java.util.Locale;

/**
 * How query results are printed.
 */
public enum OutputFormat {
    TABLE,
    JSON;

    /**
     * Parses a format name, ignoring case.
     *
     * @param name The format name
     * @return The output format
     * @throws IllegalArgumentException If the name is not a known format
     */
    public static OutputFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + name, e);
        }
    }
}
