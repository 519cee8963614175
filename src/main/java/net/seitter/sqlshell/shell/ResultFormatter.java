package net.seitter.sqlshell.shell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.seitter.sqlshell.sql.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats query results for the terminal.
 */
public class ResultFormatter {
    private static final Logger logger = LoggerFactory.getLogger(ResultFormatter.class);

    private final OutputFormat format;
    private final ObjectMapper objectMapper;

    public ResultFormatter(OutputFormat format) {
        this.format = format;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Formats a result according to the configured output format.
     *
     * @param result The query result
     * @return The formatted text, without a trailing newline
     */
    public String format(QueryResult result) {
        if (!result.hasColumns()) {
            return "OK";
        }
        switch (format) {
            case JSON:
                return formatJson(result);
            case TABLE:
            default:
                return formatTable(result);
        }
    }

    private String formatTable(QueryResult result) {
        List<String> header = result.getColumnNames();
        int[] widths = new int[header.size()];
        for (int i = 0; i < header.size(); i++) {
            widths[i] = header.get(i).length();
        }

        List<List<String>> cells = new ArrayList<>();
        for (List<Object> row : result.getRows()) {
            List<String> line = new ArrayList<>(row.size());
            for (int i = 0; i < header.size(); i++) {
                String value = i < row.size() ? String.valueOf(row.get(i)) : "";
                widths[i] = Math.max(widths[i], value.length());
                line.add(value);
            }
            cells.add(line);
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, header, widths);
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                sb.append("-+-");
            }
            sb.append("-".repeat(widths[i]));
        }
        sb.append('\n');
        for (List<String> line : cells) {
            appendRow(sb, line, widths);
        }

        int count = cells.size();
        sb.append('(').append(count).append(count == 1 ? " row)" : " rows)");
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> values, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            String value = values.get(i);
            sb.append(value).append(" ".repeat(widths[i] - value.length()));
        }
        sb.append('\n');
    }

    private String formatJson(QueryResult result) {
        List<String> columns = result.getColumnNames();
        StringBuilder sb = new StringBuilder();
        for (List<Object> row : result.getRows()) {
            Map<String, JsonNode> object = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                object.put(columns.get(i), toJson(i < row.size() ? row.get(i) : null));
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            try {
                sb.append(objectMapper.writeValueAsString(object));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize result row", e);
            }
        }
        return sb.toString();
    }

    /**
     * Converts a cell value to JSON. Driver types Jackson has no serializer for
     * are written as their string form.
     */
    private JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            logger.debug("Writing {} as text: {}", value.getClass().getName(), e.getMessage());
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}
