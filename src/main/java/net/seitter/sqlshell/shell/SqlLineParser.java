package net.seitter.sqlshell.shell;

import net.seitter.sqlshell.completion.WordExtractor;
import org.jline.reader.impl.DefaultParser;

/**
 * Line parser that splits words on the same characters as the completion engine,
 * so the word JLine replaces is the word the engine completed.
 */
public class SqlLineParser extends DefaultParser {

    public SqlLineParser() {
        // Backslashes are literal in SQL text
        escapeChars(new char[0]);
    }

    @Override
    public boolean isDelimiterChar(CharSequence buffer, int pos) {
        return WordExtractor.isDelimiter(buffer.charAt(pos));
    }
}
