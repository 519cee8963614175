package net.seitter.sqlshell.shell;

import net.seitter.sqlshell.completion.CompletionEngine;
import net.seitter.sqlshell.completion.RenderedCompletion;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

import java.util.List;
import java.util.Objects;

/**
 * Adapts the completion engine to JLine.
 */
public class SqlCompleter implements Completer {
    private final CompletionEngine engine;

    public SqlCompleter(CompletionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
        String word = line.word();
        int wordCursor = line.wordCursor();

        engine.complete(line.line(), line.cursor())
                .forEach(completion -> candidates.add(toCandidate(completion, word, wordCursor)));
    }

    private static Candidate toCandidate(RenderedCompletion completion, String word, int wordCursor) {
        // JLine replaces the whole parsed word, so keep whatever precedes the completed part
        int keep = Math.max(0, Math.min(wordCursor + completion.getInsertionOffset(), word.length()));
        String value = word.substring(0, keep) + completion.getLabel();

        return new Candidate(value, completion.getDisplay().toAnsi(), completion.getKind().name(),
                completion.getMeta(), null, null, true);
    }
}
