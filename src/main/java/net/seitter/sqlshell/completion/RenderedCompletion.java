package net.seitter.sqlshell.completion;

import org.jline.utils.AttributedString;

/**
 * A completion candidate ready to be shown by a line editor.
 */
public final class RenderedCompletion {
    private final String label;
    private final int insertionOffset;
    private final AttributedString display;
    private final String meta;
    private final SuggestionKind kind;

    /**
     * Creates a new rendered completion.
     *
     * @param label The text to insert
     * @param insertionOffset Non-positive offset relative to the cursor where the replacement starts
     * @param display The highlighted label
     * @param meta The description shown next to the label
     * @param kind The kind of the underlying suggestion
     */
    public RenderedCompletion(String label, int insertionOffset, AttributedString display,
                              String meta, SuggestionKind kind) {
        this.label = label;
        this.insertionOffset = insertionOffset;
        this.display = display;
        this.meta = meta;
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Gets the offset relative to the cursor at which the label replaces the typed text.
     * The caller removes {@code -insertionOffset} characters before the cursor.
     *
     * @return The insertion offset, zero or negative
     */
    public int getInsertionOffset() {
        return insertionOffset;
    }

    public AttributedString getDisplay() {
        return display;
    }

    public String getMeta() {
        return meta;
    }

    public SuggestionKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return label + " [" + meta + "] @" + insertionOffset;
    }
}
