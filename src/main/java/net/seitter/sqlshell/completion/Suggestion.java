package net.seitter.sqlshell.completion;

import java.util.Objects;
import java.util.Optional;

/**
 * A single completion suggestion: a label tagged with its kind.
 */
public final class Suggestion {
    private final String label;
    private final SuggestionKind kind;
    private final String detail;

    /**
     * Creates a new suggestion.
     *
     * @param label The text that will be inserted
     * @param kind The kind of the suggestion
     * @param detail Additional display information, or null if there is none
     */
    public Suggestion(String label, SuggestionKind kind, String detail) {
        this.label = Objects.requireNonNull(label, "label");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
    }

    /**
     * Creates a new suggestion without detail.
     *
     * @param label The text that will be inserted
     * @param kind The kind of the suggestion
     */
    public Suggestion(String label, SuggestionKind kind) {
        this(label, kind, null);
    }

    /**
     * Creates a column suggestion with its declared type and owning table as detail.
     *
     * @param column The column name
     * @param declaredType The declared type of the column
     * @param table The table the column belongs to
     * @return The column suggestion
     */
    public static Suggestion column(String column, String declaredType, String table) {
        return new Suggestion(column, SuggestionKind.COLUMN,
                String.format("COLUMN (%s, %s)", declaredType, table));
    }

    public String getLabel() {
        return label;
    }

    public SuggestionKind getKind() {
        return kind;
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    /**
     * Gets the text shown next to the label: the detail if present, the kind name otherwise.
     *
     * @return The display meta text
     */
    public String getDisplayMeta() {
        return detail != null ? detail : kind.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Suggestion)) {
            return false;
        }
        Suggestion other = (Suggestion) o;
        return label.equals(other.label) && kind == other.kind && Objects.equals(detail, other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, kind, detail);
    }

    @Override
    public String toString() {
        return "Suggestion{label='" + label + "', kind=" + kind + ", meta='" + getDisplayMeta() + "'}";
    }
}
