package edictjava;

import java.util.Objects;

/**
 * One dictionary record: the full source line and the classes derived from its glosses.
 */
public final class DictionaryEntry {
    private final String line;
    private final int typeMask;

    public DictionaryEntry(String line, int typeMask) {
        this.line = Objects.requireNonNull(line, "line");
        this.typeMask = typeMask;
    }

    /**
     * @return the complete record as found in the dictionary file
     */
    public String getLine() {
        return line;
    }

    public int getTypeMask() {
        return typeMask;
    }

    public boolean hasClass(WordClass wordClass) {
        return (typeMask & wordClass.mask()) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictionaryEntry)) return false;
        DictionaryEntry that = (DictionaryEntry) o;
        return typeMask == that.typeMask && line.equals(that.line);
    }

    @Override
    public int hashCode() {
        return 31 * line.hashCode() + typeMask;
    }

    @Override
    public String toString() {
        return line;
    }
}
