package edictjava;

import java.util.List;

/**
 * Builds the sub-dictionary of a text: the dictionary lines that may explain some
 * word of the text.
 */
public interface Annotator {

    /**
     * Returns the distinct dictionary lines matching words of {@code text}, sorted
     * lexicographically.
     *
     * @param text any text; non-Japanese characters are ignored
     * @return sorted list without duplicates
     */
    List<String> annotate(String text);

    /**
     * Serializes a sub-dictionary as stored alongside a story: one line per entry,
     * each terminated by a newline.
     *
     * @param lines lines returned by {@link #annotate(String)}
     * @return the sub-dictionary text; empty when {@code lines} is empty
     */
    static String export(List<String> lines) {
        if (lines.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(lines.size() * 64);
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
