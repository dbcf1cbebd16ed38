package edictjava;

import java.util.*;

/**
 * Sub-dictionary builder for the proper-name dictionary (ENAMDICT).
 * Names do not inflect, so fragments are looked up as they are.
 */
public final class NameAnnotator implements Annotator {
    private final DictionaryIndex names;

    public NameAnnotator(DictionaryIndex names) {
        this.names = Objects.requireNonNull(names, "names");
    }

    @Override
    public List<String> annotate(String text) {
        Set<String> lines = new HashSet<>();
        for (String fragment : FragmentExtractor.distinctFragments(text)) {
            names.lookup(fragment).ifPresent(entries -> {
                for (DictionaryEntry entry : entries) {
                    lines.add(entry.getLine());
                }
            });
        }
        List<String> sorted = new ArrayList<>(lines);
        Collections.sort(sorted);
        return sorted;
    }
}
