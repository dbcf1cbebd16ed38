package edictjava;

import java.util.*;
import java.util.logging.Logger;

/**
 * Sub-dictionary builder for the word dictionary (EDICT2).
 *
 * <p>Each distinct fragment of the text is deinflected; every candidate word is
 * looked up and an entry is kept when its classes intersect the candidate's.</p>
 */
public final class EdictAnnotator implements Annotator {
    private static final Logger LOGGER = Logger.getLogger(EdictAnnotator.class.getName());

    private final Deinflector deinflector;
    private final DictionaryIndex dictionary;

    public EdictAnnotator(Deinflector deinflector, DictionaryIndex dictionary) {
        this.deinflector = Objects.requireNonNull(deinflector, "deinflector");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    @Override
    public List<String> annotate(String text) {
        Set<String> fragments = FragmentExtractor.distinctFragments(text);

        // word → union of the masks it was reached with
        Map<String, Integer> candidates = new HashMap<>(fragments.size() * 4);
        for (String fragment : fragments) {
            Iterator<Candidate> it = deinflector.deinflect(fragment);
            while (it.hasNext()) {
                Candidate c = it.next();
                candidates.merge(c.getWord(), c.getTypeMask(), (a, b) -> a | b);
            }
        }

        Set<String> lines = new HashSet<>();
        for (Map.Entry<String, Integer> candidate : candidates.entrySet()) {
            int mask = candidate.getValue();
            dictionary.lookup(candidate.getKey()).ifPresent(entries -> {
                for (DictionaryEntry entry : entries) {
                    if ((entry.getTypeMask() & mask) != 0) {
                        lines.add(entry.getLine());
                    }
                }
            });
        }

        List<String> sorted = new ArrayList<>(lines);
        Collections.sort(sorted);
        LOGGER.fine(() -> fragments.size() + " fragments, " + candidates.size()
                + " candidate words, " + sorted.size() + " entries");
        return sorted;
    }
}
