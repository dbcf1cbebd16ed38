package edictjava;

import java.util.*;

/**
 * Dictionary lookup of a single word, reporting how each entry was reached.
 *
 * <p>Unlike {@link EdictAnnotator} this keeps the deinflection path, so that a
 * lookup tool can explain that 食べた was found as 食べる through "past".</p>
 */
public final class WordLookup {
    private static final Comparator<LookupMatch> ORDER =
            Comparator.<LookupMatch>comparingInt(m -> m.getReasons().size())
                    .thenComparing(LookupMatch::getLine)
                    .thenComparing(m -> String.join("<", m.getReasons()));

    private final Deinflector deinflector;
    private final DictionaryIndex dictionary;

    public WordLookup(Deinflector deinflector, DictionaryIndex dictionary) {
        this.deinflector = Objects.requireNonNull(deinflector, "deinflector");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * Finds every class-compatible entry reachable from {@code word}.
     * An entry reached by several paths is reported once, with its shortest path.
     *
     * @param word word as found in text
     * @return matches, shortest deinflection path first
     */
    public List<LookupMatch> lookup(String word) {
        List<LookupMatch> matches = new ArrayList<>();
        Iterator<Candidate> it = deinflector.deinflect(word);
        while (it.hasNext()) {
            Candidate candidate = it.next();
            Optional<List<DictionaryEntry>> entries = dictionary.lookup(candidate.getWord());
            if (entries.isEmpty()) continue;
            for (DictionaryEntry entry : entries.get()) {
                if (candidate.accepts(entry)) {
                    matches.add(new LookupMatch(word, candidate, entry));
                }
            }
        }
        matches.sort(ORDER);

        Set<String> seen = new HashSet<>();
        List<LookupMatch> out = new ArrayList<>(matches.size());
        for (LookupMatch m : matches) {
            if (seen.add(m.getLine())) {
                out.add(m);
            }
        }
        return out;
    }
}
