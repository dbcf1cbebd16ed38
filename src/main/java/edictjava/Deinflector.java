package edictjava;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Undoes inflections by repeatedly rewriting word suffixes with the rules of a
 * {@link RuleIndex}.
 *
 * <p>Starting from the seed word (mask {@link WordClass#ANY}), every candidate is
 * emitted, then each of its suffixes of length 1 up to the maximum suffix length is
 * looked up. A rule is applied only if the candidate has one of the classes the rule
 * requires; the produced word gets the rule's result classes.</p>
 *
 * <p>Results are not deduplicated. The rule data is assumed to contain no rewrite
 * cycles: a cyclic rule set makes the sequence infinite.</p>
 *
 * <p>Instances are immutable and thread-safe; every call to {@link #deinflect(String)}
 * owns its own work list.</p>
 */
public final class Deinflector {
    /**
     * Longest suffix observed across the standard rule file.
     */
    public static final int DEFAULT_MAX_SUFFIX_LENGTH = 9;

    private final RuleIndex rules;
    private final int maxSuffixLength;

    /**
     * Creates a deinflector scanning suffixes up to {@link #DEFAULT_MAX_SUFFIX_LENGTH}.
     *
     * @param rules rule index
     */
    public Deinflector(RuleIndex rules) {
        this(rules, DEFAULT_MAX_SUFFIX_LENGTH);
    }

    /**
     * @param rules           rule index
     * @param maxSuffixLength longest suffix (in UTF-16 units) to look up; rules with longer
     *                        suffixes are never applied
     */
    public Deinflector(RuleIndex rules, int maxSuffixLength) {
        this.rules = Objects.requireNonNull(rules, "rules");
        if (maxSuffixLength < 1) {
            throw new IllegalArgumentException("maxSuffixLength must be positive: " + maxSuffixLength);
        }
        this.maxSuffixLength = maxSuffixLength;
    }

    public RuleIndex getRules() {
        return rules;
    }

    public int getMaxSuffixLength() {
        return maxSuffixLength;
    }

    /**
     * Returns a lazy iterator over all words reachable from {@code word}.
     * The first element is always the seed itself.
     *
     * <p>The iterator is single-use. Call this method again to restart.</p>
     *
     * @param word word as found in text
     * @return iterator of candidates
     */
    public Iterator<Candidate> deinflect(String word) {
        return new CandidateIterator(Candidate.seed(word));
    }

    /**
     * Stream form of {@link #deinflect(String)}.
     *
     * @param word word as found in text
     * @return sequential stream of candidates
     */
    public Stream<Candidate> candidates(String word) {
        Spliterator<Candidate> spliterator = Spliterators.spliteratorUnknownSize(
                deinflect(word), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Collects every candidate of {@code word} into a list.
     *
     * @param word word as found in text
     * @return all candidates, seed first
     */
    public List<Candidate> deinflectAll(String word) {
        List<Candidate> out = new ArrayList<>();
        deinflect(word).forEachRemaining(out::add);
        return out;
    }

    private final class CandidateIterator implements Iterator<Candidate> {
        private final Deque<Candidate> pending = new ArrayDeque<>();

        CandidateIterator(Candidate seed) {
            pending.push(seed);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Candidate next() {
            Candidate candidate = pending.poll();
            if (candidate == null) {
                throw new NoSuchElementException();
            }
            expand(candidate);
            return candidate;
        }

        private void expand(Candidate candidate) {
            String word = candidate.getWord();
            int wordLen = word.length();
            // no rule has a suffix longer than the index maximum
            int maxLen = Math.min(Math.min(maxSuffixLength, rules.maxSuffixLength()), wordLen);
            for (int len = 1; len <= maxLen; len++) {
                String suffix = word.substring(wordLen - len);
                for (InflectionRule rule : rules.rulesForSuffix(suffix)) {
                    if (!rule.appliesTo(candidate.getTypeMask())) {
                        continue;
                    }
                    pending.push(candidate.apply(rule));
                }
            }
        }
    }

    @Override
    public String toString() {
        return "<Deinflector maxSuffixLength=" + maxSuffixLength + " " + rules + ">";
    }
}
