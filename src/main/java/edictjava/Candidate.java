package edictjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A word reached while deinflecting, with the classes it may belong to.
 *
 * <p>{@code reasons} lists the inflections removed to reach this word, outermost
 * first. It is empty for the seed word. Two candidates are equal when word, mask
 * and reasons are equal.</p>
 */
public final class Candidate {
    private final String word;
    private final int typeMask;
    private final List<String> reasons;

    Candidate(String word, int typeMask, List<String> reasons) {
        this.word = word;
        this.typeMask = typeMask;
        this.reasons = reasons;
    }

    /**
     * Creates the seed candidate of a deinflection.
     *
     * @param word word as it appears in text
     * @return candidate with mask {@link WordClass#ANY} and no reasons
     */
    public static Candidate seed(String word) {
        return new Candidate(Objects.requireNonNull(word, "word"), WordClass.ANY, Collections.emptyList());
    }

    /**
     * Applies a rule to this candidate. The caller checks that the rule matches.
     *
     * @param rule rule whose suffix ends this candidate's word
     * @return the deinflected candidate
     */
    Candidate apply(InflectionRule rule) {
        List<String> chain = new ArrayList<>(reasons.size() + 1);
        chain.addAll(reasons);
        chain.add(rule.getReason());
        return new Candidate(rule.rewrite(word), rule.resultMask(), Collections.unmodifiableList(chain));
    }

    public String getWord() {
        return word;
    }

    public int getTypeMask() {
        return typeMask;
    }

    public List<String> getReasons() {
        return reasons;
    }

    /**
     * @return {@code true} for the seed word (no rule applied)
     */
    public boolean isSeed() {
        return reasons.isEmpty();
    }

    /**
     * Returns whether a dictionary entry is compatible with this candidate.
     *
     * @param entry dictionary entry found under this candidate's word
     * @return {@code true} if the class masks share at least one bit
     */
    public boolean accepts(DictionaryEntry entry) {
        return (entry.getTypeMask() & typeMask) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candidate)) return false;
        Candidate that = (Candidate) o;
        return typeMask == that.typeMask && word.equals(that.word) && reasons.equals(that.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, typeMask, reasons);
    }

    @Override
    public String toString() {
        return reasons.isEmpty()
                ? word + " [" + WordClass.describe(typeMask) + "]"
                : word + " [" + WordClass.describe(typeMask) + "] < " + String.join(" < ", reasons);
    }
}
