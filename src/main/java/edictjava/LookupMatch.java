package edictjava;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One dictionary entry reached from a looked-up word, with the deinflection path
 * that led to it.
 */
@JsonPropertyOrder({"query", "word", "reasons", "classes", "line"})
public final class LookupMatch {
    private final String query;
    private final Candidate candidate;
    private final DictionaryEntry entry;

    LookupMatch(String query, Candidate candidate, DictionaryEntry entry) {
        this.query = query;
        this.candidate = candidate;
        this.entry = entry;
    }

    /**
     * @return the word as it was asked for
     */
    @JsonProperty("query")
    public String getQuery() {
        return query;
    }

    /**
     * @return the dictionary form the entry was found under
     */
    @JsonProperty("word")
    public String getWord() {
        return candidate.getWord();
    }

    /**
     * @return inflections removed from the query, outermost first
     */
    @JsonProperty("reasons")
    public List<String> getReasons() {
        return candidate.getReasons();
    }

    @JsonProperty("classes")
    public String getClasses() {
        return WordClass.describe(entry.getTypeMask());
    }

    @JsonProperty("line")
    public String getLine() {
        return entry.getLine();
    }

    @JsonIgnore
    public Candidate getCandidate() {
        return candidate;
    }

    @JsonIgnore
    public DictionaryEntry getEntry() {
        return entry;
    }

    @Override
    public String toString() {
        if (candidate.isSeed()) {
            return entry.getLine();
        }
        return getWord() + " < " + String.join(" < ", getReasons()) + "\n    " + entry.getLine();
    }
}
