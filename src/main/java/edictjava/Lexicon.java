package edictjava;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The loaded linguistic data: deinflection rules, the word dictionary and, optionally,
 * the name dictionary, with the annotators built over them.
 *
 * <p>A lexicon is immutable and can serve any number of concurrent lookups. To pick up
 * new data files, build another one and swap it in (see {@link LexiconHolder}).</p>
 */
public final class Lexicon {
    /**
     * Parent logger of the library. Logging is disabled by default to keep embedding
     * applications quiet.
     */
    private static final Logger LIBRARY_LOGGER = Logger.getLogger("edictjava");
    private static final Logger LOGGER = Logger.getLogger(Lexicon.class.getName());

    static {
        LIBRARY_LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables library logging (dictionary loading, sizes and timings).
     *
     * @param enabled {@code true} to log at {@code INFO}, {@code false} to disable logging
     */
    public static void setVerboseLogging(boolean enabled) {
        LIBRARY_LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    private final RuleIndex rules;
    private final DictionaryIndex words;
    private final DictionaryIndex names;
    private final Deinflector deinflector;
    private final EdictAnnotator wordAnnotator;
    private final NameAnnotator nameAnnotator;
    private final WordLookup wordLookup;

    /**
     * @param rules           deinflection rules
     * @param words           word dictionary
     * @param names           name dictionary, or {@code null}
     * @param maxSuffixLength longest rule suffix the deinflector examines
     */
    public Lexicon(RuleIndex rules, DictionaryIndex words, DictionaryIndex names, int maxSuffixLength) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.words = Objects.requireNonNull(words, "words");
        this.names = names;
        this.deinflector = new Deinflector(rules, maxSuffixLength);
        this.wordAnnotator = new EdictAnnotator(deinflector, words);
        this.nameAnnotator = names != null ? new NameAnnotator(names) : null;
        this.wordLookup = new WordLookup(deinflector, words);
    }

    /**
     * Loads every data file named by {@code config}. Either all files load or an
     * exception is thrown; no partial lexicon is returned.
     *
     * @param config data locations
     * @return the lexicon
     * @throws IOException         if a file is missing or unreadable
     * @throws EdictParseException if a file is malformed
     */
    public static Lexicon load(EdictConfig config) throws IOException, EdictParseException {
        long t0 = System.nanoTime();

        LOGGER.info("Loading deinflection rules: " + config.getDeinflectFile());
        RuleIndex rules = DictionarySource.loadRules(config);

        LOGGER.info("Loading EDICT2: " + config.getEdictFile());
        DictionaryIndex words = DictionarySource.loadDictionary(config, config.getEdictFile());

        DictionaryIndex names = null;
        if (config.hasNames()) {
            LOGGER.info("Loading ENAMDICT: " + config.getEnamdictFile());
            names = DictionarySource.loadDictionary(config, config.getEnamdictFile());
        }

        Lexicon lexicon = new Lexicon(rules, words, names, config.getMaxSuffixLength());
        long ms = (System.nanoTime() - t0) / 1_000_000;
        LOGGER.info(() -> "Loaded " + lexicon + " in " + ms + " ms");
        return lexicon;
    }

    /**
     * Loads only the rule file named by {@code config}, for tools that deinflect
     * without a dictionary.
     */
    public static RuleIndex loadRules(EdictConfig config) throws IOException, EdictParseException {
        return DictionarySource.loadRules(config);
    }

    /**
     * Sub-dictionary of {@code text} from the word dictionary.
     *
     * @param text any text
     * @return sorted distinct dictionary lines
     */
    public List<String> annotate(String text) {
        return wordAnnotator.annotate(text);
    }

    /**
     * Sub-dictionary of {@code text} from the name dictionary.
     *
     * @param text any text
     * @return sorted distinct dictionary lines, empty when no name dictionary is loaded
     */
    public List<String> annotateNames(String text) {
        return nameAnnotator != null ? nameAnnotator.annotate(text) : List.of();
    }

    /**
     * Entries reachable from a single word, with their deinflection paths.
     *
     * @param word word as found in text
     * @return matches, shortest path first
     */
    public List<LookupMatch> lookup(String word) {
        return wordLookup.lookup(word);
    }

    public RuleIndex getRules() {
        return rules;
    }

    public DictionaryIndex getWords() {
        return words;
    }

    /**
     * @return the name dictionary, or {@code null} when none was loaded
     */
    public DictionaryIndex getNames() {
        return names;
    }

    public boolean hasNames() {
        return names != null;
    }

    public Deinflector getDeinflector() {
        return deinflector;
    }

    @Override
    public String toString() {
        return "<Lexicon rules=" + rules.ruleCount()
                + " words=" + words.entryCount()
                + " names=" + (names != null ? names.entryCount() : 0) + ">";
    }
}
