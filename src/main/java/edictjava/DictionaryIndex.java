package edictjava;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * EDICT-style dictionary indexed by headword and by reading.
 *
 * <p>After a header line, each line is one record:</p>
 * <pre>
 * 日本 [にほん(P);にっぽん] /(n) Japan/(P)/EntL1582710X/
 * あやかし /(n) (1) ghost that appears at sea during a shipwreck/.../EntL2143630X/
 * </pre>
 *
 * <p>A record is registered under each of its semicolon-separated headwords and
 * readings, cut at the first {@code (} so that markers such as {@code (P)} do not
 * take part in the key. Its class mask comes from the tags in the leading
 * parenthesis of the gloss section (see {@link WordClass}).</p>
 *
 * <p>The same format serves ENAMDICT, the proper-name dictionary.</p>
 */
public final class DictionaryIndex {
    private static final Logger LOGGER = Logger.getLogger(DictionaryIndex.class.getName());

    private final Map<String, List<DictionaryEntry>> entries;
    private final int entryCount;

    private DictionaryIndex(Map<String, List<DictionaryEntry>> entries, int entryCount) {
        this.entries = entries;
        this.entryCount = entryCount;
    }

    /**
     * Parses the content of a dictionary file.
     *
     * @param data full text of the dictionary file
     * @return the built index
     * @throws EdictParseException if a record lacks {@code " /"}, {@code ")"} after a
     *                             leading tag list, or {@code "] /"} after a reading list
     */
    public static DictionaryIndex parse(String data) throws EdictParseException {
        return parse(data.lines().iterator());
    }

    /**
     * Reads and parses a dictionary file.
     *
     * @param file    path of the dictionary file
     * @param charset encoding of the file
     * @return the built index
     * @throws IOException         if the file cannot be read
     * @throws EdictParseException if a record is malformed
     */
    public static DictionaryIndex load(Path file, Charset charset) throws IOException, EdictParseException {
        try (BufferedReader br = Files.newBufferedReader(file, charset)) {
            return parse(br.lines().iterator());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static DictionaryIndex parse(Iterator<String> lines) throws EdictParseException {
        Map<String, List<DictionaryEntry>> entries = new HashMap<>();
        int entryCount = 0;

        // header
        if (lines.hasNext()) lines.next();

        int lineNo = 1;
        while (lines.hasNext()) {
            String line = lines.next();
            lineNo++;
            int glossStart = line.indexOf(" /");
            if (glossStart < 0) {
                throw EdictParseException.format(lineNo, " /", line);
            }

            String glosses = line.substring(glossStart + 2);
            int typeMask;
            if (glosses.startsWith("(")) {
                int close = glosses.indexOf(')');
                if (close < 0) {
                    throw EdictParseException.format(lineNo, ")", line);
                }
                typeMask = typeFromGlosses(glosses.substring(1, close));
            } else {
                typeMask = WordClass.WORD.mask();
            }

            DictionaryEntry entry = new DictionaryEntry(line, typeMask);
            int bracket = line.indexOf(" [");
            if (bracket >= 0) {
                // 日本 [にほん(P);にっぽん] /(n) Japan/(P)/EntL1582710X/
                int close = line.indexOf("] /", bracket + 2);
                if (close < 0) {
                    throw EdictParseException.format(lineNo, "] /", line);
                }
                insertAtKeys(entries, line.substring(0, bracket), entry);
                insertAtKeys(entries, line.substring(bracket + 2, close), entry);
            } else {
                // あやかし /(n) (1) ghost that appears at sea during a shipwreck/.../EntL2143630X/
                int space = line.indexOf(' ');
                insertAtKeys(entries, line.substring(0, space), entry);
            }
            entryCount++;
        }

        Map<String, List<DictionaryEntry>> frozen = new HashMap<>(entries.size() * 2);
        for (Map.Entry<String, List<DictionaryEntry>> e : entries.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }

        final int count = entryCount;
        LOGGER.fine(() -> "Parsed " + count + " records under " + frozen.size() + " keys");
        return new DictionaryIndex(Collections.unmodifiableMap(frozen), entryCount);
    }

    private static void insertAtKeys(Map<String, List<DictionaryEntry>> entries, String keys,
                                     DictionaryEntry entry) {
        for (String key : keys.split(";", -1)) {
            // あの人(P);彼の人 → あの人, 彼の人
            int marker = key.indexOf('(');
            if (marker >= 0) {
                key = key.substring(0, marker);
            }
            entries.computeIfAbsent(key, k -> new ArrayList<>(1)).add(entry);
        }
    }

    /**
     * Derives a class mask from the comma-separated tags of a gloss section,
     * e.g. {@code "v5k,vt"}. Bit 7 is always set.
     *
     * @param glosses tag list without the surrounding parentheses
     * @return class mask
     */
    public static int typeFromGlosses(String glosses) {
        int type = WordClass.WORD.mask();
        for (String tag : glosses.split(",", -1)) {
            WordClass c = WordClass.fromTag(tag);
            if (c != null) {
                type |= c.mask();
            }
        }
        return type;
    }

    /**
     * Returns the records registered under {@code key}.
     *
     * @param key headword or reading
     * @return the records, or empty if the key is unknown
     */
    public Optional<List<DictionaryEntry>> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int keyCount() {
        return entries.size();
    }

    /**
     * @return number of records parsed (each counted once, however many keys it has)
     */
    public int entryCount() {
        return entryCount;
    }

    @Override
    public String toString() {
        return "<DictionaryIndex with " + entryCount + " records under " + entries.size() + " keys>";
    }
}
