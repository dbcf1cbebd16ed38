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
 * Deinflection rules indexed by the suffix they remove.
 *
 * <p>Rule file format ({@code deinflect.dat}):</p>
 * <ul>
 *   <li>line 1 is a header and is ignored;</li>
 *   <li>a line without TAB is an entry of the reason table, indexed from 0 in
 *       file order;</li>
 *   <li>every other line holds four TAB-separated fields:
 *       {@code from}, {@code to}, {@code type} and {@code reason index},
 *       the last two as decimal integers.</li>
 * </ul>
 *
 * <p>Instances are immutable once built and can be shared between threads.</p>
 */
public final class RuleIndex {
    private static final Logger LOGGER = Logger.getLogger(RuleIndex.class.getName());

    private final Map<String, List<InflectionRule>> bySuffix;
    private final List<String> reasons;
    private final int ruleCount;
    private final int maxSuffixLength;
    private final int minSuffixLength;

    private RuleIndex(Map<String, List<InflectionRule>> bySuffix, List<String> reasons,
                      int ruleCount, int maxSuffixLength, int minSuffixLength) {
        this.bySuffix = bySuffix;
        this.reasons = reasons;
        this.ruleCount = ruleCount;
        this.maxSuffixLength = maxSuffixLength;
        this.minSuffixLength = minSuffixLength;
    }

    /**
     * Parses the content of a rule file.
     *
     * @param data full text of the rule file
     * @return the built index
     * @throws EdictParseException if a line has an unexpected number of fields, a numeric
     *                             field is not an unsigned decimal integer, or a reason index is out of range
     */
    public static RuleIndex parse(String data) throws EdictParseException {
        return parse(data.lines().iterator());
    }

    /**
     * Reads and parses a rule file.
     *
     * @param file    path of the rule file
     * @param charset encoding of the file
     * @return the built index
     * @throws IOException         if the file cannot be read
     * @throws EdictParseException if the content is malformed
     */
    public static RuleIndex load(Path file, Charset charset) throws IOException, EdictParseException {
        try (BufferedReader br = Files.newBufferedReader(file, charset)) {
            return parse(br.lines().iterator());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static RuleIndex parse(Iterator<String> lines) throws EdictParseException {
        Map<String, List<InflectionRule>> bySuffix = new HashMap<>();
        List<String> reasons = new ArrayList<>();
        int ruleCount = 0;
        int maxLength = 0;
        int minLength = Integer.MAX_VALUE;

        // header
        if (lines.hasNext()) lines.next();

        int lineNo = 1;
        while (lines.hasNext()) {
            String line = lines.next();
            lineNo++;

            String[] fields = line.split("\t", -1);
            if (fields.length == 1) {
                reasons.add(line);
                continue;
            }
            if (fields.length != 4) {
                throw EdictParseException.format(lineNo, "4 TAB-separated fields", line);
            }

            String from = fields[0];
            if (from.isEmpty()) {
                throw EdictParseException.format(lineNo, "non-empty suffix", line);
            }
            int type = parseUnsigned(fields[2], lineNo);
            int reasonIndex = parseUnsigned(fields[3], lineNo);
            if (reasonIndex < 0 || reasonIndex >= reasons.size()) {
                throw EdictParseException.format(lineNo,
                        "reason index below " + reasons.size(), line);
            }

            InflectionRule rule = new InflectionRule(from, fields[1], type, reasons.get(reasonIndex));
            bySuffix.computeIfAbsent(from, k -> new ArrayList<>(2)).add(rule);
            ruleCount++;

            int len = from.length();
            if (len > maxLength) maxLength = len;
            if (len < minLength) minLength = len;
        }

        if (ruleCount == 0) {
            maxLength = 0;
            minLength = 0;
        }

        Map<String, List<InflectionRule>> frozen = new HashMap<>(bySuffix.size() * 2);
        for (Map.Entry<String, List<InflectionRule>> e : bySuffix.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }

        LOGGER.fine(() -> "Parsed " + frozen.size() + " suffixes from rule data");
        return new RuleIndex(Collections.unmodifiableMap(frozen),
                Collections.unmodifiableList(reasons), ruleCount, maxLength, minLength);
    }

    // unsigned 32-bit; values above Integer.MAX_VALUE come back negative
    private static int parseUnsigned(String field, int lineNo) throws EdictParseException {
        try {
            return Integer.parseUnsignedInt(field);
        } catch (NumberFormatException e) {
            throw EdictParseException.integer(lineNo, field, e);
        }
    }

    /**
     * Returns the rules whose {@code suffixFrom} is exactly {@code suffix}, in file order.
     *
     * @param suffix candidate suffix of a word
     * @return the matching rules, or an empty list
     */
    public List<InflectionRule> rulesForSuffix(String suffix) {
        List<InflectionRule> rules = bySuffix.get(suffix);
        return rules != null ? rules : Collections.emptyList();
    }

    /**
     * @return the length (UTF-16 units) of the longest rule suffix, 0 when empty
     */
    public int maxSuffixLength() {
        return maxSuffixLength;
    }

    /**
     * @return the length (UTF-16 units) of the shortest rule suffix, 0 when empty
     */
    public int minSuffixLength() {
        return minSuffixLength;
    }

    public int ruleCount() {
        return ruleCount;
    }

    public int suffixCount() {
        return bySuffix.size();
    }

    /**
     * @return the reason table in file order
     */
    public List<String> reasons() {
        return reasons;
    }

    @Override
    public String toString() {
        return "<RuleIndex with " + ruleCount + " rules over " + bySuffix.size() + " suffixes>";
    }
}
