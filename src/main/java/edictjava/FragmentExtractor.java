package edictjava;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates candidate words of a text: every substring of every maximal run of
 * Japanese characters.
 *
 * <p>Japanese characters are the ideographic iteration mark 々, hiragana and katakana,
 * CJK unified ideographs (with extension A), CJK compatibility ideographs and
 * halfwidth katakana. For the run {@code 食べた} the fragments are, in order,
 * {@code 食}, {@code 食べ}, {@code 食べた}, {@code べ}, {@code べた}, {@code た}.</p>
 *
 * <p>The enumeration over-generates on purpose; deinflection and dictionary lookup
 * filter the fragments.</p>
 */
public final class FragmentExtractor {

    private FragmentExtractor() {
    }

    /**
     * Returns whether {@code ch} belongs to the Japanese script ranges.
     *
     * @param ch UTF-16 code unit
     * @return {@code true} for kana, kanji and the iteration mark
     */
    public static boolean isJapanese(char ch) {
        return ch == 0x3005                        // ideographic iteration mark
                || (ch >= 0x3040 && ch <= 0x30FF)  // hiragana, katakana
                || (ch >= 0x3400 && ch <= 0x4DBF)  // CJK unified ideographs extension A
                || (ch >= 0x4E00 && ch <= 0x9FFF)  // CJK unified ideographs
                || (ch >= 0xF900 && ch <= 0xFAFF)  // CJK compatibility ideographs
                || (ch >= 0xFF66 && ch <= 0xFF9F); // halfwidth katakana
    }

    /**
     * Splits a text into its maximal runs of Japanese characters.
     *
     * @param text any text
     * @return list of [start, end) ranges, in text order
     */
    public static List<int[]> runs(CharSequence text) {
        List<int[]> result = new ArrayList<>();
        final int length = text.length();
        int start = -1;
        for (int i = 0; i < length; i++) {
            if (isJapanese(text.charAt(i))) {
                if (start < 0) start = i;
            } else if (start >= 0) {
                result.add(new int[]{start, i});
                start = -1;
            }
        }
        if (start >= 0) {
            result.add(new int[]{start, length});
        }
        return result;
    }

    /**
     * Returns all fragments of {@code text}. The returned iterable can be iterated any
     * number of times and always yields the same sequence.
     *
     * @param text any text
     * @return restartable sequence of fragments
     */
    public static Iterable<String> fragments(CharSequence text) {
        Objects.requireNonNull(text, "text");
        return () -> new FragmentIterator(text, runs(text));
    }

    /**
     * Stream form of {@link #fragments(CharSequence)}.
     *
     * @param text any text
     * @return sequential stream of fragments
     */
    public static Stream<String> stream(CharSequence text) {
        return StreamSupport.stream(fragments(text).spliterator(), false);
    }

    /**
     * Collects the distinct fragments of {@code text}, in first-seen order.
     *
     * @param text any text
     * @return set of fragments
     */
    public static Set<String> distinctFragments(CharSequence text) {
        Set<String> out = new LinkedHashSet<>();
        for (String fragment : fragments(text)) {
            out.add(fragment);
        }
        return out;
    }

    private static final class FragmentIterator implements Iterator<String> {
        private final CharSequence text;
        private final List<int[]> runs;
        private int run;
        private int start;
        private int end;

        FragmentIterator(CharSequence text, List<int[]> runs) {
            this.text = text;
            this.runs = runs;
            this.run = 0;
            if (!runs.isEmpty()) {
                this.start = runs.get(0)[0];
                this.end = start + 1;
            }
        }

        @Override
        public boolean hasNext() {
            return run < runs.size();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String fragment = text.subSequence(start, end).toString();
            advance();
            return fragment;
        }

        private void advance() {
            int runEnd = runs.get(run)[1];
            if (end < runEnd) {
                end++;
            } else if (start + 1 < runEnd) {
                start++;
                end = start + 1;
            } else {
                run++;
                if (run < runs.size()) {
                    start = runs.get(run)[0];
                    end = start + 1;
                }
            }
        }
    }
}
