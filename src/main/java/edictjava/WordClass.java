package edictjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Grammatical classes tracked by deinflection rules and dictionary entries.
 *
 * <p>Each constant owns one bit of an 8-bit class mask. {@link #WORD} (bit 7) is
 * always set on a dictionary entry so that the seed mask {@code 0xFF} of a
 * deinflection matches any entry.</p>
 */
public enum WordClass {

    /**
     * 一段 verb, gloss tag {@code v1}.
     */
    ICHIDAN(0),

    /**
     * 五段 verb, gloss tags starting with {@code v5}.
     */
    GODAN(1),

    /**
     * い-adjective, gloss tag {@code adj-i}.
     */
    I_ADJECTIVE(2),

    /**
     * くる verb, gloss tag {@code vk}.
     */
    KURU(3),

    /**
     * す or する verb, gloss tag {@code vs} or tags starting with {@code vs-}.
     */
    SURU(4),

    /**
     * Generic word marker.
     */
    WORD(7);

    /**
     * Mask given to the seed word of a deinflection: compatible with everything.
     */
    public static final int ANY = 0xFF;

    private final int bit;

    WordClass(int bit) {
        this.bit = bit;
    }

    public int mask() {
        return 1 << bit;
    }

    /**
     * Maps a single gloss tag (e.g. {@code "v5k"}) to its class.
     *
     * @param tag a tag from the leading parenthesis of an EDICT gloss section
     * @return the class, or {@code null} when the tag carries no class information
     */
    public static WordClass fromTag(String tag) {
        if (tag.equals("v1")) {
            return ICHIDAN;
        } else if (tag.startsWith("v5")) {
            return GODAN;
        } else if (tag.equals("adj-i")) {
            return I_ADJECTIVE;
        } else if (tag.equals("vk")) {
            return KURU;
        } else if (tag.equals("vs") || tag.startsWith("vs-")) {
            return SURU;
        }
        return null;
    }

    /**
     * Lists the classes present in a mask, in bit order.
     *
     * @param mask class mask
     * @return unmodifiable list of classes whose bit is set
     */
    public static List<WordClass> fromMask(int mask) {
        List<WordClass> out = new ArrayList<>(values().length);
        for (WordClass c : values()) {
            if ((mask & c.mask()) != 0) {
                out.add(c);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Renders a mask for diagnostics, e.g. {@code "ichidan|word"}.
     *
     * @param mask class mask
     * @return pipe-separated lowercase class names, or {@code "-"} for an empty mask
     */
    public static String describe(int mask) {
        List<WordClass> classes = fromMask(mask);
        if (classes.isEmpty()) return "-";
        StringBuilder sb = new StringBuilder();
        for (WordClass c : classes) {
            if (sb.length() > 0) sb.append('|');
            sb.append(c.name().toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
