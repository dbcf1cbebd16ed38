package htmlhelper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;

import java.util.Set;

/**
 * Plain text of story HTML, ready for annotation.
 *
 * <p>News stories carry furigana as {@code <ruby>地区<rt>ちく</rt></ruby>}. The reading
 * inside {@code <rt>} would be glued to the neighbouring kana and produce fragments
 * that never occur in the story, so reading subtrees are skipped and only the base
 * text is kept.</p>
 */
public final class StoryText {

    // ruby readings and non-content elements
    private static final Set<String> SKIPPED = Set.of(
            "rt", "rp", "rtc", "script", "style", "head", "svg", "math", "noscript");

    private static final Set<String> LINE_BREAKING = Set.of(
            "p", "div", "br", "li", "tr", "section", "article", "blockquote",
            "h1", "h2", "h3", "h4", "h5", "h6", "hr");

    private StoryText() {
    }

    /**
     * Extracts the readable text of an HTML fragment or document, one line per
     * paragraph, block or {@code <br>}. Blank lines are dropped and every line is
     * trimmed.
     *
     * @param html story HTML; may be {@code null}
     * @return plain text without ruby readings
     */
    public static String toText(String html) {
        if (html == null || html.isEmpty()) return "";

        final StringBuilder raw = new StringBuilder(html.length());
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node instanceof TextNode) {
                    raw.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    String name = ((Element) node).normalName();
                    if (SKIPPED.contains(name)) return FilterResult.SKIP_ENTIRELY;
                    if (LINE_BREAKING.contains(name)) raw.append('\n');
                }
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                if (node instanceof Element && LINE_BREAKING.contains(((Element) node).normalName())) {
                    raw.append('\n');
                }
                return FilterResult.CONTINUE;
            }
        }, Jsoup.parse(html));

        StringBuilder out = new StringBuilder(raw.length());
        for (String line : raw.toString().replace('\u00A0', ' ').split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) continue;
            if (out.length() > 0) out.append('\n');
            out.append(trimmed);
        }
        return out.toString();
    }
}
