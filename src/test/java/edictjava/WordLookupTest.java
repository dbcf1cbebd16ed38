package edictjava;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WordLookupTest {

    private static final String KAKU = "書く [かく] /(v5k,vt) (P) to write/EntL1340530X/";
    private static final String KAKU_NOUN = "書 [しょ] /(n) book/EntL9X/";

    private static WordLookup lookup() throws EdictParseException {
        RuleIndex rules = RuleIndex.parse("#header\n"
                + "past\n"
                + "negative\n"
                + "masu stem\n"
                + "いた\tく\t640\t0\n"
                + "なかった\tない\t1152\t0\n"
                + "かない\tく\t516\t1\n"
                + "き\tく\t640\t2\n"
                + "きき\tく\t640\t2\n"
                + "きき\tき\t33152\t2\n");
        DictionaryIndex dict = DictionaryIndex.parse("header\n" + KAKU + "\n" + KAKU_NOUN + "\n");
        return new WordLookup(new Deinflector(rules), dict);
    }

    @Test
    public void reportsReasonsOfTheDeinflection() throws Exception {
        List<LookupMatch> matches = lookup().lookup("書かなかった");

        assertEquals(1, matches.size());
        LookupMatch m = matches.get(0);
        assertEquals("書かなかった", m.getQuery());
        assertEquals("書く", m.getWord());
        assertEquals(List.of("past", "negative"), m.getReasons());
        assertEquals("godan|word", m.getClasses());
        assertEquals(KAKU, m.getLine());
        assertTrue(m.toString().startsWith("書く < past < negative"));
    }

    @Test
    public void exactHeadwordHasNoReasons() throws Exception {
        List<LookupMatch> matches = lookup().lookup("書く");

        assertEquals(1, matches.size());
        assertTrue(matches.get(0).getReasons().isEmpty());
        assertEquals(KAKU, matches.get(0).toString());
    }

    @Test
    public void shortestPathWinsAndLinesAreUnique() throws Exception {
        // 書きき reaches 書く directly (きき) and through 書き (きき, then き)
        List<LookupMatch> matches = lookup().lookup("書きき");

        assertEquals(1, matches.size());
        assertEquals(List.of("masu stem"), matches.get(0).getReasons());
    }

    @Test
    public void unknownWordHasNoMatch() throws Exception {
        assertTrue(lookup().lookup("読んだ").isEmpty());
    }

    @Test
    public void serializesToJson() throws Exception {
        LookupMatch m = lookup().lookup("書いた").get(0);

        JsonNode node = new ObjectMapper().valueToTree(m);

        assertEquals("書いた", node.get("query").asText());
        assertEquals("書く", node.get("word").asText());
        assertEquals("past", node.get("reasons").get(0).asText());
        assertEquals(KAKU, node.get("line").asText());
        assertFalse(node.has("candidate"));
        assertFalse(node.has("entry"));
    }
}
