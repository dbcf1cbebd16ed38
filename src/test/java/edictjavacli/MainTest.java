package edictjavacli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

// dictionaries come from the sample files under src/test/resources/dicts
public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    public void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void annotateWritesSortedLines(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("story.txt");
        Path output = dir.resolve("subdict.txt");
        Files.writeString(input, "日本の本を食べました。", StandardCharsets.UTF_8);

        int code = run("annotate", "-i", input.toString(), "-o", output.toString());

        assertEquals(0, code);
        assertEquals("日本 [にほん(P);にっぽん] /(n) Japan/(P)/EntL1582710X/\n"
                        + "本 [ほん] /(n) (P) book/EntL1522150X/\n"
                        + "食べる [たべる] /(v1,vt) (P) to eat/EntL1358280X/\n",
                Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    public void annotateHtmlAsJsonWithNames(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("story.html");
        Files.writeString(input, "<p><ruby>田中<rt>たなか</rt></ruby>さんは<ruby>本<rt>ほん</rt></ruby>を書かなかった</p>",
                StandardCharsets.UTF_8);

        int code = run("annotate", "-i", input.toString(), "--html", "--names", "--json");

        assertEquals(0, code);
        JsonNode root = new ObjectMapper().readTree(stdout());
        assertEquals(2, root.get("edict").size());
        assertEquals("書く [かく] /(v5k,vt) (P) to write/EntL1340530X/", root.get("edict").get(0).asText());
        assertEquals("田中 [たなか] /(s) Tanaka/", root.get("enamdict").get(0).asText());
    }

    @Test
    public void lookupPrintsDictionaryForm() {
        int code = run("lookup", "書かなかった");

        assertEquals(0, code);
        assertTrue(stdout().contains("書く < past < negative"));
    }

    @Test
    public void lookupAsJson() throws Exception {
        int code = run("lookup", "--json", "食べました", "日本");

        assertEquals(0, code);
        JsonNode root = new ObjectMapper().readTree(stdout());
        assertEquals("食べる", root.get("食べました").get(0).get("word").asText());
        assertEquals(0, root.get("日本").get(0).get("reasons").size());
    }

    @Test
    public void lookupWithoutMatchExitsWithTwo() {
        assertEquals(2, run("lookup", "ラーメン"));
        assertTrue(stdout().contains("(no match)"));
    }

    @Test
    public void deinflectListsCandidates() {
        int code = run("deinflect", "書いた");

        assertEquals(0, code);
        String printed = stdout();
        assertTrue(printed.startsWith("書いた ["));
        assertTrue(printed.contains("書く [godan] < past"));
    }

    @Test
    public void statsReportsCounts() {
        int code = run("stats", "--no-names");

        assertEquals(0, code);
        assertTrue(stdout().contains("8 rules"));
        assertFalse(stdout().contains("ENAMDICT"));
    }

    @Test
    public void nameDictionaryIsOnlyNeededWithNamesOption(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("deinflect.dat"), "#h\npast\nた\tる\t384\t0\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("edict2"), "h\n見る [みる] /(v1,vt) to see/EntL1X/\n", StandardCharsets.UTF_8);
        Path input = dir.resolve("in.txt");
        Path output = dir.resolve("out.txt");
        Files.writeString(input, "見た", StandardCharsets.UTF_8);

        assertEquals(0, run("annotate", "-d", dir.toString(), "-i", input.toString(), "-o", output.toString()));
        assertEquals("見る [みる] /(v1,vt) to see/EntL1X/\n", Files.readString(output, StandardCharsets.UTF_8));

        assertEquals(0, run("lookup", "-d", dir.toString(), "見た"));

        assertEquals(1, run("annotate", "-d", dir.toString(), "-i", input.toString(), "--names"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("enamdict"));
    }

    @Test
    public void statsReportsEveryDictionary() {
        int code = run("stats");

        assertEquals(0, code);
        assertTrue(stdout().contains("EDICT2        : 8 entries, 16 keys"));
        assertTrue(stdout().contains("ENAMDICT      : 3 entries"));
        assertTrue(stdout().contains("Loaded in "));
    }

    @Test
    public void missingDictionaryDirectoryFails(@TempDir Path dir) {
        int code = run("stats", "-d", dir.resolve("nowhere").toString());

        assertEquals(1, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Missing resource"));
    }
}
